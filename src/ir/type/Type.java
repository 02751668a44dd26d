package ir.type;

public abstract class Type {
    private final IRKind kind;

    protected Type(IRKind kind) {
        this.kind = kind;
    }

    public abstract String toIR();

    /* classification helpers */
    public boolean is(IRKind k) { return kind == k; }
    public boolean isVoid() { return is(IRKind.VOID); }

    @Override public String toString() { return toIR(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Type other = (Type) o;
        return kind == other.kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}
