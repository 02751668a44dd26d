package ir.type;

public final class VoidType extends Type {

    private static final VoidType INSTANCE = new VoidType();

    private VoidType() {
        super(IRKind.VOID);
    }

    public static VoidType getVoid() {
        return INSTANCE;
    }

    @Override
    public String toIR() {
        return "void";
    }
}
