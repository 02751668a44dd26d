package ir.type;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public final class FunctionType extends Type {
    private final Type returnType;
    private final List<Type> paramTypes;

    private static final Map<Key, FunctionType> pool = new ConcurrentHashMap<>();

    private record Key(Type ret, List<Type> params) {}

    private FunctionType(Type returnType, List<Type> paramTypes) {
        super(IRKind.FUNC);
        this.returnType = returnType;
        this.paramTypes = paramTypes;
    }

    /**
     * @param ret return type, null means void
     */
    public static FunctionType get(Type ret, List<Type> params) {
        Type r = ret != null ? ret : VoidType.getVoid();
        return pool.computeIfAbsent(new Key(r, List.copyOf(params)),
                                    k -> new FunctionType(k.ret(), k.params()));
    }

    public Type getReturnType() { return returnType; }
    public List<Type> getParamTypes() { return paramTypes; }

    @Override
    public String toIR() {
        return returnType.toIR() + " ("
            + paramTypes.stream().map(Type::toIR).collect(Collectors.joining(", "))
            + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType other)) return false;
        return returnType.equals(other.returnType)
            && paramTypes.equals(other.paramTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), returnType, paramTypes);
    }
}
