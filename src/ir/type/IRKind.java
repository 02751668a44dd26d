package ir.type;

public enum IRKind {
    INTEGER,
    VOID,
    POINTER,
    FUNC
}
