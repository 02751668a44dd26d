package ir.value;

public enum Opcode {
    // binary operations
    ADD,
    SUB,
    MUL,
    SDIV,
    UDIV,
    SREM,
    UREM,
    SHL,  // shift left
    LSHR, // logical shift right
    ASHR, // arithmetic shift right
    AND,
    OR,
    XOR,

    // memory
    LOAD,
    STORE,

    // others
    CALL,

    // terminators
    RET,
    BR,
    ;

    public boolean isBinary() {
        return switch (this) {
            case ADD, SUB, MUL, SDIV, UDIV, SREM, UREM,
                    SHL, LSHR, ASHR, AND, OR, XOR -> true;
            default -> false;
        };
    }

    public boolean isCommutative() {
        return this == ADD || this == MUL || this == AND || this == OR || this == XOR;
    }

    public boolean isTerminator() {
        return this == RET || this == BR;
    }

    /** textual mnemonic, e.g. "sdiv" */
    public String getMnemonic() {
        return name().toLowerCase();
    }
}
