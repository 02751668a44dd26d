package ir.value.instructions;

import exception.CompileException;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

public class BinOperator extends Instruction {
    private final Opcode opcode;

    public BinOperator(String name, Opcode opcode,
            Type type, Value lhs, Value rhs) {
        super(type, name);
        if (!opcode.isBinary()) {
            throw CompileException.illegalInstruction(opcode.getMnemonic() + " is not a binary operator");
        }
        this.opcode = opcode;
        addOperand(lhs);
        addOperand(rhs);
    }

    @Override
    public Opcode opCode() {
        return opcode;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public Value getLhs() {
        return getOperand(0);
    }

    public Value getRhs() {
        return getOperand(1);
    }

    public boolean isCommutative() {
        return opcode.isCommutative();
    }

    @Override
    public String toIR() {
        return "%" + getName() + " = "
                + opcode.getMnemonic() + " "
                + getType().toIR() + " "
                + getLhs().getReference() + ", " + getRhs().getReference();
    }
}
