package ir.value.instructions;

import ir.type.VoidType;
import ir.value.Opcode;
import ir.value.Value;

public class ReturnInst extends Instruction {

    public ReturnInst(Value value) {
        super(VoidType.getVoid(), "");
        addOperand(value);
    }

    public Value getReturnValue() {
        return getOperand(0);
    }

    @Override
    public Opcode opCode() {
        return Opcode.RET;
    }

    @Override
    public String toIR() {
        Value returnVal = getReturnValue();
        return "ret " + returnVal.getType().toIR() + " " + returnVal.getReference();
    }
}
