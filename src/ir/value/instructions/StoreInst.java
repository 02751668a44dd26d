package ir.value.instructions;

import exception.CompileException;
import ir.type.PointerType;
import ir.type.VoidType;
import ir.value.Opcode;
import ir.value.Value;

public class StoreInst extends Instruction {

    public StoreInst(Value pointer, Value value) {
        super(VoidType.getVoid(), "");
        if (!(pointer.getType() instanceof PointerType)) {
            throw CompileException.illegalOperand("store to non-pointer " + pointer.getReference());
        }
        addOperand(pointer);
        addOperand(value);
    }

    public Value getPointer() {
        return getOperand(0);
    }

    public Value getValue() {
        return getOperand(1);
    }

    @Override
    public Opcode opCode() {
        return Opcode.STORE;
    }

    @Override
    public String toIR() {
        Value pointer = getPointer();
        Value value = getValue();
        return "store " + value.getType().toIR() + " " + value.getReference()
                + ", " + pointer.getType().toIR() + " " + pointer.getReference();
    }
}
