package ir.value.instructions;

import exception.CompileException;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

public class LoadInst extends Instruction {

    public LoadInst(Value pointer, String name) {
        super(pointeeOf(pointer), name);
        addOperand(pointer);
    }

    private static Type pointeeOf(Value pointer) {
        if (!(pointer.getType() instanceof PointerType ptrTy)) {
            throw CompileException.illegalOperand("load from non-pointer " + pointer.getReference());
        }
        return ptrTy.getPointeeType();
    }

    public Value getPointer() {
        return getOperand(0);
    }

    @Override
    public Opcode opCode() {
        return Opcode.LOAD;
    }

    @Override
    public String toIR() {
        Value pointer = getPointer();
        return "%" + getName() + " = load " + getType().toIR()
                + ", " + pointer.getType().toIR() + " " + pointer.getReference();
    }
}
