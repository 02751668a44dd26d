package ir.value.instructions;

import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;

// unconditional branch
public class BranchInst extends Instruction {

    public BranchInst(BasicBlock dest) {
        super(VoidType.getVoid(), "");
        addOperand(dest);
    }

    @Override
    public Opcode opCode() {
        return Opcode.BR;
    }

    public BasicBlock getDest() {
        return (BasicBlock) getOperand(0);
    }

    @Override
    public String toIR() {
        return "br label %" + getDest().getName();
    }
}
