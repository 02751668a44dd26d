package ir;

import java.util.List;

import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.instructions.BinOperator;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.ReturnInst;
import ir.value.instructions.StoreInst;

/**
 * Creates instructions and inserts them at the current insertion point:
 * either the end of a block or right before a given instruction.
 */
public class Builder {
    private final IRModule module;
    private BasicBlock currentBlock;
    private Instruction insertPoint; // null: append at the end of currentBlock

    public Builder(IRModule module) {
        this.module = module;
    }

    public IRModule getModule() {
        return module;
    }

    public void positionAtEnd(BasicBlock block) {
        this.currentBlock = block;
        this.insertPoint = null;
    }

    public void positionBefore(Instruction inst) {
        this.currentBlock = inst.getParent();
        this.insertPoint = inst;
    }

    public Function getCurrentFunction() {
        return currentBlock != null ? currentBlock.getParent() : null;
    }

    private <T extends Instruction> T insertInstruction(T inst) {
        assert currentBlock != null : "Builder is not positioned";
        if (insertPoint != null) {
            currentBlock.addInstructionBefore(inst, insertPoint);
        } else {
            assert !currentBlock.lastInstIsTerminator()
                    : "Cannot insert into a terminated BasicBlock";
            currentBlock.addInstruction(inst);
        }
        return inst;
    }

    public BinOperator buildBinary(Opcode opcode, Value lhs, Value rhs, String name) {
        assert lhs.getType().equals(rhs.getType())
                : "lhs and rhs should have the same type in bin instruction";
        return insertInstruction(new BinOperator(name, opcode, lhs.getType(), lhs, rhs));
    }

    // --- arithmetic ---
    public BinOperator buildAdd(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.ADD, lhs, rhs, name);
    }

    public BinOperator buildSub(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.SUB, lhs, rhs, name);
    }

    public BinOperator buildMul(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.MUL, lhs, rhs, name);
    }

    public BinOperator buildSDiv(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.SDIV, lhs, rhs, name);
    }

    public BinOperator buildUDiv(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.UDIV, lhs, rhs, name);
    }

    // --- bitwise ---
    public BinOperator buildShl(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.SHL, lhs, rhs, name);
    }

    public BinOperator buildOr(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.OR, lhs, rhs, name);
    }

    // --- memory ---
    public LoadInst buildLoad(Value pointer, String name) {
        return insertInstruction(new LoadInst(pointer, name));
    }

    public StoreInst buildStore(Value value, Value pointer) {
        return insertInstruction(new StoreInst(pointer, value));
    }

    // --- others ---
    public CallInst buildCall(Function callee, List<Value> args, String name) {
        String n = callee.getFunctionType().getReturnType().isVoid() ? "" : name;
        return insertInstruction(new CallInst(callee, args, n));
    }

    // --- terminators ---
    public ReturnInst buildRet(Value value) {
        return insertInstruction(new ReturnInst(value));
    }

    public BranchInst buildBr(BasicBlock dest) {
        return insertInstruction(new BranchInst(dest));
    }
}
