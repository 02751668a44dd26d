package ir.value.instructions;

import ir.type.Type;
import ir.value.*;
import util.IList.INode;

public abstract class Instruction extends User {
    private final INode<Instruction, BasicBlock> instNode;

    public Instruction(Type type, String name) {
        super(type, name);
        this.instNode = new INode<>(this);
    }

    public abstract Opcode opCode();

    public INode<Instruction, BasicBlock> _getINode() {
        return instNode;
    }

    public Instruction getNext() {
        return instNode.getNext() != null ? instNode.getNext().getVal() : null;
    }

    public Instruction getPrev() {
        return instNode.getPrev() != null ? instNode.getPrev().getVal() : null;
    }

    /** owning block, null once erased or before insertion */
    public BasicBlock getParent() {
        return instNode.getParent() != null ? instNode.getParent().getVal() : null;
    }

    public boolean isTerminator() {
        return opCode().isTerminator();
    }

    public boolean isBinary() {
        return opCode().isBinary();
    }

    /**
     * Unlink from the parent block. The instruction must have no users.
     *
     * @return the instruction that followed this one, or null
     */
    public Instruction eraseFromParent() {
        BasicBlock parent = getParent();
        assert parent != null : "instruction is not in a block: " + toIR();
        return parent.eraseInstruction(this);
    }

    public abstract String toIR();
}
