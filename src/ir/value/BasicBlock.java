package ir.value;

import ir.type.VoidType;
import ir.value.instructions.Instruction;
import util.IList;
import util.IList.INode;

public class BasicBlock extends Value {
    private final IList<Instruction, BasicBlock> instructions;
    private final INode<BasicBlock, Function> blockNode;

    /** creates the block and appends it to {@code parent} */
    public BasicBlock(String name, Function parent) {
        this(name);
        blockNode.insertAtEnd(parent.getBlocks());
    }

    /** detached block, not owned by any function */
    public BasicBlock(String name) {
        super(VoidType.getVoid(), name);
        this.instructions = new IList<>(this);
        this.blockNode = new INode<>(this);
    }

    /* getter setter */
    public IList<Instruction, BasicBlock> getInstructions() {
        return instructions;
    }

    public INode<BasicBlock, Function> _getINode() {
        return this.blockNode;
    }

    public BasicBlock getNext() {
        return blockNode.getNext() != null ? blockNode.getNext().getVal() : null;
    }

    public Function getParent() {
        return blockNode.getParent() != null ? blockNode.getParent().getVal() : null;
    }

    public int size() {
        return instructions.getNumNode();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public Instruction getFirstInstruction() {
        return instructions.getEntry() != null ? instructions.getEntry().getVal() : null;
    }

    public Instruction getLastInstruction() {
        return instructions.getLast() != null ? instructions.getLast().getVal() : null;
    }

    /* insertion */
    public void addInstruction(Instruction inst) {
        if (inst == null) {
            return;
        }
        uniquifyName(inst);
        inst._getINode().insertAtEnd(instructions);
    }

    public void addInstructionBefore(Instruction inst, Instruction before) {
        if (inst == null) {
            return;
        }
        assert before.getParent() == this : "insertion point is not in block " + getName();
        uniquifyName(inst);
        inst._getINode().insertBefore(before._getINode());
    }

    public void addInstructionAfter(Instruction inst, Instruction after) {
        if (inst == null) {
            return;
        }
        assert after.getParent() == this : "insertion point is not in block " + getName();
        uniquifyName(inst);
        inst._getINode().insertAfter(after._getINode());
    }

    private void uniquifyName(Instruction inst) {
        Function parent = getParent();
        if (parent != null && inst.getName() != null && !inst.getName().isEmpty()) {
            inst.setName(parent.getUniqueName(inst.getName()));
        }
    }

    /**
     * Erase an instruction that nobody uses any more. Its own operand uses are
     * dropped first so no stale user entry survives.
     *
     * @return the instruction that followed the erased one, or null if it was the last
     */
    public Instruction eraseInstruction(Instruction inst) {
        INode<Instruction, BasicBlock> node = inst._getINode();
        assert node.getParent() == instructions : "instruction is not in block " + getName();
        assert inst.hasNoUses() : "erasing " + inst.toIR() + " which still has " + inst.getNumUses() + " use(s)";

        inst.clearOperands();
        INode<Instruction, BasicBlock> next = node.removeSelf();
        return next != null ? next.getVal() : null;
    }

    /* whether the last instruction is a terminator */
    public boolean lastInstIsTerminator() {
        Instruction last = getLastInstruction();
        return last != null && last.isTerminator();
    }

    public Instruction getTerminator() {
        return lastInstIsTerminator() ? getLastInstruction() : null;
    }

    @Override
    public String getReference() {
        return "%" + getName();
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append(getName()).append(":\n");
        for (var node : instructions) {
            sb.append("  ").append(node.getVal().toIR()).append("\n");
        }
        return sb.toString();
    }
}
