package pass.IRPass.localopts;

import ir.value.Value;
import ir.value.constants.ConstantInt;
import ir.value.instructions.Instruction;

/**
 * The constant operand of a two-operand instruction and the operand it is combined with.
 */
public record ConstantOperand(ConstantInt constant, Value other) {

    /**
     * Operand 0 is checked first, then operand 1; only valid as-is for
     * commutative opcodes.
     *
     * @return null if neither operand is a {@link ConstantInt}
     */
    public static ConstantOperand of(Instruction inst) {
        assert inst.getNumOperands() == 2 : "expected a binary instruction: " + inst.toIR();
        if (inst.getOperand(0) instanceof ConstantInt c) {
            return new ConstantOperand(c, inst.getOperand(1));
        }
        if (inst.getOperand(1) instanceof ConstantInt c) {
            return new ConstantOperand(c, inst.getOperand(0));
        }
        return null;
    }

    /**
     * For non-commutative opcodes: only operand 1 may be the constant.
     * A leading constant ({@code 8 sdiv x}) yields null.
     */
    public static ConstantOperand ofDivisor(Instruction inst) {
        assert inst.getNumOperands() == 2 : "expected a binary instruction: " + inst.toIR();
        if (inst.getOperand(1) instanceof ConstantInt c) {
            return new ConstantOperand(c, inst.getOperand(0));
        }
        return null;
    }
}
