package pass.IRPass.localopts;

import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;
import ir.value.instructions.BinOperator;
import ir.value.instructions.Instruction;
import util.logging.Logger;

public final class RewriteUtils {
    private RewriteUtils() {}

    /**
     * Redirect every use of {@code inst} to {@code with}.
     *
     * @return false if {@code inst} had no uses, i.e. nothing changed
     */
    public static boolean replaceAllUses(Instruction inst, Value with, Logger log) {
        if (inst.hasNoUses() || inst == with) {
            return false;
        }
        log.debug("replace {} -> {} ({} use(s))", inst.toIR(), with.getReference(), inst.getNumUses());
        inst.replaceAllUsesWith(with);
        return true;
    }

    /**
     * Create {@code opc lhs, rhs} right after {@code after}, typed like {@code after}.
     * The block makes the name unique in the enclosing function.
     */
    public static BinOperator insertBinAfter(Instruction after, Opcode opc, Value lhs, Value rhs, String baseName) {
        BasicBlock bb = after.getParent();
        BinOperator bin = new BinOperator(baseName, opc, after.getType(), lhs, rhs);
        bb.addInstructionAfter(bin, after);
        return bin;
    }

    /** shift amount constant of the same type as {@code c} */
    public static ConstantInt shiftAmount(ConstantInt c, int amount) {
        return ConstantInt.get(c.getIntegerType(), amount);
    }
}
