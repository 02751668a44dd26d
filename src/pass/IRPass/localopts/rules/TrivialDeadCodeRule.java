package pass.IRPass.localopts.rules;

import ir.value.BasicBlock;
import ir.value.instructions.Instruction;
import pass.IRPass.localopts.LocalOptRule;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Single forward sweep erasing binary operations nobody reads.
 * Anything else (load, store, call, terminators) is kept whatever its use count.
 * An operation only used by one erased later in the sweep survives until the next run.
 */
public class TrivialDeadCodeRule implements LocalOptRule {
    private static final Logger log = LoggingManager.getLogger(TrivialDeadCodeRule.class);

    @Override
    public boolean apply(BasicBlock block) {
        boolean changed = false;
        Instruction inst = block.getFirstInstruction();
        while (inst != null) {
            if (inst.hasNoUses() && inst.isBinary()) {
                log.debug("erase dead {}", inst.toIR());
                inst = block.eraseInstruction(inst);
                changed = true;
            } else {
                inst = inst.getNext();
            }
        }
        return changed;
    }
}
