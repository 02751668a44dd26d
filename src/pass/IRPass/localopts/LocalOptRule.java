package pass.IRPass.localopts;

import ir.value.BasicBlock;

/**
 * One rewrite stage of {@link pass.IRPass.LocalOptsPass}.
 */
public interface LocalOptRule {
    /** one sweep over the block; true if the block was modified */
    boolean apply(BasicBlock block);
}
