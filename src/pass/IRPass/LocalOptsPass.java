package pass.IRPass;

import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Function;
import pass.IRPassType;
import pass.Pass;
import pass.PreservedAnalyses;
import pass.IRPass.localopts.LocalOptRule;
import pass.IRPass.localopts.rules.AlgebraicIdentityRule;
import pass.IRPass.localopts.rules.InverseOpCancellationRule;
import pass.IRPass.localopts.rules.TrivialDeadCodeRule;
import util.LoggingManager;
import util.logging.Logger;

import java.util.List;

/**
 * LocalOptsPass: block local peephole optimizations.
 *
 * Every block goes through the rules once, in this order:
 * 1) algebraic identities and strength reduction
 * 2) cancellation of (x op C) op' C pairs
 * 3) removal of unused binary operations
 *
 * There is no iteration to a fixpoint. A chain that needs several rule
 * applications converges over repeated runs of the pass.
 */
public class LocalOptsPass implements Pass.IRPass {
    private static final Logger log = LoggingManager.getLogger(LocalOptsPass.class);

    // order matters: later rules see what earlier ones did to the block
    private final List<LocalOptRule> rules = List.of(
            new AlgebraicIdentityRule(),
            new InverseOpCancellationRule(),
            new TrivialDeadCodeRule());

    @Override
    public IRPassType getType() {
        return IRPassType.LocalOpts;
    }

    @Override
    public PreservedAnalyses run() {
        IRModule module = IRModule.getModule();
        boolean changed = false;
        for (Function f : module.getFunctions()) {
            if (f.isDeclaration()) {
                continue;
            }
            if (runOnFunction(f)) {
                log.info("LocalOpts changed function {}", f.getName());
                changed = true;
            }
        }
        return PreservedAnalyses.of(changed);
    }

    /**
     * @return true if any block of {@code f} was modified
     */
    public boolean runOnFunction(Function f) {
        boolean changed = false;
        for (var bbNode : f.getBlocks()) {
            changed |= runOnBlock(bbNode.getVal());
        }
        return changed;
    }

    /**
     * @return true if the block was modified
     */
    public boolean runOnBlock(BasicBlock bb) {
        boolean changed = false;
        for (LocalOptRule rule : rules) {
            changed |= rule.apply(bb);
        }
        return changed;
    }
}
