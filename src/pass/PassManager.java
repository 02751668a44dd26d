package pass;

import driver.Config;
import ir.IRModule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import pass.Pass.IRPass;
import util.LoggingManager;
import util.logging.LogManager;
import util.logging.Logger;

public class PassManager {
    private final List<IRPass> irPipeline = new ArrayList<>();

    private final Set<String> enabledIR;

    private final Logger log = LoggingManager.getLogger(PassManager.class);

    private PreservedAnalyses lastPreserved = PreservedAnalyses.ALL;

    private static PassManager INSTANCE = null;

    public static PassManager getInstance() {
        if (INSTANCE == null) {
            INSTANCE = new PassManager();
        }
        return INSTANCE;
    }

    private PassManager() {
        // read the system property
        // eg: -Dir.passes=localopts,otherpass,...
        enabledIR = loadEnabled("ir.passes");

        if (Config.getInstance().isO1) {
            setO1Pipeline();
        } else {
            setDefaultPipeline();
        }
    }

    /**
     * Reset the singleton instance (used for testing different configurations)
     */
    public static void resetInstance() {
        INSTANCE = null;
    }

    /**
     * One round of local optimizations
     */
    private void setDefaultPipeline() {
        setIRPipeline(IRPassType.LocalOpts);
    }

    /**
     * LocalOpts does not iterate to a fixpoint, a second round picks up
     * what the first round exposed (e.g. a shift feeding an add of 0)
     */
    private void setO1Pipeline() {
        setIRPipeline(
                IRPassType.LocalOpts,
                IRPassType.LocalOpts);
    }

    /** read “a,b,c” from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    public List<IRPass> getIRPipeline() {
        return Collections.unmodifiableList(irPipeline);
    }

    /**
     * run the pipeline over {@link IRModule#getModule()}
     * @return ALL if no pass touched the IR
     */
    public PreservedAnalyses runIRPasses() {
        IRModule module = IRModule.getModule();
        LogManager.setContext(module.getName());

        PreservedAnalyses preserved = PreservedAnalyses.ALL;
        for (IRPass p : irPipeline) {
            log.info("[IR] {}", p.getType().getName());
            PreservedAnalyses result = p.run();
            if (!result.areAllPreserved()) {
                log.debug("[IR] {} invalidated analyses", p.getType().getName());
            }
            preserved = preserved.intersect(result);
        }
        lastPreserved = preserved;
        return preserved;
    }

    public PreservedAnalyses getLastPreserved() {
        return lastPreserved;
    }

    /**
     * set the IR pipeline in order (clears the previous one)
     */
    private void setIRPipeline(IRPassType... types) {
        irPipeline.clear();
        for (IRPassType type : types) {
            if (type.isSelectedBy(enabledIR)) {
                irPipeline.add(type.create());
            }
        }
    }
}
