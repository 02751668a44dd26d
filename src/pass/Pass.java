package pass;

public interface Pass {
    // just a mark interface

    public interface IRPass extends Pass {
        IRPassType getType();

        /**
         * run over the whole module
         * @return which analyses survive; {@link PreservedAnalyses#NONE} once the IR changed
         */
        PreservedAnalyses run();
    }
}
