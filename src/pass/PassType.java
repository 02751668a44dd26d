package pass;

import java.util.Set;
import java.util.function.Supplier;

/**
 * A kind of pass: knows how to create a fresh instance and under which
 * name it can be picked with {@code -Dir.passes}.
 */
public interface PassType<T extends Pass> {
    Supplier<T> constructor();

    default T create() {
        return constructor().get();
    }

    /** lower case enum name, e.g. "localopts" */
    default String getName() {
        return ((Enum<?>) this).name().toLowerCase();
    }

    /** an empty selection keeps every pass */
    default boolean isSelectedBy(Set<String> selection) {
        return selection.isEmpty() || selection.contains(getName());
    }
}
