package io.github.yok.flexschemasync.tool;

/**
 * Computes the ALTER script that makes the live table match its scratch counterpart.
 *
 * <p>
 * Implementations must not throw for tool failures; they report them as
 * {@link DiffResult#failure(String, String)} and leave the decision to the caller.
 * </p>
 */
public interface StructuralDiffer {

    /**
     * Compares {@code <live>.<table>} with {@code <scratch>.<table>}.
     *
     * @param tableName table present in both databases
     * @return diff outcome
     */
    DiffResult diff(String tableName);
}
