package io.github.yok.flexschemasync.model;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Tables of the file-defined and the live schema, split into the three disjoint groups that
 * drive the push script.
 *
 * <p>
 * {@code onlyInFiles}, {@code onlyLive} and {@code inBoth} partition {@code merged}. The order of
 * {@code merged} (first seen in files, then first seen only live) is the execution order of the
 * script.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
@ToString
public class ReconciliationResult {

    private final ImmutableList<String> merged;

    private final ImmutableList<String> onlyInFiles;

    private final ImmutableList<String> onlyLive;

    private final ImmutableList<String> inBoth;

    /**
     * Returns the kind of fragment the given table contributes.
     *
     * @param tableName table from {@code merged}
     * @return {@link FragmentKind#CREATE}, {@link FragmentKind#DROP} or {@link FragmentKind#ALTER}
     * @throws IllegalArgumentException if the table is not part of this result
     */
    public FragmentKind classify(String tableName) {
        if (onlyInFiles.contains(tableName)) {
            return FragmentKind.CREATE;
        }
        if (onlyLive.contains(tableName)) {
            return FragmentKind.DROP;
        }
        if (inBoth.contains(tableName)) {
            return FragmentKind.ALTER;
        }
        throw new IllegalArgumentException("Unknown table: " + tableName);
    }
}
