package io.github.yok.flexschemasync.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexschemasync.model.ReconciliationResult;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Generated;

/**
 * Splits the file-defined and the live table names into tables to create, drop and alter.
 *
 * <p>
 * Pure functions without I/O. All results keep the input order; nothing is sorted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SchemaReconciler {

    @Generated
    private SchemaReconciler() {}

    /**
     * Reconciles the two snapshots.
     *
     * @param fileTables table names defined by schema files
     * @param liveTables table names present in the live database
     * @return reconciliation whose groups partition the merged list
     */
    public static ReconciliationResult reconcile(List<String> fileTables, List<String> liveTables) {
        ImmutableList<String> merged = merge(fileTables, liveTables);
        ImmutableList<String> onlyInFiles = exclusiveOf(fileTables, liveTables);
        ImmutableList<String> onlyLive = exclusiveOf(liveTables, fileTables);

        Set<String> exclusive = new HashSet<>(onlyInFiles);
        exclusive.addAll(onlyLive);
        ImmutableList.Builder<String> inBoth = ImmutableList.builder();
        for (String name : merged) {
            if (!exclusive.contains(name)) {
                inBoth.add(name);
            }
        }
        return new ReconciliationResult(merged, onlyInFiles, onlyLive, inBoth.build());
    }

    /**
     * Returns every name of {@code first}, then every name of {@code second} not seen yet, each
     * exactly once.
     *
     * @param first names taking precedence in the order
     * @param second names appended after
     * @return deduplicated names in first-seen order
     */
    public static ImmutableList<String> merge(List<String> first, List<String> second) {
        Set<String> seen = new LinkedHashSet<>(first);
        seen.addAll(second);
        return ImmutableList.copyOf(seen);
    }

    /**
     * Returns the names of {@code first} that do not occur in {@code second}, in {@code first}
     * order and without duplicates.
     *
     * @param first candidate names
     * @param second names to exclude
     * @return exclusive names
     */
    public static ImmutableList<String> exclusiveOf(List<String> first, List<String> second) {
        Set<String> excluded = new HashSet<>(second);
        Set<String> result = new LinkedHashSet<>();
        for (String name : first) {
            if (!excluded.contains(name)) {
                result.add(name);
            }
        }
        return ImmutableList.copyOf(result);
    }
}
