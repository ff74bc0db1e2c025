package io.github.yok.flexschemasync.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of loading the schema files into the scratch database.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
@ToString
public class LoadReport {

    /**
     * Tables whose file executed without error, in load order.
     */
    private final ImmutableList<String> sourced;

    /**
     * Tables whose file failed, mapped to the error message, in load order.
     */
    private final ImmutableMap<String, String> notSourced;

    /**
     * Returns the number of files processed.
     *
     * @return sourced plus not-sourced count
     */
    public int total() {
        return sourced.size() + notSourced.size();
    }
}
