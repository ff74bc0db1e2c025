package io.github.yok.flexschemasync.model;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Statement(s) the push script contains for exactly one table.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public class ScriptFragment {

    private final String tableName;

    private final FragmentKind kind;

    /**
     * SQL text of the fragment; empty for an ALTER fragment without structural differences.
     */
    private final String sql;

    /**
     * Creates a fragment.
     *
     * @param tableName table the fragment belongs to
     * @param kind fragment kind
     * @param sql SQL text; {@code null} is treated as empty
     */
    public ScriptFragment(String tableName, FragmentKind kind, String sql) {
        this.tableName = Preconditions.checkNotNull(tableName, "tableName must not be null");
        this.kind = Preconditions.checkNotNull(kind, "kind must not be null");
        this.sql = sql == null ? "" : sql;
    }

    /**
     * Returns the text this fragment adds to the script: its SQL followed by a line break, so an
     * empty fragment still shows up as a blank line.
     *
     * @return rendered fragment
     */
    public String render() {
        return sql + "\n";
    }

    /**
     * Returns whether the fragment carries any statement.
     *
     * @return {@code true} when the SQL is blank
     */
    public boolean isBlank() {
        return sql.isBlank();
    }
}
