package io.github.yok.flexschemasync.util;

import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Removes the version-gated conditional comments ({@code /*!40101 SET ... *}{@code /;}) that
 * {@code mysqldump} writes around every table definition.
 *
 * <p>
 * A directive is matched on a single line, up to the last {@code *}{@code /;} on that line, and
 * swallows the line breaks that follow it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlMetaStripper {

    static final Pattern CONDITIONAL_COMMENT = Pattern.compile("/\\*!.+\\*/;(\\r?\\n)*");

    @Generated
    private SqlMetaStripper() {}

    /**
     * Strips every conditional-comment directive.
     *
     * @param sql raw file contents
     * @return contents without directives; {@code null} stays {@code null}
     */
    public static String strip(String sql) {
        if (sql == null) {
            return null;
        }
        return CONDITIONAL_COMMENT.matcher(sql).replaceAll("");
    }
}
