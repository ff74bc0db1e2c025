package io.github.yok.flexschemasync.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Generated;

/**
 * Utility for masking credentials before connection details or external command lines are
 * written to the log.
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * {@code --server1=user:password@host:port} as passed to {@code mysqldiff}.
     */
    private static final Pattern SERVER_AUTH_PATTERN =
            Pattern.compile("^(--server\\d=[^:@]+:)(.+)(@[^@]+)$");

    /**
     * {@code --password=secret} or {@code -psecret} as passed to {@code mysqldump}.
     */
    private static final Pattern PASSWORD_OPTION_PATTERN =
            Pattern.compile("^(--password=|-p)(.+)$");

    /**
     * Password query parameters in JDBC URLs.
     */
    private static final Pattern PASSWORD_QUERY_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a generic sensitive text.
     *
     * @param value raw text
     * @return {@code ***}, the empty string for empty input, or {@code null} for {@code null}
     */
    public static String maskText(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return "***";
    }

    /**
     * Masks password query parameters in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        return PASSWORD_QUERY_PATTERN.matcher(url).replaceAll("$1***");
    }

    /**
     * Renders a command line for logging with embedded passwords replaced by {@code ***}.
     *
     * @param command command and arguments
     * @return space separated, masked command line
     */
    public static String maskCommand(List<String> command) {
        return command.stream().map(MaskingLogUtil::maskArgument).collect(Collectors.joining(" "));
    }

    private static String maskArgument(String arg) {
        if (arg == null) {
            return "null";
        }
        Matcher server = SERVER_AUTH_PATTERN.matcher(arg);
        if (server.matches()) {
            return server.group(1) + "***" + server.group(3);
        }
        Matcher password = PASSWORD_OPTION_PATTERN.matcher(arg);
        if (password.matches()) {
            return password.group(1) + "***";
        }
        return arg;
    }
}
