package io.github.yok.flexschemasync.tool;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Exit code and captured output of an external command.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class CommandResult {

    private final int exitCode;

    private final String stdout;

    private final String stderr;
}
