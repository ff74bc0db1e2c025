package io.github.yok.flexschemasync.model;

import java.nio.file.Path;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * One schema-definition file and the table it defines.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
@ToString
public class SchemaFile {

    /**
     * Table name, the file name without its schema-file suffix.
     */
    private final String tableName;

    /**
     * Absolute path of the file.
     */
    private final Path path;
}
