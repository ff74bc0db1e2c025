package io.github.yok.flexschemasync.core;

import io.github.yok.flexschemasync.model.SchemaFile;
import io.github.yok.flexschemasync.util.SqlMetaStripper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Lists the schema files of a directory and reads them as executable SQL.
 *
 * <p>
 * A schema file is a regular file (symbolic links are not followed) whose name ends with the
 * configured suffix; its table name is the file name without that suffix. Every other entry is
 * logged and skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FileSchemaReader {

    private final String suffix;

    /**
     * Creates a reader.
     *
     * @param suffix schema-file suffix such as {@code .sql}
     */
    public FileSchemaReader(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Lists the schema files of a directory, ordered by file name.
     *
     * @param dir schema directory
     * @return schema files, never empty
     * @throws IOException if the directory cannot be listed
     * @throws IllegalStateException if the directory does not exist or holds no schema file
     */
    public List<SchemaFile> listSchemaFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IllegalStateException("Schema directory does not exist: " + dir);
        }
        List<Path> entries;
        try (Stream<Path> stream = Files.list(dir)) {
            entries = stream.sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }

        List<SchemaFile> files = new ArrayList<>();
        for (Path entry : entries) {
            if (!Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                log.info("{} is not a file.", entry);
                continue;
            }
            String fileName = entry.getFileName().toString();
            if (!fileName.endsWith(suffix)) {
                log.info("{} doesn't have `{}` extension.", entry, suffix);
                continue;
            }
            String tableName = StringUtils.removeEnd(fileName, suffix);
            if (tableName.isEmpty()) {
                log.info("{} has no table name.", entry);
                continue;
            }
            files.add(new SchemaFile(tableName, entry.toAbsolutePath()));
        }

        if (files.isEmpty()) {
            throw new IllegalStateException(
                    "No `*" + suffix + "` files found in " + dir + ", nothing to push.");
        }
        log.info("Found {} schema file(s) in {}", files.size(), dir);
        return files;
    }

    /**
     * Reads a schema file and strips the dump tool's conditional-comment directives.
     *
     * <p>
     * The file is decoded as UTF-8; malformed byte sequences become U+FFFD instead of failing the
     * read.
     * </p>
     *
     * @param file schema file
     * @return executable SQL
     * @throws IOException if the file cannot be read
     */
    public String readSanitized(SchemaFile file) throws IOException {
        return SqlMetaStripper
                .strip(FileUtils.readFileToString(file.getPath().toFile(), StandardCharsets.UTF_8));
    }
}
