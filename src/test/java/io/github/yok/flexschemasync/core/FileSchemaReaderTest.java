package io.github.yok.flexschemasync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexschemasync.model.SchemaFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSchemaReaderTest {

    @TempDir
    Path tempDir;

    private final FileSchemaReader reader = new FileSchemaReader(".sql");

    @Test
    void listSchemaFiles_正常ケース_sqlとその他のファイルを配置する_sqlファイルのみがテーブル名付きで返されること()
            throws Exception {
        write("users.sql", "CREATE TABLE users (id INT);");
        write("orders.sql", "CREATE TABLE orders (id INT);");
        write("users.txt", "data");
        write("README.md", "docs");
        Files.createDirectories(tempDir.resolve("nested.sql"));

        List<SchemaFile> files = reader.listSchemaFiles(tempDir);

        assertEquals(List.of("orders", "users"),
                files.stream().map(SchemaFile::getTableName).collect(Collectors.toList()));
        assertEquals(tempDir.resolve("orders.sql").toAbsolutePath(), files.get(0).getPath());
    }

    @Test
    void listSchemaFiles_異常ケース_sqlファイルがないディレクトリを指定する_IllegalStateExceptionが送出されること()
            throws Exception {
        write("notes.txt", "x");
        IllegalStateException ex =
                assertThrows(IllegalStateException.class, () -> reader.listSchemaFiles(tempDir));
        assertTrue(ex.getMessage().contains("nothing to push"));
    }

    @Test
    void listSchemaFiles_異常ケース_空ディレクトリを指定する_IllegalStateExceptionが送出されること() {
        assertThrows(IllegalStateException.class, () -> reader.listSchemaFiles(tempDir));
    }

    @Test
    void listSchemaFiles_異常ケース_存在しないディレクトリを指定する_IllegalStateExceptionが送出されること() {
        assertThrows(IllegalStateException.class,
                () -> reader.listSchemaFiles(tempDir.resolve("missing")));
    }

    @Test
    void listSchemaFiles_正常ケース_拡張子のみのファイルを配置する_スキップされること() throws Exception {
        write(".sql", "x");
        write("a.sql", "CREATE TABLE a (id INT);");
        assertEquals(1, reader.listSchemaFiles(tempDir).size());
    }

    @Test
    void readSanitized_正常ケース_ディレクティブ付きファイルを指定する_除去された内容が返されること()
            throws Exception {
        Path file = write("users.sql",
                "/*!40101 SET NAMES utf8 */;\nCREATE TABLE users (id INT);\n");

        String sql = reader.readSanitized(new SchemaFile("users", file));

        assertEquals("CREATE TABLE users (id INT);\n", sql);
    }

    @Test
    void readSanitized_正常ケース_UTF8として不正なバイトを含む_置換文字に置き換えて読み込まれること()
            throws Exception {
        Path file = tempDir.resolve("cafe.sql");
        Files.write(file, "-- caf\u00e9\nCREATE TABLE cafe (id INT);\n"
                .getBytes(StandardCharsets.ISO_8859_1));

        String sql = reader.readSanitized(new SchemaFile("cafe", file));

        assertEquals("-- caf\uFFFD\nCREATE TABLE cafe (id INT);\n", sql);
    }

    @Test
    void readSanitized_異常ケース_存在しないファイルを指定する_IOExceptionが送出されること() {
        assertThrows(IOException.class, () -> reader
                .readSanitized(new SchemaFile("ghost", tempDir.resolve("ghost.sql"))));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }
}
