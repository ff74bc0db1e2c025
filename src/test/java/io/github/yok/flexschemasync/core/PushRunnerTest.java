package io.github.yok.flexschemasync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import io.github.yok.flexschemasync.config.DiffFailurePolicy;
import io.github.yok.flexschemasync.config.RunSettings;
import io.github.yok.flexschemasync.config.SyncDirection;
import io.github.yok.flexschemasync.db.DbConnectionProvider;
import io.github.yok.flexschemasync.model.PushResult;
import io.github.yok.flexschemasync.model.PushStatus;
import io.github.yok.flexschemasync.tool.DiffResult;
import io.github.yok.flexschemasync.tool.StructuralDiffer;
import io.github.yok.flexschemasync.util.ErrorHandler;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PushRunnerTest {

    private static final String ORDERS_ALTER =
            "ALTER TABLE `live`.`orders` ADD COLUMN note VARCHAR(64);";

    @TempDir
    Path tempDir;

    private Path schemaDir;
    private Connection live;
    private Statement liveSt;
    private ResultSet liveTables;
    private Connection server;
    private Statement serverSt;
    private DbConnectionProvider provider;
    private StructuralDiffer differ;

    @BeforeEach
    void setUp() throws Exception {
        schemaDir = Files.createDirectories(tempDir.resolve("schema"));
        Files.writeString(schemaDir.resolve("orders.sql"),
                "/*!40101 SET NAMES utf8 */;\nCREATE TABLE orders (id INT, note VARCHAR(64));",
                StandardCharsets.UTF_8);
        Files.writeString(schemaDir.resolve("users.sql"), "CREATE TABLE users (id INT);",
                StandardCharsets.UTF_8);

        live = mock(Connection.class);
        liveSt = mock(Statement.class);
        liveTables = mock(ResultSet.class);
        when(live.createStatement()).thenReturn(liveSt);
        when(liveSt.executeQuery(LiveSchemaInspector.SHOW_TABLES_SQL)).thenReturn(liveTables);
        when(liveSt.getUpdateCount()).thenReturn(-1);
        when(liveTables.next()).thenReturn(true, true, false);
        when(liveTables.getString(1)).thenReturn("legacy", "orders");

        server = mock(Connection.class);
        serverSt = mock(Statement.class);
        when(server.createStatement()).thenReturn(serverSt);
        when(serverSt.getUpdateCount()).thenReturn(-1);

        provider = mock(DbConnectionProvider.class);
        when(provider.openLive()).thenReturn(live);
        when(provider.openServer()).thenReturn(server);

        differ = mock(StructuralDiffer.class);
        when(differ.diff("orders")).thenReturn(DiffResult.success("orders", ORDERS_ALTER));
    }

    @AfterEach
    void tearDown() {
        ErrorHandler.restoreExitForCurrentThread();
    }

    @Test
    void execute_正常ケース_users_orders_legacyの構成で実行する_ALTER_CREATE_DROPが適用されること()
            throws Exception {
        Path export = tempDir.resolve("push.sql");

        PushResult result = new PushRunner(settings(export, false, true), provider, differ)
                .execute();

        String expected = ORDERS_ALTER + "\n" + "CREATE TABLE users (id INT);\n"
                + "DROP TABLE IF EXISTS legacy;\n";
        assertEquals(PushStatus.APPLIED, result.getStatus());
        assertEquals(List.of("orders", "users", "legacy"), result.getReconciliation().getMerged());
        assertEquals(List.of("orders", "users"), result.getLoadReport().getSourced());
        assertEquals(expected, result.getScript().getText());
        assertEquals(expected, Files.readString(export, StandardCharsets.UTF_8));
        verify(liveSt).execute(expected);
        verify(serverSt).execute("CREATE TABLE orders (id INT, note VARCHAR(64));");
        verify(serverSt, times(1)).execute("DROP DATABASE IF EXISTS tmp");
        verify(live).close();
        verify(server).close();
    }

    @Test
    void execute_正常ケース_ライブのビューと同名のファイルがある_CREATEではなく差分として扱われること()
            throws Exception {
        Files.writeString(schemaDir.resolve("v_orders.sql"),
                "CREATE VIEW v_orders AS SELECT id FROM orders;", StandardCharsets.UTF_8);
        when(liveTables.next()).thenReturn(true, true, true, false);
        when(liveTables.getString(1)).thenReturn("legacy", "orders", "v_orders");
        when(differ.diff("v_orders")).thenReturn(DiffResult.success("v_orders", ""));

        PushResult result = new PushRunner(settings(tempDir.resolve("p.sql"), false, true),
                provider, differ).execute();

        assertEquals(PushStatus.APPLIED, result.getStatus());
        assertEquals(List.of("orders", "v_orders"), result.getReconciliation().getInBoth());
        assertFalse(result.getScript().getText().contains("CREATE VIEW"));
        verify(differ).diff("v_orders");
    }

    @Test
    void execute_正常ケース_ドライランで実行する_ライブDBにスクリプトが送信されないこと() throws Exception {
        Path export = tempDir.resolve("dry.sql");

        PushResult result = new PushRunner(settings(export, true, true), provider, differ)
                .execute();

        assertEquals(PushStatus.DRY_RUN, result.getStatus());
        assertTrue(Files.exists(export));
        verify(liveSt, never()).execute(anyString());
    }

    @Test
    void execute_正常ケース_スクラッチを保持しない_最後にスクラッチDBが削除されること() throws Exception {
        new PushRunner(settings(tempDir.resolve("p.sql"), false, false), provider, differ)
                .execute();

        // once when recreating, once when cleaning up
        verify(serverSt, times(2)).execute("DROP DATABASE IF EXISTS tmp");
    }

    @Test
    void execute_異常ケース_実行が失敗する_EXECUTION_FAILEDが返されること() throws Exception {
        when(liveSt.execute(anyString())).thenThrow(new SQLException("Duplicate column"));

        PushResult result = new PushRunner(settings(tempDir.resolve("p.sql"), false, true),
                provider, differ).execute();

        assertEquals(PushStatus.EXECUTION_FAILED, result.getStatus());
        assertEquals("Duplicate column", result.getApplyResult().getExecutionError());
    }

    @Test
    void execute_異常ケース_SHOW_TABLESが失敗する_副作用なく中断されること() throws Exception {
        when(liveSt.executeQuery(LiveSchemaInspector.SHOW_TABLES_SQL))
                .thenThrow(new SQLException("Unknown database 'live'"));

        PushResult result = new PushRunner(settings(tempDir.resolve("p.sql"), false, true),
                provider, differ).execute();

        assertEquals(PushStatus.ABORTED, result.getStatus());
        assertNull(result.getScript());
        verifyNoInteractions(serverSt, differ);
        assertTrue(Files.notExists(tempDir.resolve("p.sql")));
    }

    @Test
    void execute_異常ケース_差分がABORTで失敗する_中断されスクラッチDBは削除されること() throws Exception {
        when(differ.diff("orders")).thenReturn(DiffResult.failure("orders", "exit 2"));

        PushResult result = new PushRunner(settings(tempDir.resolve("p.sql"), false, false),
                provider, differ).execute();

        assertEquals(PushStatus.ABORTED, result.getStatus());
        verify(liveSt, never()).execute(anyString());
        verify(serverSt, times(2)).execute("DROP DATABASE IF EXISTS tmp");
    }

    @Test
    void execute_異常ケース_例外モードで接続できない_IllegalStateExceptionが送出されること() throws Exception {
        ErrorHandler.disableExitForCurrentThread();
        when(provider.openLive()).thenThrow(new SQLException("Communications link failure"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new PushRunner(settings(tempDir.resolve("p.sql"), false, true), provider,
                        differ).execute());
        assertTrue(ex.getMessage().contains("Cannot connect"));
    }

    private RunSettings settings(Path export, boolean dryRun, boolean retainsScratch) {
        return RunSettings.builder().direction(SyncDirection.PUSH).host("localhost").port(3306)
                .user("root").liveDbName("live").urlOptions("allowMultiQueries=true")
                .schemaDir(schemaDir).schemaFileSuffix(".sql").pushScriptExportPath(export)
                .dryRunPush(dryRun).retainsScratch(retainsScratch).scratchDbName("tmp")
                .diffCommand("mysqldiff").diffFailurePolicy(DiffFailurePolicy.ABORT)
                .diffParallelism(1).build();
    }
}
