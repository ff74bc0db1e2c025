package io.github.yok.flexschemasync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flexschemasync.config.CommandLineOptions;
import io.github.yok.flexschemasync.config.ConnectionConfig;
import io.github.yok.flexschemasync.config.PathsConfig;
import io.github.yok.flexschemasync.config.PullConfig;
import io.github.yok.flexschemasync.config.PushConfig;
import io.github.yok.flexschemasync.config.RunSettingsAssembler;
import io.github.yok.flexschemasync.config.SyncDirection;
import io.github.yok.flexschemasync.core.PullRunner;
import io.github.yok.flexschemasync.core.PushRunner;
import io.github.yok.flexschemasync.model.PushResult;
import io.github.yok.flexschemasync.model.PushStatus;
import io.github.yok.flexschemasync.util.ErrorHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private Main main;

    @BeforeEach
    void setup() {
        main = new Main(new RunSettingsAssembler(new ConnectionConfig(), new PathsConfig(),
                new PushConfig(), new PullConfig()));
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(null);
                    Class<?>[] sources = (Class<?>[]) ctx.arguments().get(0);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"app", "push"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("app"), eq("push"));
        }
    }

    @Test
    void run_正常ケース_pushを指定する_PushRunnerが実行されること() {
        try (MockedConstruction<PushRunner> mocked = mockConstruction(PushRunner.class,
                (mock, ctx) -> when(mock.execute()).thenReturn(
                        PushResult.builder().status(PushStatus.APPLIED).build()))) {

            main.run("app", "push", "--tab", "schema", "--dryRunPush");

            assertEquals(1, mocked.constructed().size());
            verify(mocked.constructed().get(0)).execute();
        }
    }

    @Test
    void run_正常ケース_pullを指定する_PullRunnerが実行されること() {
        try (MockedConstruction<PullRunner> pull = mockConstruction(PullRunner.class);
                MockedConstruction<PushRunner> push = mockConstruction(PushRunner.class)) {

            main.run("app", "pull");

            verify(pull.constructed().get(0)).execute();
            assertTrue(push.constructed().isEmpty());
        }
    }

    @Test
    void run_異常ケース_ライブDB名が未指定_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<PushRunner> push = mockConstruction(PushRunner.class)) {
            mocked.when(() -> ErrorHandler.errorAndExit(anyString())).thenAnswer(inv -> {
                throw new IllegalStateException("exit");
            });

            assertThrows(IllegalStateException.class, () -> main.run());

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("Live database name is required.")));
            assertTrue(push.constructed().isEmpty());
        }
    }

    @Test
    void run_異常ケース_方向が不正_ランナーは実行されないこと() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<PushRunner> push = mockConstruction(PushRunner.class);
                MockedConstruction<PullRunner> pull = mockConstruction(PullRunner.class)) {

            main.run("app", "sideways");

            mocked.verify(() -> ErrorHandler
                    .errorAndExit(eq("Direction must be `push` or `pull` but was: sideways")));
            assertTrue(push.constructed().isEmpty());
            assertTrue(pull.constructed().isEmpty());
        }
    }

    @Test
    void parseArguments_正常ケース_全オプションを指定する_各値が設定されること() {
        CommandLineOptions options = main.parseArguments("app", "push", "--tab", "/repo",
                "--host", "db", "--port", "3307", "--user", "deploy", "--password", "pw",
                "--retainsTmp", "false", "--pushScriptExportPath", "/tmp/p.sql", "--dryRunPush",
                "true");

        assertEquals("app", options.getLiveDbName());
        assertEquals("push", options.getDirection());
        assertEquals("/repo", options.getTab());
        assertEquals("db", options.getHost());
        assertEquals("3307", options.getPort());
        assertEquals("deploy", options.getUser());
        assertEquals("pw", options.getPassword());
        assertEquals(Boolean.FALSE, options.getRetainsTmp());
        assertEquals("/tmp/p.sql", options.getPushScriptExportPath());
        assertEquals(Boolean.TRUE, options.getDryRunPush());
    }

    @Test
    void parseArguments_正常ケース_dryRunPushのみを指定する_trueになり後続の位置引数が保持されること() {
        CommandLineOptions options = main.parseArguments("--dryRunPush", "app", "push");

        assertEquals(Boolean.TRUE, options.getDryRunPush());
        assertEquals("app", options.getLiveDbName());
        assertEquals(SyncDirection.PUSH, SyncDirection.fromArgument(options.getDirection()));
    }

    @Test
    void parseArguments_正常ケース_未知のオプションを指定する_無視されること() {
        CommandLineOptions options = main.parseArguments("app", "--verbose", "pull", "extra");

        assertEquals("app", options.getLiveDbName());
        assertEquals("pull", options.getDirection());
        assertNull(options.getTab());
    }

    @Test
    void parseArguments_正常ケース_値のないオプションで終わる_nullが設定されること() {
        CommandLineOptions options = main.parseArguments("app", "push", "--tab");

        assertNull(options.getTab());
        assertNull(options.getRetainsTmp());
    }
}
