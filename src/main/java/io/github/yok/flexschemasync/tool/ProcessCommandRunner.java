package io.github.yok.flexschemasync.tool;

import io.github.yok.flexschemasync.util.MaskingLogUtil;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>
 * Standard error is drained on a separate thread while standard output is read on the calling
 * thread, so a command writing a lot to both streams cannot block. There is no timeout.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public CommandResult run(List<String> command) throws IOException, InterruptedException {
        log.debug("Executing: {}", MaskingLogUtil.maskCommand(command));
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        CompletableFuture<String> stderr =
                CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
        String stdout;
        try (InputStream in = process.getInputStream()) {
            stdout = IOUtils.toString(in, StandardCharsets.UTF_8);
        }
        int exitCode = process.waitFor();

        try {
            return new CommandResult(exitCode, stdout, stderr.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            throw new IOException("Failed to read standard error", cause);
        }
    }

    private static String readFully(InputStream in) {
        try (InputStream stream = in) {
            return IOUtils.toString(stream, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
