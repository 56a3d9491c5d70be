package io.netwatch.discovery.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

public class ProcessCommandRunner implements CommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ExecutorService streamReaders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "command-output-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Override
    public CommandResult run(List<String> command, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        logger.trace("Running {}", command);
        Process process = new ProcessBuilder(command).start();

        try {
            process.getOutputStream().close();
            CompletableFuture<String> stdout = drain(process.getInputStream());
            CompletableFuture<String> stderr = drain(process.getErrorStream());

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TimeoutException(command.get(0) + " did not finish within " + timeout.toMillis() + " ms");
            }

            return new CommandResult(process.exitValue(), await(stdout), await(stderr));
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                in.transferTo(buffer);
                return buffer.toString(Charset.defaultCharset());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamReaders);
    }

    private static String await(CompletableFuture<String> output) throws IOException, InterruptedException {
        try {
            return output.get(1, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read command output", e.getCause());
        } catch (TimeoutException e) {
            // a child process that inherited the pipe can keep it open after we return
            output.cancel(true);
            return "";
        }
    }
}
