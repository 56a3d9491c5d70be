package io.netwatch.discovery.exec;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

public interface CommandRunner {

    /**
     * @throws IOException          the program could not be started (missing binary, permissions)
     * @throws TimeoutException     the program did not finish in time; it has been killed
     * @throws InterruptedException the calling thread was interrupted while waiting
     */
    CommandResult run(List<String> command, Duration timeout)
        throws IOException, TimeoutException, InterruptedException;
}
