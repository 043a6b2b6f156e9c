package com.phillippitts.speechgate.util;

import java.time.Duration;

/**
 * Bounds for stream draining and process teardown around inference runtimes.
 *
 * <p>These only cover cleanup. Inference calls themselves are never timed out.
 */
public final class ProcessTimeouts {

    /** Wait for gobbler threads to flush after the process exited. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Grace period after {@link Process#destroy()} before a forced kill. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
    }
}
