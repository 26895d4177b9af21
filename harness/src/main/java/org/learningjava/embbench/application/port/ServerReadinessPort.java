package org.learningjava.embbench.application.port;

import java.time.Duration;

public interface ServerReadinessPort {
    /** Blocks until the server answers its health check or {@code timeout} passes. */
    boolean awaitReady(Duration timeout);
}
