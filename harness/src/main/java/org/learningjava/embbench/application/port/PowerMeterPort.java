package org.learningjava.embbench.application.port;

import java.io.IOException;

/**
 * Instantaneous power readings from the accelerators on this host.
 * Implementations are opened once per process and closed at shutdown.
 */
public interface PowerMeterPort extends AutoCloseable {

    /** False when the device-management layer could not be initialised. */
    boolean isAvailable();

    int deviceCount();

    /**
     * Current draw of every device in watts, read in one call. A device whose sensor did not
     * answer is {@link Double#NaN}; the array has {@link #deviceCount()} entries.
     */
    double[] readAllWatts() throws IOException;

    @Override
    void close();
}
