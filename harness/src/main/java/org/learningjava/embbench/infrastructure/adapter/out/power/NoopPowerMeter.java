package org.learningjava.embbench.infrastructure.adapter.out.power;

import org.learningjava.embbench.application.port.PowerMeterPort;

import java.io.IOException;

/** Stand-in used when no GPU management tooling is present. */
public class NoopPowerMeter implements PowerMeterPort {

    @Override public boolean isAvailable() { return false; }

    @Override public int deviceCount() { return 0; }

    @Override
    public double[] readAllWatts() throws IOException {
        throw new IOException("power metering is not available");
    }

    @Override public void close() { }
}
