package org.learningjava.embbench.infrastructure.adapter.out.power;

import org.learningjava.embbench.application.port.PowerMeterPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads GPU board power through the {@code nvidia-smi} CLI, one process per reading for all
 * devices.
 * <p>
 * Devices are enumerated once in {@link #open}; if that fails the caller gets a
 * {@link NoopPowerMeter} and the rest of the run reports no power data.
 */
public class NvidiaSmiPowerMeter implements PowerMeterPort {

    private static final Logger log = LoggerFactory.getLogger(NvidiaSmiPowerMeter.class);

    private final String command;
    private final List<Integer> devices;
    private final Duration timeout;
    private volatile boolean closed;

    NvidiaSmiPowerMeter(String command, List<Integer> devices, Duration timeout) {
        this.command = command;
        this.devices = List.copyOf(devices);
        this.timeout = timeout;
    }

    public static PowerMeterPort open(String command, Duration timeout) {
        try {
            String out = run(List.of(command, "--query-gpu=index", "--format=csv,noheader"), timeout);
            List<Integer> devices = parseIndices(out);
            if (devices.isEmpty()) {
                log.info("{} reported no GPUs, power will not be sampled", command);
                return new NoopPowerMeter();
            }
            log.info("Power metering via {} on {} device(s): {}", command, devices.size(), devices);
            return new NvidiaSmiPowerMeter(command, devices, timeout);
        } catch (IOException e) {
            log.info("Power metering unavailable ({}), power fields will be empty", e.getMessage());
            return new NoopPowerMeter();
        }
    }

    @Override public boolean isAvailable() { return !closed; }

    @Override public int deviceCount() { return devices.size(); }

    @Override
    public double[] readAllWatts() throws IOException {
        if (closed) throw new IOException("power meter closed");
        String out = run(List.of(command, "--query-gpu=index,power.draw", "--format=csv,noheader,nounits"), timeout);
        return parseReadings(out, devices);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("Power meter closed");
        }
    }

    static List<Integer> parseIndices(String out) throws IOException {
        List<Integer> indices = new ArrayList<>();
        for (String line : out.split("\\R")) {
            String s = line.trim();
            if (s.isEmpty()) continue;
            try {
                indices.add(Integer.parseInt(s));
            } catch (NumberFormatException e) {
                throw new IOException("Unexpected GPU index line: '" + s + "'", e);
            }
        }
        return indices;
    }

    /**
     * Parses {@code index, watts} lines into one slot per enumerated device. Devices missing from
     * the output or without a readable sensor are NaN; GPUs that were not enumerated are ignored.
     */
    static double[] parseReadings(String out, List<Integer> devices) throws IOException {
        double[] watts = new double[devices.size()];
        Arrays.fill(watts, Double.NaN);
        for (String line : out.split("\\R")) {
            String s = line.trim();
            if (s.isEmpty()) continue;
            int comma = s.indexOf(',');
            if (comma < 0) throw new IOException("Unexpected power line: '" + s + "'");
            int gpu;
            try {
                gpu = Integer.parseInt(s.substring(0, comma).trim());
            } catch (NumberFormatException e) {
                throw new IOException("Unexpected power line: '" + s + "'", e);
            }
            int slot = devices.indexOf(gpu);
            if (slot < 0) continue;
            try {
                watts[slot] = parseWatts(s.substring(comma + 1));
            } catch (IOException e) {
                log.debug("GPU {}: {}", gpu, e.getMessage());
            }
        }
        return watts;
    }

    static double parseWatts(String out) throws IOException {
        String s = out.trim();
        int nl = s.indexOf('\n');
        if (nl >= 0) s = s.substring(0, nl).trim();
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            // "[N/A]" or "[Not Supported]" on boards without a power sensor
            throw new IOException("Unreadable power value: '" + s + "'", e);
        }
    }

    private static String run(List<String> cmd, Duration timeout) throws IOException {
        Process p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new IOException(cmd.get(0) + " timed out after " + timeout.toMillis() + " ms");
            }
            String out;
            try (InputStream in = p.getInputStream()) {
                out = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            if (p.exitValue() != 0) {
                throw new IOException(cmd.get(0) + " exited with " + p.exitValue() + ": " + out.trim());
            }
            return out;
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running " + cmd.get(0), e);
        }
    }
}
