package org.learningjava.embbench.domain.service.power;

import org.learningjava.embbench.application.port.PowerMeterPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalDouble;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls a {@link PowerMeterPort} on its own executor while a measurement runs.
 * <p>
 * Every tick reads all devices with one meter call, sums the ones that answered and appends the
 * total to a lock-free queue; nothing on the request path ever waits on the sampler.
 */
public class PowerSampler {

    private static final Logger log = LoggerFactory.getLogger(PowerSampler.class);

    private final PowerMeterPort meter;
    private final Executor executor;
    private final Duration pollInterval;
    private final Duration stopTimeout;

    public PowerSampler(PowerMeterPort meter, Executor executor, Duration pollInterval, Duration stopTimeout) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, got " + pollInterval);
        }
        this.meter = meter;
        this.executor = executor;
        this.pollInterval = pollInterval;
        this.stopTimeout = stopTimeout;
    }

    public SamplingWindow start() {
        if (!meter.isAvailable()) return SamplingWindow.NONE;
        try {
            return new ActiveWindow();
        } catch (RejectedExecutionException e) {
            log.warn("No free sampler thread, power will not be reported for this point: {}", e.getMessage());
            return SamplingWindow.NONE;
        }
    }

    /** Sum over devices, or null when no device answered. */
    Double readTotal() {
        double[] watts;
        try {
            watts = meter.readAllWatts();
        } catch (IOException | RuntimeException e) {
            log.debug("Power read failed: {}", e.getMessage());
            return null;
        }
        double total = 0.0;
        int answered = 0;
        for (double w : watts) {
            if (Double.isNaN(w)) continue;
            total += w;
            answered++;
        }
        return answered > 0 ? total : null;
    }

    private final class ActiveWindow implements SamplingWindow {

        private final Queue<Double> samples = new ConcurrentLinkedQueue<>();
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final CompletableFuture<Void> loop;
        private OptionalDouble mean;

        ActiveWindow() {
            this.loop = CompletableFuture.runAsync(this::poll, executor);
        }

        // Ticks sit on a fixed grid from the first sample; time spent reading comes out of the wait.
        private void poll() {
            long interval = pollInterval.toNanos();
            long nextTick = System.nanoTime();
            try {
                do {
                    Double total = readTotal();
                    if (total != null) samples.add(total);
                    nextTick += interval;
                    long behind = System.nanoTime() - nextTick;
                    if (behind > 0) {
                        // read overran one or more ticks: skip them rather than sampling back to back
                        nextTick += (behind / interval + 1) * interval;
                    }
                } while (!stopSignal.await(Math.max(0L, nextTick - System.nanoTime()), TimeUnit.NANOSECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public synchronized OptionalDouble stop() {
            if (mean != null) return mean;
            stopSignal.countDown();
            try {
                loop.get(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Power sampler still busy after {} ms, abandoning it", stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping the power sampler");
            } catch (ExecutionException e) {
                log.warn("Power sampler loop failed", e.getCause());
            }
            mean = samples.stream().mapToDouble(Double::doubleValue).average();
            log.debug("Power window closed with {} samples", samples.size());
            return mean;
        }
    }
}
