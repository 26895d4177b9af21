package org.learningjava.embbench.domain.service.dispatch;

import org.learningjava.embbench.domain.model.DispatchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one call per batch with at most {@code concurrency} calls in flight.
 * <p>
 * The calling thread takes a permit from a fair semaphore before handing each batch to a worker;
 * the worker gives it back when its call returns or throws. A call that throws is counted as a
 * failure and leaves no latency sample behind.
 */
@Component
public class BoundedDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BoundedDispatcher.class);

    @FunctionalInterface
    public interface BatchCall {
        /** @return latency of the call in milliseconds */
        double call(List<String> batch);
    }

    public DispatchOutcome dispatch(List<List<String>> batches, int concurrency, BatchCall call) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
        }

        Semaphore gate = new Semaphore(concurrency, true);
        List<Double> latencies = Collections.synchronizedList(new ArrayList<>(batches.size()));
        AtomicInteger failures = new AtomicInteger();
        List<Future<?>> pending = new ArrayList<>(batches.size());

        CustomizableThreadFactory threads = new CustomizableThreadFactory("emb-request-");
        threads.setDaemon(true);
        ExecutorService workers = Executors.newCachedThreadPool(threads);
        try {
            for (List<String> batch : batches) {
                gate.acquire();
                try {
                    pending.add(workers.submit(() -> runOne(call, batch, gate, latencies, failures)));
                } catch (RejectedExecutionException e) {
                    gate.release();
                    throw e;
                }
            }
            for (Future<?> f : pending) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Dispatch interrupted after " + pending.size() + " submissions", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Request worker died", e.getCause());
        } finally {
            workers.shutdownNow();
        }

        if (failures.get() > 0) {
            log.warn("{} of {} requests failed", failures.get(), batches.size());
        }
        return new DispatchOutcome(latencies, failures.get());
    }

    private static void runOne(BatchCall call,
                               List<String> batch,
                               Semaphore gate,
                               List<Double> latencies,
                               AtomicInteger failures) {
        try {
            latencies.add(call.call(batch));
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.debug("Request with {} texts failed: {}", batch.size(), e.getMessage());
        } finally {
            gate.release();
        }
    }
}
