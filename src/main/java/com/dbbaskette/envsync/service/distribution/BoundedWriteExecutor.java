package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Runs scope writes on a fixed pool. Every task is awaited independently up to one deadline;
 * tasks still running at the deadline are cancelled and reported through the failure mapper.
 */
@Component
public class BoundedWriteExecutor {

    private static final Logger log = LoggerFactory.getLogger(BoundedWriteExecutor.class);

    private final ExecutorService pool;

    public BoundedWriteExecutor(EnvSyncProperties properties) {
        int concurrency = properties.getDistribution().getConcurrency();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, "envsync-write-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.pool = Executors.newFixedThreadPool(concurrency, factory);
        log.info("Scope write pool started with {} threads", concurrency);
    }

    /**
     * @param failure maps a task index and its failure (a {@link CancellationException} on timeout) to a result
     */
    public <T> List<T> runAll(List<Callable<T>> tasks, Duration timeout, BiFunction<Integer, Throwable, T> failure) {
        if (tasks.isEmpty()) return List.of();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Callable<T>> wrapped = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            wrapped.add(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return task.call();
                } finally {
                    MDC.clear();
                }
            });
        }

        List<Future<T>> futures;
        try {
            futures = pool.invokeAll(wrapped, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            List<T> interrupted = new ArrayList<>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                interrupted.add(failure.apply(i, new CancellationException("Interrupted before completion")));
            }
            return interrupted;
        }

        List<T> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            Future<T> future = futures.get(i);
            try {
                results.add(future.get());
            } catch (CancellationException e) {
                results.add(failure.apply(i, e));
            } catch (ExecutionException e) {
                results.add(failure.apply(i, e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(failure.apply(i, e));
            }
        }
        return results;
    }

    @PreDestroy
    void shutdown() {
        pool.shutdownNow();
    }
}
