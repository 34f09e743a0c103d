package com.nilsson.soeji.service.reindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 <h2>BoundedWorkerPool</h2>
 <p>
 Drains a list of items with a fixed number of workers that pull from one shared queue, so at
 most {@code concurrency} items are in flight at any time. {@link #drain} returns only after
 every item has been handled.
 </p>
 <p>
 A failing item is reported to the handler and the worker moves on to the next one.
 </p>
 */
public class BoundedWorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BoundedWorkerPool.class);

    @FunctionalInterface
    public interface ItemProcessor<T> {
        void process(T item) throws Exception;
    }

    @FunctionalInterface
    public interface FailureHandler<T> {
        void onFailure(T item, Exception error);
    }

    private final int concurrency;
    private final ExecutorService executor;

    public BoundedWorkerPool(int concurrency) {
        if (concurrency < 1) throw new IllegalArgumentException("Concurrency must be positive: " + concurrency);
        this.concurrency = concurrency;
        this.executor = Executors.newFixedThreadPool(concurrency, new ThreadFactory() {
            private final AtomicInteger count = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r);
                t.setDaemon(true);
                t.setName("Reindex-Worker-" + count.getAndIncrement());
                return t;
            }
        });
    }

    public int getConcurrency() {
        return concurrency;
    }

    public <T> void drain(List<T> items, ItemProcessor<T> processor, FailureHandler<T> onFailure)
            throws InterruptedException {
        if (items.isEmpty()) return;

        Queue<T> queue = new ConcurrentLinkedQueue<>(items);
        int workers = Math.min(concurrency, items.size());
        List<Future<?>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            futures.add(executor.submit(() -> {
                T item;
                while ((item = queue.poll()) != null) {
                    try {
                        processor.process(item);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        onFailure.onFailure(item, e);
                        return;
                    } catch (Exception e) {
                        onFailure.onFailure(item, e);
                    }
                }
            }));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                // Only reachable if a failure handler itself throws
                logger.error("Worker terminated abnormally", e.getCause());
            }
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
