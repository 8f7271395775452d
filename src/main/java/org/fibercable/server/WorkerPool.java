package org.fibercable.server;

import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.PoolFiberFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded set of threads running connection work. Each connection gets its own fiber, so its tasks run
 * in submission order while different connections run in parallel.
 */
public class WorkerPool {

    private final Supplier<Fiber> fiberFactory;
    private final ExecutorService executor;
    private final PoolFiberFactory poolFiberFactory;

    public WorkerPool(int size) {
        this.executor = Executors.newFixedThreadPool(size, new WorkerThreadFactory());
        this.poolFiberFactory = new PoolFiberFactory(executor);
        this.fiberFactory = poolFiberFactory::create;
    }

    public WorkerPool(Supplier<Fiber> fiberFactory) {
        this.executor = null;
        this.poolFiberFactory = null;
        this.fiberFactory = fiberFactory;
    }

    /**
     * @return a started fiber; dispose it when the connection is torn down.
     */
    public Fiber newFiber() {
        Fiber fiber = fiberFactory.get();
        fiber.start();
        return fiber;
    }

    public void dispose() {
        if (poolFiberFactory != null) {
            poolFiberFactory.dispose();
        }
        if (executor != null) {
            executor.shutdown();
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "cable-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
