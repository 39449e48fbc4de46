package com.syncpipeline.service.worker;

import com.syncpipeline.config.TraceContextManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single-writer worker: one dedicated thread drains a FIFO queue of tasks.
 *
 * At most one task runs at any time and tasks run in submission order.
 * {@link #submit(Callable)} never blocks; the queue is unbounded.
 * The caller's MDC is carried onto the worker thread for each task.
 */
@Slf4j
public class SerialChunkWorker implements AutoCloseable {

    private final BlockingQueue<QueuedTask> queue = new LinkedBlockingQueue<>();
    private final Object submitLock = new Object();
    private final Thread workerThread;
    private final Duration shutdownTimeout;
    private boolean accepting = true;

    public SerialChunkWorker(String threadName, Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
        this.workerThread = new Thread(this::drain, threadName);
        this.workerThread.setDaemon(true);
        this.workerThread.start();
        log.info("SerialChunkWorker '{}' started (shutdown timeout {}s)", threadName, shutdownTimeout.toSeconds());
    }

    /**
     * Queues a task behind everything submitted before it.
     *
     * @return future completed with the task's value, or exceptionally with what it threw
     * @throws RejectedExecutionException if the worker has been closed
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        QueuedTask queued = new CallableTask<>(TraceContextManager.propagate(task), future);
        synchronized (submitLock) {
            if (!accepting) {
                throw new RejectedExecutionException("Worker " + workerThread.getName() + " is closed");
            }
            queue.add(queued);
        }
        return future;
    }

    public boolean isAccepting() {
        synchronized (submitLock) {
            return accepting;
        }
    }

    /**
     * Stops intake, lets queued tasks finish and waits for the worker thread.
     * Tasks still queued when the timeout expires are failed with {@link RejectedExecutionException}.
     */
    @Override
    public void close() {
        synchronized (submitLock) {
            if (!accepting) return;
            accepting = false;
            queue.add(StopSignal.INSTANCE);
        }
        log.info("Closing worker '{}' with {} pending tasks", workerThread.getName(), queue.size() - 1);
        try {
            workerThread.join(shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (workerThread.isAlive()) {
            log.warn("Worker '{}' did not drain within {}s, interrupting", workerThread.getName(),
                    shutdownTimeout.toSeconds());
            workerThread.interrupt();
        }
        abandonRemaining();
    }

    private void drain() {
        while (true) {
            QueuedTask task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (task == StopSignal.INSTANCE) {
                break;
            }
            task.run();
        }
        log.info("Worker '{}' stopped", workerThread.getName());
    }

    private void abandonRemaining() {
        List<QueuedTask> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        for (QueuedTask task : leftovers) {
            task.abandon(new RejectedExecutionException("Worker closed before task ran"));
        }
        // worker may still be finishing its last task
        if (workerThread.isAlive()) {
            queue.add(StopSignal.INSTANCE);
        }
    }

    private interface QueuedTask {
        void run();

        void abandon(RejectedExecutionException reason);
    }

    private record CallableTask<T>(Callable<T> callable, CompletableFuture<T> future) implements QueuedTask {
        @Override
        public void run() {
            try {
                future.complete(callable.call());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        }

        @Override
        public void abandon(RejectedExecutionException reason) {
            future.completeExceptionally(reason);
        }
    }

    private enum StopSignal implements QueuedTask {
        INSTANCE;

        @Override
        public void run() {}

        @Override
        public void abandon(RejectedExecutionException reason) {}
    }
}
