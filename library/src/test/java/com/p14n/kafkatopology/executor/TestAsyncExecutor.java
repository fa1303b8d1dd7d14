package com.p14n.kafkatopology.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * Queues submitted tasks until the test runs them with {@link #runPending()}.
 */
public class TestAsyncExecutor implements AsyncExecutor {

    private final List<FutureTask<?>> pendingTasks = new CopyOnWriteArrayList<>();
    private final int capacity;
    private volatile boolean isShutdown = false;

    public TestAsyncExecutor() {
        this(Integer.MAX_VALUE);
    }

    public TestAsyncExecutor(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public List<Runnable> shutdownNow() {
        isShutdown = true;
        List<Runnable> runnables = new ArrayList<>(pendingTasks);
        pendingTasks.clear();
        return runnables;
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        if (isShutdown) {
            throw new RejectedExecutionException("Executor is shutdown");
        }
        if (pendingTasks.size() >= capacity) {
            throw new RejectedExecutionException("Queue is full");
        }
        FutureTask<T> future = new FutureTask<>(task);
        pendingTasks.add(future);
        return future;
    }

    @Override
    public void close() {
        shutdownNow();
    }

    public boolean isShutdown() {
        return isShutdown;
    }

    public int pending() {
        return pendingTasks.size();
    }

    /**
     * Runs every queued task on the calling thread, in submission order.
     *
     * @return the number of tasks run
     */
    public int runPending() {
        List<FutureTask<?>> tasks = new ArrayList<>(pendingTasks);
        pendingTasks.removeAll(tasks);
        tasks.forEach(FutureTask::run);
        return tasks.size();
    }
}
