package com.p14n.kafkatopology.executor;

import java.util.List;
import java.util.concurrent.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a fixed-size pool
 * of named daemon threads.
 *
 * <p>
 * The work queue is bounded; when it is full the task is rejected rather than
 * blocking the submitter, so callers that must not stall can treat a
 * {@link RejectedExecutionException} as a dropped task.
 * </p>
 */
public class DefaultExecutor implements AsyncExecutor {

        public static final int DEFAULT_QUEUE_CAPACITY = 1024;

        private final ExecutorService es;

        /**
         * Creates a new executor with a fixed-size thread pool.
         *
         * @param size the number of threads in the pool
         */
        public DefaultExecutor(int size) {
                this(size, DEFAULT_QUEUE_CAPACITY);
        }

        /**
         * Creates a new executor with a fixed-size thread pool and a bounded
         * queue.
         *
         * @param size          the number of threads in the pool
         * @param queueCapacity the maximum number of queued tasks
         */
        public DefaultExecutor(int size, int queueCapacity) {
                this.es = createFixedExecutorService(size, queueCapacity);
        }

        /**
         * Creates a fixed-size thread pool with named threads.
         *
         * @param size          the number of threads in the pool
         * @param queueCapacity the maximum number of queued tasks
         * @return a fixed thread pool executor service
         */
        protected ExecutorService createFixedExecutorService(int size, int queueCapacity) {
                return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                                new ArrayBlockingQueue<>(queueCapacity),
                                new ThreadFactoryBuilder()
                                                .setNameFormat("kafka-topology-fixed-%d")
                                                .setDaemon(true)
                                                .build(),
                                new ThreadPoolExecutor.AbortPolicy());
        }

        @Override
        public List<Runnable> shutdownNow() {
                return es.shutdownNow();
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public void close() {
                shutdownNow();
        }
}
