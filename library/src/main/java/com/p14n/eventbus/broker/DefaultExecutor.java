package com.p14n.eventbus.broker;

import java.util.List;
import java.util.concurrent.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor}.
 * Each consumer loop holds its thread for as long as its channel is active, so
 * the default pool grows on demand; a fixed-size pool can be chosen instead.
 * Threads are named and daemon so an unclosed broker never keeps the JVM alive.
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ExecutorService es;

        /**
         * Creates a new executor backed by a cached thread pool.
         */
        public DefaultExecutor() {
                this.es = createCachedExecutorService();
        }

        /**
         * Creates a new executor backed by a fixed-size thread pool. Channels beyond
         * the pool size wait for a free thread before their loop starts.
         *
         * @param fixedSize the size of the fixed thread pool
         */
        public DefaultExecutor(int fixedSize) {
                this.es = createFixedExecutorService(fixedSize);
        }

        /**
         * Creates a fixed-size thread pool with named threads.
         *
         * @param size the number of threads in the pool
         * @return a fixed thread pool executor service
         */
        protected ExecutorService createFixedExecutorService(int size) {
                return Executors.newFixedThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("event-bus-fixed-%d").setDaemon(true).build());
        }

        /**
         * Creates a cached thread pool with named threads.
         *
         * @return a cached thread pool executor service
         */
        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder().setNameFormat("event-bus-consumer-%d").setDaemon(true).build());
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
