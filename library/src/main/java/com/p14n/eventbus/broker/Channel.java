package com.p14n.eventbus.broker;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * A named channel: a bounded FIFO of pending envelopes and the ordered list of
 * subscriptions every envelope is delivered to.
 */
class Channel {

    private final String name;
    private final BlockingQueue<Envelope> queue;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final boolean ephemeral;

    // written under the owning broker's lifecycle lock
    private volatile Future<?> consumer;
    private volatile long consumerGeneration = -1;

    private volatile boolean retired;
    private volatile Thread consumerThread;

    Channel(String name, int capacity, boolean ephemeral) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.ephemeral = ephemeral;
    }

    String name() {
        return name;
    }

    boolean isEphemeral() {
        return ephemeral;
    }

    boolean offer(Envelope envelope) {
        return queue.offer(envelope);
    }

    Envelope poll(Duration wait) throws InterruptedException {
        return queue.poll(wait.toNanos(), TimeUnit.NANOSECONDS);
    }

    int queueSize() {
        return queue.size();
    }

    /**
     * Removes this exact envelope if it is still queued.
     */
    boolean withdraw(Envelope envelope) {
        return queue.removeIf(queued -> queued == envelope);
    }

    void clearQueue() {
        queue.clear();
    }

    void add(Subscription subscription) {
        subscriptions.add(subscription);
    }

    boolean remove(Subscription subscription) {
        return subscriptions.remove(subscription);
    }

    List<Subscription> subscriptions() {
        return subscriptions;
    }

    int subscriberCount() {
        return subscriptions.size();
    }

    boolean hasConsumer(long generation) {
        return consumer != null && consumerGeneration == generation && !consumer.isDone();
    }

    void consumer(Future<?> future, long generation) {
        this.consumer = future;
        this.consumerGeneration = generation;
    }

    Future<?> consumer() {
        return consumer;
    }

    void retire() {
        retired = true;
        subscriptions.clear();
        queue.clear();
    }

    boolean isRetired() {
        return retired;
    }

    Thread consumerThread() {
        return consumerThread;
    }

    synchronized void consumerThread(Thread thread) {
        this.consumerThread = thread;
    }

    synchronized void clearConsumerThread(Thread thread) {
        if (consumerThread == thread) {
            consumerThread = null;
        }
    }
}
