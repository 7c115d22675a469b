package com.p14n.eventbus.broker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventbus.data.BrokerConfig;
import com.p14n.eventbus.data.ConfigData;
import com.p14n.eventbus.telemetry.BrokerMetrics;
import com.p14n.eventbus.telemetry.OpenTelemetryFunctions;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * In-memory message broker that queues messages per channel and delivers them
 * asynchronously to the channel's subscribers.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>One bounded FIFO queue and one consumer loop per channel; messages on a
 * channel are delivered in publish order</li>
 * <li>Non-blocking publish: a full queue drops the message and is reported in
 * the {@link PublishResult}</li>
 * <li>Request/response over ephemeral reply channels, matched by correlation
 * id</li>
 * <li>OpenTelemetry integration for metrics and tracing</li>
 * <li>Automatic resource cleanup via AutoCloseable</li>
 * </ul>
 *
 * <p>
 * Channels are created on first subscription and live as long as the broker,
 * except the ephemeral {@code _reply.<id>} channels, which are retired as soon
 * as their request completes or times out.
 * </p>
 *
 * <pre>{@code
 * try (var broker = new DefaultMessageBroker(OpenTelemetry.noop(), "local")) {
 *     broker.subscribe("events.order.created", order -> Map.of("status", "ok"));
 *     broker.start();
 *     Map<String, Object> reply = broker.request("events.order.created",
 *             Map.of("order_id", "ORD-001"), Duration.ofSeconds(1));
 * }
 * }</pre>
 */
public class DefaultMessageBroker implements MessageBroker {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMessageBroker.class);

    /**
     * Prefix of the ephemeral channels replies are sent to.
     */
    public static final String REPLY_PREFIX = "_reply.";

    private final String name;
    private final BrokerConfig config;
    private final AsyncExecutor asyncExecutor;
    private final boolean ownsExecutor;

    private final BrokerMetrics metrics;
    private final Tracer tracer;
    private final OpenTelemetry openTelemetry;

    private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();
    private final PendingRequests pendingRequests = new PendingRequests();

    private final Object lifecycleLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong consumed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    /**
     * Creates a broker with default configuration and no telemetry.
     */
    public DefaultMessageBroker() {
        this(OpenTelemetry.noop(), "eventbus");
    }

    /**
     * Creates a broker with default configuration and its own executor.
     *
     * @param ot        The OpenTelemetry instance for metrics and tracing
     * @param scopeName The broker name, also used as OpenTelemetry scope
     */
    public DefaultMessageBroker(OpenTelemetry ot, String scopeName) {
        this(ConfigData.defaults(), ot, scopeName);
    }

    /**
     * Creates a broker with its own executor, shut down by {@link #close()}.
     *
     * @param config    Queue size and timing settings
     * @param ot        The OpenTelemetry instance for metrics and tracing
     * @param scopeName The broker name, also used as OpenTelemetry scope
     */
    public DefaultMessageBroker(BrokerConfig config, OpenTelemetry ot, String scopeName) {
        this(new DefaultExecutor(), true, config, ot, scopeName);
    }

    /**
     * Creates a broker running its consumer loops on the given executor. The
     * executor stays open when the broker is closed.
     *
     * @param asyncExecutor The executor that runs consumer loops
     * @param config        Queue size and timing settings
     * @param ot            The OpenTelemetry instance for metrics and tracing
     * @param scopeName     The broker name, also used as OpenTelemetry scope
     */
    public DefaultMessageBroker(AsyncExecutor asyncExecutor, BrokerConfig config, OpenTelemetry ot,
            String scopeName) {
        this(asyncExecutor, false, config, ot, scopeName);
    }

    private DefaultMessageBroker(AsyncExecutor asyncExecutor, boolean ownsExecutor, BrokerConfig config,
            OpenTelemetry ot, String scopeName) {
        if (asyncExecutor == null || config == null || ot == null) {
            throw new IllegalArgumentException("Executor, config and OpenTelemetry cannot be null");
        }
        if (config.maxQueueSize() <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be positive");
        }
        this.name = scopeName;
        this.config = config;
        this.asyncExecutor = asyncExecutor;
        this.ownsExecutor = ownsExecutor;
        this.metrics = new BrokerMetrics(ot.getMeter(scopeName));
        this.tracer = ot.getTracer(scopeName);
        this.openTelemetry = ot;
    }

    public String name() {
        return name;
    }

    /**
     * Starts the broker and launches a consumer loop for every known channel.
     * If a loop cannot be launched the broker is returned to the stopped state.
     *
     * @throws BrokerException if a consumer loop could not be launched
     */
    @Override
    public void start() {
        List<Channel> rollback;
        RuntimeException failure;
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            long gen = generation.incrementAndGet();
            for (Channel channel : channels.values()) {
                channel.clearQueue();
            }
            running.set(true);
            try {
                for (Channel channel : channels.values()) {
                    launch(channel, gen);
                }
                logger.atInfo()
                        .addArgument(name)
                        .addArgument(channels.size())
                        .log("Broker {} started with {} channel(s)");
                return;
            } catch (RuntimeException e) {
                failure = e;
                rollback = halt();
            }
        }
        awaitConsumers(rollback);
        logger.atError()
                .setCause(failure)
                .addArgument(name)
                .log("Failed to start broker {}");
        throw new BrokerException("Failed to start broker " + name, failure);
    }

    /**
     * Stops the broker. Consumer loops finish the subscriber they are running and
     * exit; messages still queued are dropped. Waits up to the configured
     * shutdown timeout for the loops.
     */
    @Override
    public void stop() {
        List<Channel> stopping;
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            stopping = halt();
        }
        awaitConsumers(stopping);
        logger.atInfo()
                .addArgument(name)
                .log("Broker {} stopped");
    }

    private List<Channel> halt() {
        running.set(false);
        generation.incrementAndGet();
        List<Channel> stopping = new ArrayList<>(channels.values());
        for (Channel channel : stopping) {
            channel.clearQueue();
        }
        return stopping;
    }

    private void awaitConsumers(List<Channel> stopping) {
        long deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
        for (Channel channel : stopping) {
            Future<?> consumer = channel.consumer();
            if (consumer == null || channel.consumerThread() == Thread.currentThread()) {
                continue;
            }
            try {
                consumer.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logger.atWarn()
                        .addArgument(channel.name())
                        .log("Consumer loop for channel {} is still running a subscriber");
            } catch (ExecutionException e) {
                logger.atError()
                        .setCause(e.getCause())
                        .addArgument(channel.name())
                        .log("Consumer loop for channel {} failed");
            } catch (CancellationException e) {
                logger.atDebug()
                        .addArgument(channel.name())
                        .log("Consumer loop for channel {} was cancelled");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    boolean isActive(long loopGeneration) {
        return running.get() && generation.get() == loopGeneration;
    }

    private void ensureConsumer(Channel channel) {
        if (!running.get() || channel.hasConsumer(generation.get())) {
            return;
        }
        synchronized (lifecycleLock) {
            if (running.get()) {
                launch(channel, generation.get());
            }
        }
    }

    private void launch(Channel channel, long gen) {
        if (channel.isRetired() || channel.hasConsumer(gen)) {
            return;
        }
        channel.consumer(asyncExecutor.submit(new ConsumerLoop(this, channel, gen)), gen);
    }

    /**
     * Appends a subscriber to the channel, creating the channel on first use. The
     * channel's consumer loop is launched straight away when the broker is
     * running.
     */
    @Override
    public Subscription subscribe(String channel, MessageSubscriber subscriber) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel is required");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        Channel target = channels.computeIfAbsent(channel,
                n -> new Channel(n, config.maxQueueSize(), n.startsWith(REPLY_PREFIX)));
        Subscription subscription = new Subscription(channel, subscriber);
        target.add(subscription);
        metrics.recordSubscriberAdded(channel);
        ensureConsumer(target);

        if (!target.isEphemeral()) {
            logger.atDebug()
                    .addArgument(subscriber.name())
                    .addArgument(channel)
                    .addArgument(name)
                    .log("Registered subscriber '{}' on channel {} of broker {}");
        }
        return subscription;
    }

    @Override
    public boolean unsubscribe(Subscription subscription) {
        if (subscription == null) {
            throw new IllegalArgumentException("Subscription cannot be null");
        }
        Channel channel = channels.get(subscription.channel());
        if (channel != null && channel.remove(subscription)) {
            metrics.recordSubscriberRemoved(subscription.channel());
            return true;
        }
        return false;
    }

    /**
     * Returns a publisher bound to the channel.
     */
    public ChannelPublisher publisher(String channel) {
        return new ChannelPublisher(this, channel);
    }

    @Override
    public PublishResult publish(String channel, Map<String, Object> payload, Map<String, String> headers) {
        long gen = generation.get();
        if (!isActive(gen)) {
            throw new IllegalStateException("Broker " + name + " is not running. Call start() first.");
        }
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel is required");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }

        Channel target = channels.get(channel);
        if (target == null || target.subscriberCount() == 0) {
            logger.atDebug()
                    .addArgument(channel)
                    .log("No subscribers on channel {}, message dropped");
            return PublishResult.noSubscribers();
        }
        ensureConsumer(target);

        Envelope envelope = new Envelope(payload, OpenTelemetryFunctions.withTraceContext(openTelemetry, headers));
        if (!target.offer(envelope)) {
            recordFailed(channel);
            logger.atWarn()
                    .addArgument(channel)
                    .addArgument(config.maxQueueSize())
                    .log("Queue for channel {} is full ({} messages), message dropped");
            return PublishResult.queueFull();
        }
        if (!isActive(gen) && target.withdraw(envelope)) {
            throw new IllegalStateException("Broker " + name + " stopped while publishing to " + channel);
        }

        published.incrementAndGet();
        metrics.recordPublished(channel);
        return PublishResult.accepted(target.subscriberCount());
    }

    /**
     * Sends a request using the configured default timeout.
     *
     * @see #request(String, Map, Duration)
     */
    public Map<String, Object> request(String channel, Map<String, Object> payload)
            throws RequestTimeoutException, InterruptedException {
        return request(channel, payload, config.requestTimeout());
    }

    /**
     * Publishes a request and waits for the first reply. The request carries a
     * fresh correlation id and the name of an ephemeral reply channel; a
     * subscriber that returns a non-empty result answers it.
     *
     * @param channel The channel to send the request to
     * @param payload The request
     * @param timeout How long to wait for the reply
     * @return the reply
     * @throws RequestTimeoutException  if no reply arrived in time
     * @throws InterruptedException     if the waiting thread was interrupted
     * @throws IllegalStateException    if the broker is not running
     * @throws IllegalArgumentException if the channel is missing
     */
    public Map<String, Object> request(String channel, Map<String, Object> payload, Duration timeout)
            throws RequestTimeoutException, InterruptedException {
        if (!running.get()) {
            throw new IllegalStateException("Broker " + name + " is not running. Call start() first.");
        }
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel is required");
        }
        Duration wait = timeout == null ? config.requestTimeout() : timeout;

        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<Map<String, Object>> response = pendingRequests.register(correlationId);
        String replyChannel = REPLY_PREFIX + correlationId;
        subscribe(replyChannel, MessageSubscriber.listening("reply:" + correlationId,
                reply -> pendingRequests.complete(correlationId, reply)));

        try {
            PublishResult result = publish(channel, payload,
                    Map.of(Envelope.REPLY_TO, replyChannel, Envelope.CORRELATION_ID, correlationId));
            logger.atDebug()
                    .addArgument(correlationId)
                    .addArgument(channel)
                    .addArgument(result.status())
                    .log("Request {} sent to channel {}: {}");
            return response.get(wait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pendingRequests.expire(correlationId);
            throw new RequestTimeoutException(channel, correlationId, wait);
        } catch (ExecutionException e) {
            throw new BrokerException("Request " + correlationId + " failed", e.getCause());
        } finally {
            pendingRequests.expire(correlationId);
            retire(replyChannel);
        }
    }

    int pendingRequestCount() {
        return pendingRequests.size();
    }

    Channel channel(String channel) {
        return channels.get(channel);
    }

    private void retire(String channel) {
        Channel retired = channels.remove(channel);
        if (retired == null) {
            return;
        }
        int subscribers = retired.subscriberCount();
        retired.retire();
        for (int i = 0; i < subscribers; i++) {
            metrics.recordSubscriberRemoved(channel);
        }
    }

    void recordConsumed(String channel) {
        consumed.incrementAndGet();
        metrics.recordReceived(channel);
    }

    void recordFailed(String channel) {
        errors.incrementAndGet();
        metrics.recordFailed(channel);
    }

    BrokerConfig config() {
        return config;
    }

    OpenTelemetry openTelemetry() {
        return openTelemetry;
    }

    Tracer tracer() {
        return tracer;
    }

    /**
     * Returns a snapshot of the broker counters and channel table.
     */
    public BrokerStats getStats() {
        Map<String, Integer> queueSizes = new TreeMap<>();
        int subscribers = 0;
        for (Channel channel : channels.values()) {
            queueSizes.put(channel.name(), channel.queueSize());
            subscribers += channel.subscriberCount();
        }
        return new BrokerStats(published.get(), consumed.get(), errors.get(), running.get(),
                queueSizes.size(), subscribers, queueSizes);
    }

    /**
     * Returns the subscribers of every channel, in registration order.
     */
    public Map<String, List<SubscriberInfo>> getSubscribers() {
        Map<String, List<SubscriberInfo>> result = new TreeMap<>();
        for (Channel channel : channels.values()) {
            List<SubscriberInfo> infos = new ArrayList<>();
            for (Subscription subscription : channel.subscriptions()) {
                infos.add(new SubscriberInfo(subscription.subscriber().name(), channel.name()));
            }
            result.put(channel.name(), List.copyOf(infos));
        }
        return result;
    }

    /**
     * Stops the broker and shuts down the executor if the broker created it.
     */
    @Override
    public void close() {
        try {
            stop();
        } finally {
            if (ownsExecutor) {
                asyncExecutor.close();
            }
        }
    }
}
