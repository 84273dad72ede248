package com.streambot.client;

import com.streambot.client.credential.ClientIdentity;
import com.streambot.client.credential.Credentials;
import com.streambot.client.dispatch.CallbackBroadcaster;
import com.streambot.client.dispatch.CallbackRegistry;
import com.streambot.client.dispatch.EventListener;
import com.streambot.client.dispatch.TopicListener;
import com.streambot.client.message.FileDownloader;
import com.streambot.client.message.MediaUploader;
import com.streambot.client.message.OpenApiClient;
import com.streambot.client.message.RobotMessage;
import com.streambot.client.message.RobotMessageSender;
import com.streambot.client.negotiate.TokenNegotiator;
import com.streambot.client.protocol.FrameCodec;
import com.streambot.client.transport.NettyTransportConnector;
import com.streambot.client.transport.TransportConnector;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the stream client.
 * <p>
 * Register listeners, then either call {@link #connect()} on a dedicated
 * thread or {@link #start()} to run the connection loop on the executor.
 * {@link #exit()} stops the loop for good.
 *
 * <pre>{@code
 * StreamClient client = new StreamClient(config)
 *         .registerRobotListener(msg -> log.info("{}", msg.textContent()));
 * client.start();
 * }</pre>
 */
@Slf4j
public class StreamClient implements AutoCloseable {

    private final StreamClientConfig config;
    private final Credentials credentials;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final TransportConnector connector;
    private final FrameCodec codec;
    private final CallbackRegistry registry;
    private final TokenNegotiator negotiator;
    private final ConnectionSupervisor supervisor;

    private final RobotMessageSender messages;
    private final MediaUploader media;
    private final FileDownloader files;

    public StreamClient(StreamClientConfig config) {
        this(config, newDaemonExecutor(), true);
    }

    /**
     * @param executor runs the heartbeat watchdog, topic consumers and
     *                 {@link #start()}; not shut down by {@link #close()}
     */
    public StreamClient(StreamClientConfig config, ExecutorService executor) {
        this(config, executor, false);
    }

    private StreamClient(StreamClientConfig config, ExecutorService executor, boolean ownsExecutor) {
        this(config, executor, ownsExecutor, newHttpClient(config),
                new NettyTransportConnector(config.getHandshakeTimeoutMs()), Clock.systemUTC());
    }

    StreamClient(StreamClientConfig config, ExecutorService executor, boolean ownsExecutor,
            OkHttpClient httpClient, TransportConnector connector, Clock clock) {
        config.validate();
        this.config = config;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.connector = connector;
        this.credentials = new Credentials(
                new ClientIdentity(config.getClientId(), config.getClientSecret()),
                config.getUserAgent(), config.getHeartbeatIntervalMs(), config.getReconnectIntervalMs());
        this.codec = new FrameCodec();
        this.registry = new CallbackRegistry(credentials, executor, codec, new CallbackBroadcaster());
        this.negotiator = new TokenNegotiator(credentials, httpClient,
                config.getTokenUrl(), config.getGatewayUrl(), clock);
        this.supervisor = new ConnectionSupervisor(credentials, negotiator, connector, codec, registry, executor);

        OpenApiClient openApi = new OpenApiClient(negotiator, httpClient, codec.mapper(), config.getOpenApiBaseUrl());
        this.messages = new RobotMessageSender(openApi, codec.mapper(), config.getClientId());
        this.media = new MediaUploader(negotiator, httpClient, codec.mapper(), config.getOapiBaseUrl());
        this.files = new FileDownloader(openApi, httpClient, config.getClientId());
    }

    // =========================================================================
    // Registration
    // =========================================================================

    public StreamClient registerEventListener(EventListener listener) {
        registry.registerEventListener(listener);
        return this;
    }

    public <T> StreamClient registerTopicListener(String topic, Class<T> type, TopicListener<T> listener) {
        registry.registerTopicListener(topic, type, listener);
        return this;
    }

    public StreamClient registerRobotListener(TopicListener<RobotMessage> listener) {
        return registerTopicListener(StreamConstants.TOPIC_ROBOT, RobotMessage.class, listener);
    }

    public StreamClient addStateListener(ConnectionStateListener listener) {
        supervisor.addStateListener(listener);
        return this;
    }

    // =========================================================================
    // Tuning, effective from the next epoch
    // =========================================================================

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
        credentials.setHeartbeatIntervalMs(heartbeatIntervalMs);
    }

    public void setReconnectIntervalMs(long reconnectIntervalMs) {
        credentials.setReconnectIntervalMs(reconnectIntervalMs);
    }

    public void setUserAgent(String userAgent) {
        credentials.setUserAgent(userAgent);
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Run the connection loop on the calling thread. Returns after
     * {@link #exit()}, or after one epoch when the reconnect interval is 0.
     *
     * @throws StreamException if token negotiation or the handshake fails
     */
    public void connect() throws StreamException {
        log.info("Connecting stream client {}", config);
        supervisor.run();
    }

    /**
     * Run {@link #connect()} on the executor.
     */
    public CompletableFuture<Void> start() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                connect();
                done.complete(null);
            } catch (StreamException | RuntimeException e) {
                done.completeExceptionally(e);
            }
        });
        return done;
    }

    public void exit() {
        supervisor.exit();
    }

    public ConnectionState getState() {
        return supervisor.getState();
    }

    public boolean isAlive() {
        return supervisor.isAlive();
    }

    /**
     * Send an application frame on the current connection.
     *
     * @throws NotConnectedException if no connection is open
     */
    public void send(Object frame) throws StreamException {
        String text = frame instanceof String s ? s : codec.encode(frame);
        supervisor.currentSession().send(text);
    }

    // =========================================================================
    // Outbound helpers
    // =========================================================================

    public String getToken() throws AuthException {
        return negotiator.getToken();
    }

    public RobotMessageSender messages() {
        return messages;
    }

    public MediaUploader media() {
        return media;
    }

    public FileDownloader files() {
        return files;
    }

    Credentials credentials() {
        return credentials;
    }

    @Override
    public void close() {
        exit();
        registry.close();
        connector.close();
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static OkHttpClient newHttpClient(StreamClientConfig config) {
        Duration timeout = Duration.ofMillis(config.getHttpTimeoutMs());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    private static ExecutorService newDaemonExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "streambot-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
