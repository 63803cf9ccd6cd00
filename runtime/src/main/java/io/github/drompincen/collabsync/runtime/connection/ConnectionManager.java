package io.github.drompincen.collabsync.runtime.connection;

import io.github.drompincen.collabsync.protocol.error.ProtocolException;
import io.github.drompincen.collabsync.protocol.error.StateException;
import io.github.drompincen.collabsync.protocol.error.TransportException;
import io.github.drompincen.collabsync.protocol.ws.WireCodec;
import io.github.drompincen.collabsync.protocol.ws.WsMessage;
import io.github.drompincen.collabsync.runtime.scheduler.ScheduledTask;
import io.github.drompincen.collabsync.runtime.scheduler.SerialGuard;
import io.github.drompincen.collabsync.runtime.scheduler.SyncScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Owns the transport lifecycle: connect, heartbeat, exponential-backoff reconnect.
 *
 * <p>Every transport callback is tied to the connect attempt that created it; callbacks from a
 * transport that has since been replaced or closed are ignored. All state is guarded by the engine's
 * {@link SerialGuard}.
 */
public class ConnectionManager implements OutboundChannel {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final TransportFactory transportFactory;
    private final SyncScheduler scheduler;
    private final Clock clock;
    private final WireCodec codec;
    private final SerialGuard guard;
    private final ConnectionListener listener;
    private final Duration heartbeatInterval;
    private final int maxReconnectAttempts;
    private final BackoffPolicy backoff;

    private boolean autoReconnect;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int reconnectAttempts;
    private Instant lastHeartbeat;
    private URI endpoint;
    private Transport transport;
    private Link link;
    private ScheduledTask heartbeatTask;
    private ScheduledTask reconnectTask;

    public ConnectionManager(TransportFactory transportFactory, SyncScheduler scheduler, Clock clock,
                             WireCodec codec, SerialGuard guard, ConnectionListener listener,
                             ConnectionOptions options) {
        this.transportFactory = transportFactory;
        this.scheduler = scheduler;
        this.clock = clock;
        this.codec = codec;
        this.guard = guard;
        this.listener = listener;
        this.heartbeatInterval = options.heartbeatInterval();
        this.maxReconnectAttempts = options.maxReconnectAttempts();
        this.autoReconnect = options.autoReconnect();
        this.backoff = options.backoff();
    }

    public void connect(URI target) {
        Objects.requireNonNull(target, "endpoint");
        guard.run(() -> {
            if (state == ConnectionState.CONNECTED && transport != null && transport.isOpen()) {
                log.debug("Already connected to {}", endpoint);
                return;
            }
            if (state == ConnectionState.CONNECTING && target.equals(endpoint)) {
                log.debug("Connection to {} already in progress", target);
                return;
            }
            cancelReconnect();
            closeTransport();
            this.endpoint = target;
            transition(ConnectionState.CONNECTING);

            Link attempt = new Link();
            this.link = attempt;
            this.transport = transportFactory.create();
            log.info("Connecting to {} (attempt {})", target, reconnectAttempts);
            try {
                transport.open(target, attempt);
            } catch (RuntimeException e) {
                handleError(e);
            }
        });
    }

    public void disconnect() {
        guard.run(() -> {
            cancelReconnect();
            stopHeartbeat();
            closeTransport();
            transition(ConnectionState.DISCONNECTED);
        });
    }

    public void reconnect() {
        guard.run(() -> {
            if (endpoint == null) {
                throw new StateException("No endpoint to reconnect to");
            }
            reconnectTask = null;
            reconnectAttempts++;
            transition(ConnectionState.RECONNECTING);
            connect(endpoint);
        });
    }

    @Override
    public boolean send(WsMessage message) {
        return guard.call(() -> {
            if (!isConnected()) {
                return false;
            }
            String frame = codec.encode(message);
            try {
                transport.send(frame);
                return true;
            } catch (TransportException e) {
                log.error("Send failed for {}: {}", message.messageType(), e.getMessage());
                handleError(e);
                return false;
            }
        });
    }

    public boolean isConnected() {
        return guard.call(() -> state == ConnectionState.CONNECTED && transport != null && transport.isOpen());
    }

    public ConnectionState state() {
        return guard.call(() -> state);
    }

    public int reconnectAttempts() {
        return guard.call(() -> reconnectAttempts);
    }

    public Instant lastHeartbeat() {
        return guard.call(() -> lastHeartbeat);
    }

    public URI endpoint() {
        return guard.call(() -> endpoint);
    }

    public boolean isReconnectScheduled() {
        return guard.call(() -> reconnectTask != null && !reconnectTask.isCancelled());
    }

    public void setAutoReconnect(boolean enabled) {
        guard.run(() -> {
            this.autoReconnect = enabled;
            if (!enabled) cancelReconnect();
        });
    }

    private void handleOpen() {
        log.info("Connected to {}", endpoint);
        reconnectAttempts = 0;
        transition(ConnectionState.CONNECTED);
        startHeartbeat();
    }

    private void handleFrame(String frame) {
        WsMessage message;
        try {
            message = codec.decode(frame);
        } catch (ProtocolException e) {
            log.warn("Dropping inbound frame: {}", e.getMessage());
            return;
        }
        if (message instanceof WsMessage.Heartbeat) {
            lastHeartbeat = clock.instant();
            return;
        }
        try {
            listener.onMessage(message);
        } catch (RuntimeException e) {
            log.error("Failed to handle {} message", message.messageType(), e);
        }
    }

    private void handleClose() {
        log.info("Connection to {} closed", endpoint);
        stopHeartbeat();
        link = null;
        transport = null;
        transition(ConnectionState.DISCONNECTED);
        scheduleReconnect();
    }

    private void handleError(Throwable error) {
        log.error("Transport error on {}: {}", endpoint, error.getMessage());
        stopHeartbeat();
        cancelReconnect();
        closeTransport();
        transition(ConnectionState.ERROR);
        listener.onTransportError(error);
    }

    private void scheduleReconnect() {
        if (!autoReconnect || endpoint == null) {
            return;
        }
        if (reconnectAttempts >= maxReconnectAttempts) {
            log.warn("Giving up on {} after {} reconnect attempts", endpoint, reconnectAttempts);
            return;
        }
        Duration delay = backoff.delayFor(reconnectAttempts);
        log.info("Reconnecting to {} in {} ms", endpoint, delay.toMillis());
        reconnectTask = scheduler.schedule(this::reconnect, delay);
    }

    private void startHeartbeat() {
        stopHeartbeat();
        heartbeatTask = scheduler.scheduleAtFixedRate(this::heartbeatTick, heartbeatInterval);
    }

    private void heartbeatTick() {
        if (!isConnected()) {
            stopHeartbeat();
            if (state == ConnectionState.CONNECTED) {
                log.warn("Transport to {} closed without a close callback", endpoint);
                closeTransport();
                handleClose();
            }
            return;
        }
        send(new WsMessage.Heartbeat(clock.millis()));
    }

    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel();
            heartbeatTask = null;
        }
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel();
            reconnectTask = null;
        }
    }

    private void closeTransport() {
        link = null;
        Transport current = transport;
        transport = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("Error closing transport: {}", e.getMessage());
            }
        }
    }

    private void transition(ConnectionState next) {
        if (state == next) {
            return;
        }
        ConnectionState previous = state;
        state = next;
        log.debug("Connection state {} -> {}", previous, next);
        listener.onStateChanged(previous, next);
    }

    private final class Link implements TransportListener {

        @Override
        public void onOpen() {
            guard.run(() -> {
                if (link == this) handleOpen();
            });
        }

        @Override
        public void onMessage(String frame) {
            guard.run(() -> {
                if (link == this) handleFrame(frame);
            });
        }

        @Override
        public void onClose() {
            guard.run(() -> {
                if (link == this) handleClose();
            });
        }

        @Override
        public void onError(Throwable error) {
            guard.run(() -> {
                if (link == this) handleError(error);
            });
        }
    }
}
