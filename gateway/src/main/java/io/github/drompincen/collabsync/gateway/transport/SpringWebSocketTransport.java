package io.github.drompincen.collabsync.gateway.transport;

import io.github.drompincen.collabsync.protocol.error.TransportException;
import io.github.drompincen.collabsync.runtime.connection.Transport;
import io.github.drompincen.collabsync.runtime.connection.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;

/**
 * Client side {@link Transport} over Spring's {@link WebSocketClient}.
 */
public class SpringWebSocketTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(SpringWebSocketTransport.class);

    private final WebSocketClient client;
    private volatile WebSocketSession session;

    public SpringWebSocketTransport(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public void open(URI endpoint, TransportListener listener) {
        log.debug("Opening WebSocket to {}", endpoint);
        client.execute(new ListenerAdapter(listener), endpoint.toString())
                .whenComplete((opened, error) -> {
                    if (error != null) {
                        listener.onError(error);
                    }
                });
    }

    @Override
    public void send(String frame) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            throw new TransportException("WebSocket is not open");
        }
        try {
            synchronized (current) {
                current.sendMessage(new TextMessage(frame));
            }
        } catch (IOException e) {
            throw new TransportException("Failed to send frame: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error closing WebSocket {}: {}", current.getId(), e.getMessage());
            }
        }
    }

    @Override
    public boolean isOpen() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    private final class ListenerAdapter extends TextWebSocketHandler {

        private final TransportListener listener;

        private ListenerAdapter(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession opened) {
            session = opened;
            listener.onOpen();
        }

        @Override
        protected void handleTextMessage(WebSocketSession source, TextMessage message) {
            listener.onMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession source, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession closed, CloseStatus status) {
            log.debug("WebSocket {} closed: {}", closed.getId(), status);
            listener.onClose();
        }
    }
}
