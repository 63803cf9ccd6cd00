package io.github.drompincen.collabsync.runtime.connection;

import java.net.URI;

/**
 * One bidirectional text-frame link to the relay. Instances are single use: a reconnect asks the
 * {@link TransportFactory} for a fresh one.
 */
public interface Transport {

    /**
     * Starts opening the link. Completion is reported through {@link TransportListener#onOpen()}, failure
     * through {@link TransportListener#onError(Throwable)}. Callbacks may arrive on any thread.
     */
    void open(URI endpoint, TransportListener listener);

    /**
     * @throws io.github.drompincen.collabsync.protocol.error.TransportException if the frame cannot be written
     */
    void send(String frame);

    void close();

    boolean isOpen();
}
