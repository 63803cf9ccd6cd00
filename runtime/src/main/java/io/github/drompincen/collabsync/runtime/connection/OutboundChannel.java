package io.github.drompincen.collabsync.runtime.connection;

import io.github.drompincen.collabsync.protocol.ws.WsMessage;

/**
 * Where components hand outbound messages. {@code false} means the message was not sent and the caller
 * decides whether to queue it.
 */
@FunctionalInterface
public interface OutboundChannel {

    boolean send(WsMessage message);
}
