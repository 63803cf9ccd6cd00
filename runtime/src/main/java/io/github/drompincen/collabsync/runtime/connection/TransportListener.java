package io.github.drompincen.collabsync.runtime.connection;

public interface TransportListener {

    void onOpen();

    void onMessage(String frame);

    void onClose();

    void onError(Throwable error);
}
