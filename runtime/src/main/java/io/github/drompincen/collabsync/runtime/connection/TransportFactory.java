package io.github.drompincen.collabsync.runtime.connection;

@FunctionalInterface
public interface TransportFactory {

    Transport create();
}
