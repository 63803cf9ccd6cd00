package io.github.drompincen.collabsync.protocol.api;

public record Selection(int start, int end, String elementId) {}
