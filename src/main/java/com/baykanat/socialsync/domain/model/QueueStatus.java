package com.baykanat.socialsync.domain.model;

import java.util.Arrays;

/** post_queue.status değerleri; sent ve dlq terminaldir. */
public enum QueueStatus {

    PENDING("pending"),
    /** Dağıtım worker'ının sahiplik durumu. */
    PROCESSING("processing"),
    SENT("sent"),
    FAILED("failed"),
    DLQ("dlq");

    private final String wireValue;

    QueueStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == SENT || this == DLQ;
    }

    public static QueueStatus fromWire(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown queue status: " + value));
    }
}
