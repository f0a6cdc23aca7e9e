package com.baykanat.socialsync.domain.model;

public enum HeartbeatStatus {

    ALIVE("alive"),
    DOWN("down");

    private final String wireValue;

    HeartbeatStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static HeartbeatStatus fromWire(String value) {
        return "down".equals(value) ? DOWN : ALIVE;
    }
}
