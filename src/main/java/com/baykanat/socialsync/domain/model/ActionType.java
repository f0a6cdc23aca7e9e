package com.baykanat.socialsync.domain.model;

import java.util.Arrays;

/** Kuyruktaki dış aksiyon türleri. */
public enum ActionType {

    REPLY_COMMENT("reply_comment", false),
    REPLY_DM("reply_dm", false),
    SEND_DM("send_dm", false),
    PUBLISH_POST("publish_post", true),
    REPOST_UGC("repost_ugc", true);

    private final String wireValue;
    private final boolean twoStep;

    ActionType(String wireValue, boolean twoStep) {
        this.wireValue = wireValue;
        this.twoStep = twoStep;
    }

    public String wireValue() {
        return wireValue;
    }

    /** Container oluştur + yayınla şeklinde iki adımlı mı. */
    public boolean isTwoStep() {
        return twoStep;
    }

    public static ActionType fromWire(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown action type: " + value));
    }
}
