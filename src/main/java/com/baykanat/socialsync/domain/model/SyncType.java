package com.baykanat.socialsync.domain.model;

/** Audit kayıtlarındaki senkron türleri; döngü türleri atlanan hesaplar için de kullanılır. */
public enum SyncType {

    ENGAGEMENT("engagement"),
    UGC("ugc"),
    INSIGHTS("insights"),
    COMMENTS("comments"),
    CONVERSATIONS("conversations"),
    MESSAGES("messages"),
    UGC_TAGGED("ugc_tagged"),
    UGC_HASHTAGS("ugc_hashtags"),
    MEDIA_INSIGHTS("media_insights");

    private final String wireValue;

    SyncType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
