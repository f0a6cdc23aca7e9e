package com.baykanat.socialsync.domain.error;

/** Upstream hata kategorisi; tüm çağıranlar bu enum üzerinden switch ile karar verir. */
public enum ErrorCategory {

    /** Kimlik bilgisi kalıcı olarak geçersiz; hesap devre dışı bırakılır. */
    AUTH_FAILURE("auth_failure"),

    /** Geçici kota aşımı; retryAfterSeconds kadar beklenir. */
    RATE_LIMIT("rate_limit"),

    /** Geçici veya bilinmeyen hata; hesap cezalandırılmaz. */
    OTHER("other");

    private final String wireValue;

    ErrorCategory(String wireValue) {
        this.wireValue = wireValue;
    }

    /** post_queue.error_category ve audit detaylarında kullanılan değer. */
    public String wireValue() {
        return wireValue;
    }
}
