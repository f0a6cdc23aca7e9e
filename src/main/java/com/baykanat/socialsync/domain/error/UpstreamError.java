package com.baykanat.socialsync.domain.error;

import lombok.Builder;
import lombok.Value;

/** Graph API'den dönen ham hata şekli (HTTP durumu, graph error code, Retry-After ipucu). */
@Value
@Builder
public class UpstreamError {

    /** Yanıt yoksa (timeout, bağlantı hatası) null. */
    Integer httpStatus;

    /** Graph API error.code alanı. */
    Integer code;

    Integer subcode;

    String message;

    /** Retry-After başlığı veya gövdedeki ipucu (saniye). */
    Long retryAfterSeconds;

    boolean timeout;
}
