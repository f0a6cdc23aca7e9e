package com.baykanat.socialsync.domain.error;

/** Graph API yazma çağrısı başarısız; ham hata ErrorClassifier'a verilir. */
public class UpstreamApiException extends Exception {

    private final transient UpstreamError error;

    public UpstreamApiException(UpstreamError error) {
        super(error.getMessage());
        this.error = error;
    }

    public UpstreamApiException(UpstreamError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public UpstreamError getError() {
        return error;
    }
}
