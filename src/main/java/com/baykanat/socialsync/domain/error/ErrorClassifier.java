package com.baykanat.socialsync.domain.error;

import com.baykanat.socialsync.domain.model.FetchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;

/**
 * Upstream hatasını AUTH_FAILURE / RATE_LIMIT / OTHER olarak sınıflandırır. Yan etkisi yoktur.
 *
 * <p>Graph API kodları: 190/102/104 kimlik hatası, 4/17/32/613 kota; HTTP 401 ve 429 aynı
 * şekilde eşlenir. Diğer 4xx kalıcı, 5xx/timeout/bilinmeyen geçici sayılır.
 */
@Slf4j
@Service
public class ErrorClassifier {

    private static final Set<Integer> AUTH_CODES = Set.of(190, 102, 104);
    private static final Set<Integer> RATE_LIMIT_CODES = Set.of(4, 17, 32, 613);

    /** Ham Graph API hatasını sınıflandırır. */
    public ErrorClassification classify(UpstreamError error) {
        if (error == null) {
            return ErrorClassification.transientFailure();
        }

        Integer code = error.getCode();
        Integer status = error.getHttpStatus();

        if ((code != null && AUTH_CODES.contains(code)) || (status != null && status == 401)) {
            return ErrorClassification.authFailure();
        }
        if ((code != null && RATE_LIMIT_CODES.contains(code)) || (status != null && status == 429)) {
            return ErrorClassification.rateLimit(error.getRetryAfterSeconds());
        }
        if (error.isTimeout() || status == null || status >= 500) {
            return ErrorClassification.transientFailure();
        }
        if (status >= 400) {
            return ErrorClassification.permanentFailure();
        }
        return ErrorClassification.transientFailure();
    }

    /** GraphApiClient sonucundaki ham kategori değerini eşler; başarılı sonuç için null döner. */
    public ErrorClassification classify(FetchResult result) {
        if (result == null || result.isSuccess()) {
            return null;
        }

        String raw = result.getErrorCategory() == null
                ? ""
                : result.getErrorCategory().trim().toLowerCase(Locale.ROOT);

        return switch (raw) {
            case "auth_failure" -> ErrorClassification.authFailure();
            case "rate_limit" -> ErrorClassification.rateLimit(result.getRetryAfterSeconds());
            case "permanent" -> ErrorClassification.permanentFailure();
            default -> ErrorClassification.transientFailure();
        };
    }

    /** Dağıtım sırasında yakalanan istisnayı sınıflandırır; UpstreamApiException dışındakiler geçici sayılır. */
    public ErrorClassification classify(Throwable failure) {
        if (failure instanceof UpstreamApiException upstream) {
            return classify(upstream.getError());
        }
        log.debug("Non-upstream failure classified as transient: {}",
                failure != null ? failure.getClass().getSimpleName() : "null");
        return ErrorClassification.transientFailure();
    }
}
