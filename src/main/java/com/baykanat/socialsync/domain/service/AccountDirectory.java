package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.client.CredentialStore;
import com.baykanat.socialsync.domain.model.BusinessAccount;
import com.baykanat.socialsync.domain.model.RecentMedia;
import com.baykanat.socialsync.infrastructure.persistence.BusinessAccountJdbcRepository;
import com.baykanat.socialsync.infrastructure.persistence.MediaJdbcRepository;
import com.baykanat.socialsync.infrastructure.persistence.SystemAlertJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Döngülerin iş listesini verir; auth hatasında hesabı devre dışı bırakır. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountDirectory {

    static final String AUTH_FAILURE_ALERT = "auth_failure";

    private final BusinessAccountJdbcRepository accountRepository;
    private final MediaJdbcRepository mediaRepository;
    private final SystemAlertJdbcRepository alertRepository;
    private final CredentialStore credentialStore;
    private final Clock clock;

    public List<BusinessAccount> getActiveAccounts() {
        return accountRepository.findActiveAccounts();
    }

    /** window içinde yayınlanmış en yeni limit adet medya. */
    public List<RecentMedia> getRecentMedia(String accountId, Duration window, int limit) {
        Instant since = clock.instant().minus(window);
        return mediaRepository.findRecentMedia(accountId, since, limit);
    }

    public List<String> getMonitoredHashtags(String accountId, int limit) {
        return mediaRepository.findActiveHashtags(accountId, limit);
    }

    /**
     * Hesabı disconnected yapar, auth_failure alert'i yazar ve credential önbelleğini düşürür.
     * Adımlardan birinin hatası diğerlerini engellemez.
     */
    public void disableOnAuthFailure(String accountId, String source, String errorMessage) {
        String reason = errorMessage != null ? errorMessage : AUTH_FAILURE_ALERT;
        try {
            int updated = accountRepository.markDisconnected(accountId);
            if (updated == 0) {
                log.warn("[AccountDirectory] Account {} not found while disabling on auth failure", accountId);
            }
        } catch (DataAccessException e) {
            log.error("[AccountDirectory] Failed to mark account {} disconnected: {}", accountId, e.getMessage(), e);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", source);
        details.put("error", reason);
        details.put("occurred_at", clock.instant().toString());
        alertRepository.insert(AUTH_FAILURE_ALERT, accountId,
                "Instagram auth failure (" + source + "): " + reason, details);

        try {
            credentialStore.invalidate(accountId);
        } catch (RuntimeException e) {
            log.error("[AccountDirectory] Failed to invalidate credentials for {}: {}", accountId, e.getMessage(), e);
        }
        log.error("[AccountDirectory] Account {} disconnected due to auth_failure ({})", accountId, source);
    }
}
