package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.client.CredentialStore;
import com.baykanat.socialsync.infrastructure.persistence.BusinessAccountJdbcRepository;
import com.baykanat.socialsync.infrastructure.persistence.MediaJdbcRepository;
import com.baykanat.socialsync.infrastructure.persistence.SystemAlertJdbcRepository;
import com.baykanat.socialsync.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AccountDirectory.
 *
 * <p>Repositories and the credential store are mocked. Focus is the auth-failure disable path:
 * every step runs even when an earlier one fails.
 */
@ExtendWith(MockitoExtension.class)
class AccountDirectoryTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    @Mock
    private BusinessAccountJdbcRepository accountRepository;

    @Mock
    private MediaJdbcRepository mediaRepository;

    @Mock
    private SystemAlertJdbcRepository alertRepository;

    @Mock
    private CredentialStore credentialStore;

    private AccountDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new AccountDirectory(accountRepository, mediaRepository, alertRepository, credentialStore,
                new MutableClock(NOW));
    }

    @Test
    @DisplayName("Auth failure disconnects the account, writes an alert and invalidates credentials")
    @SuppressWarnings("unchecked")
    void disableOnAuthFailure() {
        when(accountRepository.markDisconnected("acct-1")).thenReturn(1);

        directory.disableOnAuthFailure("acct-1", "proactive_sync", "Session has expired");

        verify(accountRepository).markDisconnected("acct-1");
        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(alertRepository).insert(eq("auth_failure"), eq("acct-1"),
                eq("Instagram auth failure (proactive_sync): Session has expired"), details.capture());
        assertThat(details.getValue())
                .containsEntry("source", "proactive_sync")
                .containsEntry("error", "Session has expired")
                .containsEntry("occurred_at", NOW.toString());
        verify(credentialStore).invalidate("acct-1");
    }

    @Test
    @DisplayName("Database failure while disconnecting still raises the alert and invalidates credentials")
    void disconnectFailureDoesNotBlockOtherSteps() {
        when(accountRepository.markDisconnected("acct-1"))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> directory.disableOnAuthFailure("acct-1", "post_queue", "expired"))
                .doesNotThrowAnyException();

        verify(alertRepository).insert(eq("auth_failure"), eq("acct-1"), anyString(), any());
        verify(credentialStore).invalidate("acct-1");
    }

    @Test
    @DisplayName("Credential store failure is contained after the account is disconnected")
    void invalidateFailureIsContained() {
        when(accountRepository.markDisconnected("acct-1")).thenReturn(1);
        doThrow(new IllegalStateException("cache unavailable")).when(credentialStore).invalidate("acct-1");

        assertThatCode(() -> directory.disableOnAuthFailure("acct-1", "proactive_sync", "expired"))
                .doesNotThrowAnyException();

        verify(accountRepository).markDisconnected("acct-1");
        verify(alertRepository).insert(eq("auth_failure"), eq("acct-1"), anyString(), any());
    }

    @Test
    @DisplayName("Missing error message falls back to the alert type")
    void nullMessageUsesAlertType() {
        when(accountRepository.markDisconnected("acct-1")).thenReturn(0);

        directory.disableOnAuthFailure("acct-1", "post_queue", null);

        verify(alertRepository).insert(eq("auth_failure"), eq("acct-1"),
                eq("Instagram auth failure (post_queue): auth_failure"), any());
    }

    @Test
    @DisplayName("Recent media lookup is bounded by the window relative to the clock")
    void recentMediaUsesWindow() {
        directory.getRecentMedia("acct-1", Duration.ofHours(48), 5);

        verify(mediaRepository).findRecentMedia("acct-1", NOW.minus(Duration.ofHours(48)), 5);
    }
}
