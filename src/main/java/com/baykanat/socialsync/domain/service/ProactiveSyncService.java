package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.client.GraphApiClient;
import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.error.ErrorClassification;
import com.baykanat.socialsync.domain.error.ErrorClassifier;
import com.baykanat.socialsync.domain.model.AccountOutcome;
import com.baykanat.socialsync.domain.model.BusinessAccount;
import com.baykanat.socialsync.domain.model.ConversationFetchResult;
import com.baykanat.socialsync.domain.model.ConversationFetchResult.ConversationSummary;
import com.baykanat.socialsync.domain.model.CycleReport;
import com.baykanat.socialsync.domain.model.FetchResult;
import com.baykanat.socialsync.domain.model.RecentMedia;
import com.baykanat.socialsync.domain.model.StepDecision;
import com.baykanat.socialsync.domain.model.SyncType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Engagement, UGC ve insights döngüleri. Hesaplar sırayla işlenir; her adımın sonucu tek bir
 * triage rutininden geçer (devam / hesabı bırak / hesabı devre dışı bırak).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProactiveSyncService {

    private final GraphApiClient graphApiClient;
    private final AccountDirectory accountDirectory;
    private final RateLimitCircuitBreaker circuitBreaker;
    private final ErrorClassifier errorClassifier;
    private final SyncAuditService auditService;
    private final AppProperties appProperties;
    private final Clock clock;

    @FunctionalInterface
    private interface AccountSync {
        AccountOutcome run(BusinessAccount account);
    }

    /** Son medyaya yorumlar, konuşmalar, açık pencereli konuşmaların mesajları. */
    public CycleReport runEngagementCycle() {
        return runCycle(SyncType.ENGAGEMENT, this::syncEngagement);
    }

    /** Etiketlenen medya ve izlenen hashtag medyası. */
    public CycleReport runUgcCycle() {
        return runCycle(SyncType.UGC, this::syncUgc);
    }

    /** Son 7 günün medya metrikleri. */
    public CycleReport runInsightsCycle() {
        return runCycle(SyncType.INSIGHTS, this::syncInsights);
    }

    private CycleReport runCycle(SyncType cycle, AccountSync accountSync) {
        String runId = UUID.randomUUID().toString();
        String tag = logTag(cycle);
        Instant startedAt = clock.instant();
        Map<String, AccountOutcome> outcomes = new LinkedHashMap<>();

        log.info("{} Starting run {}", tag, runId);
        List<BusinessAccount> accounts = accountDirectory.getActiveAccounts();
        if (accounts.isEmpty()) {
            log.info("{} No active accounts, skipping run {}", tag, runId);
            return report(runId, cycle, startedAt, outcomes);
        }

        for (BusinessAccount account : accounts) {
            String accountId = account.getId();
            if (circuitBreaker.isBlocked(accountId)) {
                log.info("{} Account {} rate-limited, skipping", tag, accountId);
                auditService.recordSkipped(cycle, accountId);
                outcomes.put(accountId, AccountOutcome.SKIPPED_ALREADY_BLOCKED);
                continue;
            }

            AccountOutcome outcome;
            try {
                outcome = accountSync.run(account);
            } catch (RuntimeException e) {
                log.error("{} Account {} failed: {}", tag, accountId, e.getMessage(), e);
                auditService.recordAccountFailure(cycle, accountId, e.getMessage());
                outcome = AccountOutcome.FAILED;
            }
            outcomes.put(accountId, outcome);
            log.debug("{} Account {} finished with {}", tag, accountId, outcome);

            pause(appProperties.getSync().getInterAccountDelay());
        }

        CycleReport report = report(runId, cycle, startedAt, outcomes);
        log.info("{} Run {} complete: {} account(s), {} completed, {} skipped, {} rate-limited, {} disabled, {} failed",
                tag, runId, outcomes.size(),
                report.count(AccountOutcome.COMPLETED),
                report.count(AccountOutcome.SKIPPED_ALREADY_BLOCKED),
                report.count(AccountOutcome.BROKE_ON_RATE_LIMIT),
                report.count(AccountOutcome.DISABLED_ON_AUTH_FAILURE),
                report.count(AccountOutcome.FAILED));
        return report;
    }

    private AccountOutcome syncEngagement(BusinessAccount account) {
        AppProperties.EngagementProperties cfg = appProperties.getSync().getEngagement();
        String accountId = account.getId();

        // Yorumlar
        List<RecentMedia> media = accountDirectory.getRecentMedia(
                accountId, cfg.getRecentMediaWindow(), cfg.getMaxPosts());
        StepTally comments = new StepTally();
        StepDecision decision = StepDecision.CONTINUE;
        for (RecentMedia item : media) {
            FetchResult result = graphApiClient.fetchAndStoreComments(
                    accountId, item.getInstagramMediaId(), cfg.getCommentLimit());
            comments.add(result);
            decision = triage(account, SyncType.COMMENTS, result);
            if (decision != StepDecision.CONTINUE) {
                break;
            }
            pause(appProperties.getSync().getInterItemDelay());
        }
        audit(SyncType.COMMENTS, accountId, comments, "posts_checked", "total_comments", decision);
        if (decision != StepDecision.CONTINUE) {
            return outcomeFor(decision);
        }

        // Konuşmalar
        ConversationFetchResult conversations = graphApiClient.fetchAndStoreConversations(
                accountId, cfg.getConversationLimit());
        FetchResult conversationResult = conversations.getResult();
        StepTally conversationTally = new StepTally();
        conversationTally.add(conversationResult);
        decision = triage(account, SyncType.CONVERSATIONS, conversationResult);
        audit(SyncType.CONVERSATIONS, accountId, conversationTally, "requests", "count", decision);
        if (decision != StepDecision.CONTINUE) {
            return outcomeFor(decision);
        }
        if (conversationResult == null || !conversationResult.isSuccess()) {
            return AccountOutcome.COMPLETED;
        }

        // Açık pencereli konuşmaların mesajları
        List<ConversationSummary> open = conversations.getConversations().stream()
                .filter(ConversationSummary::isWindowOpen)
                .limit(cfg.getMaxConversations())
                .toList();
        StepTally messages = new StepTally();
        for (ConversationSummary conversation : open) {
            FetchResult result = graphApiClient.fetchAndStoreMessages(
                    accountId, conversation.getId(), cfg.getMessageLimit());
            messages.add(result);
            decision = triage(account, SyncType.MESSAGES, result);
            if (decision != StepDecision.CONTINUE) {
                break;
            }
            pause(appProperties.getSync().getInterItemDelay());
        }
        audit(SyncType.MESSAGES, accountId, messages, "conversations_checked", "total_messages", decision);
        return outcomeFor(decision);
    }

    private AccountOutcome syncUgc(BusinessAccount account) {
        AppProperties.UgcProperties cfg = appProperties.getSync().getUgc();
        String accountId = account.getId();

        FetchResult tagged = graphApiClient.fetchAndStoreTaggedMedia(accountId, cfg.getTaggedLimit());
        StepTally taggedTally = new StepTally();
        taggedTally.add(tagged);
        StepDecision decision = triage(account, SyncType.UGC_TAGGED, tagged);
        audit(SyncType.UGC_TAGGED, accountId, taggedTally, "requests", "count", decision);
        if (decision != StepDecision.CONTINUE) {
            return outcomeFor(decision);
        }
        pause(appProperties.getSync().getInterItemDelay());

        List<String> hashtags = accountDirectory.getMonitoredHashtags(accountId, cfg.getMaxHashtags());
        StepTally hashtagTally = new StepTally();
        for (String hashtag : hashtags) {
            FetchResult result = graphApiClient.fetchAndStoreHashtagMedia(accountId, hashtag, cfg.getHashtagLimit());
            hashtagTally.add(result);
            decision = triage(account, SyncType.UGC_HASHTAGS, result);
            if (decision != StepDecision.CONTINUE) {
                break;
            }
            pause(appProperties.getSync().getInterItemDelay());
        }
        audit(SyncType.UGC_HASHTAGS, accountId, hashtagTally, "hashtags_checked", "total_media", decision);
        return outcomeFor(decision);
    }

    private AccountOutcome syncInsights(BusinessAccount account) {
        String accountId = account.getId();
        Instant until = clock.instant();
        Instant since = until.minus(appProperties.getSync().getInsights().getLookback());

        FetchResult result = graphApiClient.fetchAndStoreMediaInsights(accountId, since, until);
        StepTally tally = new StepTally();
        tally.add(result);
        StepDecision decision = triage(account, SyncType.MEDIA_INSIGHTS, result);
        audit(SyncType.MEDIA_INSIGHTS, accountId, tally, "requests", "count", decision);
        return outcomeFor(decision);
    }

    /**
     * Tek adım sonucunu bir kez sınıflandırır ve kararı döner. Rate limit hesabı circuit breaker'a işler,
     * auth hatası hesabı devre dışı bırakır, diğer hatalar yalnızca loglanır.
     */
    StepDecision triage(BusinessAccount account, SyncType step, FetchResult result) {
        ErrorClassification classification = errorClassifier.classify(result);
        if (classification == null) {
            return StepDecision.CONTINUE;
        }

        String accountId = account.getId();
        return switch (classification.getCategory()) {
            case AUTH_FAILURE -> {
                log.error("[ProactiveSync:{}] Auth failure for account {}: {}",
                        step.wireValue(), accountId, result.getError());
                accountDirectory.disableOnAuthFailure(accountId, "proactive_sync", result.getError());
                yield StepDecision.DISABLE_ACCOUNT;
            }
            case RATE_LIMIT -> {
                log.warn("[ProactiveSync:{}] Rate limited on account {}, retry after {}s",
                        step.wireValue(), accountId, classification.getRetryAfterSeconds());
                circuitBreaker.markBlocked(accountId, classification.getRetryAfterSeconds());
                yield StepDecision.BREAK_ACCOUNT;
            }
            case OTHER -> {
                log.warn("[ProactiveSync:{}] Step failed for account {} ({}): {}",
                        step.wireValue(), accountId, result.getErrorCategory(), result.getError());
                yield StepDecision.CONTINUE;
            }
        };
    }

    private static AccountOutcome outcomeFor(StepDecision decision) {
        return switch (decision) {
            case CONTINUE -> AccountOutcome.COMPLETED;
            case BREAK_ACCOUNT -> AccountOutcome.BROKE_ON_RATE_LIMIT;
            case DISABLE_ACCOUNT -> AccountOutcome.DISABLED_ON_AUTH_FAILURE;
        };
    }

    private void audit(SyncType step, String accountId, StepTally tally,
                       String attemptsKey, String countKey, StepDecision decision) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(attemptsKey, tally.attempts);
        details.put(countKey, tally.stored);
        if (tally.failures > 0) {
            details.put("failed", tally.failures);
            details.put("error", tally.lastError);
        }
        if (decision != StepDecision.CONTINUE) {
            details.put("stopped", decision.name().toLowerCase(Locale.ROOT));
        }
        auditService.recordStep(step, accountId, details, tally.failures == 0);
    }

    /** Kesme gelirse flag geri yüklenir ve döngünün kalan beklemeleri atlanır. */
    private void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()
                || Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ProactiveSync] Interrupted during delay, remaining delays skipped");
        }
    }

    private CycleReport report(String runId, SyncType cycle, Instant startedAt, Map<String, AccountOutcome> outcomes) {
        return CycleReport.builder()
                .runId(runId)
                .syncType(cycle)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .outcomes(outcomes)
                .build();
    }

    private static String logTag(SyncType cycle) {
        return "[ProactiveSync:" + cycle.wireValue() + "]";
    }

    /** Bir adımdaki istek sayısı, saklanan kayıt ve hata sayacı. */
    private static final class StepTally {
        private int attempts;
        private int stored;
        private int failures;
        private String lastError;

        void add(FetchResult result) {
            attempts++;
            if (result != null && result.isSuccess()) {
                stored += result.getCount();
            } else {
                failures++;
                lastError = result != null ? result.getError() : "no result";
            }
        }
    }
}
