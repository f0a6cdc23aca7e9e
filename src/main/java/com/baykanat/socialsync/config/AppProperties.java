package com.baykanat.socialsync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/** app.* için tip güvenli configuration (cron ifadeleri, limitler, heartbeat eşikleri, kuyruk backoff). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private SyncProperties sync = new SyncProperties();
    private HeartbeatProperties heartbeat = new HeartbeatProperties();
    private QueueProperties queue = new QueueProperties();
    private DeliveryProperties delivery = new DeliveryProperties();

    @Getter
    @Setter
    public static class SyncProperties {
        /** Tüm zamanlanmış işleri açıp kapatır. */
        private boolean enabled = false;
        private String zone = "UTC";
        private Duration interItemDelay = Duration.ofSeconds(1);
        private Duration interAccountDelay = Duration.ofSeconds(3);
        private EngagementProperties engagement = new EngagementProperties();
        private UgcProperties ugc = new UgcProperties();
        private InsightsProperties insights = new InsightsProperties();
    }

    @Getter
    @Setter
    public static class EngagementProperties {
        private String cron = "0 */3 * * * *";
        private int maxPosts = 5;
        private int maxConversations = 5;
        /** Yorumları çekilecek medyanın yayın penceresi. */
        private Duration recentMediaWindow = Duration.ofHours(48);
        private int commentLimit = 50;
        private int conversationLimit = 20;
        private int messageLimit = 20;
    }

    @Getter
    @Setter
    public static class UgcProperties {
        private String cron = "0 0 */3 * * *";
        private int maxHashtags = 5;
        private int taggedLimit = 50;
        private int hashtagLimit = 25;
    }

    @Getter
    @Setter
    public static class InsightsProperties {
        private String cron = "0 0 2 * * *";
        private Duration lookback = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class HeartbeatProperties {
        private String cron = "0 */5 * * * *";
        /** Hem agent-down hem scheduled post failover için tek eşik. */
        private Duration staleThreshold = Duration.ofMinutes(30);
        private Duration expectedInterval = Duration.ofMinutes(5);
        private int missedBeatAlertThreshold = 3;
    }

    @Getter
    @Setter
    public static class QueueProperties {
        private Duration backoffBase = Duration.ofSeconds(60);
        private Duration backoffMax = Duration.ofHours(1);
        private int maxRetries = 5;
    }

    @Getter
    @Setter
    public static class DeliveryProperties {
        private boolean enabled = false;
        private String cron = "30 */5 * * * *";
        private int batchSize = 20;
        /** processing durumunda bu süreden uzun kalan satırlar yeniden pending yapılır. */
        private Duration claimTimeout = Duration.ofMinutes(15);
    }
}
