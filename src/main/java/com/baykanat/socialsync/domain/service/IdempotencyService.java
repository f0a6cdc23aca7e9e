package com.baykanat.socialsync.domain.service;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Kuyruk aksiyonları için deterministik idempotency key. Aynı mantıksal aksiyon
 * (ör. repost_ugc:&lt;permissionId&gt;, failover_publish:&lt;postId&gt;) her zaman aynı key'i üretir.
 */
@Service
public class IdempotencyService {

    private static final HexFormat HEX = HexFormat.of();

    /** Aksiyon türü ve mantıksal kimlikten seed oluşturur: &lt;prefix&gt;:&lt;logicalId&gt;. */
    public String seedFor(String actionPrefix, String logicalId) {
        return actionPrefix + ":" + logicalId;
    }

    /** Seed'in SHA-256 hex değeri (64 karakter). */
    public String keyFor(String seed) {
        if (seed == null || seed.isBlank()) {
            throw new IllegalArgumentException("Idempotency seed must not be blank");
        }
        return HEX.formatHex(newDigest().digest(seed.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
