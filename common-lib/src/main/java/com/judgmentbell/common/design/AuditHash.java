package com.judgmentbell.common.design;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Replay-integrity fingerprint of a design: first 16 hex characters of the SHA-256 of
 * the canonical JSON {@code {"n": trials, "req": requests, "sc": [sorted scenarios]}}.
 * An audit aid, not a cryptographic guarantee.
 */
public final class AuditHash {

    static final int LENGTH = 16;

    private static final ObjectMapper CANONICAL = new ObjectMapper();

    private AuditHash() {}

    public static String compute(int trialCount, Collection<String> scenarioIds, int requestCount) {
        Map<String, Object> params = new TreeMap<>();
        params.put("n", trialCount);
        params.put("req", requestCount);
        params.put("sc", scenarioIds.stream().sorted().distinct().toList());

        try {
            byte[] canonical = CANONICAL.writeValueAsString(params).getBytes(StandardCharsets.UTF_8);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            StringBuilder hex = new StringBuilder();
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
                if (hex.length() >= LENGTH) break;
            }
            return hex.substring(0, LENGTH);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute audit hash", e);
        }
    }

    public static boolean matches(String expected, int trialCount, List<String> scenarioIds, int requestCount) {
        return expected != null && expected.equals(compute(trialCount, scenarioIds, requestCount));
    }
}
