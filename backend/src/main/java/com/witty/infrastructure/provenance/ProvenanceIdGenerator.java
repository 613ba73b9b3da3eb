package com.witty.infrastructure.provenance;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Builds deterministic, content-addressed identifiers.
 * Format: {@code pr_<16 hex of SHA-256>-<suffix>}; the same inputs always yield the same id.
 */
@Component
public class ProvenanceIdGenerator {

    static final int DIGEST_PREFIX_LENGTH = 16;

    /**
     * Provenance id of one stage execution.
     *
     * @param normalizedInput the normalized input text
     * @param stageId         stage id, also used as the readable suffix
     * @param stageVersion    stage version
     * @param salt            deterministic salt (empty string when unset)
     */
    public String newId(String normalizedInput, String stageId, String stageVersion, String salt) {
        String raw = normalizedInput + "\n" + stageId + "\n" + stageVersion + "\n" + nullToEmpty(salt);
        return "pr_" + sha256(raw).substring(0, DIGEST_PREFIX_LENGTH) + "-" + suffix(stageId);
    }

    /**
     * Provenance id of one claim; the claim identifier takes part in the digest and becomes the suffix.
     */
    public String claimId(String normalizedInput, String stageId, String stageVersion, String salt, String claimIdentifier) {
        String raw = normalizedInput + "\n" + stageId + "/" + claimIdentifier + "\n" + stageVersion + "\n" + nullToEmpty(salt);
        return "pr_" + sha256(raw).substring(0, DIGEST_PREFIX_LENGTH) + "-" + suffix(claimIdentifier);
    }

    /**
     * Request id: content-derived in reproducible mode, random otherwise.
     */
    public String requestId(String normalizedInput, String salt, boolean reproducible) {
        if (!reproducible) {
            return "req_" + UUID.randomUUID();
        }
        return "req_" + sha256("request\n" + normalizedInput + "\n" + nullToEmpty(salt)).substring(0, DIGEST_PREFIX_LENGTH);
    }

    public static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String suffix(String raw) {
        return raw.replaceAll("[^A-Za-z0-9_]", "_");
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
