package com.netbet.trustedsession.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session identifier (visitorData) and the proof token (poToken) derived from it.
 * Serialized with the field names clients of the restricted API expect.
 */
public record Credentials(
        @JsonProperty("visitorData") String sessionId,
        @JsonProperty("poToken") String proof
) {
    /** Proof length observed for tokens the restricted API accepts. */
    public static final int DEFAULT_PROOF_LENGTH = 160;

    public boolean hasValidProof(int expectedLength) {
        return proof != null && proof.length() == expectedLength;
    }
}
