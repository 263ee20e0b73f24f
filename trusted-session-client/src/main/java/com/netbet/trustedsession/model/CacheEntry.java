package com.netbet.trustedsession.model;

import java.time.Instant;

/**
 * Immutable snapshot of the credentials cache. Replaced wholesale on every successful refresh.
 */
public record CacheEntry(Credentials credentials, Instant lastUpdated) {

    public static final CacheEntry EMPTY = new CacheEntry(null, null);

    public boolean isEmpty() {
        return credentials == null;
    }
}
