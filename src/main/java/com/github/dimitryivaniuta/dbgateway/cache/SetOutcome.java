package com.github.dimitryivaniuta.dbgateway.cache;

/**
 * Result of {@link CacheProvider#set}. Only {@link #STORED} means the value is retrievable.
 */
public enum SetOutcome {
    STORED,
    /** value larger than the provider's max value size; store untouched */
    REJECTED_TOO_LARGE,
    /** provider disabled, invalid ttl or internal fault */
    NOT_STORED;

    public boolean isStored() {
        return this == STORED;
    }
}
