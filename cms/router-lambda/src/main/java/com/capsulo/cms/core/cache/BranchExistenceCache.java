package com.capsulo.cms.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers whether a branch of a repository existed when it was last checked. An entry answers
 * lookups for {@code ttl} after it was observed; expired entries stay in the map until the next
 * {@link #record} for the same branch replaces them.
 */
public final class BranchExistenceCache {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(30);

    private final Map<Key, Observation> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public BranchExistenceCache() {
        this(Clock.systemUTC(), DEFAULT_TTL);
    }

    public BranchExistenceCache(Clock clock, Duration ttl) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    public Optional<Boolean> lookup(String repository, String branch) {
        Observation o = entries.get(new Key(repository, branch));
        if (o == null) return Optional.empty();
        if (Duration.between(o.observedAt(), clock.instant()).compareTo(ttl) >= 0) return Optional.empty();
        return Optional.of(o.exists());
    }

    public void record(String repository, String branch, boolean exists) {
        entries.put(new Key(repository, branch), new Observation(exists, clock.instant()));
    }

    public void invalidate(String repository, String branch) {
        entries.remove(new Key(repository, branch));
    }

    /** Forgets every branch of one repository. */
    public void clear(String repository) {
        entries.keySet().removeIf(k -> k.repository().equals(repository));
    }

    public void clear() {
        entries.clear();
    }

    private record Key(String repository, String branch) {}

    private record Observation(boolean exists, Instant observedAt) {}
}
