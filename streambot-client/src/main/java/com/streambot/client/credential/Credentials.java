package com.streambot.client.credential;

import com.streambot.client.StreamConstants;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared mutable connection state: identity, cached access token, tuning
 * knobs and the ordered subscription set.
 * <p>
 * Every accessor takes the lock for a short critical section only; callers
 * copy values out before doing any I/O.
 */
public class Credentials {

    private final ReentrantLock lock = new ReentrantLock();
    private final ClientIdentity identity;
    private final Set<Subscription> subscriptions = new LinkedHashSet<>();

    private String userAgent;
    private String accessToken = "";
    private Instant tokenExpiresAt = Instant.EPOCH;
    private long heartbeatIntervalMs;
    private long reconnectIntervalMs;

    public Credentials(ClientIdentity identity, String userAgent,
            long heartbeatIntervalMs, long reconnectIntervalMs) {
        this.identity = identity;
        this.userAgent = userAgent;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
        this.reconnectIntervalMs = reconnectIntervalMs;
        subscriptions.add(new Subscription(SubscriptionType.EVENT, StreamConstants.TOPIC_ALL));
        subscriptions.add(new Subscription(SubscriptionType.SYSTEM, StreamConstants.TOPIC_ALL));
    }

    public ClientIdentity getIdentity() {
        return identity;
    }

    // =========================================================================
    // Subscriptions
    // =========================================================================

    /**
     * @return {@code true} if the subscription was not present before
     */
    public boolean addSubscription(Subscription subscription) {
        lock.lock();
        try {
            return subscriptions.add(subscription);
        } finally {
            lock.unlock();
        }
    }

    public boolean hasSubscription(Subscription subscription) {
        lock.lock();
        try {
            return subscriptions.contains(subscription);
        } finally {
            lock.unlock();
        }
    }

    public List<Subscription> getSubscriptions() {
        lock.lock();
        try {
            return List.copyOf(subscriptions);
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // Access token
    // =========================================================================

    /**
     * The cached token, unless none was fetched yet or {@code now} is past its
     * expiry.
     */
    public Optional<String> cachedToken(Instant now) {
        lock.lock();
        try {
            if (accessToken.isEmpty() || now.isAfter(tokenExpiresAt)) {
                return Optional.empty();
            }
            return Optional.of(accessToken);
        } finally {
            lock.unlock();
        }
    }

    public void storeToken(String token, Instant expiresAt) {
        lock.lock();
        try {
            this.accessToken = token;
            this.tokenExpiresAt = expiresAt;
        } finally {
            lock.unlock();
        }
    }

    public void invalidateToken() {
        lock.lock();
        try {
            this.accessToken = "";
            this.tokenExpiresAt = Instant.EPOCH;
        } finally {
            lock.unlock();
        }
    }

    public Instant getTokenExpiresAt() {
        lock.lock();
        try {
            return tokenExpiresAt;
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // Tuning knobs
    // =========================================================================

    public String getUserAgent() {
        lock.lock();
        try {
            return userAgent;
        } finally {
            lock.unlock();
        }
    }

    public void setUserAgent(String userAgent) {
        lock.lock();
        try {
            this.userAgent = userAgent;
        } finally {
            lock.unlock();
        }
    }

    public long getHeartbeatIntervalMs() {
        lock.lock();
        try {
            return heartbeatIntervalMs;
        } finally {
            lock.unlock();
        }
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
        if (heartbeatIntervalMs < 0) {
            throw new IllegalArgumentException("heartbeatIntervalMs must be >= 0");
        }
        lock.lock();
        try {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
        } finally {
            lock.unlock();
        }
    }

    public long getReconnectIntervalMs() {
        lock.lock();
        try {
            return reconnectIntervalMs;
        } finally {
            lock.unlock();
        }
    }

    public void setReconnectIntervalMs(long reconnectIntervalMs) {
        if (reconnectIntervalMs < 0) {
            throw new IllegalArgumentException("reconnectIntervalMs must be >= 0");
        }
        lock.lock();
        try {
            this.reconnectIntervalMs = reconnectIntervalMs;
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // Snapshot
    // =========================================================================

    public CredentialsSnapshot snapshot() {
        lock.lock();
        try {
            return new CredentialsSnapshot(identity.clientId(), identity.clientSecret(),
                    userAgent, List.copyOf(subscriptions));
        } finally {
            lock.unlock();
        }
    }
}
