package com.eainde.fitengine.session;

import com.eainde.fitengine.config.GlobalConfiguration;
import com.eainde.fitengine.exception.SessionAccessException;
import com.eainde.fitengine.recommendation.FinalRecommendationController;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One isolated analysis run. Owns its records, its configuration snapshot and its
 * recommendation controller. Created by {@link AnalysisSessionManager} only.
 */
@Getter
public final class AnalysisSession {

    private final String id;
    private final Instant createdAt;
    private final GlobalConfiguration configuration;
    private final FinalRecommendationController recommendation;

    @Getter(AccessLevel.NONE)
    private final SessionRecordStore store;
    @Getter(AccessLevel.NONE)
    private final AtomicReference<SessionStatus> status = new AtomicReference<>(SessionStatus.ACTIVE);
    @Getter(AccessLevel.NONE)
    private final AtomicReference<Future<?>> inFlight = new AtomicReference<>();
    private volatile boolean cancelled;

    AnalysisSession(String id, Instant createdAt, GlobalConfiguration configuration,
                    FinalRecommendationController recommendation, SessionRecordStore store) {
        this.id = id;
        this.createdAt = createdAt;
        this.configuration = configuration;
        this.recommendation = recommendation;
        this.store = store;
    }

    public SessionStatus getStatus() {
        return status.get();
    }

    public boolean isActive() {
        return status.get() == SessionStatus.ACTIVE && !cancelled;
    }

    public void ensureActive() {
        if (cancelled) {
            throw new SessionAccessException("Session " + id + " was cancelled");
        }
        if (status.get() != SessionStatus.ACTIVE) {
            throw new SessionAccessException("Session " + id + " is sealed");
        }
    }

    public void record(String key, Object value) {
        store.put(this, key, value);
    }

    public <T> Optional<T> read(String key, Class<T> type) {
        return store.read(this, id, key, type);
    }

    /**
     * Registers the blocking provider call so a cancel can interrupt it.
     */
    public void attachInFlight(Future<?> future) {
        inFlight.set(future);
        if (cancelled) {
            future.cancel(true);
        }
    }

    public void detachInFlight(Future<?> future) {
        inFlight.compareAndSet(future, null);
    }

    void cancel() {
        cancelled = true;
        Future<?> running = inFlight.getAndSet(null);
        if (running != null) {
            running.cancel(true);
        }
    }

    boolean markSealed() {
        return status.compareAndSet(SessionStatus.ACTIVE, SessionStatus.SEALED);
    }
}
