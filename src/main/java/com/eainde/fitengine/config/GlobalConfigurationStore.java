package com.eainde.fitengine.config;

import com.eainde.fitengine.exception.ConfigurationWriteRejectedException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holder of the current configuration snapshot. Reads are lock-free; updates swap the whole
 * snapshot and bump its version.
 */
@Slf4j
public class GlobalConfigurationStore {

    private final AtomicReference<GlobalConfiguration> current;

    public GlobalConfigurationStore(GlobalConfiguration initial) {
        this.current = new AtomicReference<>(initial);
    }

    public GlobalConfiguration snapshot() {
        return current.get();
    }

    /**
     * Applies an administrative change and returns the new snapshot.
     *
     * @throws ConfigurationWriteRejectedException if the source is tagged with an analysis session
     */
    public GlobalConfiguration update(ConfigurationSource source, UnaryOperator<GlobalConfiguration> change) {
        if (source == null || source.isSessionTagged()) {
            String sessionId = source == null ? "unknown" : source.sessionId();
            log.warn("Rejected configuration write from session-tagged source, sessionId={}", sessionId);
            throw new ConfigurationWriteRejectedException(
                    "Global configuration cannot be written from analysis session " + sessionId);
        }
        GlobalConfiguration updated = current.updateAndGet(prev -> {
            GlobalConfiguration next = change.apply(prev);
            return next.withVersion(prev.version() + 1);
        });
        log.info("Global configuration updated to v{} by {}", updated.version(), source.origin());
        return updated;
    }
}
