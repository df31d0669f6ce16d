package com.eainde.fitengine.session;

import com.eainde.fitengine.config.ConfigurationSource;
import com.eainde.fitengine.config.GlobalConfiguration;
import com.eainde.fitengine.config.GlobalConfigurationStore;
import com.eainde.fitengine.exception.ConfigurationWriteRejectedException;
import com.eainde.fitengine.exception.SessionAccessException;
import com.eainde.fitengine.recommendation.FinalRecommendationController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Opens, seals and cancels analysis sessions, and guards global configuration against writes
 * that originate from session data.
 */
@Component
public class AnalysisSessionManager {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSessionManager.class);

    public static final String MDC_SESSION_ID = "sessionId";

    private final GlobalConfigurationStore configurationStore;
    private final SessionRecordStore recordStore;
    private final Clock clock;
    private final Map<String, AnalysisSession> active = new ConcurrentHashMap<>();

    public AnalysisSessionManager(GlobalConfigurationStore configurationStore,
                                  SessionRecordStore recordStore,
                                  Clock clock) {
        this.configurationStore = configurationStore;
        this.recordStore = recordStore;
        this.clock = clock;
    }

    public AnalysisSession open() {
        String id = UUID.randomUUID().toString();
        GlobalConfiguration snapshot = configurationStore.snapshot();
        AnalysisSession session = new AnalysisSession(id, clock.instant(), snapshot,
                new FinalRecommendationController(id, clock), recordStore);
        active.put(id, session);
        MDC.put(MDC_SESSION_ID, id);
        log.info("Opened analysis session {} on configuration v{}", id, snapshot.version());
        return session;
    }

    /**
     * @throws SessionAccessException if the id is unknown, sealed or cancelled
     */
    public AnalysisSession find(String sessionId) {
        AnalysisSession session = active.get(sessionId);
        if (session == null) {
            throw new SessionAccessException("No active session " + sessionId);
        }
        return session;
    }

    /**
     * Destroys every record of the session. Safe to call more than once.
     */
    public void seal(AnalysisSession session) {
        boolean firstSeal = session.markSealed();
        int purged = recordStore.purge(session.getId());
        active.remove(session.getId());
        if (firstSeal) {
            log.info("Sealed session {}, destroyed {} record(s)", session.getId(), purged);
        }
        if (session.getId().equals(MDC.get(MDC_SESSION_ID))) {
            MDC.remove(MDC_SESSION_ID);
        }
    }

    /**
     * Cancels an in-flight session: destroys its data, then interrupts the provider call.
     */
    public void cancel(String sessionId) {
        AnalysisSession session = find(sessionId);
        log.info("Cancelling session {}", sessionId);
        seal(session);
        session.cancel();
    }

    /**
     * Administrative configuration update. Any source tied to session data is refused.
     */
    public GlobalConfiguration updateConfiguration(ConfigurationSource source, UnaryOperator<GlobalConfiguration> change) {
        if (source != null && active.containsKey(source.origin())) {
            log.warn("Rejected configuration write whose origin is active session {}", source.origin());
            throw new ConfigurationWriteRejectedException(
                    "Global configuration cannot be written from analysis session " + source.origin());
        }
        return configurationStore.update(source, change);
    }

    public int activeSessionCount() {
        return active.size();
    }
}
