package com.eainde.fitengine.session;

import com.eainde.fitengine.TestFixtures;
import com.eainde.fitengine.exception.SessionAccessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRecordStoreTest {

    private SessionRecordStore store;
    private AnalysisSessionManager manager;

    @BeforeEach
    void setUp() {
        store = new SessionRecordStore();
        manager = TestFixtures.sessionManager(store);
    }

    @Test
    @DisplayName("Owner reads back its own records")
    void ownerRead() {
        AnalysisSession session = manager.open();

        store.put(session, SessionKeys.RESUME, "resume text");

        assertThat(store.read(session, session.getId(), SessionKeys.RESUME, String.class)).contains("resume text");
        assertThat(store.read(session, session.getId(), SessionKeys.NARRATIVE, String.class)).isEmpty();
    }

    @Test
    @DisplayName("Reading another session's records is refused")
    void foreignRead() {
        // Arrange
        AnalysisSession owner = manager.open();
        AnalysisSession other = manager.open();
        owner.record(SessionKeys.RESUME, "owner resume");

        // Act & Assert
        assertThatThrownBy(() -> store.read(other, owner.getId(), SessionKeys.RESUME, String.class))
                .isInstanceOf(SessionAccessException.class)
                .hasMessageContaining(owner.getId());
    }

    @Test
    @DisplayName("purge removes everything tagged with the id")
    void purge() {
        AnalysisSession a = manager.open();
        AnalysisSession b = manager.open();
        a.record(SessionKeys.RESUME, "a");
        a.record(SessionKeys.JOB_DESCRIPTION, "a-jd");
        b.record(SessionKeys.RESUME, "b");

        int purged = store.purge(a.getId());

        assertThat(purged).isEqualTo(2);
        assertThat(store.holdsRecordsFor(a.getId())).isFalse();
        assertThat(store.holdsRecordsFor(b.getId())).isTrue();
        assertThat(store.sessionCount()).isEqualTo(1);
        assertThat(store.purge(a.getId())).isZero();
    }
}
