package com.phillippitts.gatesentry.service.session;

import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.domain.FieldValue;
import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.domain.VisionSchema;
import com.phillippitts.gatesentry.exception.SessionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStateStoreTest {

    private SessionStateStore store;

    @BeforeEach
    void setUp() {
        store = new SessionStateStore();
        store.create("s1", "preamble");
    }

    @Test
    void snapshotIsDetachedFromStoredState() {
        SessionState snapshot = store.snapshot("s1");
        snapshot.append(ConversationMessage.human("hello"));

        assertThat(store.snapshot("s1").getMessages()).hasSize(1);
    }

    @Test
    void unknownSessionIsReported() {
        assertThatThrownBy(() -> store.snapshot("missing"))
                .isInstanceOf(SessionNotFoundException.class);
        assertThat(store.updateIfPresent("missing", s -> 1)).isEmpty();
    }

    @Test
    void duplicateIdIsRejected() {
        assertThatThrownBy(() -> store.create("s1", "p"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void commitStoresTurnResultWhenNothingChangedMeanwhile() {
        SessionState base = store.snapshot("s1");
        SessionState worked = base.copy();
        worked.append(ConversationMessage.human("I'm Bob"));

        assertThat(store.commitTurn(worked, base, false)).isEqualTo(CommitOutcome.COMMITTED);
        assertThat(store.snapshot("s1").getMessages()).hasSize(2);
    }

    @Test
    void commitKeepsVisionFieldsWrittenDuringTurn() {
        SessionState base = store.snapshot("s1");
        SessionState worked = base.copy();
        worked.append(ConversationMessage.human("I'm Bob"));
        worked.getProfile().offer(ProfileField.NAME, FieldValue.of("Bob"));

        VisionSchema seen = VisionSchema.none();
        store.update("s1", s -> {
            s.setVisionSchema(seen);
            s.getProfile().setAuthenticated(true);
            s.bumpVisionRevision();
            return null;
        });

        assertThat(store.commitTurn(worked, base, false)).isEqualTo(CommitOutcome.MERGED);
        SessionState stored = store.snapshot("s1");
        assertThat(stored.getVisionSchema()).isEqualTo(seen);
        assertThat(stored.getProfile().isAuthenticated()).isTrue();
        assertThat(stored.getProfile().get(ProfileField.NAME).value()).contains("Bob");
        assertThat(stored.getVisionRevision()).isEqualTo(1);
    }

    @Test
    void commitDropsTurnWhenSessionWasResetMeanwhile() {
        SessionState base = store.snapshot("s1");
        SessionState worked = base.copy();
        worked.append(ConversationMessage.human("I'm Bob"));

        store.update("s1", s -> {
            s.resetForNextVisitor();
            s.bumpResetEpoch();
            return null;
        });

        assertThat(store.commitTurn(worked, base, false)).isEqualTo(CommitOutcome.DISCARDED);
        assertThat(store.snapshot("s1").getMessages()).hasSize(1);
    }

    @Test
    void commitDropsTurnWhenSessionWasRemoved() {
        SessionState base = store.snapshot("s1");
        store.remove("s1");

        assertThat(store.commitTurn(base.copy(), base, false)).isEqualTo(CommitOutcome.DISCARDED);
        assertThat(store.exists("s1")).isFalse();
    }

    @Test
    void cameraBindingAlwaysComesFromStore() {
        SessionState base = store.snapshot("s1");
        store.update("s1", s -> {
            s.setCameraId("front-door");
            return null;
        });

        store.commitTurn(base.copy(), base, false);

        assertThat(store.snapshot("s1").getCameraId()).isEqualTo("front-door");
        assertThat(store.cameraBindings()).containsEntry("s1", "front-door");
    }
}
