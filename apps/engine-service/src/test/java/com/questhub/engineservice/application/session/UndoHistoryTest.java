package com.questhub.engineservice.application.session;

import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.domain.model.UndoEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UndoHistoryTest {

    private UndoHistory history;
    private GameSession session;

    @BeforeEach
    void setUp() {
        EngineProperties props = new EngineProperties();
        props.setMaxUndoStackSize(2);
        history = new UndoHistory(props);
        session = new GameSession();
    }

    private static UndoEntry entry(String id, boolean undoable) {
        UndoEntry e = new UndoEntry();
        e.setEntryId(id);
        e.setCommandType("move");
        e.setUndoable(undoable);
        return e;
    }

    @Test
    void oldestEntryIsDroppedWhenFull() {
        history.record(session, entry("1", true));
        history.record(session, entry("2", true));
        history.record(session, entry("3", true));

        assertThat(session.getUndoStack()).extracting(UndoEntry::getEntryId).containsExactly("2", "3");
        assertThat(history.peekUndo(session).getEntryId()).isEqualTo("3");
    }

    @Test
    void undoAndRedoMoveEntriesBetweenStacks() {
        history.record(session, entry("1", true));
        history.moveToRedo(session);

        assertThat(history.peekUndo(session)).isNull();
        assertThat(history.peekRedo(session).getEntryId()).isEqualTo("1");

        history.moveToUndo(session);
        assertThat(history.peekRedo(session)).isNull();
        assertThat(history.peekUndo(session).getEntryId()).isEqualTo("1");
    }

    @Test
    void newCommandClearsRedo() {
        history.record(session, entry("1", true));
        history.moveToRedo(session);
        history.record(session, entry("2", true));

        assertThat(session.getRedoStack()).isEmpty();
    }

    @Test
    void nonUndoableEntryClearsBothStacks() {
        history.record(session, entry("1", true));
        history.record(session, entry("2", true));
        history.moveToRedo(session);

        history.record(session, entry("3", false));

        assertThat(session.getUndoStack()).isEmpty();
        assertThat(session.getRedoStack()).isEmpty();
    }
}
