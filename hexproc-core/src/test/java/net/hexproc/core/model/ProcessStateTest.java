package net.hexproc.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Locale;
import java.util.Optional;

import static net.hexproc.core.model.ProcessEvent.*;
import static net.hexproc.core.model.ProcessState.*;
import static org.junit.jupiter.api.Assertions.*;

class ProcessStateTest {

    @Test
    @DisplayName("허용된 전이")
    void allowedTransitions() {
        assertEquals(Optional.of(RUNNING), QUEUED.next(START));
        assertEquals(Optional.of(CANCELLING), QUEUED.next(REQUEST_CANCEL));
        assertEquals(Optional.of(COMPLETED), RUNNING.next(FINISH));
        assertEquals(Optional.of(FAILED), RUNNING.next(FAIL));
        assertEquals(Optional.of(CANCELLING), RUNNING.next(REQUEST_CANCEL));
        assertEquals(Optional.of(CANCELLED), CANCELLING.next(CONFIRM_CANCEL));
    }

    @Test
    @DisplayName("QUEUED 는 START 없이 완료되거나 실패할 수 없다")
    void queuedCannotFinish() {
        assertTrue(QUEUED.next(FINISH).isEmpty());
        assertTrue(QUEUED.next(FAIL).isEmpty());
        assertEquals(Optional.of(FAILED), QUEUED.next(START).flatMap(s -> s.next(FAIL)));
        assertTrue(QUEUED.next(CONFIRM_CANCEL).isEmpty());
    }

    @Test
    @DisplayName("CANCELLING 은 CONFIRM_CANCEL 외엔 움직이지 않는다")
    void cancellingOnlyConfirms() {
        for (ProcessEvent e : ProcessEvent.values()) {
            if (e == CONFIRM_CANCEL) continue;
            assertTrue(CANCELLING.next(e).isEmpty(), e.name());
        }
    }

    @ParameterizedTest
    @EnumSource(value = ProcessState.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    @DisplayName("종료 상태에 대한 모든 이벤트는 no-op")
    void terminalAbsorbs(ProcessState s) {
        assertTrue(s.isTerminal());
        assertFalse(s.holdsReservation());
        for (ProcessEvent e : ProcessEvent.values()) {
            assertTrue(s.next(e).isEmpty(), s + " + " + e);
        }
    }

    @Test
    void codes() {
        assertEquals(RUNNING, ProcessState.from(" running "));
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            assertEquals(RUNNING, ProcessState.from("running"));
            assertEquals(CANCELLING, ProcessState.from("cancelling"));
        } finally {
            Locale.setDefault(saved);
        }
        assertEquals("CANCELLING", CANCELLING.code());
        assertThrows(IllegalArgumentException.class, () -> ProcessState.from("PAUSED"));
        assertTrue(QUEUED.advances());
        assertFalse(CANCELLING.advances());
        assertTrue(CANCELLING.holdsReservation());
    }
}
