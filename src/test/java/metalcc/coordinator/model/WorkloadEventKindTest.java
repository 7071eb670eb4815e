package metalcc.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WorkloadEventKindTest {

    @Test
    void statusBearingKindsMapToStatus() {
        assertEquals(WorkloadStatus.SCHEDULED, WorkloadEvent.deriveStatus(WorkloadEventKind.CREATED));
        assertEquals(WorkloadStatus.STARTING, WorkloadEvent.deriveStatus(WorkloadEventKind.STARTING));
        assertEquals(WorkloadStatus.STARTING, WorkloadEvent.deriveStatus(WorkloadEventKind.VM_RESTARTED));
        assertEquals(WorkloadStatus.STARTING, WorkloadEvent.deriveStatus(WorkloadEventKind.FORCED_RESTART));
        assertEquals(WorkloadStatus.AWAITING_CERT, WorkloadEvent.deriveStatus(WorkloadEventKind.AWAITING_CERT));
        assertEquals(WorkloadStatus.RUNNING, WorkloadEvent.deriveStatus(WorkloadEventKind.RUNNING));
        assertEquals(WorkloadStatus.STOPPED, WorkloadEvent.deriveStatus(WorkloadEventKind.STOPPED));
        assertEquals(WorkloadStatus.ERROR, WorkloadEvent.deriveStatus(WorkloadEventKind.FAILED_TO_START));
    }

    @Test
    void warningHasNoStatus() {
        assertFalse(WorkloadEventKind.WARNING.changesStatus());
        assertTrue(WorkloadEventKind.WARNING.resultingStatus().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> WorkloadEvent.deriveStatus(WorkloadEventKind.WARNING));
    }

    @Test
    void wireNamesParse() {
        assertEquals(WorkloadEventKind.VM_RESTARTED, WorkloadEventKind.fromWireName("vmRestarted"));
        assertEquals(WorkloadEventKind.FAILED_TO_START, WorkloadEventKind.fromWireName("failedToStart"));
        assertEquals(WorkloadStatus.AWAITING_CERT, WorkloadStatus.fromWireName("awaitingCert"));
        assertThrows(IllegalArgumentException.class, () -> WorkloadEventKind.fromWireName("exploded"));
    }

    @Test
    void detailOnlyKeptWhereItBelongs() {
        Instant now = Instant.now();
        assertThrows(IllegalArgumentException.class,
                () -> new WorkloadEvent("e1", "w1", WorkloadEventKind.WARNING, null, now));
        assertThrows(IllegalArgumentException.class,
                () -> new WorkloadEvent("e1", "w1", WorkloadEventKind.FAILED_TO_START, null, now));

        WorkloadEvent running = new WorkloadEvent("e2", "w1", WorkloadEventKind.RUNNING, "ignored", now);
        assertNull(running.detail());

        WorkloadEvent warning = new WorkloadEvent("e3", "w1", WorkloadEventKind.WARNING, "disk low", now);
        assertEquals("disk low", warning.detail());
    }

    @Test
    void onlyStoppedIsInactive() {
        for (WorkloadStatus status : WorkloadStatus.values()) {
            assertEquals(status != WorkloadStatus.STOPPED, status.isActive(), status.name());
        }
    }
}
