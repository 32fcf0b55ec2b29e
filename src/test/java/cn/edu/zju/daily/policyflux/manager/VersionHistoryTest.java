package cn.edu.zju.daily.policyflux.manager;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class VersionHistoryTest {

    @Test
    void testInitialHistoryHoldsAllPolicies() {
        VersionHistory history = VersionHistory.initial(List.of("A", "B"));
        assertEquals(0, history.version());
        assertEquals(Set.of("A", "B"), history.updatedSince(-1));
        assertTrue(history.updatedSince(0).isEmpty());
    }

    @Test
    void testUpdatedSince() {
        VersionHistory history =
                VersionHistory.initial(List.of("A", "B", "C"))
                        .append(Set.of("A"))
                        .append(Set.of())
                        .append(Set.of("B"))
                        .append(Set.of("A"));
        assertEquals(4, history.version());
        assertEquals(Set.of("A", "B"), history.updatedSince(0));
        assertEquals(Set.of("A", "B"), history.updatedSince(2));
        assertEquals(Set.of("A"), history.updatedSince(3));
        assertTrue(history.updatedSince(4).isEmpty());
        assertTrue(history.updatedSince(10).isEmpty());
        assertEquals(Set.of("A", "B", "C"), history.updatedSince(-5));
    }

    @Test
    void testAppendLeavesOriginalUntouched() {
        VersionHistory initial = VersionHistory.initial(List.of("A"));
        VersionHistory next = initial.append(Set.of("A"));
        assertEquals(0, initial.version());
        assertEquals(1, next.version());
        assertThrows(UnsupportedOperationException.class, () -> next.round(1).add("B"));
    }

    @Test
    void testLongHistoriesAppendCheaply() {
        VersionHistory history =
                assertTimeoutPreemptively(
                        Duration.ofSeconds(10),
                        () -> {
                            VersionHistory h = VersionHistory.initial(List.of("A", "B"));
                            for (int i = 0; i < 500_000; i++) {
                                h = h.append(i % 1000 == 0 ? Set.of("B") : Set.of());
                            }
                            return h;
                        });
        assertEquals(500_000, history.version());
        assertEquals(Set.of("B"), history.round(499_001));
        assertTrue(history.updatedSince(499_001).isEmpty());
        assertEquals(Set.of("B"), history.updatedSince(499_000));
        assertEquals(Set.of("A", "B"), history.updatedSince(-1));
    }

    @Test
    void testRoundOutOfRange() {
        VersionHistory history = VersionHistory.initial(List.of("A")).append(Set.of("A"));
        assertThrows(IndexOutOfBoundsException.class, () -> history.round(2));
        assertThrows(IndexOutOfBoundsException.class, () -> history.round(-1));
    }
}
