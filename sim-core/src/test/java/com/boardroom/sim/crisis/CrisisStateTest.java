package com.boardroom.sim.crisis;

import com.boardroom.sim.model.Meter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CrisisStateTest {

    private static CrisisInstance crisis(CrisisState state, int created, int deadline) {
        return new CrisisInstance("CRISIS_OUTAGE", state.nextInstanceId(created), "Outage", 3, created, deadline,
            Map.of(Meter.DELIVERY, -10),
            Map.of(Meter.MORALE, -2, Meter.DELIVERY, -1),
            null);
    }

    @Test
    @DisplayName("instance ids are crisis_{quarter}_{count}")
    void instanceIds() {
        CrisisState s = CrisisState.empty();
        assertEquals("crisis_2_0", s.nextInstanceId(2));
        s = s.withCrisisAdded(crisis(s, 2, 4));
        assertEquals("crisis_3_1", s.nextInstanceId(3));
    }

    @Test
    @DisplayName("ongoing impact sums active crises in meter order")
    void ongoingImpact() {
        CrisisState s = CrisisState.empty();
        s = s.withCrisisAdded(crisis(s, 1, 3));
        s = s.withCrisisAdded(crisis(s, 1, 3));
        Map<Meter, Integer> total = s.totalOngoingImpact();
        assertEquals(List.of(Meter.DELIVERY, Meter.MORALE), List.copyOf(total.keySet()));
        assertEquals(-2, total.get(Meter.DELIVERY));
        assertEquals(-4, total.get(Meter.MORALE));
    }

    @Test
    @DisplayName("processDeadlines() expires only active crises past their deadline")
    void deadlines() {
        CrisisState s = CrisisState.empty();
        CrisisInstance early = crisis(s, 1, 2);
        s = s.withCrisisAdded(early);
        CrisisInstance late = crisis(s, 1, 5);
        s = s.withCrisisAdded(late);

        assertTrue(s.processDeadlines(2).expired().isEmpty());

        CrisisState.DeadlineResult r = s.processDeadlines(3);
        assertEquals(1, r.expired().size());
        assertEquals(early.instanceId(), r.expired().get(0).instanceId());
        assertEquals(CrisisStatus.EXPIRED, r.expired().get(0).status());
        assertEquals(1, r.state().activeCount());
        assertTrue(r.state().processDeadlines(3).expired().isEmpty());
        assertEquals(-2, r.state().totalOngoingImpact().get(Meter.MORALE));
    }

    @Test
    @DisplayName("mitigation helpers: extended deadline, severity floor of 1")
    void mitigation() {
        CrisisInstance c = crisis(CrisisState.empty(), 1, 2);
        assertEquals(4, c.withExtendedDeadline(2).deadlineQuarter());
        assertEquals(1, c.withReducedSeverity(10).severity());
        assertEquals(1, c.quartersRemaining(1));
        assertEquals(0, c.quartersRemaining(9));

        CrisisState s = CrisisState.empty().withCrisisAdded(c)
            .withCrisisUpdated(c.withStatus(CrisisStatus.MITIGATED));
        assertEquals(0, s.activeCount());
        assertTrue(s.totalOngoingImpact().isEmpty());
    }
}
