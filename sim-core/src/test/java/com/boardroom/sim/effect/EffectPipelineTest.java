package com.boardroom.sim.effect;

import com.boardroom.sim.log.LogCategory;
import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OrgState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EffectPipelineTest {

    @Test
    @DisplayName("meter effects apply in order and clamp; profit and fines are only collected")
    void twoStage() {
        List<Effect> effects = List.of(
            new MeterEffect(Meter.MORALE, 50),
            new ProfitEffect(12),
            new FineEffect(5, "Regulator"),
            new MeterEffect(Meter.MORALE, -20),
            new FineEffect(3));

        EffectPipeline.Result r = EffectPipeline.apply(effects, OrgState.initial());

        assertEquals(80, r.org().morale());
        assertEquals(60, r.org().delivery());
        assertEquals(2, r.meterDeltas().size());
        assertEquals(List.of(new ProfitEffect(12)), r.profitEffects());
        assertEquals(8, r.fineTotal());
        assertEquals(5, r.entries().size());
        assertEquals(LogCategory.METER_CHANGE, r.entries().get(0).category());
        assertEquals("Fine: $3M (Legal settlement)", r.entries().get(4).message());
    }

    @Test
    @DisplayName("negative fines count as zero")
    void negativeFine() {
        assertEquals(0, new FineEffect(-5).amount());
    }

    @Test
    @DisplayName("empty list leaves the organization untouched")
    void empty() {
        EffectPipeline.Result r = EffectPipeline.apply(List.of(), OrgState.initial());
        assertEquals(OrgState.initial(), r.org());
        assertTrue(r.entries().isEmpty());
    }

    @Test
    @DisplayName("effects deserialize from their type-tagged JSON form")
    void polymorphicJson() throws Exception {
        String json = "[{\"type\":\"meter\",\"meter\":\"RUNWAY\",\"delta\":-4},"
            + "{\"type\":\"profit\",\"delta\":7},{\"type\":\"fine\",\"amount\":2}]";
        List<Effect> effects = new ObjectMapper().readValue(json, new TypeReference<List<Effect>>() { });
        assertEquals(List.of(new MeterEffect(Meter.RUNWAY, -4), new ProfitEffect(7),
            new FineEffect(2, FineEffect.DEFAULT_REASON)), effects);
    }
}
