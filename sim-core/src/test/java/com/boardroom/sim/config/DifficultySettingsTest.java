package com.boardroom.sim.config;

import com.boardroom.sim.exception.ContentValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DifficultySettingsTest {

    @Test
    @DisplayName("built-in tiers carry their balance values")
    void builtInTiers() {
        assertEquals(120, DifficultyTier.WELCH.settings().retirementThreshold());
        assertFalse(DifficultyTier.WELCH.settings().tenureDecayEnabled());
        assertEquals(75, DifficultyTier.NADELLA.settings().startingFavorability());
        assertEquals(6, DifficultyTier.ICAHN.settings().tenureDecayStartQuarter());
        assertEquals(-1, DifficultyTier.ICAHN.settings().successRewardBonus());
        assertEquals(DifficultyTier.NADELLA, DifficultyTier.defaultTier());
    }

    @Test
    @DisplayName("custom tier reads from JSON")
    void fromJson() {
        String json = "{\"name\":\"Custom\",\"retirementThreshold\":100,\"tenureDecayEnabled\":true,"
            + "\"tenureDecayStartQuarter\":10,\"successRewardBonus\":2,\"startingFavorability\":70}";
        DifficultySettings s = DifficultySettings.fromJson(
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        assertEquals(new DifficultySettings("Custom", 100, true, 10, 2, 70), s);
    }

    @Test
    @DisplayName("invalid values are rejected")
    void validation() {
        assertThrows(ContentValidationException.class, () -> new DifficultySettings("", 100, true, 10, 0, 70));
        assertThrows(ContentValidationException.class, () -> new DifficultySettings("X", 0, true, 10, 0, 70));
        assertThrows(ContentValidationException.class, () -> new DifficultySettings("X", 100, true, 10, 0, 101));
    }

    @Test
    @DisplayName("unreadable JSON is reported as a content error")
    void unreadable() {
        ByteArrayInputStream in = new ByteArrayInputStream("nope".getBytes(StandardCharsets.UTF_8));
        assertThrows(ContentValidationException.class, () -> DifficultySettings.fromJson(in));
    }
}
