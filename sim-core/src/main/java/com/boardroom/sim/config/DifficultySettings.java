package com.boardroom.sim.config;

import com.boardroom.sim.exception.ContentValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Resolved balance configuration for one game.
 *
 * <p>Passed explicitly to every calculation that depends on it and stored in
 * the game state, so a saved game always resumes with the tier it started on.
 *
 * <h3>Fields</h3>
 * <ul>
 *   <li>{@code retirementThreshold} — accumulated bonus ($M) needed to retire</li>
 *   <li>{@code tenureDecayEnabled} / {@code tenureDecayStartQuarter} — -1 favorability per
 *       quarter once tenure reaches the start quarter</li>
 *   <li>{@code successRewardBonus} — added to the base favorability reward on success</li>
 *   <li>{@code startingFavorability} — board favorability of a new CEO</li>
 * </ul>
 */
public record DifficultySettings(
    @JsonProperty("name")                    String name,
    @JsonProperty("retirementThreshold")     int retirementThreshold,
    @JsonProperty("tenureDecayEnabled")      boolean tenureDecayEnabled,
    @JsonProperty("tenureDecayStartQuarter") int tenureDecayStartQuarter,
    @JsonProperty("successRewardBonus")      int successRewardBonus,
    @JsonProperty("startingFavorability")    int startingFavorability
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public DifficultySettings {
        if (name == null || name.isBlank()) {
            throw new ContentValidationException("DifficultySettings", "name must not be blank");
        }
        if (retirementThreshold <= 0) {
            throw new ContentValidationException("DifficultySettings",
                "retirementThreshold must be positive, was " + retirementThreshold);
        }
        if (startingFavorability < 0 || startingFavorability > 100) {
            throw new ContentValidationException("DifficultySettings",
                "startingFavorability must be within 0..100, was " + startingFavorability);
        }
    }

    /**
     * Reads a custom tier from JSON, e.g. a balance-testing override.
     */
    public static DifficultySettings fromJson(InputStream in) {
        try {
            return MAPPER.readValue(in, DifficultySettings.class);
        } catch (IOException e) {
            throw new ContentValidationException("DifficultySettings", "Unreadable difficulty settings", e);
        }
    }
}
