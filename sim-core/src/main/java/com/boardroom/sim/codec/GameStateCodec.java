package com.boardroom.sim.codec;

import com.boardroom.sim.engine.QuarterGameState;
import com.boardroom.sim.exception.SimulationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lossless JSON form of a {@link QuarterGameState}.
 *
 * <p>Output is stable: two equal states always serialize to the same string,
 * which makes the JSON usable for save files and replay comparisons.
 */
public class GameStateCodec {

    private static final Logger log = LoggerFactory.getLogger(GameStateCodec.class);

    private static final String COMPONENT = "GameStateCodec";

    private final ObjectMapper objectMapper;

    public GameStateCodec() {
        this(defaultMapper());
    }

    public GameStateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        return mapper;
    }

    public String write(QuarterGameState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            log.error("[GameStateCodec] Serialization failed. quarter={} error={}",
                state.quarterNumber(), e.getOriginalMessage());
            throw new SimulationException(COMPONENT, "Cannot serialize game state", e);
        }
    }

    public QuarterGameState read(String json) {
        try {
            QuarterGameState state = objectMapper.readValue(json, QuarterGameState.class);
            log.debug("[GameStateCodec] Restored. seed={} quarter={} phase={}",
                state.seed(), state.quarterNumber(), state.quarter().phase());
            return state;
        } catch (JsonProcessingException e) {
            log.error("[GameStateCodec] Deserialization failed. error={}", e.getOriginalMessage());
            throw new SimulationException(COMPONENT, "Cannot read game state", e);
        }
    }
}
