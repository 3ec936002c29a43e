package com.boardroom.sim.engine;

import com.boardroom.sim.log.QuarterLog;

/**
 * Output of one engine transition: the new state and what happened on the way.
 */
public record QuarterResult(QuarterGameState state, QuarterLog log) {}
