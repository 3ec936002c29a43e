package com.boardroom.sim.situation;

/** Kind of consequence a played project produces in a later quarter. */
public enum FollowUpType {
    /** Small positive meter effect. */
    GOOD,
    /** Mild effect, either sign. */
    MEH,
    /** Queues a situation. */
    CRISIS
}
