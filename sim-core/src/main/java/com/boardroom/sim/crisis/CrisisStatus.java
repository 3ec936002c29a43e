package com.boardroom.sim.crisis;

public enum CrisisStatus {
    ACTIVE,
    MITIGATED,
    ESCALATED,
    EXPIRED
}
