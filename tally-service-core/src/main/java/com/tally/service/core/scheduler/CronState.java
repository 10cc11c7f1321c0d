package com.tally.service.core.scheduler;

public enum CronState {
    IDLE,
    SCHEDULED,
    FIRING,
    STOPPED
}
