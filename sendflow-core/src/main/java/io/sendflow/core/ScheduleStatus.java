package io.sendflow.core;

public enum ScheduleStatus {
    ACTIVE,
    PAUSED,
    CANCELLED,
    /**
     * Reached only by ONCE schedules after firing.
     */
    DONE
}
