package io.sendflow.core;

public enum ScheduleType {
    ONCE {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    CRON {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    public abstract boolean isRecurring();
}
