package io.pulse4j.core;

public enum JobType {
    /**
     * Runs once; retired after the first successful run.
     */
    ONCE {
        @Override
        public boolean shouldReschedule() {
            return false;
        }
    },
    NORMAL {
        @Override
        public boolean shouldReschedule() {
            return true;
        }
    },
    /**
     * Recurring job kept as a single document per name (see {@code Pulse.every}).
     */
    SINGLE {
        @Override
        public boolean shouldReschedule() {
            return true;
        }
    };

    public abstract boolean shouldReschedule();
}
