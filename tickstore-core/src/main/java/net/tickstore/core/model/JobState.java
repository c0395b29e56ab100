package net.tickstore.core.model;

import net.tickstore.core.error.MappingException;

/** Lifecycle state a notification can be registered for. */
public enum JobState {
    STOP(0), SCHEDULED(1), STARTED(2), DONE(3), REMOVED(4);

    private final int code;

    JobState(int code) { this.code = code; }

    public int code() { return code; }

    public static JobState fromCode(int code) throws MappingException {
        for (JobState s : values()) {
            if (s.code == code) return s;
        }
        throw new MappingException("Unknown notification state code: " + code);
    }
}
