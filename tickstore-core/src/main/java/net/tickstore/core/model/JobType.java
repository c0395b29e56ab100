package net.tickstore.core.model;

import net.tickstore.core.error.MappingException;

public enum JobType {
    CRON(0), REPEATED(1), ONE_SHOT(2);

    private final int code;

    JobType(int code) { this.code = code; }

    public int code() { return code; }

    public boolean isCron() { return this == CRON; }

    public static JobType fromCode(int code) throws MappingException {
        for (JobType t : values()) {
            if (t.code == code) return t;
        }
        throw new MappingException("Unknown job type code: " + code);
    }
}
