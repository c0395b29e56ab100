package net.tickstore.app.reminder;

import java.util.Optional;

/** Kinds of per-user reminder jobs. Codes are persisted in {@code job_extensions.type}. */
public enum ExtensionType {
    WHITE_DAYS_MESSAGE(1),
    DAILY_HADITH_MESSAGE(2);

    private final int code;

    ExtensionType(int code) { this.code = code; }

    public int code() { return code; }

    public static Optional<ExtensionType> fromCode(int code) {
        for (ExtensionType t : values()) {
            if (t.code == code) return Optional.of(t);
        }
        return Optional.empty();
    }
}
