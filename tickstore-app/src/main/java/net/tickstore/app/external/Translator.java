package net.tickstore.app.external;

public interface Translator {
    String WHITE_DAYS_NOTIFICATION = "white_days_notification";
    String GENERIC_ERROR = "generic_error";

    String translate(String key, Object... args);
}
