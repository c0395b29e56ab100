package net.tickstore.app.external;

/** Remote source of the current Hijri date. */
public interface HijriCalendar {
    HijriDate today() throws Exception;
}
