package net.tickstore.app.reminder;

public class ReminderException extends Exception {
    public ReminderException(String message) { super(message); }

    public ReminderException(String message, Throwable cause) { super(message, cause); }
}
