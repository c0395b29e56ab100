package net.tickstore.app.reminder;

import net.tickstore.core.service.DeliveryFanOut.DeliveryReport;

import java.util.Collection;

/** What runs when a reminder job of {@link #type()} comes due. */
public interface ReminderNotifier {
    ExtensionType type();

    DeliveryReport notify(Collection<Long> chatIds) throws InterruptedException;
}
