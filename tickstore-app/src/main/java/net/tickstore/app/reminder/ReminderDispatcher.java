package net.tickstore.app.reminder;

import net.tickstore.core.codec.JobExtraCodec;
import net.tickstore.core.error.MappingException;
import net.tickstore.core.model.JobExtra;
import net.tickstore.core.model.JobStoredData;
import net.tickstore.core.service.DeliveryFanOut.DeliveryReport;
import net.tickstore.core.spi.OwnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point the engine calls when a reminder job comes due. The job's extra payload names the
 * owner and the reminder kind.
 */
public class ReminderDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ReminderDispatcher.class);

    private final OwnerRegistry owners;
    private final JobExtraCodec codec;
    private final Map<ExtensionType, ReminderNotifier> notifiers = new EnumMap<>(ExtensionType.class);

    public ReminderDispatcher(OwnerRegistry owners, JobExtraCodec codec, List<? extends ReminderNotifier> notifiers) {
        this.owners = owners;
        this.codec = codec;
        for (ReminderNotifier n : notifiers) this.notifiers.put(n.type(), n);
    }

    /** Runs the reminder for the owner of {@code job}. */
    public DeliveryReport dispatch(JobStoredData job) throws ReminderException, InterruptedException {
        JobExtra extra;
        try {
            extra = codec.decode(job.extra());
        } catch (MappingException e) {
            log.error("Job {} has unreadable extra data: {}", job.id(), e.getMessage());
            throw new ReminderException("Job " + job.id() + " has unreadable extra data", e);
        }
        ReminderNotifier notifier = notifierFor(extra.extensionType());

        Optional<Long> chatId;
        try {
            chatId = owners.findChatId(extra.ownerId());
        } catch (Exception e) {
            log.error("Failed to look up chat for user {}: {}", extra.ownerId(), e.getMessage());
            throw new ReminderException("Failed to look up chat for user " + extra.ownerId(), e);
        }
        if (chatId.isEmpty()) {
            log.warn("User {} of job {} no longer exists, nothing sent", extra.ownerId(), job.id());
            return new DeliveryReport(0, 0, 0);
        }
        return notifier.notify(List.of(chatId.get()));
    }

    /** Runs the reminder once for every user linked to a job of {@code type}. */
    public DeliveryReport broadcast(ExtensionType type) throws ReminderException, InterruptedException {
        ReminderNotifier notifier = notifierFor(type.code());
        List<Long> chatIds;
        try {
            chatIds = owners.chatIdsForExtension(type.code());
        } catch (Exception e) {
            log.error("Failed to list recipients of {}: {}", type, e.getMessage());
            throw new ReminderException("Failed to list recipients of " + type, e);
        }
        return notifier.notify(chatIds);
    }

    private ReminderNotifier notifierFor(int extensionType) throws ReminderException {
        ReminderNotifier notifier = ExtensionType.fromCode(extensionType).map(notifiers::get).orElse(null);
        if (notifier == null) {
            log.error("No notifier for extension type {}", extensionType);
            throw new ReminderException("No notifier for extension type " + extensionType);
        }
        return notifier;
    }
}
