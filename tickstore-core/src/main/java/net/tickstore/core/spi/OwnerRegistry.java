package net.tickstore.core.spi;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Source of stable owner identities keyed by the messaging channel's chat id. */
public interface OwnerRegistry {

    /** Returns the existing owner for {@code chatId}, creating one if needed. */
    UUID register(long chatId, String username) throws Exception;

    Optional<UUID> findByChatId(long chatId) throws Exception;

    Optional<Long> findChatId(UUID ownerId) throws Exception;

    /** Chat ids of every owner linked to a job of the given extension type. */
    List<Long> chatIdsForExtension(int extensionType) throws Exception;
}
