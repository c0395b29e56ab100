package net.tickstore.adapter.jdbc.repo;

import net.tickstore.adapter.jdbc.JdbcTxRunner;
import net.tickstore.adapter.jdbc.TestSupport;
import net.tickstore.adapter.jdbc.hook.OwnerLinkageHook;
import net.tickstore.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JdbcOwnerRegistryTest extends TestSupport {

    TxRunner tx;
    JdbcOwnerRegistry owners;
    JdbcMetadataStore jobs;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        owners = new JdbcOwnerRegistry(tx);
        jobs = JdbcMetadataStore.builder(ds).txRunner(tx).codec(codec)
                .hook(new OwnerLinkageHook(1))
                .hook(new OwnerLinkageHook(2))
                .build();
    }

    @BeforeEach
    void clean() throws Exception {
        truncateAll();
    }

    @Test
    void register_isIdempotentPerChat() throws Exception {
        UUID first = owners.register(555L, "alice");
        UUID second = owners.register(555L, "renamed");

        assertEquals(first, second);
        assertEquals(Optional.of(first), owners.findByChatId(555L));
        assertEquals(Optional.empty(), owners.findByChatId(556L));
        assertEquals(Optional.of(555L), owners.findChatId(first));
        assertEquals(Optional.empty(), owners.findChatId(UUID.randomUUID()));
        assertEquals(1, count("SELECT COUNT(*) FROM users"));
    }

    @Test
    void chatIdsForExtension_followsLinkage() throws Exception {
        UUID a = owners.register(10L, "a");
        UUID b = owners.register(20L, "b");
        owners.register(30L, "c");

        jobs.addOrUpdate(cronJob(a, 1, 0));
        jobs.addOrUpdate(cronJob(a, 2, 0));
        jobs.addOrUpdate(cronJob(b, 2, 0));

        assertThat(owners.chatIdsForExtension(1)).containsExactly(10L);
        assertThat(owners.chatIdsForExtension(2)).containsExactlyInAnyOrder(10L, 20L);
        assertThat(owners.chatIdsForExtension(3)).isEmpty();
    }
}
