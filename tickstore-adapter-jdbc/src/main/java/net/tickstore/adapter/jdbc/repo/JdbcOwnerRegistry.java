package net.tickstore.adapter.jdbc.repo;

import net.tickstore.adapter.jdbc.JdbcUtil;
import net.tickstore.adapter.jdbc.TxContext;
import net.tickstore.core.spi.OwnerRegistry;
import net.tickstore.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Owners keyed by chat id, stored in {@code users}. */
public final class JdbcOwnerRegistry implements OwnerRegistry {
    private static final Logger log = LoggerFactory.getLogger(JdbcOwnerRegistry.class);

    private final TxRunner tx;

    public JdbcOwnerRegistry(TxRunner tx) {
        this.tx = tx;
    }

    @Override
    public UUID register(long chatId, String username) throws Exception {
        Optional<UUID> existing = findByChatId(chatId);
        if (existing.isPresent()) return existing.get();

        UUID id = UUID.randomUUID();
        try {
            tx.requiresNew(() -> {
                try (PreparedStatement ps = TxContext.require().prepareStatement(
                        "INSERT INTO users (id, chat_id, username) VALUES (?, ?, ?)")) {
                    ps.setObject(1, id);
                    ps.setLong(2, chatId);
                    JdbcUtil.setString(ps, 3, username);
                    return ps.executeUpdate();
                }
            });
            log.info("Registered user {} for chat {}", id, chatId);
            return id;
        } catch (SQLException e) {
            // integrity constraint violation: a concurrent registration won the race
            if (e.getSQLState() != null && e.getSQLState().startsWith("23")) {
                log.debug("Chat {} registered concurrently, re-reading", chatId);
                return findByChatId(chatId).orElseThrow(() -> e);
            }
            throw e;
        }
    }

    @Override
    public Optional<UUID> findByChatId(long chatId) throws Exception {
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.require().prepareStatement(
                    "SELECT id FROM users WHERE chat_id = ?")) {
                ps.setLong(1, chatId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(JdbcUtil.getUuid(rs, "id")) : Optional.<UUID>empty();
                }
            }
        });
    }

    @Override
    public Optional<Long> findChatId(UUID ownerId) throws Exception {
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.require().prepareStatement(
                    "SELECT chat_id FROM users WHERE id = ?")) {
                ps.setObject(1, ownerId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(rs.getLong(1)) : Optional.<Long>empty();
                }
            }
        });
    }

    @Override
    public List<Long> chatIdsForExtension(int extensionType) throws Exception {
        return tx.required(() -> {
            Connection c = TxContext.require();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT DISTINCT u.chat_id
                      FROM users u
                      JOIN users_jobs uj ON uj.user_id = u.id
                      JOIN job_extensions je ON je.job_id = uj.job_id
                     WHERE je.type = ?
                    """)) {
                ps.setInt(1, extensionType);
                try (ResultSet rs = ps.executeQuery()) {
                    List<Long> out = new ArrayList<>();
                    while (rs.next()) out.add(rs.getLong(1));
                    return out;
                }
            }
        });
    }
}
