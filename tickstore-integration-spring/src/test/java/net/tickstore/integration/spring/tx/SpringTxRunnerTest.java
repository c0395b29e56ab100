package net.tickstore.integration.spring.tx;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.tickstore.adapter.jdbc.TxContext;
import net.tickstore.adapter.jdbc.hook.JobAddHook;
import net.tickstore.adapter.jdbc.hook.OwnerLinkageHook;
import net.tickstore.adapter.jdbc.mapper.JobRow;
import net.tickstore.adapter.jdbc.mapper.UuidHalves;
import net.tickstore.adapter.jdbc.repo.JdbcMetadataStore;
import net.tickstore.core.codec.JobExtraCodec;
import net.tickstore.core.error.CantAddException;
import net.tickstore.core.model.JobExtra;
import net.tickstore.core.model.JobStoredData;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.io.IOException;
import java.sql.Connection;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SpringTxRunnerTest {

    HikariDataSource ds;
    JdbcTemplate jdbc;
    SpringTxRunner tx;
    final JobExtraCodec codec = new JobExtraCodec();

    @BeforeAll
    void setupDb() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:spring-tx;DB_CLOSE_DELAY=-1");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(4);
        ds = new HikariDataSource(cfg);
        Flyway.configure().dataSource(ds).locations("classpath:db/migration/h2").load().migrate();

        jdbc = new JdbcTemplate(ds);
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
    }

    @AfterAll
    void cleanup() {
        ds.close();
    }

    @BeforeEach
    void clean() {
        for (String t : new String[]{"users_jobs", "job_extensions", "jobs", "users"}) jdbc.update("DELETE FROM " + t);
    }

    private int users() {
        return jdbc.queryForObject("SELECT COUNT(*) FROM users", Integer.class);
    }

    private Object insertUser(long chatId) throws Exception {
        try (var ps = TxContext.require().prepareStatement("INSERT INTO users (id, chat_id) VALUES (?, ?)")) {
            ps.setObject(1, UUID.randomUUID());
            ps.setLong(2, chatId);
            return ps.executeUpdate();
        }
    }

    @Test
    void required_commitsAndPublishesConnection() throws Exception {
        tx.required(() -> insertUser(1L));

        assertThat(users()).isEqualTo(1);
        assertThat(TxContext.get()).isNull();
    }

    @Test
    void checkedException_rollsBack_andKeepsItsType() {
        assertThatThrownBy(() -> tx.required(() -> {
            insertUser(2L);
            throw new IOException("disk gone");
        })).isInstanceOf(IOException.class).hasMessage("disk gone");

        assertThat(users()).isZero();
    }

    @Test
    void requiresNew_commitsIndependentlyOfOuterRollback() {
        assertThatThrownBy(() -> tx.required(() -> {
            Connection outer = TxContext.require();
            insertUser(3L);
            tx.requiresNew(() -> {
                assertThat(TxContext.require()).isNotSameAs(outer);
                return insertUser(4L);
            });
            assertThat(TxContext.require()).isSameAs(outer);
            throw new IllegalStateException("outer fails");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(jdbc.queryForList("SELECT chat_id FROM users", Long.class)).containsExactly(4L);
    }

    @Test
    void metadataStore_hookFailure_surfacesAsCantAdd_andRollsBack() throws Exception {
        JobAddHook failing = new JobAddHook() {
            @Override
            public boolean beforeAdd(JobRow job, JobExtra extra, Connection connection) { return false; }

            @Override
            public void afterAdd(JobRow job, JobExtra extra, Connection transaction) {
                throw new IllegalStateException("linkage refused");
            }
        };
        JdbcMetadataStore store = JdbcMetadataStore.builder(ds).txRunner(tx).codec(codec)
                .hook(new OwnerLinkageHook(2)).hook(failing).build();

        UUID owner = UUID.randomUUID();
        jdbc.update("INSERT INTO users (id, chat_id) VALUES (?, ?)", owner, 5L);
        JobStoredData job = JobStoredData.cron(UuidHalves.split(UUID.randomUUID()), "0 0 8 * * *", 0L,
                codec.encode(new JobExtra(owner, 2)));

        assertThatThrownBy(() -> store.addOrUpdate(job)).isInstanceOf(CantAddException.class);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM jobs", Integer.class)).isZero();
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM job_extensions", Integer.class)).isZero();
    }
}
