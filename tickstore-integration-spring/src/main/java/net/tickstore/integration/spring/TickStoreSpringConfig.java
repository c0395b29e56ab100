package net.tickstore.integration.spring;

import net.tickstore.adapter.jdbc.hook.JobAddHook;
import net.tickstore.adapter.jdbc.repo.JdbcMetadataStore;
import net.tickstore.adapter.jdbc.repo.JdbcNotificationStore;
import net.tickstore.adapter.jdbc.repo.JdbcOwnerRegistry;
import net.tickstore.core.codec.JobExtraCodec;
import net.tickstore.core.spi.Clock;
import net.tickstore.core.spi.MetadataStore;
import net.tickstore.core.spi.NotificationStore;
import net.tickstore.core.spi.OwnerRegistry;
import net.tickstore.core.spi.TxRunner;
import net.tickstore.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

/** Store wiring on top of the application's DataSource and transaction manager. */
@Configuration(proxyBeanMethods = false)
public class TickStoreSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public Clock systemClock() { return Instant::now; }

    @Bean
    public JobExtraCodec jobExtraCodec() { return new JobExtraCodec(); }

    // hooks are picked up from the context, honouring @Order
    @Bean
    public MetadataStore metadataStore(DataSource ds, TxRunner tx, Clock clock, JobExtraCodec codec,
                                       ObjectProvider<JobAddHook> hooks) {
        return JdbcMetadataStore.builder(ds)
                .txRunner(tx)
                .clock(clock)
                .codec(codec)
                .hooks(hooks.orderedStream().toList())
                .build();
    }

    @Bean
    public NotificationStore notificationStore(TxRunner tx) { return new JdbcNotificationStore(tx); }

    @Bean
    public OwnerRegistry ownerRegistry(TxRunner tx) { return new JdbcOwnerRegistry(tx); }
}
