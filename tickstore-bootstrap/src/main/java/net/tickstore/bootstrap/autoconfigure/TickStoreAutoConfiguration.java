package net.tickstore.bootstrap.autoconfigure;

import net.tickstore.bootstrap.props.TickStoreProperties;
import net.tickstore.core.service.DeliveryFanOut;
import net.tickstore.core.service.SchedulerRuntime;
import net.tickstore.core.spi.CronCalculator;
import net.tickstore.core.spi.SchedulerEngine;
import net.tickstore.integration.spring.TickStoreSpringConfig;
import net.tickstore.integration.spring.cron.CronUtilsCalculator;
import net.tickstore.integration.spring.sched.SchedulerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@EnableConfigurationProperties(TickStoreProperties.class)
@Import(TickStoreSpringConfig.class) // integration-spring: stores/tx/clock wiring
public class TickStoreAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(TickStoreAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator(TickStoreProperties props) {
        CronUtilsCalculator cron = new CronUtilsCalculator();
        // fail at startup rather than on the first registration
        cron.validate(props.getReminders().getWhiteDaysCron());
        cron.validate(props.getReminders().getDailyHadithCron());
        return cron;
    }

    @Bean
    @ConditionalOnMissingBean
    public ZoneId tickstoreZone(TickStoreProperties props) {
        return ZoneId.of(props.getZone());
    }

    @Bean(name = "tickstoreDeliveryExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "tickstoreDeliveryExecutor")
    public ExecutorService tickstoreDeliveryExecutor(TickStoreProperties props) {
        int parallelism = props.getDelivery().getParallelism();
        if (parallelism < 1) {
            throw new IllegalArgumentException("tickstore.delivery.parallelism must be positive: " + parallelism);
        }
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "tickstore-delivery-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(parallelism, tf);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryFanOut deliveryFanOut(@Qualifier("tickstoreDeliveryExecutor") ExecutorService executor) {
        return new DeliveryFanOut(executor);
    }

    // --- engine lifecycle, only when the application supplies an engine ---

    @Bean
    @ConditionalOnBean(SchedulerEngine.class)
    @ConditionalOnMissingBean
    public SchedulerRuntime schedulerRuntime(SchedulerEngine engine) {
        return new SchedulerRuntime(engine);
    }

    @Bean
    @ConditionalOnBean(SchedulerEngine.class)
    public SchedulerLifecycle schedulerLifecycle(SchedulerRuntime runtime, TickStoreProperties props) {
        log.info("Scheduler engine lifecycle registered: autoStart={}, zone={}, reminders={}",
                props.getRuntime().isEnabled(), props.getZone(), props.getReminders());
        return new SchedulerLifecycle(runtime, props.getRuntime().isEnabled());
    }
}
