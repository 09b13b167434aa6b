package net.scanorama.bootstrap.autoconfigure;

import net.scanorama.bootstrap.catalog.CatalogRegistrar;
import net.scanorama.bootstrap.defaults.LoggingDiscoveryService;
import net.scanorama.bootstrap.defaults.LoggingScanningService;
import net.scanorama.bootstrap.lifecycle.SchedulerLifecycle;
import net.scanorama.bootstrap.props.ScanoramaProperties;
import net.scanorama.core.job.DiscoveryJobBody;
import net.scanorama.core.job.JobBody;
import net.scanorama.core.job.ScanJobBody;
import net.scanorama.core.selection.HostSelector;
import net.scanorama.core.selection.ProfileResolver;
import net.scanorama.core.service.JobExecutionEngine;
import net.scanorama.core.service.JobRegistry;
import net.scanorama.core.service.JobScheduler;
import net.scanorama.core.spi.*;
import net.scanorama.integration.spring.ScanoramaSpringConfig;
import net.scanorama.integration.spring.sched.TaskSchedulerTriggerDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.ZoneId;
import java.util.List;

@AutoConfiguration
@EnableConfigurationProperties(ScanoramaProperties.class)
@Import(ScanoramaSpringConfig.class) // integration-spring: repos/tx/clock/cron wiring
public class ScanoramaAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ScanoramaAutoConfiguration.class);

    // --- collaborators owned by other subsystems; logging stand-ins when absent ---

    @Bean
    @ConditionalOnMissingBean
    public DiscoveryService discoveryService() {
        log.warn("No DiscoveryService bean, discovery jobs will only log");
        return new LoggingDiscoveryService();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanningService scanningService() {
        log.warn("No ScanningService bean, scan jobs will only log");
        return new LoggingScanningService();
    }

    // --- executors ---

    @Bean
    public ThreadPoolTaskScheduler scanoramaTriggerScheduler(ScanoramaProperties props) {
        var s = new ThreadPoolTaskScheduler();
        s.setPoolSize(props.getScheduler().getTriggerPoolSize());
        s.setThreadNamePrefix("scanorama-trigger-");
        return s;
    }

    @Bean
    public ThreadPoolTaskExecutor scanoramaJobExecutor(ScanoramaProperties props) {
        var e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(props.getScheduler().getWorkerThreads());
        e.setMaxPoolSize(props.getScheduler().getWorkerThreads());
        e.setQueueCapacity(props.getScheduler().getQueueCapacity());
        e.setThreadNamePrefix("scanorama-job-");
        return e;
    }

    @Bean
    public ThreadPoolTaskExecutor scanoramaScanExecutor(ScanoramaProperties props) {
        var e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(props.getScheduler().getScanThreads());
        e.setMaxPoolSize(props.getScheduler().getScanThreads());
        e.setThreadNamePrefix("scanorama-scan-");
        return e;
    }

    // --- core assembly ---

    @Bean
    @ConditionalOnMissingBean
    public HostSelector hostSelector(HostInventory inventory, TxRunner tx, Clock clock) {
        return new HostSelector(inventory, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProfileResolver profileResolver(ProfileRepository profiles, TxRunner tx) {
        return new ProfileResolver(profiles, tx);
    }

    @Bean
    public DiscoveryJobBody discoveryJobBody(DiscoveryService discovery) {
        return new DiscoveryJobBody(discovery);
    }

    @Bean
    public ScanJobBody scanJobBody(HostSelector hosts,
                                   ProfileResolver profiles,
                                   ScanningService scanner,
                                   @Qualifier("scanoramaScanExecutor") ThreadPoolTaskExecutor scanExecutor,
                                   ScanoramaProperties props) {
        return new ScanJobBody(hosts, profiles, scanner, scanExecutor, props.getScheduler().getScanBatchSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry() {
        return new JobRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutionEngine jobExecutionEngine(JobRegistry registry,
                                                 List<JobBody> bodies,
                                                 JobStore store,
                                                 TxRunner tx,
                                                 CronCalculator cron,
                                                 Clock clock,
                                                 ScanoramaProperties props) {
        return new JobExecutionEngine(registry, bodies, store, tx, cron, clock, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerDriver triggerDriver(@Qualifier("scanoramaTriggerScheduler") ThreadPoolTaskScheduler triggers,
                                       @Qualifier("scanoramaJobExecutor") ThreadPoolTaskExecutor workers,
                                       ScanoramaProperties props) {
        return new TaskSchedulerTriggerDriver(triggers, workers, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(JobRegistry registry,
                                     JobExecutionEngine engine,
                                     TriggerDriver driver,
                                     JobStore store,
                                     JobConfigCodec codec,
                                     CronCalculator cron,
                                     TxRunner tx,
                                     Clock clock,
                                     ScanoramaProperties props) {
        return new JobScheduler(registry, engine, driver, store, codec, cron, tx, clock, ZoneId.of(props.getZone()));
    }

    // --- lifecycle (property-controlled) ---

    @Bean
    @ConditionalOnProperty(prefix = "scanorama.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SchedulerLifecycle schedulerLifecycle(JobScheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(JobScheduler scheduler, JobStore store, TxRunner tx) {
        return new CatalogRegistrar(scheduler, store, tx);
    }

    @Bean
    @ConditionalOnProperty(prefix = "scanorama.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, ScanoramaProperties props) {
        log.info("Catalog: {} job definitions", props.getCatalog().getJobs().size());
        return args -> registrar.register(props.getCatalog());
    }
}
