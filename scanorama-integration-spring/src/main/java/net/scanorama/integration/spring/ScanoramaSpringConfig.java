package net.scanorama.integration.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.scanorama.adapter.jdbc.codec.JacksonJobConfigCodec;
import net.scanorama.adapter.jdbc.repo.JdbcHostInventory;
import net.scanorama.adapter.jdbc.repo.JdbcJobStore;
import net.scanorama.adapter.jdbc.repo.JdbcProfileRepository;
import net.scanorama.core.spi.*;
import net.scanorama.integration.spring.cron.CronUtilsCalculator;
import net.scanorama.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** Persistence and cron beans shared by every scheduler wiring. */
@Configuration
public class ScanoramaSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // adapter-jdbc implementations
    @Bean public JobStore jobStore() { return new JdbcJobStore(); }
    @Bean public HostInventory hostInventory() { return new JdbcHostInventory(); }

    @Bean
    public ProfileRepository profileRepository(
            @Value("${scanorama.scheduler.default-profile-id:" + JdbcProfileRepository.DEFAULT_PROFILE_ID + "}") String defaultProfileId) {
        return new JdbcProfileRepository(defaultProfileId);
    }

    @Bean
    public JobConfigCodec jobConfigCodec(ObjectProvider<ObjectMapper> mapper) {
        return new JacksonJobConfigCodec(mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean public Clock systemClock() { return java.time.Instant::now; }

    @Bean public CronCalculator cronCalculator() { return new CronUtilsCalculator(); }
}
