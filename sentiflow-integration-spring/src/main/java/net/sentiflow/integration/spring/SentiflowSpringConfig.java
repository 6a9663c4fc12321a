package net.sentiflow.integration.spring;

import net.sentiflow.adapter.jdbc.repo.JdbcBatchRunRepository;
import net.sentiflow.adapter.jdbc.repo.JdbcTemporalDatasetStore;
import net.sentiflow.adapter.jdbc.repo.JdbcUnitRunRepository;
import net.sentiflow.core.spi.BatchRunRepository;
import net.sentiflow.core.spi.Clock;
import net.sentiflow.core.spi.TemporalDatasetStore;
import net.sentiflow.core.spi.TxRunner;
import net.sentiflow.core.spi.UnitRunRepository;
import net.sentiflow.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class SentiflowSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // 저장소 구현 (adapter-jdbc 재사용)
    @Bean public TemporalDatasetStore temporalDatasetStore(DataSource ds) { return new JdbcTemporalDatasetStore(ds); }
    @Bean public BatchRunRepository batchRunRepository(DataSource ds) { return new JdbcBatchRunRepository(ds); }
    @Bean public UnitRunRepository unitRunRepository(DataSource ds) { return new JdbcUnitRunRepository(ds); }

    @Bean public Clock systemClock() { return Instant::now; }
}
