package net.sentiflow.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * ORACLE_JDBC_URL 이 있으면 그 DB, 없으면 Oracle 호환 모드 인메모리 H2.
 * 스키마는 운영과 같은 Flyway 스크립트로 만든다.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static DataSource ds;

    @BeforeAll
    void setupDb() {
        String url = System.getenv("ORACLE_JDBC_URL");
        String user = System.getenv("ORACLE_USERNAME");
        String pass = System.getenv("ORACLE_PASSWORD");

        HikariConfig cfg = new HikariConfig();
        if (url == null || url.isBlank()) {
            cfg.setJdbcUrl("jdbc:h2:mem:sentiflow_" + UUID.randomUUID().toString().replace("-", "")
                    + ";MODE=Oracle;DB_CLOSE_DELAY=-1");
            cfg.setUsername("sa");
            cfg.setPassword("");
        } else {
            cfg.setJdbcUrl(url);
            cfg.setUsername(user);
            cfg.setPassword(pass);
            cfg.setDriverClassName("oracle.jdbc.OracleDriver");
        }
        cfg.setMaximumPoolSize(6);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/oracle")
                .baselineOnMigrate(true)
                .load()
                .migrate();
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
    }

    /** 테이블 비우기. 자식 테이블부터 */
    protected static void deleteAll(String... tables) throws Exception {
        new JdbcTxRunner(ds).required(() -> {
            try (var st = TxContext.get().createStatement()) {
                for (String t : tables) st.executeUpdate("DELETE FROM " + t);
            }
            return null;
        });
    }
}
