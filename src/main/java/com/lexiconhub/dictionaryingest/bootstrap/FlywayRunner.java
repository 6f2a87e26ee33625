package com.lexiconhub.dictionaryingest.bootstrap;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;

/**
 * 애플리케이션 시작 시점에 staging/production 스키마 마이그레이션을 실행하는 설정 클래스입니다.
 *
 * <p>R2DBC에는 Flyway 자동 설정이 없으므로 JDBC 접속 정보({@code spring.datasource.*})로
 * 직접 {@link Flyway#migrate()}를 수행합니다. 적재 러너보다 먼저 실행됩니다.</p>
 *
 * <p>주요 설정값:
 * {@code spring.datasource.*}, {@code spring.flyway.locations},
 * {@code spring.flyway.baseline-on-migrate}, {@code spring.flyway.baseline-version}</p>
 */
@Configuration
@Profile({"local", "ingest"})
public class FlywayRunner {

    private static final Logger log = LoggerFactory.getLogger(FlywayRunner.class);

    @Bean
    @Order(0)
    ApplicationRunner runFlyway(Environment env) {
        return args -> {
            MigrateResult result = flyway(env).migrate();
            log.info("Flyway migration done. applied={}, targetVersion={}",
                    result.migrationsExecuted, result.targetSchemaVersion);
        };
    }

    static Flyway flyway(Environment env) {
        return Flyway.configure()
                .dataSource(
                        env.getProperty("spring.datasource.url"),
                        env.getProperty("spring.datasource.username"),
                        env.getProperty("spring.datasource.password")
                )
                .locations(env.getProperty("spring.flyway.locations", "classpath:db/migration"))
                .baselineOnMigrate(Boolean.parseBoolean(
                        env.getProperty("spring.flyway.baseline-on-migrate", "false")
                ))
                .baselineVersion(env.getProperty("spring.flyway.baseline-version", "0"))
                .load();
    }
}
