package com.lexiconhub.dictionaryingest.bootstrap;

import org.flywaydb.core.api.output.MigrateResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.mock.env.MockEnvironment;

import java.sql.Connection;
import java.sql.DriverManager;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link FlywayRunner}가 설정값으로 Flyway를 구성해 마이그레이션을 수행하는지 검증한다.
 *
 * <p>H2(JDBC) in-memory DB와 테스트용 마이그레이션({@code db/migration-h2})을 사용하고,
 * 실행 후 적용 이력과 생성된 테이블을 조회한다.</p>
 */
@DisplayName("Flyway 러너 테스트")
class FlywayRunnerTest {

    private static final String URL = "jdbc:h2:mem:flyway_runner;DB_CLOSE_DELAY=-1";

    @Test
    @DisplayName("마이그레이션 후 히스토리와 staging/production 테이블이 생긴다")
    void runFlyway() throws Exception {
        MockEnvironment env = new MockEnvironment()
                .withProperty("spring.datasource.url", URL)
                .withProperty("spring.datasource.username", "sa")
                .withProperty("spring.datasource.password", "")
                .withProperty("spring.flyway.locations", "classpath:db/migration-h2");

        new FlywayRunner().runFlyway(env).run(new DefaultApplicationArguments(new String[0]));

        assertThat(FlywayRunner.flyway(env).info().applied()).isNotEmpty();

        try (Connection conn = DriverManager.getConnection(URL, "sa", "");
             var st = conn.createStatement()) {
            try (var rs = st.executeQuery("SELECT COUNT(*) FROM parsed_definition_staging")) {
                rs.next();
                assertThat(rs.getInt(1)).isZero();
            }
        }
    }

    @Test
    @DisplayName("이미 적용된 마이그레이션은 다시 실행하지 않는다")
    void migrate_isRepeatable() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:h2:mem:flyway_repeat;DB_CLOSE_DELAY=-1")
                .withProperty("spring.datasource.username", "sa")
                .withProperty("spring.datasource.password", "")
                .withProperty("spring.flyway.locations", "classpath:db/migration-h2");

        MigrateResult first = FlywayRunner.flyway(env).migrate();
        MigrateResult second = FlywayRunner.flyway(env).migrate();

        assertThat(first.migrationsExecuted).isEqualTo(1);
        assertThat(second.migrationsExecuted).isZero();
    }
}
