package com.lexiconhub.dictionaryingest.support;

import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.config.R2dbcTxConfig;
import io.r2dbc.h2.H2ConnectionFactory;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * 테스트용 H2 in-memory R2DBC 데이터베이스.
 *
 * <p>스키마는 {@code db/migration-h2} 마이그레이션과 같은 파일을 사용한다.
 * {@link #reset()}은 모든 객체를 지우고 스키마를 다시 만든다.</p>
 */
public final class H2TestDatabase {

    private static final String SCHEMA = "db/migration-h2/V1__dictionary_ingest_schema.sql";

    public final ConnectionFactory connectionFactory;
    public final DatabaseClient db;
    public final TransactionalOperator tx;

    private H2TestDatabase(String name) {
        this.connectionFactory = H2ConnectionFactory.inMemory(name);
        this.db = DatabaseClient.create(connectionFactory);
        this.tx = R2dbcTxConfig.operatorFor(connectionFactory);
    }

    public static H2TestDatabase create(String name) {
        return new H2TestDatabase(name);
    }

    public void reset() {
        db.sql("DROP ALL OBJECTS").then().block(Duration.ofSeconds(10));
        Flux.fromIterable(statements())
                .concatMap(sql -> db.sql(sql).then())
                .then()
                .block(Duration.ofSeconds(10));
    }

    public long count(String sql) {
        Long n = db.sql(sql)
                .map((row, meta) -> row.get(0, Long.class))
                .one()
                .block(Duration.ofSeconds(10));
        return n == null ? 0L : n;
    }

    public Mono<Long> countMono(String sql) {
        return db.sql(sql).map((row, meta) -> row.get(0, Long.class)).one();
    }

    /** 작은 insert-chunk로 분할 경로까지 타도록 한 설정 */
    public static IngestProperties properties(int batchSize, int workerCount, int insertChunk) {
        return new IngestProperties(batchSize, workerCount, 64, 3,
                Duration.ofMillis(1), insertChunk, Duration.ofMillis(20), null);
    }

    private static List<String> statements() {
        try {
            String script = new ClassPathResource(SCHEMA).getContentAsString(StandardCharsets.UTF_8);
            return Arrays.stream(script.split(";"))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
