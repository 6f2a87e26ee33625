package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * {@link BatchSqlSupport} 단위 테스트.
 *
 * <p>chunk 분할/합산, 다중 VALUES SQL 생성, null-safe 바인딩을 검증한다.</p>
 */
@DisplayName("batch sql support 테스트")
class BatchSqlSupportTest {

    static class ExposedSupport extends BatchSqlSupport {
        ExposedSupport(DatabaseClient db) {
            super(db);
        }
    }

    @Test
    @DisplayName("chunk 크기대로 나누어 순서대로 실행하고 결과를 합산")
    void chunkedSum_splitsAndSums() {
        ExposedSupport support = new ExposedSupport(mock(DatabaseClient.class));
        List<List<Integer>> seen = new ArrayList<>();

        StepVerifier.create(support.chunkedSum(List.of(1, 2, 3, 4, 5), 2, part -> {
                    seen.add(part);
                    return Mono.just((long) part.size());
                }))
                .expectNext(5L)
                .verifyComplete();

        assertThat(seen).containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
    }

    @Test
    @DisplayName("빈 목록/null이면 DB 호출 없이 0")
    void chunkedSum_emptyReturnsZero() {
        ExposedSupport support = new ExposedSupport(mock(DatabaseClient.class));

        StepVerifier.create(support.chunkedSum(List.<Integer>of(), 2, part -> Mono.error(new AssertionError())))
                .expectNext(0L)
                .verifyComplete();
        StepVerifier.create(support.chunkedSum(null, 2, part -> Mono.error(new AssertionError())))
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    @DisplayName("다중 VALUES SQL은 컬럼명_행번호 파라미터를 사용")
    void valuesSql_namesParametersByColumnAndRow() {
        String sql = BatchSqlSupport.valuesSql("t", List.of("a", "b"), 2);

        assertThat(sql).isEqualTo("INSERT INTO t (a, b) VALUES (:a_0, :b_0), (:a_1, :b_1)");
    }

    @Test
    @DisplayName("null 값은 bindNull, 아니면 bind")
    void bindOrNull_choosesBindNullForNull() {
        ExposedSupport support = new ExposedSupport(mock(DatabaseClient.class));
        DatabaseClient.GenericExecuteSpec spec = mock(DatabaseClient.GenericExecuteSpec.class);
        when(spec.bindNull(anyString(), any())).thenReturn(spec);
        when(spec.bind(anyString(), any())).thenReturn(spec);

        support.bindOrNull(spec, "x", null, String.class);
        support.bindOrNull(spec, "y", "v", String.class);

        verify(spec).bindNull("x", String.class);
        verify(spec).bind("y", "v");
    }
}
