package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc;

import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * R2DBC 기반 배치 SQL 처리를 위한 공통 유틸/베이스 클래스입니다.
 * <p>
 * 대량 입력을 chunk 단위로 나누어 순차 실행하고, 처리 결과(rowsUpdated)를 합산하는 기능과
 * 다중 VALUES INSERT 생성, null-safe 바인딩 편의 메서드를 제공합니다.
 */
public abstract class BatchSqlSupport {

    /** R2DBC SQL 실행을 위한 DatabaseClient */
    protected final DatabaseClient db;

    /**
     * {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    protected BatchSqlSupport(DatabaseClient db) {
        this.db = db;
    }

    /**
     * 주어진 아이템 목록을 chunk 단위로 분할하여 순차(concat) 처리하고,
     * 각 처리 결과를 합산하여 반환합니다.
     *
     * @param items  처리할 전체 아이템 목록
     * @param chunk  한 번에 처리할 chunk 크기
     * @param onceFn chunk 단위로 실행할 함수(각 chunk에 대한 rowsUpdated 반환)
     * @param <T>    아이템 타입
     * @return 처리된 rowsUpdated 합계
     */
    protected <T> Mono<Long> chunkedSum(
            List<T> items,
            int chunk,
            Function<List<T>, Mono<Long>> onceFn
    ) {
        if (items == null || items.isEmpty()) return Mono.just(0L);
        return Flux.fromIterable(items)
                .buffer(chunk)
                .concatMap(onceFn)
                .reduce(0L, Long::sum);
    }

    /**
     * 행 목록을 chunk 단위의 다중 VALUES INSERT로 실행합니다.
     * <p>
     * 파라미터 이름은 {@code 컬럼명_행번호} 형식이며, {@link #p(String, int)}로 만듭니다.
     *
     * @param table   대상 테이블
     * @param columns 컬럼 목록(순서대로 VALUES에 배치)
     * @param rows    적재할 행 목록
     * @param chunk   한 문장에 담을 최대 행 수
     * @param binder  i번째 행의 값을 바인딩하는 함수
     * @param <T>     행 타입
     * @return 삽입된 행 수 합계
     */
    protected <T> Mono<Long> insertValues(
            String table,
            List<String> columns,
            List<T> rows,
            int chunk,
            RowBinder<T> binder
    ) {
        return chunkedSum(rows, chunk, part -> {
            DatabaseClient.GenericExecuteSpec spec = db.sql(valuesSql(table, columns, part.size()));
            for (int i = 0; i < part.size(); i++) {
                spec = binder.bind(spec, i, part.get(i));
            }
            return spec.fetch().rowsUpdated();
        });
    }

    /**
     * {@code INSERT INTO table (c1, c2) VALUES (:c1_0, :c2_0), (:c1_1, :c2_1)} 형태의 SQL을 만듭니다.
     */
    static String valuesSql(String table, List<String> columns, int rowCount) {
        StringBuilder sql = new StringBuilder("INSERT INTO ")
                .append(table)
                .append(" (")
                .append(String.join(", ", columns))
                .append(") VALUES ");

        for (int i = 0; i < rowCount; i++) {
            if (i > 0) sql.append(", ");
            sql.append("(");
            for (int c = 0; c < columns.size(); c++) {
                if (c > 0) sql.append(", ");
                sql.append(":").append(p(columns.get(c), i));
            }
            sql.append(")");
        }
        return sql.toString();
    }

    /**
     * 다중 VALUES INSERT의 파라미터 이름.
     *
     * @param column 컬럼명
     * @param i      chunk 내 행 번호
     * @return {@code column_i}
     */
    protected static String p(String column, int i) {
        return column + "_" + i;
    }

    /**
     * 값이 null인 경우 {@code bindNull}, 아니면 {@code bind}를 수행하는 null-safe 바인딩 헬퍼입니다.
     *
     * @param spec 바인딩 대상 {@link org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec}
     * @param name 파라미터 이름
     * @param value 바인딩할 값(Nullable)
     * @param type null 바인딩 시 사용할 타입
     * @param <V> 값 타입
     * @return 바인딩이 적용된 spec
     */
    protected <V> DatabaseClient.GenericExecuteSpec bindOrNull(
            DatabaseClient.GenericExecuteSpec spec, String name, V value, Class<V> type
    ) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }

    /**
     * 다중 VALUES INSERT에서 한 행을 바인딩하는 함수.
     *
     * @param <T> 행 타입
     */
    @FunctionalInterface
    protected interface RowBinder<T> {
        DatabaseClient.GenericExecuteSpec bind(DatabaseClient.GenericExecuteSpec spec, int i, T row);
    }
}
