package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * staging → production 병합에 사용하는 SQL을 모아둔 Repository입니다.
 * <p>
 * 모든 메서드는 소스 코드 하나({@code source_code})의 staging 행만 대상으로 합니다.
 * 트랜잭션 경계는 호출하는 서비스가 {@code TransactionalOperator}로 감쌉니다.
 * <p>
 * 중복 판단 키는 {@code (source_code, normalized_key, sense_number)}이며,
 * 같은 키의 staging 행이 여러 개면 {@code created_at}이 가장 최근인 행(동률이면 id가 큰 행)이 승자가 됩니다.
 * <p>
 * 병합 대상은 {@link #analyze(String)} 시점의 최대 staging id({@code maxId}) 이하 행으로 한정합니다.
 * 병합 도중 다른 적재가 커밋한 행은 선택도 삭제도 되지 않고 다음 병합 때 처리됩니다.
 */
@Component
public class StagingMergeRepo {

    private static final String MAX_ID_SQL = """
        SELECT MAX(id) AS max_id
          FROM parsed_definition_staging
         WHERE source_code = :source
        """;

    private static final String ANALYZE_SQL = """
        SELECT
          (SELECT COUNT(*)
             FROM parsed_definition_staging
            WHERE source_code = :source
              AND id <= :maxId) AS total_rows,
          (SELECT COUNT(*)
             FROM (SELECT DISTINCT normalized_key, sense_number
                     FROM parsed_definition_staging
                    WHERE source_code = :source
                      AND id <= :maxId) k) AS unique_keys
        """;

    private static final String INSERT_MISSING_PARENTS_SQL = """
        INSERT INTO parsed_definition (
          source_code, normalized_key, sense_number,
          dictionary_entry_id, parent_parsed_id,
          meaning_title, definition, raw_fragment,
          domain, usage_label, has_non_english_text, non_english_text_id,
          created_at, origin_batch_id, origin_seq_id
        )
        SELECT
          s.source_code, s.normalized_key, s.sense_number,
          s.dictionary_entry_id, s.parent_parsed_id,
          s.meaning_title, s.definition, s.raw_fragment,
          s.domain, s.usage_label, s.has_non_english_text, s.non_english_text_id,
          s.created_at, s.batch_id, s.seq_id
        FROM (
          SELECT st.*,
                 ROW_NUMBER() OVER (
                   PARTITION BY st.normalized_key, st.sense_number
                   ORDER BY st.created_at DESC, st.id DESC
                 ) AS rn
            FROM parsed_definition_staging st
           WHERE st.source_code = :source
             AND st.id <= :maxId
        ) s
        WHERE s.rn = 1
          AND NOT EXISTS (
            SELECT 1
              FROM parsed_definition d
             WHERE d.source_code = s.source_code
               AND d.normalized_key = s.normalized_key
               AND d.sense_number = s.sense_number
          )
        """;

    private static final String PROMOTE_CROSS_REFERENCES_SQL = """
        INSERT INTO parsed_definition_cross_reference (parsed_definition_id, target_word, reference_type)
        SELECT d.id, c.target_word, c.reference_type
          FROM parsed_cross_reference_staging c
          JOIN parsed_definition d
            ON d.origin_batch_id = c.batch_id
           AND d.origin_seq_id = c.seq_id
         WHERE d.source_code = :source
        """;

    private static final String PROMOTE_ETYMOLOGIES_SQL = """
        INSERT INTO parsed_definition_etymology (parsed_definition_id, etymology_text, language_code, has_non_english_text)
        SELECT d.id, c.etymology_text, c.language_code, c.has_non_english_text
          FROM parsed_etymology_staging c
          JOIN parsed_definition d
            ON d.origin_batch_id = c.batch_id
           AND d.origin_seq_id = c.seq_id
         WHERE d.source_code = :source
        """;

    private static final String DELETE_PARENTS_SQL = """
        DELETE FROM parsed_definition_staging
         WHERE source_code = :source
           AND id <= :maxId
        """;

    private static final String COUNT_STAGING_SQL = """
        SELECT COUNT(*) AS cnt
          FROM parsed_definition_staging
         WHERE source_code = :source
        """;

    private static final String COUNT_PRODUCTION_SQL = """
        SELECT COUNT(*) AS cnt
          FROM parsed_definition
         WHERE source_code = :source
        """;

    private static final String COUNT_DUPLICATE_GROUPS_SQL = """
        SELECT COUNT(*) AS cnt
          FROM (SELECT normalized_key, sense_number
                  FROM parsed_definition
                 WHERE source_code = :source
                 GROUP BY normalized_key, sense_number
                HAVING COUNT(*) > 1) g
        """;

    private final DatabaseClient db;

    public StagingMergeRepo(DatabaseClient db) {
        this.db = db;
    }

    /**
     * 병합 대상 범위({@code maxId})를 정하고 그 범위의 staging 상태를 집계합니다.
     *
     * @param sourceCode 소스 코드
     * @return 대상 범위와 전체 행 수, 고유 키 수. staging이 비어 있으면 {@code maxId}는 0
     */
    public Mono<StagingStats> analyze(String sourceCode) {
        return db.sql(MAX_ID_SQL)
                .bind("source", sourceCode)
                .map((row, meta) -> nz(row.get("max_id", Long.class)))
                .one()
                .defaultIfEmpty(0L)
                .flatMap(maxId -> db.sql(ANALYZE_SQL)
                        .bind("source", sourceCode)
                        .bind("maxId", maxId)
                        .map((row, meta) -> new StagingStats(
                                maxId,
                                nz(row.get("total_rows", Long.class)),
                                nz(row.get("unique_keys", Long.class))
                        ))
                        .one()
                        .defaultIfEmpty(new StagingStats(maxId, 0, 0)));
    }

    /**
     * 키별 승자 행 중 production에 아직 없는 것만 INSERT 합니다.
     * <p>
     * 이미 production에 같은 키가 있으면 건너뛰므로(기존 행 갱신 없음) 재실행해도 결과가 같습니다.
     * 승자의 {@code (batch_id, seq_id)}는 origin 컬럼에 남겨 하위 행 승격에 사용합니다.
     *
     * @param sourceCode 소스 코드
     * @param maxId      대상 staging id 상한
     * @return 새로 INSERT 된 부모 행 수
     */
    public Mono<Long> insertMissingParents(String sourceCode, long maxId) {
        return execute(INSERT_MISSING_PARENTS_SQL, sourceCode, maxId);
    }

    /**
     * 이번 병합에서 INSERT 된 부모(origin이 staging 행과 일치)의 하위 행을 production으로 복사합니다.
     *
     * @param sourceCode 소스 코드
     * @return 복사된 하위 행 수 합계
     */
    public Mono<Long> promoteChildren(String sourceCode) {
        return Flux.concat(
                        Flux.fromArray(ChildTextTable.values())
                                .concatMap(t -> execute(promoteChildTextSql(t), sourceCode)),
                        execute(PROMOTE_CROSS_REFERENCES_SQL, sourceCode),
                        execute(PROMOTE_ETYMOLOGIES_SQL, sourceCode)
                )
                .reduce(0L, Long::sum);
    }

    /**
     * 병합한 범위({@code id <= maxId})의 staging 행을 비웁니다.
     * 하위 staging 행은 그 범위의 부모를 통해 찾아 먼저 지우고, 부모 행을 지웁니다.
     *
     * @param sourceCode 소스 코드
     * @param maxId      대상 staging id 상한
     * @return 삭제된 부모 staging 행 수
     */
    public Mono<Long> clearStaging(String sourceCode, long maxId) {
        return Flux.concat(
                        Flux.fromArray(ChildTextTable.values())
                                .concatMap(t -> execute(deleteChildSql(t.stagingTable()), sourceCode, maxId)),
                        execute(deleteChildSql("parsed_cross_reference_staging"), sourceCode, maxId),
                        execute(deleteChildSql("parsed_etymology_staging"), sourceCode, maxId)
                )
                .then(execute(DELETE_PARENTS_SQL, sourceCode, maxId));
    }

    /** 소스의 남은 부모 staging 행 수 */
    public Mono<Long> countStaging(String sourceCode) {
        return count(COUNT_STAGING_SQL, sourceCode);
    }

    /** 소스의 production 부모 행 수 */
    public Mono<Long> countProduction(String sourceCode) {
        return count(COUNT_PRODUCTION_SQL, sourceCode);
    }

    /** production에서 같은 키를 2개 이상 가진 그룹 수(정상이라면 0) */
    public Mono<Long> countDuplicateKeyGroups(String sourceCode) {
        return count(COUNT_DUPLICATE_GROUPS_SQL, sourceCode);
    }

    private Mono<Long> execute(String sql, String sourceCode) {
        return db.sql(sql)
                .bind("source", sourceCode)
                .fetch()
                .rowsUpdated();
    }

    private Mono<Long> execute(String sql, String sourceCode, long maxId) {
        return db.sql(sql)
                .bind("source", sourceCode)
                .bind("maxId", maxId)
                .fetch()
                .rowsUpdated();
    }

    private Mono<Long> count(String sql, String sourceCode) {
        return db.sql(sql)
                .bind("source", sourceCode)
                .map((row, meta) -> nz(row.get("cnt", Long.class)))
                .one()
                .defaultIfEmpty(0L);
    }

    static String promoteChildTextSql(ChildTextTable t) {
        return """
            INSERT INTO %s (parsed_definition_id, %s)
            SELECT d.id, c.%s
              FROM %s c
              JOIN parsed_definition d
                ON d.origin_batch_id = c.batch_id
               AND d.origin_seq_id = c.seq_id
             WHERE d.source_code = :source
            """.formatted(t.productionTable(), t.column(), t.column(), t.stagingTable());
    }

    static String deleteChildSql(String stagingTable) {
        return """
            DELETE FROM %1$s
             WHERE EXISTS (
               SELECT 1
                 FROM parsed_definition_staging s
                WHERE s.batch_id = %1$s.batch_id
                  AND s.seq_id = %1$s.seq_id
                  AND s.source_code = :source
                  AND s.id <= :maxId
             )
            """.formatted(stagingTable);
    }

    private static long nz(Long v) {
        return v == null ? 0L : v;
    }

    /**
     * 병합 전 staging 집계.
     *
     * @param maxId      병합 대상 staging id 상한
     * @param totalRows  대상 범위의 staging 부모 행 수
     * @param uniqueKeys 대상 범위의 고유 {@code (normalized_key, sense_number)} 수
     */
    public record StagingStats(long maxId, long totalRows, long uniqueKeys) {

        /** 병합에서 버려질 중복 행 수 */
        public long duplicates() {
            return totalRows - uniqueKeys;
        }
    }
}
