package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo;

import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row.DefinitionStagingRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/**
 * parsed_definition_staging 테이블에 부모 행을 배치로 적재하는 Repository입니다.
 * <p>
 * staging은 중복을 허용하는 append-only 테이블이므로 충돌 처리 없이 INSERT만 수행합니다.
 * 중복 제거는 병합 단계에서 수행합니다.
 */
@Component
public class DefinitionStagingRepo extends BatchSqlSupport {

    static final String TABLE = "parsed_definition_staging";

    private static final List<String> COLUMNS = List.of(
            "batch_id", "seq_id", "dictionary_entry_id", "parent_parsed_id",
            "meaning_title", "normalized_key", "definition", "raw_fragment",
            "sense_number", "domain", "usage_label",
            "has_non_english_text", "non_english_text_id",
            "source_code", "created_at"
    );

    /** 한 INSERT 문에 담을 최대 행 수 */
    private final int chunk;

    /**
     * @param db         R2DBC DatabaseClient
     * @param properties 적재 설정(insert-chunk)
     */
    public DefinitionStagingRepo(DatabaseClient db, IngestProperties properties) {
        super(db);
        this.chunk = properties.insertChunk();
    }

    /**
     * 부모 staging 행을 배치로 적재합니다.
     *
     * @param rows 적재할 행 목록
     * @return 삽입된 행 수
     */
    public Mono<Long> insert(List<DefinitionStagingRow> rows) {
        return insertValues(TABLE, COLUMNS, rows, chunk, (spec, i, r) -> {
            spec = spec.bind(p("batch_id", i), r.batchId())
                    .bind(p("seq_id", i), r.seqId())
                    .bind(p("dictionary_entry_id", i), r.dictionaryEntryId());
            spec = bindOrNull(spec, p("parent_parsed_id", i), r.parentParsedId(), Long.class);
            spec = spec.bind(p("meaning_title", i), r.meaningTitle())
                    .bind(p("normalized_key", i), r.normalizedKey())
                    .bind(p("definition", i), r.definition())
                    .bind(p("raw_fragment", i), r.rawFragment())
                    .bind(p("sense_number", i), r.senseNumber());
            spec = bindOrNull(spec, p("domain", i), r.domain(), String.class);
            spec = bindOrNull(spec, p("usage_label", i), r.usageLabel(), String.class);
            spec = spec.bind(p("has_non_english_text", i), r.hasNonEnglishText());
            spec = bindOrNull(spec, p("non_english_text_id", i), r.nonEnglishTextId(), Long.class);
            spec = spec.bind(p("source_code", i), r.sourceCode());
            return bindOrNull(spec, p("created_at", i), r.createdAt(), LocalDateTime.class);
        });
    }
}
