package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo;

import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row.EtymologyStagingRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * parsed_etymology_staging 적재 Repository.
 * <p>
 * language_code는 없으면 NULL로 저장합니다.
 */
@Component
public class EtymologyStagingRepo extends BatchSqlSupport {

    private static final List<String> COLUMNS = List.of(
            "batch_id", "seq_id", "etymology_text", "language_code", "has_non_english_text");

    private final int chunk;

    public EtymologyStagingRepo(DatabaseClient db, IngestProperties properties) {
        super(db);
        this.chunk = properties.insertChunk();
    }

    public Mono<Long> insert(List<EtymologyStagingRow> rows) {
        return insertValues("parsed_etymology_staging", COLUMNS, rows, chunk, (spec, i, r) -> {
            spec = spec.bind(p("batch_id", i), r.batchId())
                    .bind(p("seq_id", i), r.seqId())
                    .bind(p("etymology_text", i), r.etymologyText());
            spec = bindOrNull(spec, p("language_code", i), r.languageCode(), String.class);
            return spec.bind(p("has_non_english_text", i), r.hasNonEnglishText());
        });
    }
}
