package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo;

import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row.CrossReferenceStagingRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * parsed_cross_reference_staging 적재 Repository.
 */
@Component
public class CrossReferenceStagingRepo extends BatchSqlSupport {

    private static final List<String> COLUMNS = List.of("batch_id", "seq_id", "target_word", "reference_type");

    private final int chunk;

    public CrossReferenceStagingRepo(DatabaseClient db, IngestProperties properties) {
        super(db);
        this.chunk = properties.insertChunk();
    }

    public Mono<Long> insert(List<CrossReferenceStagingRow> rows) {
        return insertValues("parsed_cross_reference_staging", COLUMNS, rows, chunk, (spec, i, r) ->
                spec.bind(p("batch_id", i), r.batchId())
                        .bind(p("seq_id", i), r.seqId())
                        .bind(p("target_word", i), r.targetWord())
                        .bind(p("reference_type", i), r.referenceType()));
    }
}
