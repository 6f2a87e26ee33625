package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo;

import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row.ChildTextStagingRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 별칭/동의어/예문 staging 테이블에 하위 행을 배치로 적재하는 Repository입니다.
 * <p>
 * 세 테이블은 {@code (batch_id, seq_id, 텍스트)} 구조가 같으므로 {@link ChildTextTable}로 대상을 고릅니다.
 */
@Component
public class ChildTextStagingRepo extends BatchSqlSupport {

    private final int chunk;

    public ChildTextStagingRepo(DatabaseClient db, IngestProperties properties) {
        super(db);
        this.chunk = properties.insertChunk();
    }

    /**
     * 하위 텍스트 행을 적재합니다.
     *
     * @param table 대상 테이블
     * @param rows  적재할 행 목록
     * @return 삽입된 행 수
     */
    public Mono<Long> insert(ChildTextTable table, List<ChildTextStagingRow> rows) {
        List<String> columns = List.of("batch_id", "seq_id", table.column());
        return insertValues(table.stagingTable(), columns, rows, chunk, (spec, i, r) ->
                spec.bind(p("batch_id", i), r.batchId())
                        .bind(p("seq_id", i), r.seqId())
                        .bind(p(table.column(), i), r.text()));
    }
}
