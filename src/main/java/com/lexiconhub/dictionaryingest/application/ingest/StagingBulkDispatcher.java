package com.lexiconhub.dictionaryingest.application.ingest;

import com.lexiconhub.dictionaryingest.application.common.error.FlushFailureException;
import com.lexiconhub.dictionaryingest.infrastructure.mapper.BatchPayloadMapper.RelationalPayload;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo.ChildTextTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 배치 페이로드를 staging 테이블에 한 트랜잭션으로 적재합니다.
 *
 * <p>적재 순서: 부모 → 별칭 → 동의어 → 예문 → 상호 참조 → 어원.
 * 중간에 실패하면 트랜잭션 전체가 롤백되고 {@link FlushFailureException}으로 변환됩니다.
 * 재시도는 호출자({@link BatchFlushWorkers})가 결정합니다.</p>
 */
@Service
public class StagingBulkDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StagingBulkDispatcher.class);

    private final IngestFacade staging;
    private final TransactionalOperator tx;

    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public StagingBulkDispatcher(IngestFacade staging, TransactionalOperator tx) {
        this.staging = staging;
        this.tx = tx;
    }

    /**
     * 페이로드 하나를 적재합니다.
     *
     * @param payload 배치 페이로드
     * @return 적재 결과. 실패 시 {@link FlushFailureException}
     */
    public Mono<DispatchResult> dispatch(RelationalPayload payload) {
        String batchId = payload.batchId();
        int items = payload.definitions().size();

        Mono<Long> work = Mono.defer(() -> Flux.concat(
                        staging.definition.insert(payload.definitions()),
                        staging.childText.insert(ChildTextTable.ALIAS, payload.aliases()),
                        staging.childText.insert(ChildTextTable.SYNONYM, payload.synonyms()),
                        staging.childText.insert(ChildTextTable.EXAMPLE, payload.examples()),
                        staging.crossReference.insert(payload.crossReferences()),
                        staging.etymology.insert(payload.etymologies())
                )
                .reduce(0L, Long::sum));

        return tx.transactional(work)
                .map(rows -> new DispatchResult(batchId, items, rows))
                .doOnNext(r -> {
                    succeeded.incrementAndGet();
                    log.debug("Batch staged. batchId={}, items={}, rows={}", batchId, items, r.rowsInserted());
                })
                .onErrorMap(e -> !(e instanceof FlushFailureException),
                        e -> new FlushFailureException(batchId, items, e))
                .doOnError(e -> {
                    failed.incrementAndGet();
                    log.warn("Staging dispatch failed. batchId={}, items={}, cause={}",
                            batchId, items, e.getCause() == null ? e.toString() : e.getCause().toString());
                });
    }

    /** 성공한 적재 시도 수 */
    public long succeeded() {
        return succeeded.get();
    }

    /** 실패한 적재 시도 수(재시도 포함) */
    public long failed() {
        return failed.get();
    }
}
