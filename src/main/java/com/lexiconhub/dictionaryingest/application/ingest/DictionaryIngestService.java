package com.lexiconhub.dictionaryingest.application.ingest;

import com.lexiconhub.dictionaryingest.application.ingest.BatchItemCollector.CollectorStats;
import com.lexiconhub.dictionaryingest.application.ingest.dto.response.ImportSummary;
import com.lexiconhub.dictionaryingest.application.ingest.dto.response.IngestStatsResponse;
import com.lexiconhub.dictionaryingest.application.merge.MergeReport;
import com.lexiconhub.dictionaryingest.application.merge.PostMergeVerifier;
import com.lexiconhub.dictionaryingest.application.merge.StagingMergeService;
import com.lexiconhub.dictionaryingest.application.merge.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * 적재 파이프라인의 진입점 서비스입니다.
 *
 * <p>입력 스트림이 끝난 뒤 {@link #completeImport(Collection)}로
 * 남은 버퍼 봉인 → 큐 비우기 → 소스별 병합 → 병합 후 검증을 순서대로 수행합니다.</p>
 */
@Service
public class DictionaryIngestService {

    private static final Logger log = LoggerFactory.getLogger(DictionaryIngestService.class);

    private static final Duration IDLE_TIMEOUT = Duration.ofMinutes(10);

    private final BatchItemCollector collector;
    private final BatchFlushWorkers workers;
    private final FlushQueue queue;
    private final StagingBulkDispatcher dispatcher;
    private final StagingMergeService mergeService;
    private final PostMergeVerifier verifier;

    public DictionaryIngestService(
            BatchItemCollector collector,
            BatchFlushWorkers workers,
            FlushQueue queue,
            StagingBulkDispatcher dispatcher,
            StagingMergeService mergeService,
            PostMergeVerifier verifier
    ) {
        this.collector = collector;
        this.workers = workers;
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.mergeService = mergeService;
        this.verifier = verifier;
    }

    /**
     * 남은 버퍼를 봉인하고 큐가 빌 때까지 적재합니다.
     * <p>
     * 큐가 가득 차면 flush-all이 대기하므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
     *
     * @return flush-all로 큐에 넣은 배치 수
     */
    public Mono<Integer> flushAndDrain() {
        return Mono.fromCallable(collector::flushAll)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(sealed -> workers.drain()
                        .then(workers.awaitIdle(IDLE_TIMEOUT))
                        .thenReturn(sealed));
    }

    /**
     * 적재를 마무리합니다: flush-all → drain → merge → verify.
     * <p>
     * 병합은 소스별로 독립적이며, 실패한 소스는 staging이 남은 채 실패 리포트로 기록됩니다.
     *
     * @param sourceCodes 병합할 소스 코드
     * @return 전체 결과
     */
    public Mono<ImportSummary> completeImport(Collection<String> sourceCodes) {
        return flushAndDrain()
                .flatMap(sealed -> mergeService.mergeAll(sourceCodes)
                        .collectList()
                        .flatMap(merges -> verifyAll(merges)
                                .map(verifications -> new ImportSummary(
                                        sealed,
                                        workers.batchesFlushed(),
                                        workers.batchesDiscarded(),
                                        merges,
                                        verifications
                                ))))
                .doOnNext(s -> log.info("Import completed. sealedOnFlush={}, flushed={}, discarded={}, allPassed={}",
                        s.sealedOnFlush(), s.batchesFlushed(), s.batchesDiscarded(), s.allPassed()));
    }

    /** 수집기에 레코드를 넣은 모든 소스를 대상으로 {@link #completeImport(Collection)}. */
    public Mono<ImportSummary> completeImport() {
        return Mono.defer(() -> completeImport(collector.sourceCodes()));
    }

    public IngestStatsResponse stats() {
        CollectorStats c = collector.stats();
        return new IngestStatsResponse(
                c.itemsAdded(),
                c.thresholdSeals(),
                c.producerFullSeals(),
                c.flushAllSeals(),
                c.producers(),
                c.sealedAwaitingHandOff(),
                queue.pending(),
                dispatcher.succeeded(),
                dispatcher.failed(),
                workers.batchesFlushed(),
                workers.batchesDiscarded(),
                workers.itemsDiscarded()
        );
    }

    private Mono<List<VerificationResult>> verifyAll(List<MergeReport> merges) {
        return Flux.fromIterable(merges)
                .filter(MergeReport::succeeded)
                .concatMap(r -> verifier.verify(r.sourceCode()))
                .collectList();
    }
}
