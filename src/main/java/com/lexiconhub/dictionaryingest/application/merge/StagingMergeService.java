package com.lexiconhub.dictionaryingest.application.merge;

import com.lexiconhub.dictionaryingest.application.common.error.MergeFailureException;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo.StagingMergeRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * staging 행을 production 테이블로 병합하는 서비스입니다.
 *
 * <p>소스 하나에 대해 한 트랜잭션 안에서 다음을 순서대로 수행합니다.</p>
 * <ol>
 *   <li>병합 대상 범위(최대 staging id) 확정과 집계(전체 행/고유 키)</li>
 *   <li>키별 최신 행 1건만 골라 production에 없는 키만 INSERT</li>
 *   <li>새로 들어간 부모의 하위 행 복사</li>
 *   <li>대상 범위의 staging 행 삭제</li>
 * </ol>
 *
 * <p>어느 단계든 실패하면 트랜잭션 전체가 롤백되어 staging이 그대로 남고,
 * 실패 리포트를 반환합니다(에러를 전파하지 않음). 다음 실행에서 같은 staging으로 다시 병합할 수 있습니다.</p>
 */
@Service
public class StagingMergeService {

    private static final Logger log = LoggerFactory.getLogger(StagingMergeService.class);

    private final StagingMergeRepo repo;
    private final TransactionalOperator tx;

    /** 소스별 마지막 병합 결과 */
    private final Map<String, MergeReport> lastReports = new ConcurrentHashMap<>();

    public StagingMergeService(StagingMergeRepo repo, TransactionalOperator tx) {
        this.repo = repo;
        this.tx = tx;
    }

    /**
     * 소스 하나를 병합합니다.
     *
     * @param sourceCode 소스 코드
     * @return 병합 결과(실패해도 에러 없이 실패 리포트)
     */
    public Mono<MergeReport> merge(String sourceCode) {
        Mono<MergeReport> work = Mono.defer(() -> repo.analyze(sourceCode)
                .flatMap(stats -> {
                    log.info("Merging source {}. stagingRows={}, uniqueKeys={}, duplicates={}, maxId={}",
                            sourceCode, stats.totalRows(), stats.uniqueKeys(), stats.duplicates(), stats.maxId());

                    return repo.insertMissingParents(sourceCode, stats.maxId())
                            .flatMap(inserted -> repo.promoteChildren(sourceCode)
                                    .flatMap(children -> repo.clearStaging(sourceCode, stats.maxId())
                                            .map(cleared -> MergeReport.success(
                                                    sourceCode,
                                                    stats.totalRows(),
                                                    stats.uniqueKeys(),
                                                    inserted,
                                                    children,
                                                    cleared
                                            ))));
                }));

        return tx.transactional(work)
                .doOnNext(report -> log.info("Merge done for source {}. inserted={}, children={}, cleared={}",
                        sourceCode, report.inserted(), report.childrenPromoted(), report.cleared()))
                .onErrorResume(e -> {
                    MergeFailureException failure = new MergeFailureException(sourceCode, e);
                    log.error(failure.getMessage(), failure);
                    return Mono.just(MergeReport.failed(sourceCode, String.valueOf(e.getMessage())));
                })
                .doOnNext(report -> lastReports.put(sourceCode, report));
    }

    /**
     * 여러 소스를 순서대로 병합합니다. 한 소스의 실패는 다른 소스에 영향을 주지 않습니다.
     *
     * @param sourceCodes 소스 코드 목록
     * @return 소스별 병합 결과
     */
    public Flux<MergeReport> mergeAll(Collection<String> sourceCodes) {
        return Flux.fromIterable(sourceCodes)
                .distinct()
                .concatMap(this::merge);
    }

    /** 소스의 마지막 병합 결과 */
    public Optional<MergeReport> lastReport(String sourceCode) {
        return Optional.ofNullable(lastReports.get(sourceCode));
    }
}
