package com.lexiconhub.dictionaryingest.application.merge;

import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo.StagingMergeRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * 병합 후 상태를 점검합니다.
 *
 * <p>staging에 남은 행이 없어야 하고, production에 같은 키가 둘 이상 있으면 안 됩니다.
 * 결과는 로그와 반환값으로만 알리며 예외를 던지지 않습니다.</p>
 */
@Service
public class PostMergeVerifier {

    private static final Logger log = LoggerFactory.getLogger(PostMergeVerifier.class);

    private final StagingMergeRepo repo;

    public PostMergeVerifier(StagingMergeRepo repo) {
        this.repo = repo;
    }

    public Mono<VerificationResult> verify(String sourceCode) {
        return Mono.zip(
                        repo.countStaging(sourceCode),
                        repo.countDuplicateKeyGroups(sourceCode),
                        repo.countProduction(sourceCode)
                )
                .map(t -> new VerificationResult(sourceCode, t.getT1(), t.getT2(), t.getT3()))
                .doOnNext(r -> {
                    if (r.passed()) {
                        log.info("Post-merge check passed for source {}. productionRows={}",
                                sourceCode, r.productionRows());
                    } else {
                        log.error("Post-merge check failed for source {}. stagingRemaining={}, duplicateKeyGroups={}",
                                sourceCode, r.stagingRemaining(), r.duplicateKeyGroups());
                    }
                });
    }
}
