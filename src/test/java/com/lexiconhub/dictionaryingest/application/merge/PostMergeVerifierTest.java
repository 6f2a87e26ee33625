package com.lexiconhub.dictionaryingest.application.merge;

import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo.StagingMergeRepo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * {@link PostMergeVerifier} 단위 테스트.
 */
@DisplayName("병합 후 검증 테스트")
class PostMergeVerifierTest {

    private final StagingMergeRepo repo = mock(StagingMergeRepo.class);
    private final PostMergeVerifier verifier = new PostMergeVerifier(repo);

    @Test
    @DisplayName("staging 0건, 중복 그룹 0건이면 통과")
    void verify_passes() {
        when(repo.countStaging("WIKT")).thenReturn(Mono.just(0L));
        when(repo.countDuplicateKeyGroups("WIKT")).thenReturn(Mono.just(0L));
        when(repo.countProduction("WIKT")).thenReturn(Mono.just(12L));

        StepVerifier.create(verifier.verify("WIKT"))
                .assertNext(r -> {
                    assertThat(r.passed()).isTrue();
                    assertThat(r.productionRows()).isEqualTo(12L);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("staging이 남아 있으면 실패(예외 없이 결과로만 알림)")
    void verify_failsWhenStagingRemains() {
        when(repo.countStaging("WIKT")).thenReturn(Mono.just(3L));
        when(repo.countDuplicateKeyGroups("WIKT")).thenReturn(Mono.just(0L));
        when(repo.countProduction("WIKT")).thenReturn(Mono.just(0L));

        StepVerifier.create(verifier.verify("WIKT"))
                .assertNext(r -> {
                    assertThat(r.passed()).isFalse();
                    assertThat(r.stagingRemaining()).isEqualTo(3L);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("production에 중복 키 그룹이 있으면 실패")
    void verify_failsOnDuplicateGroups() {
        when(repo.countStaging("WIKT")).thenReturn(Mono.just(0L));
        when(repo.countDuplicateKeyGroups("WIKT")).thenReturn(Mono.just(1L));
        when(repo.countProduction("WIKT")).thenReturn(Mono.just(5L));

        StepVerifier.create(verifier.verify("WIKT"))
                .assertNext(r -> assertThat(r.passed()).isFalse())
                .verifyComplete();
    }
}
