package com.lexiconhub.dictionaryingest.application.ingest.dto.response;

import com.lexiconhub.dictionaryingest.application.merge.MergeReport;
import com.lexiconhub.dictionaryingest.application.merge.VerificationResult;

import java.util.List;

/**
 * 적재 완료 처리(flush-all → drain → merge → verify) 결과.
 *
 * @param sealedOnFlush    flush-all로 큐에 넣은 배치 수
 * @param batchesFlushed   누적 적재 성공 배치 수
 * @param batchesDiscarded 누적 폐기 배치 수
 * @param merges           소스별 병합 결과
 * @param verifications    소스별 검증 결과
 */
public record ImportSummary(
        int sealedOnFlush,
        long batchesFlushed,
        long batchesDiscarded,
        List<MergeReport> merges,
        List<VerificationResult> verifications
) {
    /** 모든 소스가 병합·검증을 통과했는지 */
    public boolean allPassed() {
        return merges.stream().allMatch(MergeReport::succeeded)
                && verifications.stream().allMatch(VerificationResult::passed);
    }
}
