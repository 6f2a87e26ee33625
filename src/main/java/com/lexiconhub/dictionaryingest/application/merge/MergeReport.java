package com.lexiconhub.dictionaryingest.application.merge;

import java.time.Instant;

/**
 * 소스 하나의 병합 결과.
 *
 * @param sourceCode      소스 코드
 * @param succeeded       성공 여부(실패 시 staging은 그대로 남음)
 * @param stagingRows     병합 전 staging 부모 행 수
 * @param uniqueKeys      병합 전 고유 키 수
 * @param duplicates      버려진 중복 행 수
 * @param inserted        production에 새로 들어간 부모 행 수
 * @param childrenPromoted production에 복사된 하위 행 수
 * @param cleared         삭제된 staging 부모 행 수
 * @param error           실패 사유(성공 시 null)
 * @param finishedAt      종료 시각
 */
public record MergeReport(
        String sourceCode,
        boolean succeeded,
        long stagingRows,
        long uniqueKeys,
        long duplicates,
        long inserted,
        long childrenPromoted,
        long cleared,
        String error,
        Instant finishedAt
) {
    public static MergeReport success(String sourceCode, long stagingRows, long uniqueKeys,
                                      long inserted, long childrenPromoted, long cleared) {
        return new MergeReport(sourceCode, true, stagingRows, uniqueKeys, stagingRows - uniqueKeys,
                inserted, childrenPromoted, cleared, null, Instant.now());
    }

    public static MergeReport failed(String sourceCode, String error) {
        return new MergeReport(sourceCode, false, 0, 0, 0, 0, 0, 0, error, Instant.now());
    }
}
