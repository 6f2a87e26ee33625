package com.lexiconhub.dictionaryingest.application.merge;

/**
 * 병합 후 검증 결과.
 *
 * @param sourceCode         소스 코드
 * @param stagingRemaining   남은 staging 부모 행 수(정상 0)
 * @param duplicateKeyGroups production 중복 키 그룹 수(정상 0)
 * @param productionRows     production 부모 행 수
 */
public record VerificationResult(
        String sourceCode,
        long stagingRemaining,
        long duplicateKeyGroups,
        long productionRows
) {
    public boolean passed() {
        return stagingRemaining == 0 && duplicateKeyGroups == 0;
    }
}
