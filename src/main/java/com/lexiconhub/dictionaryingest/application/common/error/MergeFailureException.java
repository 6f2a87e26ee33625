package com.lexiconhub.dictionaryingest.application.common.error;

/**
 * 소스 하나의 staging → production 병합이 실패했을 때의 예외.
 *
 * <p>병합 트랜잭션은 롤백되며 staging 행은 그대로 남는다.</p>
 */
public class MergeFailureException extends IngestException {

    public static final String CODE = "MERGE_FAILURE";

    private final String sourceCode;

    public MergeFailureException(String sourceCode, Throwable cause) {
        super("Merge failed for source " + sourceCode + ". Staging preserved.", CODE, cause);
        this.sourceCode = sourceCode;
    }

    public String sourceCode() {
        return sourceCode;
    }
}
