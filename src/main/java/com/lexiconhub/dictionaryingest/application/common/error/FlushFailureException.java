package com.lexiconhub.dictionaryingest.application.common.error;

/**
 * 배치 하나를 staging에 적재하지 못했을 때 발생하는 예외.
 *
 * <p>staging 적재 트랜잭션은 롤백된 상태이며, 호출자(flush 워커)가 재시도 여부를 결정한다.</p>
 */
public class FlushFailureException extends IngestException {

    public static final String CODE = "FLUSH_FAILURE";

    private final String batchId;
    private final int itemCount;

    public FlushFailureException(String batchId, int itemCount, Throwable cause) {
        super("Failed to flush batch " + batchId + " (" + itemCount + " items) to staging", CODE, cause);
        this.batchId = batchId;
        this.itemCount = itemCount;
    }

    public String batchId() {
        return batchId;
    }

    public int itemCount() {
        return itemCount;
    }
}
