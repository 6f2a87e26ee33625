package com.lexiconhub.dictionaryingest.application.ingest.dto.response;

/**
 * 적재 파이프라인 현재 상태.
 *
 * @param itemsAdded        추가된 레코드 수
 * @param thresholdSeals    공유 임계치 봉인 수
 * @param producerFullSeals 생산자 버퍼 가득 참 봉인 수
 * @param flushAllSeals     flush-all 봉인 수
 * @param producers         등록된 생산자 수
 * @param sealedAwaitingHandOff 봉인이 결정됐지만 아직 큐에 넘어가지 않은 배치 수
 * @param queuePending      큐 대기 + 처리 중 배치 수
 * @param dispatchSucceeded 성공한 적재 시도 수
 * @param dispatchFailed    실패한 적재 시도 수
 * @param batchesFlushed    적재 완료 배치 수
 * @param batchesDiscarded  폐기 배치 수
 * @param itemsDiscarded    폐기 레코드 수
 */
public record IngestStatsResponse(
        long itemsAdded,
        long thresholdSeals,
        long producerFullSeals,
        long flushAllSeals,
        int producers,
        int sealedAwaitingHandOff,
        int queuePending,
        long dispatchSucceeded,
        long dispatchFailed,
        long batchesFlushed,
        long batchesDiscarded,
        long itemsDiscarded
) {}
