package com.lexiconhub.dictionaryingest.application.ingest;

/**
 * 배치 하나의 staging 적재 결과.
 *
 * @param batchId      배치 식별자
 * @param items        부모 레코드 수
 * @param rowsInserted 부모/하위 합계 삽입 행 수
 */
public record DispatchResult(String batchId, int items, long rowsInserted) {}
