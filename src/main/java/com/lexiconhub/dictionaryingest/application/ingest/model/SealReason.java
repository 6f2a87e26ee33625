package com.lexiconhub.dictionaryingest.application.ingest.model;

/**
 * 배치가 봉인된 이유.
 */
public enum SealReason {
    /** 공유 카운터가 배치 크기에 도달 */
    THRESHOLD,
    /** 생산자 자신의 버퍼가 배치 크기에 도달 */
    PRODUCER_FULL,
    /** 스트림 종료 등으로 명시적 flushAll 요청 */
    FLUSH_ALL
}
