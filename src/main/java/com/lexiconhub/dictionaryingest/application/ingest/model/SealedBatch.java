package com.lexiconhub.dictionaryingest.application.ingest.model;

import java.util.List;

/**
 * 봉인된(더 이상 생산자가 쓰지 않는) 배치.
 * <p>
 * {@code items}는 생산자 버퍼 그 자체이며 복사본이 아닙니다.
 * flush 큐에 들어간 뒤에는 {@code BatchFreezer}만 읽습니다.
 *
 * @param items  봉인 시점의 아이템 목록(추가 순서 유지)
 * @param reason 봉인 이유
 */
public record SealedBatch(List<BatchItem> items, SealReason reason) {

    public int size() {
        return items.size();
    }
}
