package com.lexiconhub.dictionaryingest.application.ingest.model;

import java.util.List;

/**
 * 봉인된 배치의 불변 깊은 복사본.
 *
 * @param batchId 배치 식별자(staging 테이블에서 순번과 함께 조인 키로 사용)
 * @param items   순번 1..N이 부여된 아이템(원래 추가 순서)
 */
public record FrozenBatch(String batchId, List<FrozenItem> items) {

    public FrozenBatch {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }
}
