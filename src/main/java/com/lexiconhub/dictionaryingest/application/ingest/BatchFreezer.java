package com.lexiconhub.dictionaryingest.application.ingest;

import com.lexiconhub.dictionaryingest.application.ingest.model.BatchItem;
import com.lexiconhub.dictionaryingest.application.ingest.model.FrozenBatch;
import com.lexiconhub.dictionaryingest.application.ingest.model.FrozenItem;
import com.lexiconhub.dictionaryingest.application.ingest.model.SealedBatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 봉인된 배치를 불변 스냅샷으로 복사합니다.
 * <p>
 * 하위 목록까지 모두 복사하므로 이후 원본 {@link BatchItem}이 바뀌어도 스냅샷에는 영향이 없습니다.
 * 배치 ID는 UUID, 순번은 입력 순서대로 1부터 부여합니다.
 */
@Component
public class BatchFreezer {

    public FrozenBatch freeze(SealedBatch sealed) {
        return freeze(sealed, UUID.randomUUID().toString());
    }

    FrozenBatch freeze(SealedBatch sealed, String batchId) {
        List<FrozenItem> items = new ArrayList<>(sealed.size());
        int seq = 1;
        for (BatchItem it : sealed.items()) {
            items.add(new FrozenItem(
                    seq++,
                    it.dictionaryEntryId(),
                    it.parentParsedId(),
                    it.meaningTitle(),
                    it.definition(),
                    it.rawFragment(),
                    it.senseNumber(),
                    it.domain(),
                    it.usageLabel(),
                    it.hasNonEnglishText(),
                    it.nonEnglishTextId(),
                    it.sourceCode(),
                    it.createdAt(),
                    it.aliases(),
                    it.synonyms(),
                    it.examples(),
                    it.crossReferences(),
                    it.etymologies()
            ));
        }
        return new FrozenBatch(batchId, items);
    }
}
