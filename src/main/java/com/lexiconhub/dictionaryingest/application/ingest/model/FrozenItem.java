package com.lexiconhub.dictionaryingest.application.ingest.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * {@link BatchItem}의 불변 스냅샷입니다. 배치 내 순번({@code seqId})이 부여되어 있습니다.
 * 모든 하위 목록은 {@link List#copyOf}로 만든 불변 목록입니다.
 */
public record FrozenItem(
        int seqId,
        long dictionaryEntryId,
        Long parentParsedId,
        String meaningTitle,
        String definition,
        String rawFragment,
        int senseNumber,
        String domain,
        String usageLabel,
        boolean hasNonEnglishText,
        Long nonEnglishTextId,
        String sourceCode,
        LocalDateTime createdAt,
        List<String> aliases,
        List<String> synonyms,
        List<String> examples,
        List<CrossReference> crossReferences,
        List<Etymology> etymologies
) {
    public FrozenItem {
        aliases = List.copyOf(aliases);
        synonyms = List.copyOf(synonyms);
        examples = List.copyOf(examples);
        crossReferences = List.copyOf(crossReferences);
        etymologies = List.copyOf(etymologies);
    }
}
