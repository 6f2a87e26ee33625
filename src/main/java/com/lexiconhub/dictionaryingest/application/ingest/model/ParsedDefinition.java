package com.lexiconhub.dictionaryingest.application.ingest.model;

/**
 * 파서가 만들어 낸 "뜻풀이 한 건"의 스칼라 필드 묶음입니다.
 * <p>
 * 상위 파이프라인(소스별 파서)이 생성하여 {@code BatchItemCollector#add}에 넘기며,
 * 수집기는 이 값을 복사해 {@link BatchItem}을 만듭니다.
 *
 * @param meaningTitle      뜻풀이 제목(표제어 또는 의미 제목)
 * @param definition        정의 본문
 * @param rawFragment       원본 소스 조각(HTML/JSON 일부)
 * @param senseNumber       의미 번호
 * @param domain            분야 라벨(Nullable)
 * @param usageLabel        용법 라벨(Nullable)
 * @param parentParsedId    상위 의미 식별자(Nullable, 0 이하이면 없음으로 취급)
 * @param hasNonEnglishText 비영어 텍스트 포함 여부
 * @param nonEnglishTextId  외부 저장된 비영어 텍스트 참조(Nullable)
 */
public record ParsedDefinition(
        String meaningTitle,
        String definition,
        String rawFragment,
        int senseNumber,
        String domain,
        String usageLabel,
        Long parentParsedId,
        boolean hasNonEnglishText,
        Long nonEnglishTextId
) {

    /**
     * 제목/정의/의미 번호만 있는 단순 뜻풀이를 생성합니다.
     */
    public static ParsedDefinition of(String meaningTitle, String definition, int senseNumber) {
        return new ParsedDefinition(meaningTitle, definition, null, senseNumber,
                null, null, null, false, null);
    }
}
