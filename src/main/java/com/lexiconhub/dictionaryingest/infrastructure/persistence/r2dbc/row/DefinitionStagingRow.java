package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row;

import java.time.LocalDateTime;

/**
 * parsed_definition_staging 테이블에 적재되는 부모 행입니다.
 * <p>
 * {@code (batchId, seqId)}가 하위 staging 행들과의 조인 키이며,
 * {@code (sourceCode, normalizedKey, senseNumber)}가 병합 시 중복 판단 키입니다.
 * Nullable 필드는 null 그대로 바인딩되어 SQL NULL이 됩니다(빈 문자열과 구분).
 *
 * @param batchId           배치 식별자
 * @param seqId             배치 내 순번(1..N)
 * @param dictionaryEntryId 표제어 ID
 * @param parentParsedId    상위 의미 ID(Nullable)
 * @param meaningTitle      뜻풀이 제목
 * @param normalizedKey     비교용 자연키
 * @param definition        정의 본문
 * @param rawFragment       원본 조각
 * @param senseNumber       의미 번호
 * @param domain            분야 라벨(Nullable)
 * @param usageLabel        용법 라벨(Nullable)
 * @param hasNonEnglishText 비영어 텍스트 포함 여부
 * @param nonEnglishTextId  비영어 텍스트 참조(Nullable)
 * @param sourceCode        소스 코드
 * @param createdAt         레코드 생성 시각
 */
public record DefinitionStagingRow(
        String batchId,
        int seqId,
        long dictionaryEntryId,
        Long parentParsedId,
        String meaningTitle,
        String normalizedKey,
        String definition,
        String rawFragment,
        int senseNumber,
        String domain,
        String usageLabel,
        boolean hasNonEnglishText,
        Long nonEnglishTextId,
        String sourceCode,
        LocalDateTime createdAt
) {}
