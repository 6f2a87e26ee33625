package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row;

/**
 * parsed_etymology_staging 행.
 *
 * @param batchId           부모 배치 식별자
 * @param seqId             부모의 배치 내 순번
 * @param etymologyText     어원 설명
 * @param languageCode      언어 코드(Nullable)
 * @param hasNonEnglishText 비영어 텍스트 포함 여부
 */
public record EtymologyStagingRow(
        String batchId,
        int seqId,
        String etymologyText,
        String languageCode,
        boolean hasNonEnglishText
) {}
