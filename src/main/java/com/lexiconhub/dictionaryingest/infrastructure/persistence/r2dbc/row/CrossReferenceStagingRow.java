package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row;

/**
 * parsed_cross_reference_staging 행.
 *
 * @param batchId       부모 배치 식별자
 * @param seqId         부모의 배치 내 순번
 * @param targetWord    참조 대상 단어
 * @param referenceType 참조 유형(기본 {@code "see"})
 */
public record CrossReferenceStagingRow(String batchId, int seqId, String targetWord, String referenceType) {}
