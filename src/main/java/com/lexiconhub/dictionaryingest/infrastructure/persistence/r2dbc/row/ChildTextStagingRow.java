package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row;

/**
 * 별칭/동의어/예문처럼 텍스트 하나만 가진 하위 staging 행입니다.
 *
 * @param batchId 부모 배치 식별자
 * @param seqId   부모의 배치 내 순번
 * @param text    텍스트
 */
public record ChildTextStagingRow(String batchId, int seqId, String text) {}
