package com.lexiconhub.dictionaryingest.application.ingest.model;

/**
 * 다른 표제어를 가리키는 상호 참조.
 *
 * @param targetWord    참조 대상 단어
 * @param referenceType 참조 유형(Nullable, 비어 있으면 적재 시 {@code "see"}로 대체)
 */
public record CrossReference(String targetWord, String referenceType) {

    /** 참조 유형이 지정되지 않았을 때 사용하는 기본값 */
    public static final String DEFAULT_TYPE = "see";

    public static CrossReference see(String targetWord) {
        return new CrossReference(targetWord, DEFAULT_TYPE);
    }
}
