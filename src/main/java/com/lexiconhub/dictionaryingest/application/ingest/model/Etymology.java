package com.lexiconhub.dictionaryingest.application.ingest.model;

/**
 * 어원 정보.
 *
 * @param text              어원 설명
 * @param languageCode      언어 코드(Nullable)
 * @param hasNonEnglishText 비영어 텍스트 포함 여부
 */
public record Etymology(String text, String languageCode, boolean hasNonEnglishText) {
}
