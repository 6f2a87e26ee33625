package com.lexiconhub.dictionaryingest.infrastructure.input.ndjson;

import java.text.Normalizer;
import java.util.Locale;

/**
 * 적재 과정에서 반복적으로 사용하는 문자열 정규화 유틸리티입니다.
 * <p>
 * - 문자열 정규화(trim, 빈 값 처리)
 * - staging/production 중복 판단용 자연키(normalized key) 생성
 */
public final class NormalizeUtils {

    private NormalizeUtils() {}

    /**
     * 문자열을 정규화합니다.
     * <p>
     * trim 후 빈 문자열이면 null을 반환합니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * 뜻풀이 제목을 비교용 자연키로 변환합니다.
     * <p>
     * NFKC 정규화 → 소문자화 → NFD 분해 후 결합 문자(악센트 등) 제거 → NFC 재조합 →
     * 공백과 문자/숫자가 아닌 기호 제거 순서로 처리합니다.
     * 같은 소스에서 "Café", "cafe", " CAFE. "는 모두 {@code "cafe"}가 됩니다.
     *
     * @param meaningTitle 뜻풀이 제목(Nullable)
     * @return 자연키(입력이 비어 있으면 빈 문자열)
     */
    public static String normalizedKey(String meaningTitle) {
        String n = norm(meaningTitle);
        if (n == null) return "";

        String result = Normalizer.normalize(n, Normalizer.Form.NFKC);

        // 소문자화 후 NFD로 분해 → 결합문자 제거
        result = Normalizer.normalize(result.toLowerCase(Locale.ROOT), Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "");

        // 분해된 한글 자모 등은 다시 완성형으로
        result = Normalizer.normalize(result, Normalizer.Form.NFC);

        return result.replaceAll("[^\\p{L}\\p{N}]", "");
    }
}
