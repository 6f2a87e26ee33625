package com.lexiconhub.dictionaryingest.application.ingest.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 적재 대기 중인 뜻풀이 한 건과 그 하위 데이터(별칭/동의어/예문/상호참조/어원)입니다.
 * <p>
 * 스칼라 필드는 생성 시점에 고정되고, 하위 목록은 append만 허용됩니다.
 * 생산자(파서 스레드) 한 명이 독점 소유하며, 봉인(seal) 이후에는
 * {@code BatchFreezer}가 깊은 복사본을 만들어 사용합니다.
 * <p>
 * 이 클래스는 스레드 안전하지 않습니다. 동기화는 수집기의 슬롯 단위에서 이뤄집니다.
 */
public final class BatchItem {

    private final long dictionaryEntryId;
    private final Long parentParsedId;
    private final String meaningTitle;
    private final String definition;
    private final String rawFragment;
    private final int senseNumber;
    private final String domain;
    private final String usageLabel;
    private final boolean hasNonEnglishText;
    private final Long nonEnglishTextId;
    private final String sourceCode;
    private final LocalDateTime createdAt;

    private final List<String> aliases = new ArrayList<>();
    private final List<String> synonyms = new ArrayList<>();
    private final List<String> examples = new ArrayList<>();
    private final List<CrossReference> crossReferences = new ArrayList<>();
    private final List<Etymology> etymologies = new ArrayList<>();

    /**
     * 파싱 결과로부터 배치 아이템을 생성합니다.
     * <p>
     * 필수 텍스트(제목/정의/원본 조각)가 null이면 빈 문자열로, 0 이하의 상위 의미 ID는 null로 정리합니다.
     *
     * @param dictionaryEntryId 이미 확정된 표제어 ID
     * @param parsed            파싱 결과
     * @param sourceCode        이 레코드를 만든 소스 코드
     * @param createdAt         생성 시각(병합 시 최신 행 선택 기준)
     */
    public BatchItem(long dictionaryEntryId, ParsedDefinition parsed, String sourceCode, LocalDateTime createdAt) {
        this.dictionaryEntryId = dictionaryEntryId;
        this.parentParsedId = (parsed.parentParsedId() != null && parsed.parentParsedId() > 0)
                ? parsed.parentParsedId() : null;
        this.meaningTitle = parsed.meaningTitle() == null ? "" : parsed.meaningTitle();
        this.definition = parsed.definition() == null ? "" : parsed.definition();
        this.rawFragment = parsed.rawFragment() == null ? "" : parsed.rawFragment();
        this.senseNumber = parsed.senseNumber();
        this.domain = parsed.domain();
        this.usageLabel = parsed.usageLabel();
        this.hasNonEnglishText = parsed.hasNonEnglishText();
        this.nonEnglishTextId = parsed.nonEnglishTextId();
        this.sourceCode = sourceCode;
        this.createdAt = createdAt;
    }

    // ---- child append ----

    public void addAlias(String alias) {
        aliases.add(normalizeChildText(alias));
    }

    public void addSynonyms(Collection<String> values) {
        if (values == null) return;
        for (String v : values) synonyms.add(normalizeChildText(v));
    }

    public void addExample(String example) {
        examples.add(normalizeChildText(example));
    }

    /** 대상 단어가 없는 상호 참조는 적재할 수 없으므로 버립니다. */
    public void addCrossReference(CrossReference crossReference) {
        if (crossReference == null || isBlank(crossReference.targetWord())) return;
        crossReferences.add(new CrossReference(crossReference.targetWord().strip(), crossReference.referenceType()));
    }

    /** 설명이 없는 어원은 버립니다. */
    public void addEtymology(Etymology etymology) {
        if (etymology == null || isBlank(etymology.text())) return;
        etymologies.add(new Etymology(etymology.text().strip(), etymology.languageCode(), etymology.hasNonEnglishText()));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** 앞뒤 공백과 감싸는 큰따옴표를 제거합니다. null은 빈 문자열이 됩니다. */
    static String normalizeChildText(String text) {
        if (text == null) return "";
        String t = text.strip();
        int start = 0;
        int end = t.length();
        while (start < end && t.charAt(start) == '"') start++;
        while (end > start && t.charAt(end - 1) == '"') end--;
        return t.substring(start, end);
    }

    // ---- accessors ----

    public long dictionaryEntryId() { return dictionaryEntryId; }
    public Long parentParsedId() { return parentParsedId; }
    public String meaningTitle() { return meaningTitle; }
    public String definition() { return definition; }
    public String rawFragment() { return rawFragment; }
    public int senseNumber() { return senseNumber; }
    public String domain() { return domain; }
    public String usageLabel() { return usageLabel; }
    public boolean hasNonEnglishText() { return hasNonEnglishText; }
    public Long nonEnglishTextId() { return nonEnglishTextId; }
    public String sourceCode() { return sourceCode; }
    public LocalDateTime createdAt() { return createdAt; }

    /** 하위 목록의 읽기 전용 뷰. 복사가 필요하면 {@code BatchFreezer}를 사용합니다. */
    public List<String> aliases() { return Collections.unmodifiableList(aliases); }
    public List<String> synonyms() { return Collections.unmodifiableList(synonyms); }
    public List<String> examples() { return Collections.unmodifiableList(examples); }
    public List<CrossReference> crossReferences() { return Collections.unmodifiableList(crossReferences); }
    public List<Etymology> etymologies() { return Collections.unmodifiableList(etymologies); }
}
