package com.lexiconhub.dictionaryingest.application.ingest.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("batch item 테스트")
class BatchItemTest {

    private static BatchItem item(ParsedDefinition parsed) {
        return new BatchItem(1L, parsed, "WIKT", LocalDateTime.of(2024, 1, 1, 0, 0));
    }

    @Test
    @DisplayName("하위 텍스트는 앞뒤 공백과 감싼 큰따옴표를 제거")
    void childText_isTrimmedAndUnquoted() {
        BatchItem it = item(ParsedDefinition.of("t", "d", 1));

        it.addAlias("  \"quoted\"  ");
        it.addExample("\"\"double\"\"");
        it.addSynonyms(Arrays.asList(" plain ", null));

        assertThat(it.aliases()).containsExactly("quoted");
        assertThat(it.examples()).containsExactly("double");
        assertThat(it.synonyms()).containsExactly("plain", "");
    }

    @Test
    @DisplayName("null 제목/정의는 빈 문자열, 0 이하 상위 ID는 null")
    void constructor_normalizesMissingValues() {
        BatchItem it = item(new ParsedDefinition(null, null, null, 2, null, null, 0L, false, null));

        assertThat(it.meaningTitle()).isEmpty();
        assertThat(it.definition()).isEmpty();
        assertThat(it.rawFragment()).isEmpty();
        assertThat(it.parentParsedId()).isNull();
        assertThat(it.senseNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("null 상호 참조/어원은 무시하고, 반환 목록은 수정할 수 없다")
    void nullChildren_ignored_andViewsReadOnly() {
        BatchItem it = item(ParsedDefinition.of("t", "d", 1));
        it.addCrossReference(null);
        it.addEtymology(null);
        it.addCrossReference(CrossReference.see("other"));

        assertThat(it.crossReferences()).containsExactly(new CrossReference("other", "see"));
        assertThat(it.etymologies()).isEmpty();
        assertThatThrownBy(() -> it.aliases().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("대상 단어가 없는 상호 참조와 설명이 없는 어원은 버린다")
    void blankCrossReferenceAndEtymology_areDropped() {
        BatchItem it = item(ParsedDefinition.of("t", "d", 1));
        it.addCrossReference(CrossReference.see(null));
        it.addCrossReference(new CrossReference("   ", "compare"));
        it.addCrossReference(new CrossReference(" flow ", "compare"));
        it.addEtymology(new Etymology(null, "fr", true));
        it.addEtymology(new Etymology("  ", null, false));
        it.addEtymology(new Etymology(" From Latin. ", "la", false));

        assertThat(it.crossReferences()).containsExactly(new CrossReference("flow", "compare"));
        assertThat(it.etymologies()).containsExactly(new Etymology("From Latin.", "la", false));
    }
}
