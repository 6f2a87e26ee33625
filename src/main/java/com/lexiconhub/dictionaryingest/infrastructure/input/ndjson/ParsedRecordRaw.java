package com.lexiconhub.dictionaryingest.infrastructure.input.ndjson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 파서가 출력한 NDJSON의 "한 줄(= 뜻풀이 하나)"을 매핑하기 위한 원본 DTO입니다.
 * <p>
 * 파서 버전에 따라 필드가 추가될 수 있으므로 {@link JsonIgnoreProperties#ignoreUnknown()}를 사용합니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParsedRecordRaw {

    /** 소스 코드(예: "WIKT", "GCIDE") */
    @JsonProperty("sourceCode")
    public String sourceCode;

    /** 표제어 ID */
    @JsonProperty("dictionaryEntryId")
    public Long dictionaryEntryId;

    /** 상위 의미 ID(없으면 null 또는 0) */
    @JsonProperty("parentParsedId")
    public Long parentParsedId;

    @JsonProperty("meaningTitle")
    public String meaningTitle;

    @JsonProperty("definition")
    public String definition;

    @JsonProperty("rawFragment")
    public String rawFragment;

    /** 의미 번호(없으면 1) */
    @JsonProperty("senseNumber")
    public Integer senseNumber;

    @JsonProperty("domain")
    public String domain;

    @JsonProperty("usageLabel")
    public String usageLabel;

    @JsonProperty("hasNonEnglishText")
    public Boolean hasNonEnglishText;

    @JsonProperty("nonEnglishTextId")
    public Long nonEnglishTextId;

    @JsonProperty("aliases")
    public List<String> aliases;

    @JsonProperty("synonyms")
    public List<String> synonyms;

    @JsonProperty("examples")
    public List<String> examples;

    @JsonProperty("crossReferences")
    public List<CrossReferenceRaw> crossReferences;

    @JsonProperty("etymologies")
    public List<EtymologyRaw> etymologies;

    /** 상호 참조 원본 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CrossReferenceRaw {

        @JsonProperty("targetWord")
        public String targetWord;

        /** 비어 있으면 적재 시 "see" */
        @JsonProperty("referenceType")
        public String referenceType;
    }

    /** 어원 원본 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EtymologyRaw {

        @JsonProperty("text")
        public String text;

        @JsonProperty("languageCode")
        public String languageCode;

        @JsonProperty("hasNonEnglishText")
        public Boolean hasNonEnglishText;
    }
}
