package com.lexiconhub.dictionaryingest.bootstrap;

import com.lexiconhub.dictionaryingest.application.ingest.BatchItemCollector;
import com.lexiconhub.dictionaryingest.application.ingest.DictionaryIngestService;
import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.application.ingest.model.CrossReference;
import com.lexiconhub.dictionaryingest.application.ingest.model.Etymology;
import com.lexiconhub.dictionaryingest.application.ingest.model.ParsedDefinition;
import com.lexiconhub.dictionaryingest.infrastructure.input.ndjson.NdjsonLineReader;
import com.lexiconhub.dictionaryingest.infrastructure.input.ndjson.NormalizeUtils;
import com.lexiconhub.dictionaryingest.infrastructure.input.ndjson.ParsedRecordRaw;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.databind.ObjectMapper;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 파서가 출력한 NDJSON 파일을 읽어 적재 파이프라인에 흘려보내는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code ingest}일 때만 활성화된다.</p>
 * <p>흐름: 라인 읽기 → JSON 파싱 → {@code worker-count}개 생산자가 병렬로 수집기에 추가
 * → 입력 종료 후 flush-all/drain → 소스별 병합 → 검증</p>
 */
@Component
@Profile("ingest")
public class DictionaryNdjsonIngestRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DictionaryNdjsonIngestRunner.class);

    private final NdjsonLineReader lineReader;
    private final ObjectMapper mapper;
    private final BatchItemCollector collector;
    private final DictionaryIngestService ingestService;
    private final IngestProperties properties;

    public DictionaryNdjsonIngestRunner(
            NdjsonLineReader lineReader,
            ObjectMapper mapper,
            BatchItemCollector collector,
            DictionaryIngestService ingestService,
            IngestProperties properties
    ) {
        this.lineReader = lineReader;
        this.mapper = mapper;
        this.collector = collector;
        this.ingestService = ingestService;
        this.properties = properties;
    }

    /**
     * {@code dictionary.ingest.input-path}의 파일을 끝까지 적재하고 병합까지 마친 뒤 반환한다.
     *
     * @param args 커맨드라인 인자
     * @throws IllegalStateException 입력 경로 미설정 또는 JSON 파싱 실패 시
     */
    @Override
    public void run(String... args) {
        String path = properties.inputPath();
        if (path == null || path.isBlank()) {
            throw new IllegalStateException("dictionary.ingest.input-path is not configured");
        }

        Set<String> sources = ConcurrentHashMap.newKeySet();
        AtomicLong skipped = new AtomicLong();

        lineReader.readLines(path)
                .filter(line -> line != null && !line.isBlank())
                .map(this::parse)
                .parallel(properties.workerCount())
                .runOn(Schedulers.boundedElastic())
                .filter(raw -> {
                    if (raw.dictionaryEntryId != null && NormalizeUtils.norm(raw.sourceCode) != null) return true;
                    skipped.incrementAndGet();
                    return false;
                })
                .doOnNext(raw -> sources.add(feed(raw)))
                .sequential()
                .count()
                .doOnNext(n -> log.info("Records fed to collector. count={}, skipped={}", n, skipped.get()))
                .then(Mono.defer(() -> ingestService.completeImport(sources)))
                .doOnNext(summary -> {
                    if (!summary.allPassed()) {
                        log.warn("Import finished with failures. merges={}", summary.merges());
                    }
                })
                .doOnError(e -> log.error("Ingest failed: {}", e.getMessage(), e))
                .block();
    }

    /**
     * 레코드 하나와 하위 항목을 수집기에 넣는다. 같은 스레드에서 호출되어야
     * 하위 항목이 방금 넣은 레코드에 붙는다.
     *
     * @return 정규화된 소스 코드
     */
    String feed(ParsedRecordRaw raw) {
        String source = NormalizeUtils.norm(raw.sourceCode);

        collector.add(raw.dictionaryEntryId, new ParsedDefinition(
                raw.meaningTitle,
                raw.definition,
                raw.rawFragment,
                raw.senseNumber == null ? 1 : raw.senseNumber,
                NormalizeUtils.norm(raw.domain),
                NormalizeUtils.norm(raw.usageLabel),
                raw.parentParsedId,
                Boolean.TRUE.equals(raw.hasNonEnglishText),
                raw.nonEnglishTextId
        ), source);

        if (raw.aliases != null) raw.aliases.forEach(collector::addAlias);
        collector.addSynonyms(raw.synonyms);
        if (raw.examples != null) raw.examples.forEach(collector::addExample);
        if (raw.crossReferences != null) {
            for (ParsedRecordRaw.CrossReferenceRaw ref : raw.crossReferences) {
                if (NormalizeUtils.norm(ref.targetWord) == null) continue;
                collector.addCrossReference(new CrossReference(ref.targetWord.trim(), ref.referenceType));
            }
        }
        if (raw.etymologies != null) {
            for (ParsedRecordRaw.EtymologyRaw ety : raw.etymologies) {
                if (NormalizeUtils.norm(ety.text) == null) continue;
                collector.addEtymology(new Etymology(
                        ety.text.trim(), ety.languageCode, Boolean.TRUE.equals(ety.hasNonEnglishText)));
            }
        }
        return source;
    }

    /**
     * NDJSON의 한 줄(JSON 문자열)을 {@link ParsedRecordRaw}로 파싱한다.
     *
     * @throws IllegalStateException JSON 파싱 실패 시
     */
    private ParsedRecordRaw parse(String line) {
        try {
            return mapper.readValue(line, ParsedRecordRaw.class);
        } catch (Exception e) {
            throw new IllegalStateException("JSON parse error", e);
        }
    }
}
