package com.lexiconhub.dictionaryingest.bootstrap;

import com.lexiconhub.dictionaryingest.application.ingest.BatchItemCollector;
import com.lexiconhub.dictionaryingest.application.ingest.DictionaryIngestService;
import com.lexiconhub.dictionaryingest.application.ingest.FlushQueue;
import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.application.ingest.dto.response.ImportSummary;
import com.lexiconhub.dictionaryingest.application.ingest.model.BatchItem;
import com.lexiconhub.dictionaryingest.application.ingest.model.SealedBatch;
import com.lexiconhub.dictionaryingest.infrastructure.input.ndjson.NdjsonLineReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

/**
 * {@link DictionaryNdjsonIngestRunner} 단위 테스트.
 *
 * <p>NDJSON 라인을 파싱해 수집기에 넣고(하위 항목 포함), 입력이 끝나면
 * 등장한 소스 코드로 {@link DictionaryIngestService#completeImport(Collection)}를 호출하는지 검증한다.</p>
 */
@DisplayName("NDJSON 적재 러너 테스트")
class DictionaryNdjsonIngestRunnerTest {

    private static final String PATH = "classpath:ndjson/sample.ndjson";

    private final ObjectMapper mapper = JsonMapper.builder().build();
    private final IngestProperties props = new IngestProperties(1000, 2, 64, 3,
            Duration.ofMillis(1), 100, Duration.ofMillis(10), PATH);
    private final FlushQueue queue = new FlushQueue(props);
    private final BatchItemCollector collector = new BatchItemCollector(props, queue);
    private final DictionaryIngestService ingestService = mock(DictionaryIngestService.class);

    private static ImportSummary emptySummary() {
        return new ImportSummary(0, 0, 0, List.of(), List.of());
    }

    @Test
    @DisplayName("blank 라인은 건너뛰고 모든 레코드를 수집한 뒤 등장한 소스로 completeImport 호출")
    @SuppressWarnings("unchecked")
    void run_feedsRecords_andCompletesImport() {
        NdjsonLineReader lineReader = new NdjsonLineReader();
        when(ingestService.completeImport(anyCollection())).thenAnswer(inv -> {
            collector.flushAll();
            return Mono.just(emptySummary());
        });

        new DictionaryNdjsonIngestRunner(lineReader, mapper, collector, ingestService, props).run();

        ArgumentCaptor<Collection<String>> sources = ArgumentCaptor.forClass(Collection.class);
        verify(ingestService).completeImport(sources.capture());
        assertThat(sources.getValue()).containsExactlyInAnyOrder("WIKT", "GCIDE");
        assertThat(collector.stats().itemsAdded()).isEqualTo(3);

        List<BatchItem> items = new ArrayList<>();
        SealedBatch b;
        while ((b = queue.poll()) != null) items.addAll(b.items());

        BatchItem cafe = items.stream().filter(i -> i.dictionaryEntryId() == 1L).findFirst().orElseThrow();
        assertThat(cafe.aliases()).containsExactly("cafe");
        assertThat(cafe.synonyms()).containsExactly("bistro", "coffeehouse");
        assertThat(cafe.examples()).containsExactly("We met at the café.");
        assertThat(cafe.crossReferences()).singleElement()
                .satisfies(r -> assertThat(r.targetWord()).isEqualTo("coffee"));
        assertThat(cafe.etymologies()).singleElement()
                .satisfies(e -> assertThat(e.languageCode()).isEqualTo("fr"));

        BatchItem run = items.stream().filter(i -> i.dictionaryEntryId() == 2L).findFirst().orElseThrow();
        assertThat(run.domain()).isEqualTo("sports");
        assertThat(run.senseNumber()).isEqualTo(1);
    }

    @Test
    @DisplayName("JSON 파싱 실패 시 IllegalStateException이 전파되고 completeImport는 호출되지 않는다")
    void run_parseError_propagates() {
        NdjsonLineReader lineReader = mock(NdjsonLineReader.class);
        when(lineReader.readLines(PATH)).thenReturn(Flux.just("{not json"));

        DictionaryNdjsonIngestRunner runner =
                new DictionaryNdjsonIngestRunner(lineReader, mapper, collector, ingestService, props);

        assertThatThrownBy(runner::run)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("JSON parse error");
        verify(ingestService, never()).completeImport(anyCollection());
    }

    @Test
    @DisplayName("소스 코드나 표제어 ID가 없는 레코드는 건너뛴다")
    void run_skipsRecordsWithoutKeys() {
        NdjsonLineReader lineReader = mock(NdjsonLineReader.class);
        when(lineReader.readLines(PATH)).thenReturn(Flux.just(
                "{\"dictionaryEntryId\":1,\"meaningTitle\":\"a\"}",
                "{\"sourceCode\":\"WIKT\",\"meaningTitle\":\"b\"}",
                "{\"sourceCode\":\"WIKT\",\"dictionaryEntryId\":3,\"meaningTitle\":\"c\"}"
        ));
        when(ingestService.completeImport(anyCollection())).thenReturn(Mono.just(emptySummary()));

        new DictionaryNdjsonIngestRunner(lineReader, mapper, collector, ingestService, props).run();

        assertThat(collector.stats().itemsAdded()).isEqualTo(1);
    }

    @Test
    @DisplayName("입력 경로가 없으면 시작하지 않는다")
    void run_requiresInputPath() {
        IngestProperties noPath = IngestProperties.of(10, 1);
        DictionaryNdjsonIngestRunner runner = new DictionaryNdjsonIngestRunner(
                mock(NdjsonLineReader.class), mapper, collector, ingestService, noPath);

        assertThatThrownBy(runner::run).isInstanceOf(IllegalStateException.class);
        verify(ingestService, never()).completeImport(any());
    }
}
