package com.lexiconhub.dictionaryingest.application.ingest;

import com.lexiconhub.dictionaryingest.application.merge.PostMergeVerifier;
import com.lexiconhub.dictionaryingest.application.merge.StagingMergeService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * {@link DictionaryIngestService#flushAndDrain()} 단위 테스트.
 *
 * <p>큐가 가득 차면 flush-all이 대기할 수 있으므로 요청 스레드가 아닌
 * boundedElastic 스레드에서 실행되는지 검증한다.</p>
 */
@DisplayName("flush-and-drain 스케줄링 테스트")
class DictionaryIngestServiceFlushTest {

    private final BatchItemCollector collector = mock(BatchItemCollector.class);
    private final BatchFlushWorkers workers = mock(BatchFlushWorkers.class);

    private final DictionaryIngestService service = new DictionaryIngestService(
            collector, workers, mock(FlushQueue.class), mock(StagingBulkDispatcher.class),
            mock(StagingMergeService.class), mock(PostMergeVerifier.class));

    @Test
    @DisplayName("flush-all은 boundedElastic 스레드에서 실행되고 drain과 idle 대기가 이어진다")
    void flushAll_runsOffCallerThread() {
        AtomicReference<String> flushThread = new AtomicReference<>();
        when(collector.flushAll()).thenAnswer(inv -> {
            flushThread.set(Thread.currentThread().getName());
            return 3;
        });
        when(workers.drain()).thenReturn(Mono.just(3L));
        when(workers.awaitIdle(any(Duration.class))).thenReturn(Mono.empty());

        StepVerifier.create(service.flushAndDrain())
                .expectNext(3)
                .verifyComplete();

        assertThat(flushThread.get()).startsWith("boundedElastic");
        verify(workers).drain();
        verify(workers).awaitIdle(any(Duration.class));
    }
}
