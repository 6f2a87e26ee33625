package com.lexiconhub.dictionaryingest.application.ingest;

import com.lexiconhub.dictionaryingest.application.common.error.FlushFailureException;
import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.application.ingest.model.BatchItem;
import com.lexiconhub.dictionaryingest.application.ingest.model.ParsedDefinition;
import com.lexiconhub.dictionaryingest.application.ingest.model.SealReason;
import com.lexiconhub.dictionaryingest.application.ingest.model.SealedBatch;
import com.lexiconhub.dictionaryingest.infrastructure.mapper.BatchPayloadMapper;
import com.lexiconhub.dictionaryingest.infrastructure.mapper.BatchPayloadMapper.RelationalPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * {@link BatchFlushWorkers} 단위 테스트.
 *
 * <p>재시도 후 성공, 재시도 소진 시 폐기, 큐 drain, 백그라운드 루프와 idle 대기를 검증한다.</p>
 */
@DisplayName("flush 워커 테스트")
class BatchFlushWorkersTest {

    private final IngestProperties props = new IngestProperties(10, 2, 16, 3,
            Duration.ofMillis(1), 100, Duration.ofMillis(10), null);

    private final FlushQueue queue = new FlushQueue(props);
    private final StagingBulkDispatcher dispatcher = mock(StagingBulkDispatcher.class);
    private final BatchFlushWorkers workers =
            new BatchFlushWorkers(queue, new BatchFreezer(), new BatchPayloadMapper(), dispatcher, props);

    private static SealedBatch sealed(int size) {
        List<BatchItem> items = new java.util.ArrayList<>();
        for (int i = 0; i < size; i++) {
            items.add(new BatchItem(i, ParsedDefinition.of("w" + i, "d", 1), "WIKT",
                    LocalDateTime.of(2024, 1, 1, 0, 0)));
        }
        return new SealedBatch(items, SealReason.THRESHOLD);
    }

    private static Mono<DispatchResult> ok(RelationalPayload p) {
        return Mono.just(new DispatchResult(p.batchId(), p.definitions().size(), p.totalRows()));
    }

    @Test
    @DisplayName("적재가 두 번 실패한 뒤 성공하면 같은 배치 ID로 재시도되고 폐기되지 않는다")
    void flushOne_retriesThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        when(dispatcher.dispatch(any())).thenAnswer(inv -> {
            RelationalPayload p = inv.getArgument(0);
            if (calls.incrementAndGet() < 3) {
                return Mono.error(new FlushFailureException(p.batchId(), 2, new IllegalStateException("deadlock")));
            }
            return ok(p);
        });

        SealedBatch batch = sealed(2);
        queue.enqueue(batch);
        queue.poll();

        StepVerifier.create(workers.flushOne(batch))
                .assertNext(r -> assertThat(r.items()).isEqualTo(2))
                .verifyComplete();

        assertThat(calls.get()).isEqualTo(3);
        assertThat(workers.batchesDiscarded()).isZero();
        assertThat(workers.batchesFlushed()).isEqualTo(1);
        assertThat(queue.isIdle()).isTrue();
    }

    @Test
    @DisplayName("재시도를 모두 소진하면 배치를 폐기하고 에러 없이 끝난다")
    void flushOne_discardsAfterExhaustingAttempts() {
        when(dispatcher.dispatch(any())).thenAnswer(inv -> {
            RelationalPayload p = inv.getArgument(0);
            return Mono.error(new FlushFailureException(p.batchId(), 3, new IllegalStateException("down")));
        });

        SealedBatch batch = sealed(3);
        queue.enqueue(batch);
        queue.poll();

        StepVerifier.create(workers.flushOne(batch))
                .verifyComplete();

        verify(dispatcher, times(3)).dispatch(any());
        assertThat(workers.batchesDiscarded()).isEqualTo(1);
        assertThat(workers.itemsDiscarded()).isEqualTo(3);
        assertThat(queue.isIdle()).isTrue();
    }

    @Test
    @DisplayName("drain은 큐에 있는 배치를 모두 처리한다")
    void drain_processesEverythingQueued() {
        when(dispatcher.dispatch(any())).thenAnswer(inv -> ok(inv.getArgument(0)));
        for (int i = 0; i < 5; i++) queue.enqueue(sealed(1));

        StepVerifier.create(workers.drain())
                .expectNext(5L)
                .verifyComplete();

        assertThat(queue.size()).isZero();
        assertThat(queue.isIdle()).isTrue();
    }

    @Test
    @DisplayName("백그라운드 루프가 큐의 배치를 처리하고 awaitIdle이 완료된다")
    void backgroundLoops_processQueue() {
        when(dispatcher.dispatch(any())).thenAnswer(inv -> ok(inv.getArgument(0)));

        workers.start();
        try {
            for (int i = 0; i < 4; i++) queue.enqueue(sealed(2));

            StepVerifier.create(workers.awaitIdle(Duration.ofSeconds(10)))
                    .verifyComplete();

            assertThat(workers.batchesFlushed()).isEqualTo(4);
            assertThat(workers.isRunning()).isTrue();
        } finally {
            workers.stop();
        }
        assertThat(workers.isRunning()).isFalse();
    }

    @Test
    @DisplayName("stop은 큐에 남은 배치를 적재한 뒤 끝난다")
    void stop_drainsQueuedBatches() {
        when(dispatcher.dispatch(any())).thenAnswer(inv -> ok(inv.getArgument(0)));

        for (int i = 0; i < 3; i++) queue.enqueue(sealed(1));

        workers.start();
        workers.stop();

        assertThat(queue.size()).isZero();
        assertThat(queue.isIdle()).isTrue();
        assertThat(workers.batchesFlushed()).isEqualTo(3);
    }

    @Test
    @DisplayName("처리 중인 배치가 있으면 awaitIdle은 시간 초과로 실패")
    void awaitIdle_timesOutWhilePending() {
        queue.enqueue(sealed(1));

        StepVerifier.create(workers.awaitIdle(Duration.ofMillis(100)))
                .expectError(java.util.concurrent.TimeoutException.class)
                .verify(Duration.ofSeconds(5));
    }
}
