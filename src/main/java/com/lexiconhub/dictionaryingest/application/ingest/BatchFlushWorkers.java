package com.lexiconhub.dictionaryingest.application.ingest;

import com.lexiconhub.dictionaryingest.application.common.error.FlushFailureException;
import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.application.ingest.model.FrozenBatch;
import com.lexiconhub.dictionaryingest.application.ingest.model.SealedBatch;
import com.lexiconhub.dictionaryingest.infrastructure.mapper.BatchPayloadMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link FlushQueue}에서 봉인 배치를 꺼내 staging에 적재하는 워커 풀입니다.
 *
 * <p>배치 하나의 처리 순서: 동결({@link BatchFreezer}) → 페이로드 변환({@link BatchPayloadMapper})
 * → 적재({@link StagingBulkDispatcher}). 적재가 {@link FlushFailureException}으로 실패하면
 * {@code dispatch-attempts}까지 지수 backoff로 재시도하고, 그래도 실패하면 배치를 폐기하고 기록합니다.</p>
 *
 * <p>{@code worker-count}개의 루프가 큐를 polling 하며, {@link #stop()}은 처리 중인 배치가 끝날 때까지 기다린 뒤
 * 큐에 남은 배치를 적재합니다.</p>
 */
@Component
public class BatchFlushWorkers implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BatchFlushWorkers.class);

    private static final Duration IDLE_CHECK_INTERVAL = Duration.ofMillis(20);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    private final FlushQueue queue;
    private final BatchFreezer freezer;
    private final BatchPayloadMapper mapper;
    private final StagingBulkDispatcher dispatcher;

    private final int workerCount;
    private final int dispatchAttempts;
    private final Duration dispatchBackoff;
    private final Duration pollInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong batchesFlushed = new AtomicLong();
    private final AtomicLong batchesDiscarded = new AtomicLong();
    private final AtomicLong itemsDiscarded = new AtomicLong();

    private volatile Disposable loops;
    private volatile CountDownLatch stopped = new CountDownLatch(0);

    public BatchFlushWorkers(
            FlushQueue queue,
            BatchFreezer freezer,
            BatchPayloadMapper mapper,
            StagingBulkDispatcher dispatcher,
            IngestProperties properties
    ) {
        this.queue = queue;
        this.freezer = freezer;
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.workerCount = properties.workerCount();
        this.dispatchAttempts = properties.dispatchAttempts();
        this.dispatchBackoff = properties.dispatchBackoff();
        this.pollInterval = properties.pollInterval();
    }

    /**
     * 봉인 배치 하나를 동결·변환·적재합니다.
     * <p>
     * 재시도가 모두 실패하면 배치를 폐기하고 빈 Mono로 끝납니다(에러를 전파하지 않음).
     * 성공/폐기와 관계없이 끝나면 {@link FlushQueue#complete()}를 호출합니다.
     *
     * @param sealed 큐에서 꺼낸 봉인 배치
     * @return 적재 결과(폐기 시 empty)
     */
    public Mono<DispatchResult> flushOne(SealedBatch sealed) {
        return Mono.defer(() -> {
                    FrozenBatch frozen = freezer.freeze(sealed);
                    return Mono.defer(() -> dispatcher.dispatch(mapper.build(frozen)))
                            .retryWhen(Retry.backoff(dispatchAttempts - 1L, dispatchBackoff)
                                    .filter(FlushFailureException.class::isInstance)
                                    .doBeforeRetry(sig -> log.warn("Retrying batch {}. attempt={}/{}",
                                            frozen.batchId(), sig.totalRetries() + 2, dispatchAttempts))
                                    .onRetryExhaustedThrow((spec, sig) -> sig.failure()))
                            .onErrorResume(FlushFailureException.class, e -> {
                                batchesDiscarded.incrementAndGet();
                                itemsDiscarded.addAndGet(frozen.size());
                                log.error("Batch discarded after {} attempt(s). batchId={}, items={}",
                                        dispatchAttempts, frozen.batchId(), frozen.size(), e);
                                return Mono.empty();
                            });
                })
                .doOnNext(r -> batchesFlushed.incrementAndGet())
                .doFinally(signal -> queue.complete());
    }

    /**
     * 현재 큐에 있는 배치를 호출자 쪽에서 바로 처리합니다(최대 {@code worker-count}개 동시).
     * 백그라운드 루프와 함께 동작해도 배치는 한 번씩만 꺼내집니다.
     *
     * @return 적재에 성공한 배치 수
     */
    public Mono<Long> drain() {
        return Flux.<SealedBatch>generate(sink -> {
                    SealedBatch next = queue.poll();
                    if (next == null) sink.complete();
                    else sink.next(next);
                })
                .flatMap(this::flushOne, workerCount)
                .count();
    }

    /**
     * 큐가 비고 처리 중인 배치가 없을 때까지 기다립니다.
     *
     * @param timeout 최대 대기 시간
     * @return 완료 신호. 시간 초과 시 {@link java.util.concurrent.TimeoutException}
     */
    public Mono<Void> awaitIdle(Duration timeout) {
        return Mono.fromSupplier(queue::isIdle)
                .filter(Boolean::booleanValue)
                .repeatWhenEmpty(retries -> retries.delayElements(IDLE_CHECK_INTERVAL))
                .timeout(timeout)
                .then();
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) return;

        CountDownLatch done = new CountDownLatch(1);
        stopped = done;
        loops = Flux.range(0, workerCount)
                .flatMap(this::workerLoop, workerCount)
                .doFinally(signal -> done.countDown())
                .subscribe();
        log.info("Flush workers started. workers={}", workerCount);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) return;

        try {
            if (!stopped.await(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Flush workers did not stop within {}. Disposing.", STOP_TIMEOUT);
                loops.dispose();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loops.dispose();
        }
        drainRemaining();
        log.info("Flush workers stopped. flushed={}, discarded={}", batchesFlushed.get(), batchesDiscarded.get());
    }

    /** 종료 시 큐에 남은 봉인 배치를 {@code STOP_TIMEOUT} 안에서 적재합니다. */
    private void drainRemaining() {
        int left = queue.size();
        if (left == 0) return;
        log.info("Draining {} queued batch(es) before shutdown", left);
        try {
            drain().block(STOP_TIMEOUT);
        } catch (RuntimeException e) {
            log.error("Shutdown drain did not finish. queued={}", queue.size(), e);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public long batchesFlushed() {
        return batchesFlushed.get();
    }

    public long batchesDiscarded() {
        return batchesDiscarded.get();
    }

    public long itemsDiscarded() {
        return itemsDiscarded.get();
    }

    private Mono<Void> workerLoop(int workerId) {
        return Mono.fromCallable(() -> queue.poll(pollInterval))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(this::flushOne)
                .onErrorResume(e -> {
                    log.error("Flush worker {} hit an unexpected error", workerId, e);
                    return Mono.empty();
                })
                .then()
                .repeat(running::get)
                .then();
    }
}
