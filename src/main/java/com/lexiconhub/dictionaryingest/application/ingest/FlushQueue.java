package com.lexiconhub.dictionaryingest.application.ingest;

import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.application.ingest.model.SealedBatch;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 봉인된 배치를 flush 워커에 넘기는 유한 큐입니다.
 * <p>
 * 큐가 가득 차면 {@link #enqueue(SealedBatch)}가 빈 자리가 생길 때까지 생산자를 막습니다.
 * {@code pending}은 큐에 있는 배치와 워커가 처리 중인 배치를 합한 수이며,
 * 워커는 배치 처리가 끝나면(성공/폐기 모두) {@link #complete()}를 호출해야 합니다.
 */
@Component
public class FlushQueue {

    private final BlockingQueue<SealedBatch> queue;
    private final AtomicInteger pending = new AtomicInteger();

    public FlushQueue(IngestProperties properties) {
        this.queue = new LinkedBlockingQueue<>(properties.queueCapacity());
    }

    /**
     * 봉인 배치를 넣습니다. 큐가 가득 차면 대기합니다.
     *
     * @param batch 봉인 배치
     * @throws IllegalStateException 대기 중 인터럽트된 경우
     */
    public void enqueue(SealedBatch batch) {
        pending.incrementAndGet();
        try {
            queue.put(batch);
        } catch (InterruptedException e) {
            pending.decrementAndGet();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while enqueueing sealed batch", e);
        }
    }

    /** 대기 없이 꺼냅니다. 비어 있으면 null. */
    public SealedBatch poll() {
        return queue.poll();
    }

    /** 최대 timeout 동안 기다려 꺼냅니다. 시간 안에 없으면 null. */
    public SealedBatch poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** 꺼낸 배치 하나의 처리가 끝났음을 알립니다. */
    public void complete() {
        pending.decrementAndGet();
    }

    /** 큐 대기 + 처리 중 배치 수 */
    public int pending() {
        return pending.get();
    }

    /** 큐에 대기 중인 배치 수 */
    public int size() {
        return queue.size();
    }

    public boolean isIdle() {
        return pending.get() == 0;
    }
}
