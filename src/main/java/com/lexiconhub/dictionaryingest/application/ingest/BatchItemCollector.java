package com.lexiconhub.dictionaryingest.application.ingest;

import com.lexiconhub.dictionaryingest.application.ingest.config.IngestProperties;
import com.lexiconhub.dictionaryingest.application.ingest.model.BatchItem;
import com.lexiconhub.dictionaryingest.application.ingest.model.CrossReference;
import com.lexiconhub.dictionaryingest.application.ingest.model.Etymology;
import com.lexiconhub.dictionaryingest.application.ingest.model.ParsedDefinition;
import com.lexiconhub.dictionaryingest.application.ingest.model.SealReason;
import com.lexiconhub.dictionaryingest.application.ingest.model.SealedBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 여러 생산자 스레드가 파싱한 레코드를 모아 배치로 봉인하는 수집기입니다.
 *
 * <p>동작 방식:</p>
 * <ul>
 *   <li>생산자(스레드)마다 자기 버퍼(slot)를 가집니다. slot의 lock은 해당 생산자와 {@link #flushAll()}만 잡습니다.</li>
 *   <li>모든 생산자가 공유하는 카운터가 {@code batchSize}에 도달하면, CAS로 0으로 되돌린 생산자
 *       한 명만 자기 버퍼를 봉인합니다({@link SealReason#THRESHOLD}).</li>
 *   <li>자기 버퍼만으로 {@code batchSize}가 차도 봉인합니다({@link SealReason#PRODUCER_FULL}).
 *       따라서 봉인 배치 크기는 {@code batchSize}를 넘지 않습니다.</li>
 *   <li>봉인이 결정된 버퍼는 해당 생산자의 다음 {@code add} 직전(또는 {@link #flushAll()})에 큐로 넘어갑니다.
 *       봉인 직후에도 마지막 레코드의 하위 항목({@code addAlias} 등)이 같은 배치에 들어갑니다.</li>
 *   <li>큐 전달({@link FlushQueue#enqueue(SealedBatch)})은 slot lock을 놓은 뒤에 수행합니다.</li>
 * </ul>
 *
 * <p>하위 항목 추가 메서드는 "현재 스레드가 마지막으로 추가한 레코드"를 대상으로 하며,
 * 버퍼가 비어 있으면 아무것도 하지 않습니다.</p>
 */
@Component
public class BatchItemCollector {

    private static final Logger log = LoggerFactory.getLogger(BatchItemCollector.class);

    private final int batchSize;
    private final FlushQueue flushQueue;
    private final Clock clock;

    /** 마지막 임계치 봉인 이후 추가된 레코드 수(전 생산자 합계) */
    private final AtomicInteger outstanding = new AtomicInteger();

    private final Set<ProducerSlot> slots = ConcurrentHashMap.newKeySet();
    private final ThreadLocal<ProducerSlot> localSlot = ThreadLocal.withInitial(this::registerSlot);
    private final Set<String> sourceCodes = ConcurrentHashMap.newKeySet();

    private final AtomicLong itemsAdded = new AtomicLong();
    private final AtomicLong thresholdSeals = new AtomicLong();
    private final AtomicLong producerFullSeals = new AtomicLong();
    private final AtomicLong flushAllSeals = new AtomicLong();

    @Autowired
    public BatchItemCollector(IngestProperties properties, FlushQueue flushQueue) {
        this(properties, flushQueue, Clock.systemUTC());
    }

    BatchItemCollector(IngestProperties properties, FlushQueue flushQueue, Clock clock) {
        this.batchSize = properties.batchSize();
        this.flushQueue = flushQueue;
        this.clock = clock;
    }

    /**
     * 파싱된 뜻풀이 하나를 현재 스레드의 버퍼에 추가합니다.
     *
     * @param dictionaryEntryId 표제어 ID
     * @param parsed            파싱 결과
     * @param sourceCode        소스 코드
     */
    public void add(long dictionaryEntryId, ParsedDefinition parsed, String sourceCode) {
        BatchItem item = new BatchItem(dictionaryEntryId, parsed, sourceCode, LocalDateTime.now(clock));
        ProducerSlot slot = localSlot.get();
        sourceCodes.add(sourceCode);

        SealedBatch ready;
        slot.lock.lock();
        try {
            ready = slot.takeSealed();

            slot.buffer.add(item);
            itemsAdded.incrementAndGet();

            int n = outstanding.incrementAndGet();
            if (n >= batchSize && outstanding.compareAndSet(n, 0)) {
                slot.markSealed(SealReason.THRESHOLD);
                thresholdSeals.incrementAndGet();
            } else if (slot.buffer.size() >= batchSize) {
                slot.markSealed(SealReason.PRODUCER_FULL);
                producerFullSeals.incrementAndGet();
            }
        } finally {
            slot.lock.unlock();
        }

        if (ready != null) handOff(ready);
    }

    /**
     * 현재 스레드가 마지막으로 추가한 레코드에 하위 항목을 덧붙입니다.
     * 버퍼가 비어 있으면 아무것도 하지 않습니다.
     *
     * @param mutator 마지막 레코드에 적용할 변경
     */
    public void addChildDetail(Consumer<BatchItem> mutator) {
        ProducerSlot slot = localSlot.get();
        slot.lock.lock();
        try {
            if (slot.buffer.isEmpty()) return;
            mutator.accept(slot.buffer.get(slot.buffer.size() - 1));
        } finally {
            slot.lock.unlock();
        }
    }

    public void addAlias(String alias) {
        addChildDetail(it -> it.addAlias(alias));
    }

    public void addSynonyms(Collection<String> synonyms) {
        addChildDetail(it -> it.addSynonyms(synonyms));
    }

    public void addExample(String example) {
        addChildDetail(it -> it.addExample(example));
    }

    public void addCrossReference(CrossReference crossReference) {
        addChildDetail(it -> it.addCrossReference(crossReference));
    }

    public void addEtymology(Etymology etymology) {
        addChildDetail(it -> it.addEtymology(etymology));
    }

    /**
     * 모든 생산자의 비어 있지 않은 버퍼를 봉인해 큐에 넣습니다.
     * <p>
     * 이미 봉인이 결정된 버퍼는 원래 사유로, 나머지는 {@link SealReason#FLUSH_ALL}로 넘깁니다.
     *
     * @return 이번 호출로 큐에 넣은 배치 수
     */
    public int flushAll() {
        outstanding.set(0);
        int handed = 0;
        for (ProducerSlot slot : slots) {
            SealedBatch batch;
            slot.lock.lock();
            try {
                batch = slot.takeSealed();
                if (batch == null && !slot.buffer.isEmpty()) {
                    slot.markSealed(SealReason.FLUSH_ALL);
                    flushAllSeals.incrementAndGet();
                    batch = slot.takeSealed();
                }
            } finally {
                slot.lock.unlock();
            }
            if (batch != null) {
                handOff(batch);
                handed++;
            }
        }
        log.info("Flush-all sealed {} batch(es). producers={}", handed, slots.size());
        return handed;
    }

    /** 지금까지 레코드를 추가한 소스 코드 */
    public Set<String> sourceCodes() {
        return Set.copyOf(sourceCodes);
    }

    public CollectorStats stats() {
        return new CollectorStats(
                itemsAdded.get(),
                thresholdSeals.get(),
                producerFullSeals.get(),
                flushAllSeals.get(),
                slots.size(),
                sealedAwaitingHandOff()
        );
    }

    /**
     * 봉인이 결정됐지만 아직 큐에 넘어가지 않은 배치 수.
     * 해당 생산자의 다음 {@code add} 또는 {@link #flushAll()}에서 큐로 넘어갑니다.
     */
    public int sealedAwaitingHandOff() {
        int held = 0;
        for (ProducerSlot slot : slots) {
            slot.lock.lock();
            try {
                if (slot.sealedReason != null) held++;
            } finally {
                slot.lock.unlock();
            }
        }
        return held;
    }

    private void handOff(SealedBatch batch) {
        log.debug("Sealed batch handed off. size={}, reason={}", batch.size(), batch.reason());
        flushQueue.enqueue(batch);
    }

    private ProducerSlot registerSlot() {
        ProducerSlot slot = new ProducerSlot();
        slots.add(slot);
        return slot;
    }

    /** 생산자 하나의 버퍼. 필드는 {@code lock}을 잡은 상태에서만 다룹니다. */
    private static final class ProducerSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private List<BatchItem> buffer = new ArrayList<>();
        private SealReason sealedReason;

        void markSealed(SealReason reason) {
            sealedReason = reason;
        }

        /** 봉인이 결정된 버퍼를 떼어내고 새 버퍼로 교체합니다. 결정된 봉인이 없으면 null. */
        SealedBatch takeSealed() {
            if (sealedReason == null) return null;
            SealedBatch sealed = new SealedBatch(buffer, sealedReason);
            buffer = new ArrayList<>();
            sealedReason = null;
            return sealed;
        }
    }

    /**
     * 수집기 누적 통계.
     *
     * @param itemsAdded        추가된 레코드 수
     * @param thresholdSeals    공유 임계치로 봉인된 횟수
     * @param producerFullSeals 생산자 버퍼가 가득 차 봉인된 횟수
     * @param flushAllSeals     flush-all로 봉인된 횟수
     * @param producers         등록된 생산자 수
     * @param sealedAwaitingHandOff 큐에 넘어가기를 기다리는 봉인 배치 수
     */
    public record CollectorStats(
            long itemsAdded,
            long thresholdSeals,
            long producerFullSeals,
            long flushAllSeals,
            int producers,
            int sealedAwaitingHandOff
    ) {}
}
