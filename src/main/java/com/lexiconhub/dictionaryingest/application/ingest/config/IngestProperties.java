package com.lexiconhub.dictionaryingest.application.ingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 배치 적재 파이프라인 설정({@code dictionary.ingest.*}).
 *
 * @param batchSize        봉인 임계값(레코드 수)
 * @param workerCount      백그라운드 flush 워커 수(동시 dispatch 상한)
 * @param queueCapacity    flush 큐 용량(봉인 배치 수). 가득 차면 생산자가 대기합니다.
 * @param dispatchAttempts 배치 하나당 dispatch 총 시도 횟수
 * @param dispatchBackoff  재시도 간 기본 대기 시간
 * @param insertChunk      multi-VALUES INSERT 한 문장에 담을 최대 행 수
 * @param pollInterval     큐가 비었을 때 워커의 대기 간격
 * @param inputPath        {@code ingest} 프로파일에서 읽을 NDJSON 파일 경로
 */
@ConfigurationProperties("dictionary.ingest")
public record IngestProperties(
        @DefaultValue("1000") int batchSize,
        @DefaultValue("4") int workerCount,
        @DefaultValue("64") int queueCapacity,
        @DefaultValue("3") int dispatchAttempts,
        @DefaultValue("200ms") Duration dispatchBackoff,
        @DefaultValue("300") int insertChunk,
        @DefaultValue("200ms") Duration pollInterval,
        String inputPath
) {
    public IngestProperties {
        if (batchSize < 1) throw new IllegalArgumentException("dictionary.ingest.batch-size must be >= 1");
        if (workerCount < 1) throw new IllegalArgumentException("dictionary.ingest.worker-count must be >= 1");
        if (queueCapacity < 1) throw new IllegalArgumentException("dictionary.ingest.queue-capacity must be >= 1");
        if (dispatchAttempts < 1) throw new IllegalArgumentException("dictionary.ingest.dispatch-attempts must be >= 1");
        if (insertChunk < 1) throw new IllegalArgumentException("dictionary.ingest.insert-chunk must be >= 1");
    }

    /** 테스트/수동 구성용: 배치 크기와 워커 수만 지정하고 나머지는 기본값을 사용합니다. */
    public static IngestProperties of(int batchSize, int workerCount) {
        return new IngestProperties(batchSize, workerCount, 64, 3,
                Duration.ofMillis(200), 300, Duration.ofMillis(200), null);
    }
}
