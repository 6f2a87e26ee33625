package com.lexiconhub.dictionaryingest.application.ingest.controller;

import com.lexiconhub.dictionaryingest.application.common.error.NotFoundException;
import com.lexiconhub.dictionaryingest.application.ingest.DictionaryIngestService;
import com.lexiconhub.dictionaryingest.application.ingest.dto.response.IngestStatsResponse;
import com.lexiconhub.dictionaryingest.application.merge.MergeReport;
import com.lexiconhub.dictionaryingest.application.merge.StagingMergeService;
import jakarta.validation.constraints.Pattern;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 적재 파이프라인 관리 API 컨트롤러.
 *
 * <p>현재 통계 조회, 수동 flush, 소스별 병합 실행/결과 조회를 제공한다.</p>
 */
@RestController
@RequestMapping("/api/ingest")
@Validated
public class IngestAdminController {

    private static final String SOURCE_CODE_PATTERN = "[A-Za-z0-9_-]{1,32}";

    private final DictionaryIngestService ingestService;
    private final StagingMergeService mergeService;

    public IngestAdminController(DictionaryIngestService ingestService, StagingMergeService mergeService) {
        this.ingestService = ingestService;
        this.mergeService = mergeService;
    }

    /**
     * 수집/적재 통계를 조회한다.
     */
    @GetMapping("/stats")
    public Mono<IngestStatsResponse> stats() {
        return Mono.fromSupplier(ingestService::stats);
    }

    /**
     * 모든 생산자 버퍼를 봉인하고 큐가 빌 때까지 적재한다.
     *
     * @return 봉인된 배치 수
     */
    @PostMapping("/flush")
    public Mono<Map<String, Integer>> flush() {
        return ingestService.flushAndDrain()
                .map(sealed -> Map.of("sealedBatches", sealed));
    }

    /**
     * 소스 하나의 staging을 production으로 병합한다.
     * 병합 실패도 200과 실패 리포트로 응답한다.
     *
     * @param sourceCode 소스 코드
     */
    @PostMapping("/sources/{sourceCode}/merge")
    public Mono<MergeReport> merge(@PathVariable @Pattern(regexp = SOURCE_CODE_PATTERN) String sourceCode) {
        return mergeService.merge(sourceCode);
    }

    /**
     * 소스의 마지막 병합 결과를 조회한다.
     *
     * @param sourceCode 소스 코드
     * @return 마지막 병합 결과. 없으면 404(MERGE_REPORT_NOT_FOUND)
     */
    @GetMapping("/sources/{sourceCode}/merge")
    public Mono<MergeReport> lastMerge(@PathVariable @Pattern(regexp = SOURCE_CODE_PATTERN) String sourceCode) {
        return Mono.justOrEmpty(mergeService.lastReport(sourceCode))
                .switchIfEmpty(Mono.error(() -> new NotFoundException(
                        "No merge report for source " + sourceCode, "MERGE_REPORT_NOT_FOUND")));
    }
}
