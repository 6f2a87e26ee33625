package com.lexiconhub.dictionaryingest.infrastructure.input.ndjson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * NDJSON 파일을 "한 줄씩" 읽기 위한 라인 리더입니다.
 * <p>
 * {@link BufferedReader#lines()}의 lazy 스트림을 이용해 파일 전체를 메모리에 올리지 않으며,
 * 리소스 생성/사용/해제를 {@link Flux#using}으로 관리합니다.
 * <p>
 * 파일 I/O는 blocking 작업이므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
 */
@Component
public class NdjsonLineReader {

    private static final Logger log = LoggerFactory.getLogger(NdjsonLineReader.class);

    static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * NDJSON 파일을 한 줄씩 {@link Flux}로 반환합니다.
     *
     * @param location {@code classpath:} 접두사가 있으면 classpath, 없으면 파일 시스템 경로
     *                 (예: {@code classpath:ndjson/sample.ndjson}, {@code /data/wiktionary.ndjson})
     * @return 파일의 각 라인을 순차적으로 방출하는 Flux
     */
    public Flux<String> readLines(String location) {
        return Flux.using(
                () -> new BufferedReader(new InputStreamReader(
                        resolve(location).getInputStream(),
                        StandardCharsets.UTF_8
                )),
                br -> Flux.fromStream(br.lines()),
                br -> close(br, location)
        ).subscribeOn(Schedulers.boundedElastic());
    }

    static Resource resolve(String location) {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(location);
    }

    private static void close(BufferedReader br, String location) {
        try {
            br.close();
        } catch (IOException e) {
            log.warn("Failed to close NDJSON reader for {}", location, e);
        }
    }
}
