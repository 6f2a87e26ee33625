package com.lexiconhub.dictionaryingest.application.common.error;

/**
 * 조회 대상이 없을 때(404) 사용하는 예외.
 * 예: 아직 병합한 적 없는 소스의 병합 리포트 조회 시 {@code MERGE_REPORT_NOT_FOUND}.
 */
public class NotFoundException extends IngestException {

    public NotFoundException(String message, String code) {
        super(message, code, null);
    }
}
