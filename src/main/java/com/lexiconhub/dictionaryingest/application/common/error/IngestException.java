package com.lexiconhub.dictionaryingest.application.common.error;

/**
 * 적재 파이프라인 예외의 공통 부모.
 *
 * <p>응답/로그에 남길 애플리케이션 에러 코드({@link #code()})를 함께 가진다.</p>
 */
public abstract class IngestException extends RuntimeException {

    private final String code;

    protected IngestException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
