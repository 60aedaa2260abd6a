package com.pdfcache.core.error;

import java.io.IOException;

/**
 * 원격 PDF 획득 실패의 공통 상위 타입.
 * 모두 현재 fetch 시도에 대해 종결적이며 내부 재시도는 없다(재시도 정책은 호출자 몫).
 */
public abstract class FetchException extends IOException {

    private final String url;

    protected FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    protected FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    /** 실패가 관측된 URL(리다이렉트 중이면 해당 홉의 URL) */
    public String getUrl() { return url; }
}
