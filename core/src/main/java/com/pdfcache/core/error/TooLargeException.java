package com.pdfcache.core.error;

/** 선언(Content-Length) 또는 실측 크기가 다운로드 상한을 넘음 */
public final class TooLargeException extends FetchException {

    private final long limitBytes;
    private final long observedBytes;
    private final boolean declared;

    public TooLargeException(String url, long limitBytes, long observedBytes, boolean declared) {
        super(url, declared
                ? "PDF file too large: " + observedBytes + " bytes (max " + limitBytes + " bytes)"
                : "PDF download exceeded maximum size of " + limitBytes + " bytes");
        this.limitBytes = limitBytes;
        this.observedBytes = observedBytes;
        this.declared = declared;
    }

    public long getLimitBytes() { return limitBytes; }

    /** 선언 크기이거나, 스트리밍 중이면 상한을 넘긴 시점까지 읽은 바이트 수 */
    public long getObservedBytes() { return observedBytes; }

    /** true 면 Content-Length 헤더만 보고 중단(본문 미수신) */
    public boolean isDeclared() { return declared; }
}
