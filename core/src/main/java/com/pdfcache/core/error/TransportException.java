package com.pdfcache.core.error;

/**
 * 네트워크/HTTP 수준 실패. statusCode 는 응답을 받았을 때만 의미가 있고
 * 연결 실패·타임아웃이면 -1.
 */
public final class TransportException extends FetchException {

    private final int statusCode;

    public TransportException(String url, int statusCode, String message) {
        super(url, message);
        this.statusCode = statusCode;
    }

    public TransportException(String url, String message, Throwable cause) {
        super(url, message, cause);
        this.statusCode = -1;
    }

    public static TransportException status(String url, int statusCode) {
        return new TransportException(url, statusCode, "HTTP " + statusCode + " for " + url);
    }

    public int getStatusCode() { return statusCode; }
}
