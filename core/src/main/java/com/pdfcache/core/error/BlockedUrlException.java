package com.pdfcache.core.error;

/** SSRF 정책에 의해 차단된 URL. 항상 fail-closed. */
public final class BlockedUrlException extends FetchException {

    public enum Reason {
        /** http/https 외 스킴 */
        SCHEME,
        /** 호스트 추출 불가(파싱 실패 포함) */
        NO_HOST,
        /** localhost, 127.0.0.1, ::1, 0.0.0.0 문자열 일치 */
        LOCALHOST,
        /** DNS 해석 실패 */
        UNRESOLVABLE,
        /** 사설/루프백/링크로컬/예약/멀티캐스트 주소로 해석됨 */
        PRIVATE_ADDRESS
    }

    private final Reason reason;

    public BlockedUrlException(String url, Reason reason, String message) {
        super(url, message);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
