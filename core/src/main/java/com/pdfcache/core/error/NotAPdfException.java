package com.pdfcache.core.error;

/** Content-Type 과 매직 바이트(%PDF) 검사 모두 실패 */
public final class NotAPdfException extends FetchException {

    private final String contentType;

    public NotAPdfException(String url, String contentType) {
        super(url, "URL does not appear to be a PDF: " + url
                + (contentType == null || contentType.isEmpty() ? "" : " (Content-Type: " + contentType + ")"));
        this.contentType = contentType;
    }

    public String getContentType() { return contentType; }
}
