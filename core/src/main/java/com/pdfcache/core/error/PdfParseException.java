package com.pdfcache.core.error;

import java.io.IOException;

/** 파서가 문서를 열거나 읽지 못함(손상, 암호화 등) */
public class PdfParseException extends IOException {

    public PdfParseException(String message) {
        super(message);
    }

    public PdfParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
