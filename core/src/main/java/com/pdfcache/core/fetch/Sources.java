package com.pdfcache.core.fetch;

/** 소스 문자열 분류: 접두사만 본다(파싱/DNS 없음). */
public final class Sources {
    private Sources() {}

    public static boolean isUrl(String source) {
        return source != null && (source.startsWith("http://") || source.startsWith("https://"));
    }
}
