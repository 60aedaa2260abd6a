package com.pdfcache.core.cache;

/**
 * @param totalFiles     캐시된 문서 수
 * @param totalPages     캐시된 페이지 텍스트 수(모든 문서 합)
 * @param cacheSizeBytes 캐시 디렉터리 JSON 파일 크기 합
 */
public record ContentCacheStats(int totalFiles, int totalPages, long cacheSizeBytes) {}
