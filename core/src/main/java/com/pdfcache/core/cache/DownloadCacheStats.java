package com.pdfcache.core.cache;

import java.nio.file.Path;

/** 디렉터리 스캔 결과(인메모리 인덱스가 아니라 실제 파일 기준) */
public record DownloadCacheStats(int fileCount, long totalBytes, Path directory) {

    public double totalMegabytes() {
        return Math.round(totalBytes / (1024.0 * 1024.0) * 100.0) / 100.0;
    }
}
