package com.pdfcache.core.cache;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** URL → 로컬 파일. 생성 후 변경하지 않는다. */
public record CachedDownload(String url, Path path, long sizeBytes) {

    public CachedDownload {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(path, "path");
    }

    /** 외부에서 파일이 지워졌으면 false (오류가 아니라 미스로 취급) */
    public boolean exists() {
        return Files.isRegularFile(path);
    }
}
