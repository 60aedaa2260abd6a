package com.pdfcache.core.service;

import com.pdfcache.core.cache.TocEntry;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 문서 정보 조회 결과.
 * @param fromCache 콘텐츠 캐시에서 바로 나왔으면 true (파서를 열지 않음)
 */
public record DocumentInfo(String source,
                           Path path,
                           int pageCount,
                           Map<String, Object> metadata,
                           List<TocEntry> toc,
                           boolean fromCache) {

    public DocumentInfo {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        toc = toc == null ? List.of() : List.copyOf(toc);
    }
}
