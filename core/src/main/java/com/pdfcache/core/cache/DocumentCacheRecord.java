package com.pdfcache.core.cache;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** getMetadata 결과. 메타데이터/목차 부분만 담는다(페이지 텍스트는 별도 조회). */
public record DocumentCacheRecord(String key,
                                  Path path,
                                  int pageCount,
                                  Map<String, Object> metadata,
                                  List<TocEntry> toc,
                                  Instant createdAt) {

    public DocumentCacheRecord {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        toc = toc == null ? List.of() : List.copyOf(toc);
    }
}
