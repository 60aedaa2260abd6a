package com.pdfcache.core.cache;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 콘텐츠 캐시 디스크 포맷(문서당 JSON 하나).
 * meta 와 pages 는 따로 저장·만료된다. meta == null 이면 메타데이터 미캐시.
 */
final class StoredDocument {

    public int v = 1;
    public String path;
    public long lastModified;
    public long size;
    public Meta meta;
    public Map<Integer, Page> pages = new TreeMap<>();

    record Meta(int pageCount, Map<String, Object> metadata, List<TocEntry> toc, Instant createdAt) {}

    record Page(String text, Instant createdAt) {}

    static StoredDocument of(DocumentIdentity id) {
        StoredDocument d = new StoredDocument();
        d.path = id.path().toString();
        d.lastModified = id.lastModifiedMillis();
        d.size = id.sizeBytes();
        return d;
    }

    boolean isEmpty() {
        return meta == null && (pages == null || pages.isEmpty());
    }
}
