package com.pdfcache.core.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 0-based 페이지 인덱스 → 텍스트(오름차순) + 캐시 히트/미스 수 */
public record PageTexts(Map<Integer, String> pages, int cacheHits, int cacheMisses) {

    public PageTexts {
        pages = pages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(pages));
    }
}
