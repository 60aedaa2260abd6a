package com.pdfcache.core.cache;

import java.util.Objects;

/**
 * 목차 한 줄.
 * @param level 1부터 시작하는 깊이
 * @param page  1부터 시작하는 페이지 번호, 목적지를 알 수 없으면 -1
 */
public record TocEntry(int level, String title, int page) {

    public TocEntry {
        if (level < 1) throw new IllegalArgumentException("level must be >= 1");
        title = Objects.requireNonNullElse(title, "");
    }
}
