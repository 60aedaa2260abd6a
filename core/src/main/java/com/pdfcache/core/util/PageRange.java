package com.pdfcache.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * 사용자 페이지 지정(1-based) → 0-based 인덱스 목록(정렬, 중복 제거).
 * 예: null/"" = 전체, "5", "1-5", "1-3,5,8-10". 범위를 벗어난 페이지는 버린다.
 */
public final class PageRange {
    private PageRange() {}

    public static List<Integer> parse(String spec, int pageCount) {
        if (pageCount < 0) throw new IllegalArgumentException("pageCount must be >= 0");
        if (spec == null || spec.isBlank()) return all(pageCount);

        TreeSet<Integer> out = new TreeSet<>();
        for (String raw : spec.split(",")) {
            String part = raw.trim();
            if (part.isEmpty()) continue;

            int dash = part.indexOf('-', 1);
            if (dash > 0) {
                int a = number(part.substring(0, dash), spec);
                int b = number(part.substring(dash + 1), spec);
                int lo = Math.min(a, b), hi = Math.max(a, b);   // "5-3" → 3..5
                for (int p = Math.max(lo, 1); p <= Math.min(hi, pageCount); p++) {
                    out.add(p - 1);
                }
            } else {
                addIfInRange(out, number(part, spec), pageCount);
            }
        }
        return new ArrayList<>(out);
    }

    /** 1-based 목록 입력. null 이면 전체 */
    public static List<Integer> of(List<Integer> oneBased, int pageCount) {
        if (pageCount < 0) throw new IllegalArgumentException("pageCount must be >= 0");
        if (oneBased == null) return all(pageCount);
        TreeSet<Integer> out = new TreeSet<>();
        for (Integer p : oneBased) {
            if (p != null) addIfInRange(out, p, pageCount);
        }
        return new ArrayList<>(out);
    }

    private static List<Integer> all(int pageCount) {
        List<Integer> out = new ArrayList<>(pageCount);
        for (int i = 0; i < pageCount; i++) out.add(i);
        return out;
    }

    private static void addIfInRange(TreeSet<Integer> out, int oneBased, int pageCount) {
        if (oneBased >= 1 && oneBased <= pageCount) out.add(oneBased - 1);
    }

    private static int number(String token, String spec) {
        try {
            return Integer.parseInt(token.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid page range '" + spec + "': '" + token.trim() + "' is not a page number", e);
        }
    }
}
