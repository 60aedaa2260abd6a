package com.pdfcache.core.parse;

import com.pdfcache.core.cache.TocEntry;
import com.pdfcache.core.error.PdfParseException;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 파싱 엔진 경계. 캐시 계층은 이 인터페이스만 안다.
 * 페이지 인덱스는 0부터.
 */
public interface PdfParser {

    /** 손상/암호화 등으로 열 수 없으면 PdfParseException */
    DocumentHandle open(Path path) throws PdfParseException;

    String extractText(DocumentHandle handle, int pageIndex) throws PdfParseException;

    /** 문자열 → 스칼라(String/Number/Boolean) */
    Map<String, Object> extractMetadata(DocumentHandle handle) throws PdfParseException;

    /** 문서 순서(깊이 우선) 목차 */
    List<TocEntry> extractToc(DocumentHandle handle) throws PdfParseException;
}
