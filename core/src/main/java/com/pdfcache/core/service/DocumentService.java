package com.pdfcache.core.service;

import com.pdfcache.core.cache.DocumentCacheRecord;
import com.pdfcache.core.cache.DocumentContentCache;
import com.pdfcache.core.cache.DocumentIdentity;
import com.pdfcache.core.cache.DownloadCache;
import com.pdfcache.core.cache.DownloadCacheStats;
import com.pdfcache.core.cache.ContentCacheStats;
import com.pdfcache.core.cache.TocEntry;
import com.pdfcache.core.fetch.RemoteFetcher;
import com.pdfcache.core.fetch.Sources;
import com.pdfcache.core.model.CacheConfig;
import com.pdfcache.core.parse.DocumentHandle;
import com.pdfcache.core.parse.PdfBoxParser;
import com.pdfcache.core.parse.PdfParser;
import com.pdfcache.core.util.PageRange;
import com.pdfcache.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 문서 오케스트레이터:
 *  - source(URL 또는 로컬 경로) → 로컬 파일 (RemoteFetcher / 존재 확인)
 *  - 메타데이터·페이지 텍스트는 콘텐츠 캐시 우선, 미스만 파서로 추출 후 저장
 *  - 기본 구현체(DownloadCache/DocumentContentCache/RemoteFetcher/PdfBoxParser)
 *  - DI 생성자는 테스트 주입용
 *  - resolveAsync 는 고정 스레드풀(동시성=concurrency)에서 실행
 */
public final class DocumentService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentService.class);
    private static final StructuredLog SLOG = StructuredLog.get(DocumentService.class);

    private final DownloadCache downloads;
    private final DocumentContentCache content;
    private final RemoteFetcher fetcher;
    private final PdfParser parser;
    private final ExecutorService exec;

    /** 기본 구현 */
    public DocumentService(CacheConfig config) {
        this(config, new DownloadCache(config.getDownloadDir()));
    }

    private DocumentService(CacheConfig config, DownloadCache downloads) {
        this(config,
                downloads,
                new DocumentContentCache(config.getContentDir(), config.getContentTtl()),
                new RemoteFetcher(config, downloads),
                new PdfBoxParser());
    }

    /** DI/테스트용 */
    public DocumentService(CacheConfig config,
                           DownloadCache downloads,
                           DocumentContentCache content,
                           RemoteFetcher fetcher,
                           PdfParser parser) {
        Objects.requireNonNull(config, "config").validate();
        this.downloads = Objects.requireNonNull(downloads, "downloads");
        this.content = Objects.requireNonNull(content, "content");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.exec = Executors.newFixedThreadPool(config.getConcurrency(), daemonFactory());
        LOG.debug("DocumentService ready: {}", config);
    }

    /* =========================
       source 해석
       ========================= */

    public Path resolve(String source) throws IOException {
        return resolve(source, false);
    }

    /** URL 이면 내려받은(또는 캐시된) 파일, 아니면 존재하는 일반 파일이어야 한다 */
    public Path resolve(String source, boolean forceRefresh) throws IOException {
        Objects.requireNonNull(source, "source");
        if (Sources.isUrl(source)) {
            return fetcher.fetch(source, forceRefresh);
        }
        Path p;
        try {
            p = Path.of(source);
        } catch (InvalidPathException e) {
            throw new NoSuchFileException(source, null, "invalid path: " + e.getReason());
        }
        if (!Files.isRegularFile(p)) {
            throw new NoSuchFileException(source, null, "PDF file not found");
        }
        return p.toAbsolutePath().normalize();
    }

    /** 실패는 CompletionException(cause=IOException) */
    public CompletableFuture<Path> resolveAsync(String source, boolean forceRefresh) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return resolve(source, forceRefresh);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, exec);
    }

    /* =========================
       문서 정보 / 페이지 텍스트
       ========================= */

    public DocumentInfo info(String source) throws IOException {
        Path path = resolve(source);
        DocumentIdentity id = DocumentIdentity.of(path);

        Optional<DocumentCacheRecord> cached = content.getMetadata(id);
        if (cached.isPresent()) {
            DocumentCacheRecord r = cached.get();
            SLOG.debug("info-cache-hit", "source", source, "pages", r.pageCount());
            return new DocumentInfo(source, path, r.pageCount(), r.metadata(), r.toc(), true);
        }

        try (DocumentHandle h = parser.open(path)) {
            DocumentCacheRecord r = extractAndCacheMetadata(id, h);
            return new DocumentInfo(source, path, r.pageCount(), r.metadata(), r.toc(), false);
        }
    }

    /** pageSpec: 1-based 지정 문자열(null/빈 문자열 = 전체) */
    public PageTexts readPages(String source, String pageSpec) throws IOException {
        return readPages(source, count -> PageRange.parse(pageSpec, count));
    }

    /** 1-based 페이지 목록(null = 전체) */
    public PageTexts readPages(String source, List<Integer> pages) throws IOException {
        return readPages(source, count -> PageRange.of(pages, count));
    }

    private PageTexts readPages(String source, PageSelector selector) throws IOException {
        Path path = resolve(source);
        DocumentIdentity id = DocumentIdentity.of(path);

        DocumentHandle handle = null;
        try {
            // 페이지 수: 메타 캐시 → 없으면 파서(연 김에 메타도 저장)
            int pageCount;
            Optional<DocumentCacheRecord> meta = content.getMetadata(id);
            if (meta.isPresent()) {
                pageCount = meta.get().pageCount();
            } else {
                handle = parser.open(path);
                pageCount = extractAndCacheMetadata(id, handle).pageCount();
            }

            List<Integer> wanted = selector.select(pageCount);
            Map<Integer, String> hits = content.getPagesText(id, wanted);

            List<Integer> missing = new ArrayList<>();
            for (Integer i : wanted) {
                if (!hits.containsKey(i)) missing.add(i);
            }

            Map<Integer, String> extracted = new LinkedHashMap<>();
            if (!missing.isEmpty()) {
                if (handle == null) handle = parser.open(path);
                for (Integer i : missing) {
                    extracted.put(i, parser.extractText(handle, i));
                }
                content.savePagesText(id, extracted);
            }

            Map<Integer, String> out = new LinkedHashMap<>();
            for (Integer i : wanted) {
                out.put(i, hits.containsKey(i) ? hits.get(i) : extracted.get(i));
            }
            SLOG.info("pages-read", "source", source, "requested", wanted.size(),
                    "hits", hits.size(), "misses", missing.size());
            return new PageTexts(out, hits.size(), missing.size());
        } finally {
            if (handle != null) handle.close();
        }
    }

    private DocumentCacheRecord extractAndCacheMetadata(DocumentIdentity id, DocumentHandle h) throws IOException {
        int pageCount = h.pageCount();
        Map<String, Object> metadata = parser.extractMetadata(h);
        List<TocEntry> toc = parser.extractToc(h);
        content.saveMetadata(id, pageCount, metadata, toc);
        return new DocumentCacheRecord(id.key(), id.path(), pageCount, metadata, toc, null);
    }

    /* =========================
       캐시 관리
       ========================= */

    public int clearDownloads() {
        return downloads.clear();
    }

    public DownloadCacheStats downloadStats() {
        return downloads.stats();
    }

    public int clearContentCache() {
        return content.clearAll();
    }

    public ContentCacheStats contentStats() {
        return content.stats();
    }

    @Override
    public void close() {
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not terminate within 30s");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface PageSelector {
        List<Integer> select(int pageCount);
    }

    private static ThreadFactory daemonFactory() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "pdf-cache-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
