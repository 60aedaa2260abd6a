package com.pdfcache.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 캐시/다운로드 설정 (pdf-cache.yml 매핑 대상). 순수 설정 보관용.
 * 프로세스 시작 시 한 번 만들어 DocumentService 에 넘긴다.
 */
public final class CacheConfig {

    /** 100 MiB */
    public static final long DEFAULT_MAX_DOWNLOAD_BYTES = 100L * 1024 * 1024;
    public static final int DEFAULT_MAX_REDIRECTS = 10;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CONTENT_TTL = Duration.ofHours(24);

    // ---------- 다운로드 ----------
    private Path downloadDir = defaultRoot().resolve("downloads");
    private Duration timeout = DEFAULT_TIMEOUT;          // 연결 + 전체 수신 데드라인
    private long maxDownloadBytes = DEFAULT_MAX_DOWNLOAD_BYTES;
    private int maxRedirects = DEFAULT_MAX_REDIRECTS;    // 요청 횟수 상한(첫 요청 포함)
    private String userAgent = "pdf-cache";

    // ---------- 콘텐츠 캐시 ----------
    private Path contentDir = defaultRoot().resolve("content");
    private Duration contentTtl = DEFAULT_CONTENT_TTL;

    // ---------- 실행 ----------
    private int concurrency = 4;                         // resolveAsync 워커 수

    // ---------- getters ----------
    public Path getDownloadDir() { return downloadDir; }
    public Duration getTimeout() { return timeout; }
    public long getMaxDownloadBytes() { return maxDownloadBytes; }
    public int getMaxRedirects() { return maxRedirects; }
    public String getUserAgent() { return userAgent; }
    public Path getContentDir() { return contentDir; }
    public Duration getContentTtl() { return contentTtl; }
    public int getConcurrency() { return concurrency; }

    // ---------- fluent setters ----------
    public CacheConfig setDownloadDir(Path downloadDir) { this.downloadDir = downloadDir; return this; }
    public CacheConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CacheConfig setMaxDownloadBytes(long maxDownloadBytes) { this.maxDownloadBytes = maxDownloadBytes; return this; }
    public CacheConfig setMaxRedirects(int maxRedirects) { this.maxRedirects = maxRedirects; return this; }
    public CacheConfig setContentDir(Path contentDir) { this.contentDir = contentDir; return this; }
    public CacheConfig setContentTtl(Duration contentTtl) { this.contentTtl = contentTtl; return this; }
    public CacheConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }

    public CacheConfig setUserAgent(String userAgent) {
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? "pdf-cache" : userAgent.trim();
        return this;
    }

    /** YAML 은 초 단위로 들어온다 */
    public CacheConfig setTimeoutSeconds(long seconds) {
        this.timeout = Duration.ofSeconds(Math.max(1, seconds));
        return this;
    }

    /** YAML 은 시간 단위로 들어온다 */
    public CacheConfig setContentTtlHours(long hours) {
        this.contentTtl = Duration.ofHours(hours);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(downloadDir, "downloadDir");
        Objects.requireNonNull(contentDir, "contentDir");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (maxDownloadBytes <= 0) throw new IllegalArgumentException("maxDownloadBytes must be > 0");
        if (maxRedirects < 1) throw new IllegalArgumentException("maxRedirects must be >= 1");
        if (contentTtl == null || contentTtl.isNegative())
            throw new IllegalArgumentException("contentTtl must be >= 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
    }

    // ---------- helpers ----------
    public static CacheConfig defaults() { return new CacheConfig(); }

    /** ${java.io.tmpdir}/pdf-cache */
    public static Path defaultRoot() {
        return Path.of(System.getProperty("java.io.tmpdir"), "pdf-cache");
    }

    @Override
    public String toString() {
        return "CacheConfig{downloadDir=" + downloadDir
                + ", timeout=" + timeout
                + ", maxDownloadBytes=" + maxDownloadBytes
                + ", maxRedirects=" + maxRedirects
                + ", contentDir=" + contentDir
                + ", contentTtl=" + contentTtl
                + ", concurrency=" + concurrency + '}';
    }
}
