package com.pdfcache.core.fetch;

import com.pdfcache.core.cache.CachedDownload;
import com.pdfcache.core.cache.DownloadCache;
import com.pdfcache.core.error.FetchException;
import com.pdfcache.core.error.NotAPdfException;
import com.pdfcache.core.error.TooLargeException;
import com.pdfcache.core.error.TooManyRedirectsException;
import com.pdfcache.core.error.TransportException;
import com.pdfcache.core.model.CacheConfig;
import com.pdfcache.core.security.SsrfGuard;
import com.pdfcache.core.security.UrlGuard;
import com.pdfcache.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * URL → 로컬 PDF 경로.
 * <ul>
 *   <li>원래 URL 과 모든 리다이렉트 대상을 연결 전에 UrlGuard 로 검사</li>
 *   <li>리다이렉트는 HttpClient 에 맡기지 않고(Redirect.NEVER) 한 홉씩 직접 따라간다</li>
 *   <li>Content-Length 선검사 + 스트리밍 중 누적 크기 검사(헤더는 없거나 틀릴 수 있음)</li>
 *   <li>본문 읽기는 별도 스레드에서 하고 남은 데드라인만큼만 기다린다(헤더 후 멈춘 서버 대비)</li>
 *   <li>Content-Type 에 pdf 가 없으면 %PDF 매직 바이트로 판정</li>
 *   <li>본문 전체가 검증된 뒤에만 DownloadCache 에 저장</li>
 * </ul>
 * 내부 재시도 없음. 같은 URL 동시 요청은 URL 별 락으로 한 번만 내려받는다(forceRefresh 제외).
 */
public final class RemoteFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(RemoteFetcher.class);

    static final int CHUNK_SIZE = 8192;
    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private static final AtomicInteger READER_SEQ = new AtomicInteger();
    private static final ExecutorService BODY_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "pdf-fetch-body-" + READER_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    /** 테스트/모킹용 송신 훅 (HttpClient.send 와 같은 계약, 본문은 스트림) */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<InputStream> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final UrlGuard guard;
    private final DownloadCache cache;
    private final HttpSender sender;
    private final Duration timeout;
    private final long maxBytes;
    private final int maxRedirects;
    private final String userAgent;
    private final ConcurrentHashMap<String, ReentrantLock> inFlight = new ConcurrentHashMap<>();

    /** 기본 구현: 시스템 DNS 기반 SsrfGuard + JDK HttpClient */
    public RemoteFetcher(CacheConfig config, DownloadCache cache) {
        this(config, cache, new SsrfGuard(), defaultSender(config));
    }

    /** DI/테스트용 */
    public RemoteFetcher(CacheConfig config, DownloadCache cache, UrlGuard guard, HttpSender sender) {
        Objects.requireNonNull(config, "config").validate();
        this.cache = Objects.requireNonNull(cache, "cache");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.timeout = config.getTimeout();
        this.maxBytes = config.getMaxDownloadBytes();
        this.maxRedirects = config.getMaxRedirects();
        this.userAgent = config.getUserAgent();
    }

    /** 자동 리다이렉트 끔. 리다이렉트는 fetch 루프가 홉마다 검사하며 처리 */
    static HttpSender defaultSender(CacheConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofInputStream());
    }

    public Path fetch(String url) throws FetchException {
        return fetch(url, false);
    }

    public Path fetch(String url, boolean forceRefresh) throws FetchException {
        // 1) SSRF 검사 (실패는 그대로 전파)
        try {
            guard.validate(url);
        } catch (FetchException blocked) {
            SLOG.warn("fetch-blocked", "url", url, "reason", blocked.getMessage());
            throw blocked;
        }

        // 2) 캐시
        if (!forceRefresh) {
            Optional<CachedDownload> hit = cache.lookup(url);
            if (hit.isPresent()) {
                SLOG.debug("fetch-cache-hit", "url", url, "file", hit.get().path().getFileName());
                return hit.get().path();
            }
        }

        ReentrantLock lock = inFlight.computeIfAbsent(url, k -> new ReentrantLock());
        lock.lock();
        try {
            // 앞선 호출자가 방금 받아뒀으면 그대로 사용
            if (!forceRefresh) {
                Optional<CachedDownload> hit = cache.lookup(url);
                if (hit.isPresent()) return hit.get().path();
            }
            long started = System.nanoTime();
            SLOG.info("fetch-start", "url", url, "force", forceRefresh);

            byte[] body = download(url);

            CachedDownload saved;
            try {
                saved = cache.store(url, body);
            } catch (IOException e) {
                throw new TransportException(url, "Could not write downloaded PDF to cache: " + e.getMessage(), e);
            }
            long ms = (System.nanoTime() - started) / 1_000_000;
            LOG.info("Fetched {} ({} bytes, {} ms)", url, body.length, ms);
            SLOG.info("fetch-done", "url", url, "bytes", body.length, "ms", ms);
            return saved.path();
        } finally {
            lock.unlock();
            if (!lock.hasQueuedThreads()) inFlight.remove(url, lock);
        }
    }

    /** 호출자 풀에서 실행. 실패는 CompletionException(cause=FetchException) */
    public CompletableFuture<Path> fetchAsync(String url, boolean forceRefresh, Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> {
            try {
                return fetch(url, forceRefresh);
            } catch (FetchException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /* =========================
       다운로드 루프
       ========================= */

    private byte[] download(String url) throws FetchException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        String current = url;

        for (int hop = 0; hop < maxRedirects; hop++) {
            HttpResponse<InputStream> res = send(current);
            int code = res.statusCode();

            // 리다이렉트: 본문은 읽지 않고 다음 대상 검사 후 계속
            if (isRedirect(code)) {
                Optional<String> location = res.headers().firstValue("Location");
                closeQuietly(res.body());
                if (location.isEmpty() || location.get().isBlank()) {
                    throw new TransportException(current, code, "Redirect with no target URL (HTTP " + code + ")");
                }
                String next = resolveLocation(current, location.get());
                try {
                    guard.validate(next);
                } catch (FetchException blocked) {
                    SLOG.warn("fetch-redirect-blocked", "url", url, "from", current, "to", next);
                    throw blocked;
                }
                SLOG.debug("fetch-redirect", "from", current, "to", next, "status", code, "hop", hop + 1);
                current = next;
                continue;
            }

            try (InputStream in = res.body()) {
                if (code < 200 || code >= 300) {
                    throw TransportException.status(current, code);
                }

                long declared = contentLength(res);
                if (declared > maxBytes) {
                    throw new TooLargeException(current, maxBytes, declared, true);
                }

                byte[] body = readBounded(in, current, deadline);

                String contentType = res.headers().firstValue("Content-Type").orElse("");
                if (!contentType.toLowerCase(Locale.ROOT).contains("pdf") && !hasPdfMagic(body)) {
                    throw new NotAPdfException(url, contentType);
                }
                return body;
            } catch (FetchException e) {
                throw e;
            } catch (IOException closeFailure) {
                // try-with-resources close 실패
                throw new TransportException(current, "Error closing response: " + closeFailure.getMessage(), closeFailure);
            }
        }
        throw new TooManyRedirectsException(url, maxRedirects);
    }

    private HttpResponse<InputStream> send(String url) throws TransportException {
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/pdf,*/*;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new TransportException(url, "Invalid request URL: " + e.getMessage(), e);
        }
        try {
            return sender.send(req);
        } catch (HttpTimeoutException e) {
            throw new TransportException(url, "Timed out after " + timeout.toSeconds() + "s: " + url, e);
        } catch (IOException e) {
            throw new TransportException(url, "Request failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(url, "Interrupted while fetching " + url, e);
        }
    }

    /**
     * 본문을 읽기 스레드에 넘기고 데드라인까지만 기다린다.
     * 시간 초과 시 읽기 스레드를 인터럽트하고 스트림을 닫아 막힌 read 를 풀어준다.
     */
    private byte[] readBounded(InputStream in, String url, long deadline) throws FetchException {
        if (in == null) return new byte[0];
        Future<byte[]> task = BODY_READERS.submit(() -> drain(in, url, deadline));
        try {
            return task.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            closeQuietly(in);
            throw new TransportException(url, -1, "Download timed out after " + timeout.toSeconds() + "s: " + url);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchException) throw (FetchException) cause;
            throw new TransportException(url, "Error reading response body: " + cause, cause);
        } catch (InterruptedException e) {
            task.cancel(true);
            closeQuietly(in);
            Thread.currentThread().interrupt();
            throw new TransportException(url, "Interrupted while fetching " + url, e);
        }
    }

    /** 청크 단위로 읽으며 누적 크기와 전체 데드라인을 확인 */
    private byte[] drain(InputStream in, String url, long deadline) throws FetchException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[CHUNK_SIZE];
        long total = 0;
        while (true) {
            int n;
            try {
                n = in.read(buf);
            } catch (IOException e) {
                throw new TransportException(url, "Error reading response body: " + e.getMessage(), e);
            }
            if (n < 0) break;
            total += n;
            if (total > maxBytes) {
                throw new TooLargeException(url, maxBytes, total, false);
            }
            if (System.nanoTime() - deadline > 0) {
                throw new TransportException(url, -1, "Download timed out after " + timeout.toSeconds() + "s: " + url);
            }
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    /* =========================
       helpers
       ========================= */

    static boolean isRedirect(int code) {
        return code == 301 || code == 302 || code == 303 || code == 307 || code == 308;
    }

    static boolean hasPdfMagic(byte[] body) {
        if (body == null || body.length < PDF_MAGIC.length) return false;
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (body[i] != PDF_MAGIC[i]) return false;
        }
        return true;
    }

    /** 헤더가 없거나 숫자가 아니면 -1 (스트리밍 검사에 맡김) */
    private static long contentLength(HttpResponse<?> res) {
        Optional<String> v = res.headers().firstValue("Content-Length");
        if (v.isEmpty()) return -1L;
        try {
            return Long.parseLong(v.get().trim());
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private static String resolveLocation(String current, String location) throws TransportException {
        try {
            return URI.create(current).resolve(location.trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new TransportException(current, "Invalid redirect target: " + location, e);
        }
    }

    private static void closeQuietly(InputStream in) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("Ignoring close failure on response body: {}", e.toString());
        }
    }
}
