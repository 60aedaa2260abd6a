package com.pdfcache.core.cache;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pdfcache.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 파싱 결과(메타데이터/목차/페이지 텍스트) 캐시.
 * - 문서 식별자(경로+mtime+size)당 JSON 파일 하나. 디스크가 원본이고 앞단 맵은 최근 문서 몇 개만 둔다(LRU)
 * - TTL 은 저장 시각 기준. 모든 읽기에서 만료를 확인한다(백그라운드 스위퍼 없음)
 * - 쓰기 시 해당 문서의 만료 부분과 같은 경로의 이전 버전을 정리, stats/clearAll 은 전체 정리
 * - TTL <= 0 이면 저장은 되지만 읽기는 항상 미스
 */
public final class DocumentContentCache {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentContentCache.class);
    private static final StructuredLog SLOG = StructuredLog.get(DocumentContentCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    private static final String SUFFIX = ".json";
    static final int MAX_RESIDENT = 16;

    private final Path directory;
    private final Duration ttl;
    private final CacheClock clock;
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // guarded by this. 접근 순서 LRU
    private final Map<String, StoredDocument> recent = new LinkedHashMap<>(MAX_RESIDENT, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, StoredDocument> eldest) {
            return size() > MAX_RESIDENT;
        }
    };

    public DocumentContentCache(Path directory) {
        this(directory, DEFAULT_TTL, CacheClock.SYSTEM);
    }

    public DocumentContentCache(Path directory, Duration ttl) {
        this(directory, ttl, CacheClock.SYSTEM);
    }

    public DocumentContentCache(Path directory, Duration ttl, CacheClock clock) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.ttl = (ttl == null ? DEFAULT_TTL : ttl);
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create content cache directory: " + this.directory, e);
        }
    }

    public Path directory() { return directory; }
    public Duration ttl() { return ttl; }

    /* =========================
       메타데이터 / 목차
       ========================= */

    public synchronized void saveMetadata(DocumentIdentity id, int pageCount,
                                          Map<String, Object> metadata, List<TocEntry> toc) {
        Objects.requireNonNull(id, "id");
        StoredDocument d = loadOrCreate(id);
        d.meta = new StoredDocument.Meta(
                pageCount,
                metadata == null ? Map.of() : new LinkedHashMap<>(metadata),
                toc == null ? List.of() : List.copyOf(toc),
                now());
        write(id, d);
    }

    public synchronized Optional<DocumentCacheRecord> getMetadata(DocumentIdentity id) {
        Objects.requireNonNull(id, "id");
        StoredDocument d = load(id.key());
        if (d == null || d.meta == null || isExpired(d.meta.createdAt())) {
            SLOG.debug("content-cache-miss", "part", "metadata", "path", id.path());
            return Optional.empty();
        }
        StoredDocument.Meta m = d.meta;
        return Optional.of(new DocumentCacheRecord(id.key(), id.path(), m.pageCount(), m.metadata(), m.toc(), m.createdAt()));
    }

    /* =========================
       페이지 텍스트
       ========================= */

    public synchronized void savePageText(DocumentIdentity id, int pageIndex, String text) {
        Objects.requireNonNull(id, "id");
        if (pageIndex < 0) throw new IllegalArgumentException("pageIndex must be >= 0");
        StoredDocument d = loadOrCreate(id);
        d.pages.put(pageIndex, new StoredDocument.Page(text == null ? "" : text, now()));
        write(id, d);
    }

    /** 여러 페이지를 한 번의 파일 쓰기로 저장 */
    public synchronized void savePagesText(DocumentIdentity id, Map<Integer, String> texts) {
        Objects.requireNonNull(id, "id");
        if (texts == null || texts.isEmpty()) return;
        StoredDocument d = loadOrCreate(id);
        Instant at = now();
        for (Map.Entry<Integer, String> e : texts.entrySet()) {
            if (e.getKey() == null || e.getKey() < 0) throw new IllegalArgumentException("pageIndex must be >= 0");
            d.pages.put(e.getKey(), new StoredDocument.Page(e.getValue() == null ? "" : e.getValue(), at));
        }
        write(id, d);
    }

    public synchronized Optional<String> getPageText(DocumentIdentity id, int pageIndex) {
        Objects.requireNonNull(id, "id");
        StoredDocument d = load(id.key());
        if (d == null) return Optional.empty();
        StoredDocument.Page p = d.pages.get(pageIndex);
        if (p == null || isExpired(p.createdAt())) return Optional.empty();
        return Optional.of(p.text());
    }

    /** 존재하고 만료되지 않은 페이지만 담는다(부분 히트는 정상). 순서는 인자 순서 */
    public synchronized Map<Integer, String> getPagesText(DocumentIdentity id, Collection<Integer> pageIndices) {
        Objects.requireNonNull(id, "id");
        Map<Integer, String> out = new LinkedHashMap<>();
        if (pageIndices == null || pageIndices.isEmpty()) return out;
        StoredDocument d = load(id.key());
        if (d == null) return out;
        for (Integer i : pageIndices) {
            if (i == null) continue;
            StoredDocument.Page p = d.pages.get(i);
            if (p != null && !isExpired(p.createdAt())) out.put(i, p.text());
        }
        return out;
    }

    /* =========================
       관리
       ========================= */

    /** 만료 부분을 먼저 정리한 뒤 집계 */
    public synchronized ContentCacheStats stats() {
        purgeExpired();
        int files = 0;
        int pages = 0;
        long bytes = 0;
        for (Path f : listCacheFiles()) {
            StoredDocument d = peek(keyOf(f));
            if (d == null) continue;
            files++;
            pages += d.pages.size();
            try {
                bytes += Files.size(f);
            } catch (IOException e) {
                LOG.debug("Skipping {}: {}", f.getFileName(), e.toString());
            }
        }
        return new ContentCacheStats(files, pages, bytes);
    }

    /** 모든 문서 삭제. 삭제된 문서 수 반환(삭제 실패는 세지 않음) */
    public synchronized int clearAll() {
        int count = 0;
        for (Path f : listCacheFiles()) {
            try {
                Files.delete(f);
                count++;
            } catch (IOException e) {
                LOG.warn("Could not delete content cache file {}: {}", f.getFileName(), e.toString());
            }
        }
        recent.clear();
        SLOG.info("content-cache-clear", "deleted", count);
        return count;
    }

    /** 디렉터리 전체에서 만료 부분 제거, 빈 문서는 파일째 삭제 */
    public synchronized int purgeExpired() {
        int removed = 0;
        for (Path f : listCacheFiles()) {
            String key = keyOf(f);
            StoredDocument d = peek(key);
            if (d == null) continue;
            if (dropExpiredParts(d)) {
                removed++;
                persistOrDelete(key, d);
            }
        }
        if (removed > 0) SLOG.debug("content-cache-purge", "documents", removed);
        return removed;
    }

    /* =========================
       내부
       ========================= */

    private boolean isExpired(Instant createdAt) {
        if (createdAt == null) return true;
        if (ttl.isZero() || ttl.isNegative()) return true;
        long age = clock.nowMillis() - createdAt.toEpochMilli();
        return age >= ttl.toMillis();
    }

    private Instant now() {
        return Instant.ofEpochMilli(clock.nowMillis());
    }

    private StoredDocument loadOrCreate(DocumentIdentity id) {
        StoredDocument d = load(id.key());
        return d != null ? d : StoredDocument.of(id);
    }

    /** LRU → 디스크. 디스크에서 읽은 문서는 LRU 에 올린다 */
    private StoredDocument load(String key) {
        StoredDocument d = recent.get(key);
        if (d != null) return d;
        d = readFile(key);
        if (d != null) recent.put(key, d);
        return d;
    }

    /** 전체 스캔용: LRU 에 없으면 디스크에서 읽되 올리지 않는다 */
    private StoredDocument peek(String key) {
        StoredDocument d = recent.get(key);
        return d != null ? d : readFile(key);
    }

    /** 깨진 JSON 은 지우고 미스 처리 */
    private StoredDocument readFile(String key) {
        Path f = fileFor(key);
        if (!Files.isRegularFile(f)) return null;
        try {
            StoredDocument d = om.readValue(f.toFile(), StoredDocument.class);
            if (d.pages == null) d.pages = new TreeMap<>();
            return d;
        } catch (IOException e) {
            LOG.warn("Discarding unreadable content cache file {}: {}", f.getFileName(), e.toString());
            try { Files.deleteIfExists(f); } catch (IOException ignore) { /* 다음 쓰기에서 덮어씀 */ }
            return null;
        }
    }

    /** 쓰기 시 정리: 이 문서의 만료 부분 + (새 지문이면) 같은 경로의 이전 지문 */
    private void write(DocumentIdentity id, StoredDocument d) {
        dropExpiredParts(d);
        if (!Files.exists(fileFor(id.key()))) {
            evictOlderVersions(id);
        }
        recent.put(id.key(), d);
        persistOrDelete(id.key(), d);
    }

    private boolean dropExpiredParts(StoredDocument d) {
        boolean changed = false;
        if (d.meta != null && isExpired(d.meta.createdAt())) {
            d.meta = null;
            changed = true;
        }
        Iterator<Map.Entry<Integer, StoredDocument.Page>> it = d.pages.entrySet().iterator();
        while (it.hasNext()) {
            if (isExpired(it.next().getValue().createdAt())) {
                it.remove();
                changed = true;
            }
        }
        return changed;
    }

    /** 디스크 기준: 다른 키 파일 중 path 가 같은 것을 지운다 */
    private void evictOlderVersions(DocumentIdentity id) {
        String path = id.path().toString();
        String key = id.key();
        List<String> stale = new ArrayList<>();
        for (Path f : listCacheFiles()) {
            String k = keyOf(f);
            if (!k.equals(key) && path.equals(peekPath(f))) stale.add(k);
        }
        for (Map.Entry<String, StoredDocument> e : recent.entrySet()) {
            if (!e.getKey().equals(key) && path.equals(e.getValue().path) && !stale.contains(e.getKey())) {
                stale.add(e.getKey());
            }
        }
        for (String k : stale) {
            recent.remove(k);
            try {
                Files.deleteIfExists(fileFor(k));
            } catch (IOException e) {
                LOG.debug("Could not evict {}: {}", k, e.toString());
            }
        }
    }

    private void persistOrDelete(String key, StoredDocument d) {
        Path target = fileFor(key);
        if (d.isEmpty()) {
            recent.remove(key);
            try {
                Files.deleteIfExists(target);
            } catch (IOException e) {
                LOG.debug("Could not delete {}: {}", target.getFileName(), e.toString());
            }
            return;
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            om.writeValue(tmp.toFile(), d);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            // 디스크 쓰기 실패는 치명적이지 않다: LRU 사본이 남아 있는 동안은 히트
            LOG.warn("Could not persist content cache file {}: {}", target.getFileName(), e.toString());
            try { Files.deleteIfExists(tmp); } catch (IOException ignore) { /* 남아도 *.json 스캔에 안 걸림 */ }
        }
    }

    /** 파일 전체를 읽지 않고 최상위 "path" 필드만 본다 */
    private String peekPath(Path f) {
        try (JsonParser p = om.getFactory().createParser(f.toFile())) {
            if (p.nextToken() != JsonToken.START_OBJECT) return null;
            while (p.nextToken() == JsonToken.FIELD_NAME) {
                String name = p.currentName();
                p.nextToken();
                if ("path".equals(name)) return p.getValueAsString();
                p.skipChildren();
            }
        } catch (IOException e) {
            LOG.debug("Could not read path of {}: {}", f.getFileName(), e.toString());
        }
        return null;
    }

    /** LRU 에 올라 있는 문서 수 */
    synchronized int residentCount() {
        return recent.size();
    }

    private List<Path> listCacheFiles() {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path p : ds) {
                if (Files.isRegularFile(p)) out.add(p);
            }
        } catch (IOException | DirectoryIteratorException e) {
            LOG.warn("Could not list content cache {}: {}", directory, e.toString());
        }
        return out;
    }

    private Path fileFor(String key) {
        return directory.resolve(key + SUFFIX);
    }

    private static String keyOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - SUFFIX.length());
    }
}
