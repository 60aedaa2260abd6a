package com.pdfcache.core.cache;

import com.pdfcache.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 다운로드 캐시: URL → 로컬 PDF 파일.
 * - 1차: 인메모리 인덱스, 2차: 결정적 파일명으로 디스크 probe (히트 시 인덱스 복구)
 * - 파일명: sha256(url) 앞 16자 [+ "_" + 정제된 basename] + .pdf
 * - 디렉터리 0700, 파일 0600 (POSIX 파일시스템에서만)
 * 별도 인덱스 파일은 두지 않는다. 프로세스 재시작 후에도 파일명만으로 찾을 수 있다.
 */
public final class DownloadCache {

    private static final Logger LOG = LoggerFactory.getLogger(DownloadCache.class);
    private static final StructuredLog SLOG = StructuredLog.get(DownloadCache.class);

    static final Set<PosixFilePermission> DIR_PERMS = PosixFilePermissions.fromString("rwx------");
    static final Set<PosixFilePermission> FILE_PERMS = PosixFilePermissions.fromString("rw-------");

    private static final int HASH_CHARS = 16;

    private final Path directory;
    private final boolean posix;
    private final Map<String, Path> index = new HashMap<>(); // guarded by this

    public DownloadCache(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
        try {
            Files.createDirectories(this.directory);
            if (posix) Files.setPosixFilePermissions(this.directory, DIR_PERMS);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create download cache directory: " + this.directory, e);
        }
    }

    public Path directory() { return directory; }

    /* =========================
       조회
       ========================= */

    /** 인덱스 → 디스크 probe. 파일이 사라진 인덱스 항목은 조용히 미스 처리 */
    public Optional<CachedDownload> lookup(String url) {
        Objects.requireNonNull(url, "url");
        synchronized (this) {
            Path p = index.get(url);
            if (p != null) {
                if (Files.isRegularFile(p)) return Optional.of(describe(url, p));
                index.remove(url); // stale
            }
        }

        Path probe = directory.resolve(filenameFor(url));
        if (!Files.isRegularFile(probe)) return Optional.empty();

        synchronized (this) {
            index.put(url, probe);
        }
        SLOG.debug("download-index-backfill", "url", url, "file", probe.getFileName());
        return Optional.of(describe(url, probe));
    }

    /* =========================
       저장 (RemoteFetcher 전용)
       ========================= */

    /**
     * 본문 전체가 검증된 뒤에만 호출된다. 임시 파일에 쓰고 원자적 이동 → 인덱스 등록.
     * 실패하면 아무것도 등록되지 않는다.
     */
    public CachedDownload store(String url, byte[] body) throws IOException {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(body, "body");
        Path target = directory.resolve(filenameFor(url));

        Path tmp = posix
                ? Files.createTempFile(directory, ".dl-", ".tmp", filePermsAttr())
                : Files.createTempFile(directory, ".dl-", ".tmp");
        try {
            Files.write(tmp, body);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            if (posix) Files.setPosixFilePermissions(target, FILE_PERMS);
        } catch (IOException e) {
            try { Files.deleteIfExists(tmp); } catch (IOException suppressed) { e.addSuppressed(suppressed); }
            throw e;
        }

        synchronized (this) {
            index.put(url, target);
        }
        LOG.debug("Stored {} bytes for {} at {}", body.length, url, target);
        return new CachedDownload(url, target, body.length);
    }

    /* =========================
       관리
       ========================= */

    /** 베스트 에포트: 삭제 실패는 세지 않고 넘어간다. 예외를 던지지 않는다. */
    public int clear() {
        int count = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(directory, "*.pdf")) {
            for (Path p : ds) {
                try {
                    Files.delete(p);
                    count++;
                } catch (IOException | SecurityException e) {
                    LOG.warn("Could not delete cached download {}: {}", p.getFileName(), e.toString());
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            LOG.warn("Could not list download cache {}: {}", directory, e.toString());
        }
        synchronized (this) {
            index.clear();
        }
        SLOG.info("download-cache-clear", "deleted", count);
        return count;
    }

    /** 디렉터리 스캔 기준. 외부에서 파일을 지우거나 넣어도 실제 상태를 반영한다. */
    public DownloadCacheStats stats() {
        int files = 0;
        long bytes = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(directory, "*.pdf")) {
            for (Path p : ds) {
                if (!Files.isRegularFile(p)) continue;
                try {
                    bytes += Files.size(p);
                    files++;
                } catch (IOException e) {
                    // 스캔 중 사라진 파일
                    LOG.debug("Skipping {}: {}", p.getFileName(), e.toString());
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            LOG.warn("Could not list download cache {}: {}", directory, e.toString());
        }
        return new DownloadCacheStats(files, bytes, directory);
    }

    /* =========================
       파일명
       ========================= */

    /** 순수 함수: 같은 URL → 같은 파일명. 솔트 없음 */
    public static String filenameFor(String url) {
        String hash = sha256Hex(url).substring(0, HASH_CHARS);

        String path = null;
        try {
            path = new URI(url).getRawPath();
        } catch (Exception ignore) {
            // 파싱 불가 URL 은 해시만 사용
        }
        if (path != null && path.endsWith(".pdf")) {
            String base = path.substring(path.lastIndexOf('/') + 1);
            String safe = sanitize(base);
            if (!safe.isEmpty()) return hash + "_" + safe;
        }
        return hash + ".pdf";
    }

    /** 영숫자, '.', '_', '-' 만 남긴다 */
    static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '.' || c == '_' || c == '-') sb.append(c);
        }
        return sb.toString();
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static CachedDownload describe(String url, Path p) {
        long size;
        try {
            size = Files.size(p);
        } catch (IOException e) {
            size = -1L;
        }
        return new CachedDownload(url, p, size);
    }

    private static FileAttribute<Set<PosixFilePermission>> filePermsAttr() {
        return PosixFilePermissions.asFileAttribute(FILE_PERMS);
    }
}
