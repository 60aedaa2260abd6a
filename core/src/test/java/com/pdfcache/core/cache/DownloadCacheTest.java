package com.pdfcache.core.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class DownloadCacheTest {

    private static final byte[] PDF = "%PDF-1.4\n%%EOF\n".getBytes(StandardCharsets.US_ASCII);

    @TempDir
    Path dir;

    @Test
    void filename_is_deterministic_and_distinct() {
        String a = DownloadCache.filenameFor("https://example.com/paper.pdf");
        assertThat(DownloadCache.filenameFor("https://example.com/paper.pdf")).isEqualTo(a);
        assertThat(DownloadCache.filenameFor("https://example.com/other.pdf")).isNotEqualTo(a);
        assertThat(DownloadCache.filenameFor("https://example.com/paper.pdf?v=2")).isNotEqualTo(a);
    }

    @Test
    void filename_keeps_pdf_basename_suffix() {
        String name = DownloadCache.filenameFor("https://example.com/docs/document.pdf");
        assertThat(name).matches("[0-9a-f]{16}_document\\.pdf");
    }

    @Test
    void filename_without_pdf_path_is_hash_only() {
        String name = DownloadCache.filenameFor("https://example.com/download?id=42");
        assertThat(name).matches("[0-9a-f]{16}\\.pdf").doesNotContain("_");
    }

    @Test
    void filename_sanitizes_basename() {
        String name = DownloadCache.filenameFor("https://example.com/a%20b$c.pdf");
        assertThat(name.substring(17)).isEqualTo("a20bc.pdf");
        assertThat(DownloadCache.sanitize("../etc/pass wd")).isEqualTo("..etcpasswd");
    }

    @Test
    void store_then_lookup_hits() throws Exception {
        DownloadCache cache = new DownloadCache(dir);
        String url = "https://example.com/paper.pdf";

        assertThat(cache.lookup(url)).isEmpty();
        CachedDownload saved = cache.store(url, PDF);

        assertThat(saved.path().getParent()).isEqualTo(dir.toAbsolutePath().normalize());
        assertThat(saved.sizeBytes()).isEqualTo(PDF.length);
        assertThat(Files.readAllBytes(saved.path())).isEqualTo(PDF);
        assertThat(cache.lookup(url)).map(CachedDownload::path).contains(saved.path());
        // 임시 파일이 남지 않는다
        try (var s = Files.list(dir)) {
            assertThat(s.filter(p -> p.getFileName().toString().endsWith(".tmp"))).isEmpty();
        }
    }

    @Test
    void lookup_backfills_from_disk_after_restart() throws Exception {
        String url = "https://example.com/paper.pdf";
        new DownloadCache(dir).store(url, PDF);

        DownloadCache fresh = new DownloadCache(dir); // 빈 인덱스
        Optional<CachedDownload> hit = fresh.lookup(url);
        assertThat(hit).isPresent();
        assertThat(hit.get().path().getFileName().toString()).isEqualTo(DownloadCache.filenameFor(url));
    }

    @Test
    void stale_index_entry_is_a_miss() throws Exception {
        DownloadCache cache = new DownloadCache(dir);
        String url = "https://example.com/gone.pdf";
        CachedDownload saved = cache.store(url, PDF);

        Files.delete(saved.path());

        assertThat(cache.lookup(url)).isEmpty();
        assertThat(saved.exists()).isFalse();
    }

    @Test
    void clear_is_best_effort_and_counts_deleted_only() throws Exception {
        DownloadCache cache = new DownloadCache(dir);
        cache.store("https://example.com/a.pdf", PDF);
        cache.store("https://example.com/b.pdf", PDF);
        cache.store("https://example.com/c", PDF);

        // 지울 수 없는 항목: 비어있지 않은 디렉터리
        Path stuck = Files.createDirectory(dir.resolve("stuck.pdf"));
        Files.writeString(stuck.resolve("inner.txt"), "x");
        // *.pdf 가 아닌 파일은 건드리지 않는다
        Path other = Files.writeString(dir.resolve("notes.txt"), "keep");

        int deleted = cache.clear();

        assertThat(deleted).isEqualTo(3);
        assertThat(stuck).exists();
        assertThat(other).exists();
        assertThat(cache.lookup("https://example.com/a.pdf")).isEmpty();
    }

    @Test
    void stats_reflect_directory_contents() throws Exception {
        DownloadCache cache = new DownloadCache(dir);
        assertThat(cache.stats().fileCount()).isZero();

        cache.store("https://example.com/a.pdf", PDF);
        cache.store("https://example.com/b.pdf", new byte[2 * 1024 * 1024]);
        Files.createDirectory(dir.resolve("folder.pdf")); // 일반 파일만 센다

        DownloadCacheStats s = cache.stats();
        assertThat(s.fileCount()).isEqualTo(2);
        assertThat(s.totalBytes()).isEqualTo(PDF.length + 2L * 1024 * 1024);
        assertThat(s.totalMegabytes()).isEqualTo(2.0);
        assertThat(s.directory()).isEqualTo(dir.toAbsolutePath().normalize());
    }

    @Test
    void posix_permissions_are_owner_only() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path sub = dir.resolve("downloads");
        DownloadCache cache = new DownloadCache(sub);
        CachedDownload saved = cache.store("https://example.com/a.pdf", PDF);

        assertThat(Files.getPosixFilePermissions(sub)).isEqualTo(DownloadCache.DIR_PERMS);
        assertThat(Files.getPosixFilePermissions(saved.path())).isEqualTo(DownloadCache.FILE_PERMS);
    }
}
