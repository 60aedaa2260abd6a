package com.pdfcache.core.service;

import com.pdfcache.core.cache.DocumentContentCache;
import com.pdfcache.core.cache.DownloadCache;
import com.pdfcache.core.error.BlockedUrlException;
import com.pdfcache.core.error.PdfParseException;
import com.pdfcache.core.fetch.RemoteFetcher;
import com.pdfcache.core.model.CacheConfig;
import com.pdfcache.core.parse.SamplePdfs;
import com.pdfcache.core.security.SsrfGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.*;

class DocumentServiceTest {

    @TempDir
    Path tmp;

    private CacheConfig cfg;
    private DownloadCache downloads;
    private DocumentContentCache content;
    private CountingParser parser;
    private DocumentService svc;
    private Path pdf;

    @BeforeEach
    void setUp() throws Exception {
        cfg = CacheConfig.defaults()
                .setDownloadDir(tmp.resolve("downloads"))
                .setContentDir(tmp.resolve("content"))
                .setConcurrency(2);
        downloads = new DownloadCache(cfg.getDownloadDir());
        content = new DocumentContentCache(cfg.getContentDir(), cfg.getContentTtl());
        parser = new CountingParser();
        // 네트워크는 쓰지 않는다: 호출되면 실패
        RemoteFetcher fetcher = new RemoteFetcher(cfg, downloads, new SsrfGuard(host -> {
            throw new java.net.UnknownHostException(host);
        }), req -> {
            throw new AssertionError("unexpected network call: " + req.uri());
        });
        svc = new DocumentService(cfg, downloads, content, fetcher, parser);

        pdf = tmp.resolve("doc.pdf");
        SamplePdfs.write(pdf, 5, true);
    }

    @AfterEach
    void tearDown() {
        svc.close();
    }

    @Test
    void resolve_local_file() throws Exception {
        assertThat(svc.resolve(pdf.toString())).isEqualTo(pdf.toAbsolutePath().normalize());
    }

    @Test
    void resolve_missing_or_directory_is_no_such_file() {
        assertThatThrownBy(() -> svc.resolve(tmp.resolve("missing.pdf").toString())).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> svc.resolve(tmp.toString())).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void resolve_url_goes_through_fetcher() {
        assertThatThrownBy(() -> svc.resolve("https://nowhere.invalid/a.pdf"))
                .isInstanceOf(BlockedUrlException.class);
    }

    @Test
    void resolve_async_surfaces_failures() throws Exception {
        assertThat(svc.resolveAsync(pdf.toString(), false).get()).isEqualTo(pdf.toAbsolutePath().normalize());
        assertThatThrownBy(() -> svc.resolveAsync(tmp.resolve("nope.pdf").toString(), false).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("info: 첫 호출은 파서, 두 번째는 캐시")
    void info_uses_cache_on_second_call() throws Exception {
        DocumentInfo first = svc.info(pdf.toString());
        DocumentInfo second = svc.info(pdf.toString());

        assertThat(first.fromCache()).isFalse();
        assertThat(second.fromCache()).isTrue();
        assertThat(second.pageCount()).isEqualTo(5);
        assertThat(second.metadata()).containsEntry("title", "Sample Title");
        assertThat(second.toc()).hasSize(4);
        assertThat(parser.opens).isEqualTo(1);
    }

    @Test
    @DisplayName("readPages: 미스만 추출, 파서는 최대 한 번")
    void read_pages_extracts_only_misses() throws Exception {
        PageTexts a = svc.readPages(pdf.toString(), "1-2");
        assertThat(a.pages()).containsOnlyKeys(0, 1);
        assertThat(a.pages().get(0)).contains("Page 1 text");
        assertThat(a.cacheHits()).isZero();
        assertThat(a.cacheMisses()).isEqualTo(2);
        assertThat(parser.opens).isEqualTo(1);

        PageTexts b = svc.readPages(pdf.toString(), "1-3");
        assertThat(b.cacheHits()).isEqualTo(2);
        assertThat(b.cacheMisses()).isEqualTo(1);
        assertThat(b.pages().keySet()).containsExactly(0, 1, 2);
        assertThat(parser.opens).isEqualTo(2);
        assertThat(parser.extracted).containsExactly(0, 1, 2);

        PageTexts c = svc.readPages(pdf.toString(), "1-3");
        assertThat(c.cacheMisses()).isZero();
        assertThat(parser.opens).isEqualTo(2);
    }

    @Test
    void read_pages_with_list_and_all_pages() throws Exception {
        PageTexts some = svc.readPages(pdf.toString(), List.of(5, 1, 1, 99));
        assertThat(some.pages().keySet()).containsExactly(0, 4);

        PageTexts all = svc.readPages(pdf.toString(), (String) null);
        assertThat(all.pages()).hasSize(5);
        assertThat(all.cacheHits()).isEqualTo(2);
    }

    @Test
    void modified_file_is_reparsed() throws Exception {
        svc.info(pdf.toString());
        SamplePdfs.write(pdf, 2, false);
        Files.setLastModifiedTime(pdf, java.nio.file.attribute.FileTime.fromMillis(System.currentTimeMillis() + 10_000));

        DocumentInfo after = svc.info(pdf.toString());

        assertThat(after.fromCache()).isFalse();
        assertThat(after.pageCount()).isEqualTo(2);
        assertThat(parser.opens).isEqualTo(2);
    }

    @Test
    void corrupt_pdf_is_parse_error() throws Exception {
        Path junk = Files.writeString(tmp.resolve("junk.pdf"), "not a pdf");
        assertThatThrownBy(() -> svc.info(junk.toString())).isInstanceOf(PdfParseException.class);
    }

    @Test
    void cache_management_passthroughs() throws Exception {
        String url = "https://example.com/stored.pdf";
        downloads.store(url, Files.readAllBytes(pdf));
        svc.readPages(pdf.toString(), "1");

        assertThat(svc.downloadStats().fileCount()).isEqualTo(1);
        assertThat(svc.contentStats().totalFiles()).isEqualTo(1);
        assertThat(svc.contentStats().totalPages()).isEqualTo(1);

        assertThat(svc.clearDownloads()).isEqualTo(1);
        assertThat(svc.clearContentCache()).isEqualTo(1);
        assertThat(svc.downloadStats().fileCount()).isZero();
        assertThat(svc.contentStats().totalFiles()).isZero();
    }

    @Test
    void cached_download_is_used_without_network() throws Exception {
        // 검사 단계는 여전히 거친다: 해석 불가 호스트는 캐시가 있어도 차단
        String url = "https://example.com/stored.pdf";
        downloads.store(url, Files.readAllBytes(pdf));

        assertThatThrownBy(() -> svc.info(url)).isInstanceOf(BlockedUrlException.class);

        RemoteFetcher permissive = new RemoteFetcher(cfg, downloads, u -> { }, req -> {
            throw new AssertionError("unexpected network call");
        });
        try (DocumentService open = new DocumentService(cfg, downloads, content, permissive, parser)) {
            DocumentInfo info = open.info(url);
            assertThat(info.pageCount()).isEqualTo(5);
            assertThat(info.source()).isEqualTo(url);
        }
    }
}
