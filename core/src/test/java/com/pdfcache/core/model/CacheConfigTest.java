package com.pdfcache.core.model;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Test;

class CacheConfigTest {

    @Test
    void defaultsAreValid() {
        CacheConfig cfg = CacheConfig.defaults();
        cfg.validate();

        assertThat(cfg.getMaxDownloadBytes()).isEqualTo(100L * 1024 * 1024);
        assertThat(cfg.getMaxRedirects()).isEqualTo(10);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(cfg.getContentTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(cfg.getConcurrency()).isEqualTo(4);
        assertThat(cfg.getUserAgent()).isEqualTo("pdf-cache");
        assertThat(cfg.getDownloadDir()).isEqualTo(CacheConfig.defaultRoot().resolve("downloads"));
        assertThat(cfg.getContentDir()).isEqualTo(CacheConfig.defaultRoot().resolve("content"));
    }

    @Test
    void setTimeoutSecondsClampsToPositive() {
        CacheConfig cfg = CacheConfig.defaults().setTimeoutSeconds(0);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(1));
        cfg.validate();
    }

    @Test
    void setConcurrencyHasLowerBoundOne() {
        CacheConfig cfg = CacheConfig.defaults().setConcurrency(0);
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        cfg.validate();
    }

    @Test
    void blankUserAgentFallsBackToDefault() {
        assertThat(CacheConfig.defaults().setUserAgent("  ").getUserAgent()).isEqualTo("pdf-cache");
        assertThat(CacheConfig.defaults().setUserAgent(" bot/1.0 ").getUserAgent()).isEqualTo("bot/1.0");
    }

    @Test
    void zeroTtlIsAllowed() {
        CacheConfig cfg = CacheConfig.defaults().setContentTtlHours(0);
        cfg.validate();
        assertThat(cfg.getContentTtl()).isZero();
    }

    @Test
    void validateRejectsBadValues() {
        assertThatThrownBy(() -> CacheConfig.defaults().setMaxDownloadBytes(0).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxDownloadBytes");
        assertThatThrownBy(() -> CacheConfig.defaults().setMaxRedirects(0).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxRedirects");
        assertThatThrownBy(() -> CacheConfig.defaults().setTimeout(Duration.ZERO).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("timeout");
        assertThatThrownBy(() -> CacheConfig.defaults().setContentTtlHours(-1).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("contentTtl");
        assertThrows(NullPointerException.class, () -> CacheConfig.defaults().setDownloadDir(null).validate());
        assertThrows(NullPointerException.class, () -> CacheConfig.defaults().setContentDir(null).validate());
    }

    @Test
    void toStringMentionsDirectories() {
        CacheConfig cfg = CacheConfig.defaults().setDownloadDir(Path.of("dl"));
        assertThat(cfg.toString()).contains("downloadDir=dl").contains("maxRedirects=10");
    }
}
