package com.pdfcache.core.cache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 콘텐츠 캐시 키: 경로 + 변경 지문(mtime, size).
 * 파일이 수정되면 키가 바뀌므로 이전 텍스트가 히트로 나가지 않는다.
 */
public record DocumentIdentity(Path path, long lastModifiedMillis, long sizeBytes) {

    public DocumentIdentity {
        Objects.requireNonNull(path, "path");
        path = path.toAbsolutePath().normalize();
    }

    /** 파일 속성을 읽어 만든다. 파일이 없으면 NoSuchFileException */
    public static DocumentIdentity of(Path file) throws IOException {
        Path p = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
        return new DocumentIdentity(p, attrs.lastModifiedTime().toMillis(), attrs.size());
    }

    /** sha256(path|mtime|size) 앞 32자. 캐시 파일명으로 쓴다. */
    public String key() {
        String raw = path + "|" + lastModifiedMillis + "|" + sizeBytes;
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(raw.getBytes(StandardCharsets.UTF_8))).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
