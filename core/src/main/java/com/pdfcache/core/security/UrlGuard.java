package com.pdfcache.core.security;

import com.pdfcache.core.error.BlockedUrlException;

/** 연결 전에 URL 을 검사하는 훅. RemoteFetcher 는 원래 URL 과 모든 리다이렉트 홉에 대해 호출한다. */
@FunctionalInterface
public interface UrlGuard {
    void validate(String url) throws BlockedUrlException;
}
