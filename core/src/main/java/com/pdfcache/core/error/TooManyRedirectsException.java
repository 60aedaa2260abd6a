package com.pdfcache.core.error;

public final class TooManyRedirectsException extends FetchException {

    private final int maxRedirects;

    public TooManyRedirectsException(String url, int maxRedirects) {
        super(url, "Too many redirects (max " + maxRedirects + ")");
        this.maxRedirects = maxRedirects;
    }

    public int getMaxRedirects() { return maxRedirects; }
}
