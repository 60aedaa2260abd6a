package com.pdfcache.core.fetch;

import java.io.IOException;
import java.io.InputStream;

/** 읽힌 바이트 수와 close 여부를 기록. size 만큼 'x' 를 내보낸다(앞 4바이트는 %PDF). */
final class CountingInputStream extends InputStream {
    private static final byte[] MAGIC = {'%', 'P', 'D', 'F'};
    private final long size;
    long read = 0;
    boolean closed = false;

    CountingInputStream(long size) { this.size = size; }

    @Override
    public int read() throws IOException {
        if (read >= size) return -1;
        int b = read < MAGIC.length ? MAGIC[(int) read] : 'x';
        read++;
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (read >= size) return -1;
        int n = (int) Math.min(len, size - read);
        for (int i = 0; i < n; i++) b[off + i] = (byte) read();
        return n;
    }

    @Override
    public void close() { closed = true; }
}
