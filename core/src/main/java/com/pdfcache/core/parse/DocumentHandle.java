package com.pdfcache.core.parse;

import java.io.IOException;
import java.nio.file.Path;

/** PdfParser.open 으로 얻은 열린 문서. 사용 후 닫는다. */
public interface DocumentHandle extends AutoCloseable {

    Path path();

    int pageCount();

    @Override
    void close() throws IOException;
}
