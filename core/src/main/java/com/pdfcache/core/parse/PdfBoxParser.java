package com.pdfcache.core.parse;

import com.pdfcache.core.cache.TocEntry;
import com.pdfcache.core.error.PdfParseException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** PDFBox 2.x 기반 PdfParser. */
public final class PdfBoxParser implements PdfParser {

    private static final Logger LOG = LoggerFactory.getLogger(PdfBoxParser.class);

    // 깨진 아웃라인(순환 참조 등) 방어
    private static final int MAX_TOC_DEPTH = 32;
    private static final int MAX_TOC_ENTRIES = 10_000;

    @Override
    public DocumentHandle open(Path path) throws PdfParseException {
        Objects.requireNonNull(path, "path");
        try {
            PDDocument doc = PDDocument.load(path.toFile());
            LOG.debug("Opened {} ({} pages)", path, doc.getNumberOfPages());
            return new PdfBoxHandle(path, doc);
        } catch (IOException e) {
            throw new PdfParseException("Cannot open PDF: " + path + " (" + e.getMessage() + ")", e);
        }
    }

    @Override
    public String extractText(DocumentHandle handle, int pageIndex) throws PdfParseException {
        PdfBoxHandle h = unwrap(handle);
        if (pageIndex < 0 || pageIndex >= h.pageCount()) {
            throw new IndexOutOfBoundsException("page " + pageIndex + " of " + h.pageCount());
        }
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setStartPage(pageIndex + 1);   // PDFBox 는 1-based
            stripper.setEndPage(pageIndex + 1);
            return stripper.getText(h.doc);
        } catch (IOException e) {
            throw new PdfParseException("Text extraction failed on page " + pageIndex + " of " + h.path, e);
        }
    }

    @Override
    public Map<String, Object> extractMetadata(DocumentHandle handle) {
        PdfBoxHandle h = unwrap(handle);
        PDDocumentInformation info = h.doc.getDocumentInformation();

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("format", "PDF " + h.doc.getVersion());
        out.put("title", nz(info == null ? null : info.getTitle()));
        out.put("author", nz(info == null ? null : info.getAuthor()));
        out.put("subject", nz(info == null ? null : info.getSubject()));
        out.put("keywords", nz(info == null ? null : info.getKeywords()));
        out.put("creator", nz(info == null ? null : info.getCreator()));
        out.put("producer", nz(info == null ? null : info.getProducer()));
        out.put("creationDate", iso(info == null ? null : info.getCreationDate()));
        out.put("modDate", iso(info == null ? null : info.getModificationDate()));
        out.put("encrypted", h.doc.isEncrypted());
        return out;
    }

    @Override
    public List<TocEntry> extractToc(DocumentHandle handle) throws PdfParseException {
        PdfBoxHandle h = unwrap(handle);
        PDDocumentOutline outline = h.doc.getDocumentCatalog().getDocumentOutline();
        List<TocEntry> out = new ArrayList<>();
        if (outline == null) return out;
        try {
            walk(h.doc, outline, 1, out);
        } catch (IOException e) {
            throw new PdfParseException("Outline extraction failed for " + h.path, e);
        }
        return out;
    }

    private static void walk(PDDocument doc, PDOutlineNode node, int level, List<TocEntry> out) throws IOException {
        if (level > MAX_TOC_DEPTH) return;
        for (PDOutlineItem item : node.children()) {
            if (out.size() >= MAX_TOC_ENTRIES) return;
            out.add(new TocEntry(level, item.getTitle(), pageOf(doc, item)));
            if (item.hasChildren()) walk(doc, item, level + 1, out);
        }
    }

    /** 1-based, 목적지를 못 찾으면 -1 */
    private static int pageOf(PDDocument doc, PDOutlineItem item) throws IOException {
        PDPage page = item.findDestinationPage(doc);
        if (page == null) return -1;
        int idx = doc.getPages().indexOf(page);
        return idx < 0 ? -1 : idx + 1;
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }

    private static String iso(Calendar c) {
        return c == null ? "" : c.toInstant().toString();
    }

    private static PdfBoxHandle unwrap(DocumentHandle handle) {
        if (handle instanceof PdfBoxHandle h) {
            if (h.closed) throw new IllegalStateException("document already closed: " + h.path);
            return h;
        }
        throw new IllegalArgumentException("handle was not opened by PdfBoxParser: " + handle);
    }

    private static final class PdfBoxHandle implements DocumentHandle {
        private final Path path;
        private final PDDocument doc;
        private volatile boolean closed;

        PdfBoxHandle(Path path, PDDocument doc) {
            this.path = path;
            this.doc = doc;
        }

        @Override public Path path() { return path; }
        @Override public int pageCount() { return doc.getNumberOfPages(); }

        @Override
        public void close() throws IOException {
            if (closed) return;
            closed = true;
            doc.close();
        }

        @Override
        public String toString() { return "PdfBoxHandle[" + path + "]"; }
    }
}
