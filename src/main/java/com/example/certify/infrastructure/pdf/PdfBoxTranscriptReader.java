package com.example.certify.infrastructure.pdf;

import com.example.certify.domain.model.TranscriptPage;
import com.example.certify.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.PDFTextStripperByArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure service that turns a two-column transcript PDF into per-page text.
 * Each page is cropped into a left and a right half; the left column's lines come first.
 */
@Service
public class PdfBoxTranscriptReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTranscriptReader.class);
    private static final String LEFT_COLUMN = "left";
    private static final String RIGHT_COLUMN = "right";

    /**
     * Loads the PDF bytes and extracts column lines and whole-page text for every page.
     *
     * @param bytes  PDF bytes already loaded into memory
     * @param source logical name used in diagnostics
     * @return pages in document order
     * @throws PdfProcessingException when PDFBox cannot read the document
     */
    public List<TranscriptPage> readPages(byte[] bytes, String source) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            List<TranscriptPage> pages = new ArrayList<>(document.getNumberOfPages());
            for (int pageIndex = 0; pageIndex < document.getNumberOfPages(); pageIndex++) {
                PDPage page = document.getPage(pageIndex);
                pages.add(new TranscriptPage(mergeColumns(page), extractPageText(document, pageIndex)));
            }
            log.debug("Read {} page(s) from {}", pages.size(), source);
            return pages;
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to extract text from transcript " + source, e);
        }
    }

    /**
     * Crops the page into two halves and concatenates the left column's lines with the right column's.
     *
     * @param page page to crop
     * @return non-blank lines, left column first
     * @throws IOException when PDFBox cannot read the page content
     */
    private List<String> mergeColumns(PDPage page) throws IOException {
        PDRectangle box = page.getCropBox();
        float halfWidth = box.getWidth() / 2f;
        PDFTextStripperByArea stripper = new PDFTextStripperByArea();
        stripper.setSortByPosition(true);
        stripper.setLineSeparator("\n");
        stripper.addRegion(LEFT_COLUMN, new Rectangle2D.Float(0f, 0f, halfWidth, box.getHeight()));
        stripper.addRegion(RIGHT_COLUMN, new Rectangle2D.Float(halfWidth, 0f, halfWidth, box.getHeight()));
        stripper.extractRegions(page);

        List<String> lines = new ArrayList<>(toLines(stripper.getTextForRegion(LEFT_COLUMN)));
        lines.addAll(toLines(stripper.getTextForRegion(RIGHT_COLUMN)));
        return lines;
    }

    /**
     * Uses {@link PDFTextStripper} to extract the text of a single page for identity lookup.
     *
     * @param document  loaded PDF document
     * @param pageIndex zero-based page index
     * @return page text
     * @throws IOException when PDFBox cannot read the page content
     */
    private String extractPageText(PDDocument document, int pageIndex) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setLineSeparator("\n");
        stripper.setStartPage(pageIndex + 1);
        stripper.setEndPage(pageIndex + 1);
        return stripper.getText(document);
    }

    private static List<String> toLines(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
