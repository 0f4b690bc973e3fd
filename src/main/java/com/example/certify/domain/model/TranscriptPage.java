package com.example.certify.domain.model;

import java.util.List;

/**
 * Text of one transcript page as delivered by the extraction layer.
 *
 * @param columnLines lines of the left column followed by lines of the right column
 * @param pageText    whole-page text used for identity lookup
 */
public record TranscriptPage(List<String> columnLines, String pageText) {

    public TranscriptPage {
        columnLines = columnLines == null ? List.of() : List.copyOf(columnLines);
        pageText = pageText == null ? "" : pageText;
    }
}
