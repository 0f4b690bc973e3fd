package com.example.certify.domain.parser;

import com.example.certify.domain.model.StudentIdentity;
import com.example.certify.domain.model.TranscriptPage;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the student name and number from whole-page text, independently of the course parser.
 * The first match of each field wins and is never overwritten by later pages.
 */
public class IdentityExtractor {

    private static final Pattern NAME_PATTERN = Pattern.compile("Name:\\s+(.+)");
    private static final Pattern ID_PATTERN = Pattern.compile("Student ID:\\s+(\\d+)");

    /**
     * @param pages transcript pages in order
     * @return identity whose fields are {@code null} when not found
     */
    public StudentIdentity extract(List<TranscriptPage> pages) {
        String name = null;
        String id = null;
        for (TranscriptPage page : pages) {
            if (name != null && id != null) {
                break;
            }
            for (String line : page.pageText().split("\\R")) {
                if (name == null) {
                    Matcher matcher = NAME_PATTERN.matcher(line);
                    if (matcher.lookingAt()) {
                        name = matcher.group(1).strip();
                    }
                }
                if (id == null) {
                    Matcher matcher = ID_PATTERN.matcher(line);
                    if (matcher.lookingAt()) {
                        id = matcher.group(1);
                    }
                }
            }
        }
        return new StudentIdentity(name, id);
    }
}
