package com.example.certify.application.service;

import com.example.certify.domain.model.StudentIdentity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives report file names such as {@code jdoe_ms_phy_track.csv} from a student's name.
 */
public final class ReportFileNames {

    private static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    private ReportFileNames() {
    }

    /**
     * Builds {@code <first initial><last name>_<suffix>.csv}. The last name is the last token that is purely
     * alphabetic once surrounding punctuation is removed, so suffixes like "Jr." or "III" are handled loosely.
     *
     * @param identity student identity with a non-blank name
     * @param suffix   program suffix, e.g. {@code ms_phy_track}
     * @return lower case file name
     */
    public static String reportFileName(StudentIdentity identity, String suffix) {
        String[] names = identity.name().toLowerCase(Locale.ROOT).trim().split("\\s+");
        List<String> cleaned = new ArrayList<>();
        for (String name : names) {
            String stripped = stripPunctuation(name);
            if (!stripped.isEmpty() && stripped.chars().allMatch(Character::isLetter)) {
                cleaned.add(stripped);
            }
        }
        String lastName = cleaned.isEmpty() ? names[names.length - 1] : cleaned.get(cleaned.size() - 1);
        return names[0].charAt(0) + lastName + "_" + suffix + ".csv";
    }

    private static String stripPunctuation(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && PUNCTUATION.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && PUNCTUATION.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
