package com.example.certify.domain.model;

/**
 * Name and student number read from the transcript heading.
 * Either field may be {@code null} while pages are still being scanned.
 */
public record StudentIdentity(String name, String id) {

    public boolean complete() {
        return name != null && !name.isBlank() && id != null && !id.isBlank();
    }
}
