package com.example.certify.domain.model;

import java.math.BigDecimal;

/**
 * One row of the itemized requirements table.
 *
 * @param label human readable requirement, e.g. "≥15 Core Credits"
 * @param value computed value compared against the threshold
 * @param met   whether the requirement holds
 */
public record RequirementStatus(String label, BigDecimal value, boolean met) {

    public String statusText() {
        return met ? "Verified" : "Not Met";
    }
}
