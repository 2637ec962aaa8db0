package com.pathway.impact.core.model;

/**
 * One bioactivity measurement as delivered by the activity provider.
 * The engine never edits these; it only aggregates over them.
 *
 * @param targetId target identifier (e.g. a ChEMBL target id)
 * @param potency  pChEMBL-equivalent potency, or null when the assay reported none
 * @param assayId  source assay identifier
 * @param relation relation operator reported with the value ({@code "="}, {@code ">"}, ...)
 * @param valid    false when the source flagged the record (data validity comment)
 */
public record ActivityRecord(
        String targetId,
        Double potency,
        String assayId,
        String relation,
        boolean valid
) {
    public static final String EXACT_RELATION = "=";

    public static ActivityRecord exact(String targetId, double potency, String assayId) {
        return new ActivityRecord(targetId, potency, assayId, EXACT_RELATION, true);
    }
}
