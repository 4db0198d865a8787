package com.clinicflow.dispensing.model;

/**
 * How a prescribed drug was tied to an inventory record, strongest first.
 */
public enum MatchTier {
    /** Same name ignoring case and repeated whitespace. */
    EXACT_NAME,
    /** Same normalized name. */
    NORMALIZED_NAME,
    /** One normalized name contains the other, which is longer than five characters. */
    CONTAINMENT,
    /** The entry's {@code id} or {@code drug_id} equals the inventory id. */
    IDENTIFIER,
    NONE
}
