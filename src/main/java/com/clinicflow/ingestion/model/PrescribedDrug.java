package com.clinicflow.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

/**
 * A drug named by the provider or a clinician. The linkage hints ({@code id}, {@code drugId}) may or
 * may not resolve against the current inventory.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PrescribedDrug(
        String drugName,
        @Nullable String dosage,
        @Nullable String duration,
        @Nullable String instructions,
        @Nullable String source,
        @Nullable Boolean prescriptionRequired,
        @Nullable String id,
        @Nullable String drugId,
        @Nullable Integer dispenseQuantity
) {

    public static final String SOURCE_INVENTORY = "inventory";
    public static final String SOURCE_EXTERNAL = "external";

    public static PrescribedDrug named(String drugName, @Nullable String dosage, @Nullable String duration) {
        return new PrescribedDrug(drugName, dosage, duration, null, null, null, null, null, null);
    }

    public boolean fromInventory() {
        return SOURCE_INVENTORY.equalsIgnoreCase(source);
    }
}
