package com.pathway.impact.hierarchy;

import com.pathway.impact.core.model.MappingStatus;

import java.util.List;
import java.util.Objects;

/**
 * How a target was placed onto the hierarchy's gene products.
 *
 * @param geneProductId the gene product used for scoring, or null when unmapped
 * @param notes         how the mapping was found, in lookup order
 */
public record GeneProductMapping(MappingStatus status, String geneProductId, List<String> notes) {

    public static final String PRIMARY_NOTE = "primary_gene_product";
    public static final String SECONDARY_NOTE = "secondary mapping";

    public GeneProductMapping {
        Objects.requireNonNull(status, "status is required");
        if (status.isScorable() && geneProductId == null) {
            throw new IllegalArgumentException("A mapped target requires a gene product id");
        }
        notes = notes != null ? List.copyOf(notes) : List.of();
    }
}
