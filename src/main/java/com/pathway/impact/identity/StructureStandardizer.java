package com.pathway.impact.identity;

import com.pathway.impact.upstream.UpstreamSource;

/**
 * External cheminformatics service turning structure text (SMILES or similar) into a
 * canonical structure key.
 */
public interface StructureStandardizer extends UpstreamSource {

    /**
     * @return the canonical structure key
     * @throws com.pathway.impact.error.ValidationException when the structure cannot be parsed
     */
    String standardize(String structureText);
}
