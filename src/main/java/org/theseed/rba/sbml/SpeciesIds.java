/**
 *
 */
package org.theseed.rba.sbml;

import org.apache.commons.lang3.StringUtils;

/**
 * Utilities for SBML species IDs.  A species ID ends with an underscore and the ID of its compartment
 * (e.g. "M_glc__D_e").  The part before the last underscore is the prefix, which identifies the
 * metabolite independent of its location.
 */
public final class SpeciesIds {

    private SpeciesIds() { }

    /**
     * @return the prefix of a species ID (everything before the last underscore)
     *
     * @param speciesId		species ID to parse
     */
    public static String prefix(String speciesId) {
        return StringUtils.substringBeforeLast(speciesId, "_");
    }

    /**
     * @return the compartment suffix of a species ID (everything after the last underscore), or an
     * 		   empty string if there is no underscore
     *
     * @param speciesId		species ID to parse
     */
    public static String suffix(String speciesId) {
        return StringUtils.substringAfterLast(speciesId, "_");
    }

}
