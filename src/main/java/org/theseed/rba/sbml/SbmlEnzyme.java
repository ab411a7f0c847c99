/**
 *
 */
package org.theseed.rba.sbml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.theseed.rba.association.EnzymeComposition;

/**
 * This object describes the enzyme of a reaction as determined from the SBML model:  the genes that form
 * it, whether it sits in a membrane, and which external metabolites it imports.
 */
public class SbmlEnzyme {

    // FIELDS
    /** enzyme ID */
    private final String id;
    /** ID of the catalyzed reaction */
    private final String reaction;
    /** TRUE if this is a membrane (transport) enzyme */
    private final boolean membrane;
    /** genes forming the enzyme */
    private final EnzymeComposition composition;
    /** IDs of the external metabolites imported */
    private final List<String> importedMetabolites;

    /**
     * Construct an enzyme description.
     *
     * @param reaction		ID of the catalyzed reaction
     * @param membrane		TRUE if the reaction crosses a membrane
     * @param composition	genes forming the enzyme
     * @param imported		IDs of the external metabolites imported by the reaction
     */
    public SbmlEnzyme(String reaction, boolean membrane, EnzymeComposition composition, List<String> imported) {
        this.id = enzymeId(reaction);
        this.reaction = reaction;
        this.membrane = membrane;
        this.composition = composition;
        this.importedMetabolites = new ArrayList<String>(imported);
    }

    /**
     * @return the ID of the enzyme for a reaction
     *
     * @param reactionId	ID of the reaction
     */
    public static String enzymeId(String reactionId) {
        return reactionId + "_enzyme";
    }

    /**
     * @return the enzyme ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the ID of the catalyzed reaction
     */
    public String getReaction() {
        return this.reaction;
    }

    /**
     * @return TRUE if this is a membrane enzyme
     */
    public boolean isMembrane() {
        return this.membrane;
    }

    /**
     * @return the genes forming this enzyme
     */
    public EnzymeComposition getComposition() {
        return this.composition;
    }

    /**
     * @return the external metabolites imported by this enzyme
     */
    public List<String> getImportedMetabolites() {
        return Collections.unmodifiableList(this.importedMetabolites);
    }

    @Override
    public String toString() {
        return "Enzyme " + this.id + " (" + this.composition + ")";
    }

}
