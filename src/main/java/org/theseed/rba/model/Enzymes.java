/**
 *
 */
package org.theseed.rba.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This is the enzymes part of an RBA model.  Each enzyme catalyzes exactly one reaction.
 */
public class Enzymes extends SubModel {

    /** enzymes, keyed by ID */
    private final Map<String, Enzyme> enzymes;

    /**
     * This object represents an enzyme.  It names the reaction it catalyzes, the efficiency parameters
     * in each direction, and the macromolecules that make up its machinery.
     */
    public static class Enzyme implements IJsonItem {

        /** enzyme ID */
        private final String id;
        /** ID of the catalyzed reaction */
        private final String reaction;
        /** ID of the forward efficiency parameter */
        private final String forwardEfficiency;
        /** ID of the backward efficiency parameter */
        private final String backwardEfficiency;
        /** macromolecules forming the enzyme */
        private final List<SpeciesReference> machinery;

        public Enzyme(String id, String reaction, String forwardEfficiency, String backwardEfficiency) {
            this.id = id;
            this.reaction = reaction;
            this.forwardEfficiency = forwardEfficiency;
            this.backwardEfficiency = backwardEfficiency;
            this.machinery = new ArrayList<SpeciesReference>();
        }

        /**
         * Add a macromolecule to the machinery of this enzyme.
         *
         * @param molecule		ID of the macromolecule
         * @param stoich		number of copies required
         */
        public void addMachinery(String molecule, double stoich) {
            this.machinery.add(new SpeciesReference(molecule, stoich));
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
         * @return the ID of the forward efficiency parameter
         */
        public String getForwardEfficiency() {
            return this.forwardEfficiency;
        }

        /**
         * @return the ID of the backward efficiency parameter
         */
        public String getBackwardEfficiency() {
            return this.backwardEfficiency;
        }

        /**
         * @return the machinery composition
         */
        public List<SpeciesReference> getMachinery() {
            return Collections.unmodifiableList(this.machinery);
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("reaction", this.reaction);
            retVal.put("forwardEfficiency", this.forwardEfficiency);
            retVal.put("backwardEfficiency", this.backwardEfficiency);
            retVal.put("machineryComposition", toJsonArray(this.machinery));
            return retVal;
        }

    }

    public Enzymes() {
        this.enzymes = new LinkedHashMap<String, Enzyme>();
    }

    @Override
    public String getName() {
        return "enzymes";
    }

    /**
     * Add an enzyme.
     *
     * @param enzyme	enzyme to add
     */
    public void addEnzyme(Enzyme enzyme) {
        this.addUnique(this.enzymes, enzyme.getId(), enzyme, "enzyme");
    }

    /**
     * @return the enzymes
     */
    public Collection<Enzyme> getEnzymes() {
        return this.enzymes.values();
    }

    /**
     * @return the enzyme with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired enzyme
     */
    public Enzyme getEnzyme(String id) {
        return this.enzymes.get(id);
    }

    @Override
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("enzymes", toJsonArray(this.enzymes.values()));
        return retVal;
    }

}
