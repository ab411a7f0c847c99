/**
 *
 */
package org.theseed.rba.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This is the metabolism part of an RBA model.  It contains the compartments, the metabolite species,
 * and the reactions.
 */
public class Metabolism extends SubModel {

    // FIELDS
    /** compartments, keyed by ID */
    private final Map<String, Compartment> compartments;
    /** species, keyed by ID */
    private final Map<String, Species> species;
    /** reactions, keyed by ID */
    private final Map<String, Reaction> reactions;

    /**
     * This object represents a compartment.  A compartment is external if it is part of the
     * environment rather than the cell.
     */
    public static class Compartment implements IJsonItem {

        /** compartment ID */
        private final String id;
        /** TRUE if the compartment is environment-facing */
        private final boolean external;

        public Compartment(String id, boolean external) {
            this.id = id;
            this.external = external;
        }

        /**
         * @return the compartment ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return TRUE if this compartment is external
         */
        public boolean isExternal() {
            return this.external;
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("external", this.external);
            return retVal;
        }

    }

    /**
     * This object represents a metabolite species.  A boundary species is one exchanged with
     * the environment.
     */
    public static class Species implements IJsonItem {

        /** species ID */
        private final String id;
        /** ID of the containing compartment */
        private final String compartment;
        /** boundary condition flag */
        private final boolean boundaryCondition;

        public Species(String id, String compartment, boolean boundaryCondition) {
            this.id = id;
            this.compartment = compartment;
            this.boundaryCondition = boundaryCondition;
        }

        /**
         * @return the species ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the ID of the compartment containing this species
         */
        public String getCompartment() {
            return this.compartment;
        }

        /**
         * @return TRUE if this is a boundary (external) species
         */
        public boolean isBoundaryCondition() {
            return this.boundaryCondition;
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("compartment", this.compartment);
            retVal.put("boundaryCondition", this.boundaryCondition);
            return retVal;
        }

    }

    /**
     * Construct an empty metabolism.
     */
    public Metabolism() {
        this.compartments = new LinkedHashMap<String, Compartment>();
        this.species = new LinkedHashMap<String, Species>();
        this.reactions = new LinkedHashMap<String, Reaction>();
    }

    @Override
    public String getName() {
        return "metabolism";
    }

    /**
     * Add a compartment.
     *
     * @param compartment	compartment to add
     */
    public void addCompartment(Compartment compartment) {
        this.addUnique(this.compartments, compartment.getId(), compartment, "compartment");
    }

    /**
     * Add a species.
     *
     * @param spec		species to add
     */
    public void addSpecies(Species spec) {
        this.addUnique(this.species, spec.getId(), spec, "species");
    }

    /**
     * Add a reaction.
     *
     * @param reaction	reaction to add
     */
    public void addReaction(Reaction reaction) {
        this.addUnique(this.reactions, reaction.getId(), reaction, "reaction");
    }

    /**
     * @return the compartments
     */
    public Collection<Compartment> getCompartments() {
        return this.compartments.values();
    }

    /**
     * @return the species
     */
    public Collection<Species> getSpecies() {
        return this.species.values();
    }

    /**
     * @return the reactions
     */
    public Collection<Reaction> getReactions() {
        return this.reactions.values();
    }

    /**
     * @return the reaction with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired reaction
     */
    public Reaction getReaction(String id) {
        return this.reactions.get(id);
    }

    /**
     * @return TRUE if the specified compartment exists
     *
     * @param id	ID of the compartment to check
     */
    public boolean hasCompartment(String id) {
        return this.compartments.containsKey(id);
    }

    /**
     * @return TRUE if the specified species exists
     *
     * @param id	ID of the species to check
     */
    public boolean hasSpecies(String id) {
        return this.species.containsKey(id);
    }

    /**
     * @return TRUE if the specified reaction exists
     *
     * @param id	ID of the reaction to check
     */
    public boolean hasReaction(String id) {
        return this.reactions.containsKey(id);
    }

    @Override
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("compartments", toJsonArray(this.compartments.values()));
        retVal.put("species", toJsonArray(this.species.values()));
        retVal.put("reactions", toJsonArray(this.reactions.values()));
        return retVal;
    }

}
