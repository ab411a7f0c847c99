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
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This is the targets part of an RBA model.  Targets are organized into groups, and each group lists
 * concentrations to maintain and fluxes to sustain.  The value of each target is a parameter ID.
 */
public class Targets extends SubModel {

    /** target groups, keyed by ID */
    private final Map<String, TargetGroup> targetGroups;

    /**
     * This object represents a single target:  the ID of a species, macromolecule, or reaction, and the
     * ID of the parameter giving its value.
     */
    public static class TargetValue implements IJsonItem {

        /** ID of the targeted entity */
        private final String target;
        /** ID of the value parameter */
        private final String value;

        public TargetValue(String target, String value) {
            this.target = target;
            this.value = value;
        }

        /**
         * @return the ID of the targeted entity
         */
        public String getTarget() {
            return this.target;
        }

        /**
         * @return the ID of the value parameter
         */
        public String getValue() {
            return this.value;
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("target", this.target);
            retVal.put("value", this.value);
            return retVal;
        }

    }

    /**
     * This object represents a group of targets.
     */
    public static class TargetGroup implements IJsonItem {

        /** group ID */
        private final String id;
        /** concentration targets */
        private final List<TargetValue> concentrations;
        /** production flux targets */
        private final List<TargetValue> productionFluxes;
        /** degradation flux targets */
        private final List<TargetValue> degradationFluxes;
        /** reaction flux targets */
        private final List<TargetValue> reactionFluxes;

        public TargetGroup(String id) {
            this.id = id;
            this.concentrations = new ArrayList<TargetValue>();
            this.productionFluxes = new ArrayList<TargetValue>();
            this.degradationFluxes = new ArrayList<TargetValue>();
            this.reactionFluxes = new ArrayList<TargetValue>();
        }

        /**
         * Add a concentration target.
         *
         * @param species	ID of the species or macromolecule
         * @param value		ID of the value parameter
         */
        public void addConcentration(String species, String value) {
            this.concentrations.add(new TargetValue(species, value));
        }

        /**
         * Add a production flux target.
         *
         * @param species	ID of the species or macromolecule
         * @param value		ID of the value parameter
         */
        public void addProductionFlux(String species, String value) {
            this.productionFluxes.add(new TargetValue(species, value));
        }

        /**
         * Add a degradation flux target.
         *
         * @param species	ID of the species or macromolecule
         * @param value		ID of the value parameter
         */
        public void addDegradationFlux(String species, String value) {
            this.degradationFluxes.add(new TargetValue(species, value));
        }

        /**
         * Add a reaction flux target.
         *
         * @param reaction	ID of the reaction
         * @param value		ID of the value parameter
         */
        public void addReactionFlux(String reaction, String value) {
            this.reactionFluxes.add(new TargetValue(reaction, value));
        }

        /**
         * @return the group ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the concentration targets
         */
        public List<TargetValue> getConcentrations() {
            return Collections.unmodifiableList(this.concentrations);
        }

        /**
         * @return the production flux targets
         */
        public List<TargetValue> getProductionFluxes() {
            return Collections.unmodifiableList(this.productionFluxes);
        }

        /**
         * @return the degradation flux targets
         */
        public List<TargetValue> getDegradationFluxes() {
            return Collections.unmodifiableList(this.degradationFluxes);
        }

        /**
         * @return the reaction flux targets
         */
        public List<TargetValue> getReactionFluxes() {
            return Collections.unmodifiableList(this.reactionFluxes);
        }

        /**
         * @return all the species and macromolecule targets in this group
         */
        public List<TargetValue> getSpeciesTargets() {
            return Stream.of(this.concentrations, this.productionFluxes, this.degradationFluxes)
                    .flatMap(x -> x.stream()).collect(Collectors.toList());
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("concentrations", toJsonArray(this.concentrations));
            retVal.put("productionFluxes", toJsonArray(this.productionFluxes));
            retVal.put("degradationFluxes", toJsonArray(this.degradationFluxes));
            retVal.put("reactionFluxes", toJsonArray(this.reactionFluxes));
            return retVal;
        }

    }

    public Targets() {
        this.targetGroups = new LinkedHashMap<String, TargetGroup>();
    }

    @Override
    public String getName() {
        return "targets";
    }

    /**
     * Add a target group.
     *
     * @param group		target group to add
     */
    public void addTargetGroup(TargetGroup group) {
        this.addUnique(this.targetGroups, group.getId(), group, "target group");
    }

    /**
     * @return the target groups
     */
    public Collection<TargetGroup> getTargetGroups() {
        return this.targetGroups.values();
    }

    /**
     * @return the target group with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired group
     */
    public TargetGroup getTargetGroup(String id) {
        return this.targetGroups.get(id);
    }

    @Override
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("targetGroups", toJsonArray(this.targetGroups.values()));
        return retVal;
    }

}
