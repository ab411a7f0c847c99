/**
 *
 */
package org.theseed.rba.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This is the density part of an RBA model.  It limits the amount of protein each compartment can hold.
 */
public class Density extends SubModel {

    /** target densities, keyed by compartment */
    private final Map<String, TargetDensity> targetDensities;

    /**
     * This object represents the density constraint for one compartment.  The upper bound is the
     * ID of a parameter.
     */
    public static class TargetDensity implements IJsonItem {

        /** ID of the compartment */
        private final String compartment;
        /** ID of the upper bound parameter */
        private final String upperBound;

        public TargetDensity(String compartment, String upperBound) {
            this.compartment = compartment;
            this.upperBound = upperBound;
        }

        /**
         * @return the compartment ID
         */
        public String getCompartment() {
            return this.compartment;
        }

        /**
         * @return the ID of the upper bound parameter
         */
        public String getUpperBound() {
            return this.upperBound;
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("compartment", this.compartment);
            retVal.put("upperBound", this.upperBound);
            return retVal;
        }

    }

    public Density() {
        this.targetDensities = new LinkedHashMap<String, TargetDensity>();
    }

    @Override
    public String getName() {
        return "density";
    }

    /**
     * Add a target density.
     *
     * @param density	target density to add
     */
    public void addTargetDensity(TargetDensity density) {
        this.addUnique(this.targetDensities, density.getCompartment(), density, "target density");
    }

    /**
     * @return the target densities
     */
    public Collection<TargetDensity> getTargetDensities() {
        return this.targetDensities.values();
    }

    @Override
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("targetDensities", toJsonArray(this.targetDensities.values()));
        return retVal;
    }

}
