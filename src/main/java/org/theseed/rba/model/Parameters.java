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

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This is the parameters part of an RBA model.  It contains functions, which compute a value from
 * the growth rate or a metabolite concentration, and aggregates, which combine functions.  Both kinds
 * of parameter share a single ID space, since other parts of the model refer to them by ID alone.
 */
public class Parameters extends SubModel {

    // FIELDS
    /** functions, keyed by ID */
    private final Map<String, Function> functions;
    /** aggregates, keyed by ID */
    private final Map<String, Aggregate> aggregates;

    /** function type for a constant value */
    public static final String CONSTANT = "constant";
    /** function type for a linear function of the growth rate */
    public static final String LINEAR = "linear";
    /** function type for a Michaelis-Menten function of a metabolite concentration */
    public static final String MICHAELIS_MENTEN = "michaelisMenten";
    /** aggregate type for a product of functions */
    public static final String MULTIPLICATION = "multiplication";

    /**
     * This object represents a parameter function.
     */
    public static class Function implements IJsonItem {

        /** function ID */
        private final String id;
        /** function type */
        private final String type;
        /** variable for the function (growth rate or metabolite ID) */
        private String variable;
        /** map of parameter names to values */
        private final Map<String, Double> parameters;

        /**
         * Construct a function of the growth rate.
         *
         * @param id		ID of the function
         * @param type		type of function
         */
        public Function(String id, String type) {
            this.id = id;
            this.type = type;
            this.variable = "growth_rate";
            this.parameters = new LinkedHashMap<String, Double>();
        }

        /**
         * @return a constant function
         *
         * @param id		ID of the function
         * @param value		constant value
         */
        public static Function constant(String id, double value) {
            return new Function(id, CONSTANT).set("CONSTANT", value);
        }

        /**
         * Specify a parameter value.
         *
         * @param name		name of the parameter
         * @param value		value to store
         *
         * @return this object, for chaining
         */
        public Function set(String name, double value) {
            this.parameters.put(name, value);
            return this;
        }

        /**
         * Specify the variable for this function.
         *
         * @param variable	new variable ID
         *
         * @return this object, for chaining
         */
        public Function setVariable(String variable) {
            this.variable = variable;
            return this;
        }

        /**
         * @return the function ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the function type
         */
        public String getType() {
            return this.type;
        }

        /**
         * @return the function variable
         */
        public String getVariable() {
            return this.variable;
        }

        /**
         * @return the value of a parameter, or NULL if the parameter is not set
         *
         * @param name		name of the desired parameter
         */
        public Double get(String name) {
            return this.parameters.get(name);
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("type", this.type);
            retVal.put("variable", this.variable);
            JsonObject parms = new JsonObject();
            parms.putAll(this.parameters);
            retVal.put("parameters", parms);
            return retVal;
        }

    }

    /**
     * This object represents an aggregate, which combines the values of several functions.
     */
    public static class Aggregate implements IJsonItem {

        /** aggregate ID */
        private final String id;
        /** aggregate type */
        private final String type;
        /** IDs of the functions combined */
        private final List<String> functionRefs;

        public Aggregate(String id, String type, List<String> functionRefs) {
            this.id = id;
            this.type = type;
            this.functionRefs = new ArrayList<String>(functionRefs);
        }

        /**
         * @return the aggregate ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the aggregate type
         */
        public String getType() {
            return this.type;
        }

        /**
         * @return the IDs of the functions being combined
         */
        public List<String> getFunctionRefs() {
            return Collections.unmodifiableList(this.functionRefs);
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("type", this.type);
            retVal.put("functionReferences", new JsonArray(this.functionRefs));
            return retVal;
        }

    }

    public Parameters() {
        this.functions = new LinkedHashMap<String, Function>();
        this.aggregates = new LinkedHashMap<String, Aggregate>();
    }

    @Override
    public String getName() {
        return "parameters";
    }

    /**
     * Add a function.
     *
     * @param function	function to add
     */
    public void addFunction(Function function) {
        if (this.aggregates.containsKey(function.getId()))
            throw new IllegalArgumentException("Function ID \"" + function.getId() + "\" is already an aggregate.");
        this.addUnique(this.functions, function.getId(), function, "function");
    }

    /**
     * Add an aggregate.
     *
     * @param aggregate		aggregate to add
     */
    public void addAggregate(Aggregate aggregate) {
        if (this.functions.containsKey(aggregate.getId()))
            throw new IllegalArgumentException("Aggregate ID \"" + aggregate.getId() + "\" is already a function.");
        this.addUnique(this.aggregates, aggregate.getId(), aggregate, "aggregate");
    }

    /**
     * @return the functions
     */
    public Collection<Function> getFunctions() {
        return this.functions.values();
    }

    /**
     * @return the aggregates
     */
    public Collection<Aggregate> getAggregates() {
        return this.aggregates.values();
    }

    /**
     * @return the function with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired function
     */
    public Function getFunction(String id) {
        return this.functions.get(id);
    }

    /**
     * @return the aggregate with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired aggregate
     */
    public Aggregate getAggregate(String id) {
        return this.aggregates.get(id);
    }

    /**
     * @return TRUE if the specified ID belongs to a function
     *
     * @param id	ID to check
     */
    public boolean hasFunction(String id) {
        return this.functions.containsKey(id);
    }

    /**
     * @return TRUE if the specified ID belongs to a function or an aggregate
     *
     * @param id	ID to check
     */
    public boolean hasParameter(String id) {
        return this.functions.containsKey(id) || this.aggregates.containsKey(id);
    }

    @Override
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("functions", toJsonArray(this.functions.values()));
        retVal.put("aggregates", toJsonArray(this.aggregates.values()));
        return retVal;
    }

}
