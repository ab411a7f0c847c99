/**
 *
 */
package org.theseed.rba.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object is a macromolecule catalog.  An RBA model has three of them:  one for proteins, one
 * for RNAs, and one for DNA.  Each catalog lists the components (amino acids, nucleotides, cofactors)
 * and the macromolecules built from them.
 */
public class Macromolecules extends SubModel {

    // FIELDS
    /** name of this catalog */
    private final String name;
    /** components, keyed by ID */
    private final Map<String, Component> components;
    /** macromolecules, keyed by ID */
    private final Map<String, Macromolecule> macromolecules;

    /**
     * This object represents a building block of the macromolecules in a catalog.
     */
    public static class Component implements IJsonItem {

        /** component ID */
        private final String id;
        /** descriptive name */
        private final String name;
        /** component type */
        private final String type;
        /** weight of one unit of the component */
        private final double weight;

        public Component(String id, String name, String type, double weight) {
            this.id = id;
            this.name = name;
            this.type = type;
            this.weight = weight;
        }

        /**
         * @return the component ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the component name
         */
        public String getName() {
            return this.name;
        }

        /**
         * @return the component type
         */
        public String getType() {
            return this.type;
        }

        /**
         * @return the weight of one unit
         */
        public double getWeight() {
            return this.weight;
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("name", this.name);
            retVal.put("type", this.type);
            retVal.put("weight", this.weight);
            return retVal;
        }

    }

    /**
     * This object represents a macromolecule:  an ID, a location, and the amount of each component
     * it contains.
     */
    public static class Macromolecule implements IJsonItem {

        /** macromolecule ID */
        private final String id;
        /** ID of the compartment containing the macromolecule */
        private final String compartment;
        /** map of component IDs to amounts */
        private final Map<String, Double> composition;

        public Macromolecule(String id, String compartment, Map<String, Double> composition) {
            this.id = id;
            this.compartment = compartment;
            this.composition = new LinkedHashMap<String, Double>(composition);
        }

        /**
         * @return the macromolecule ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the ID of the containing compartment
         */
        public String getCompartment() {
            return this.compartment;
        }

        /**
         * @return the component amounts
         */
        public Map<String, Double> getComposition() {
            return Collections.unmodifiableMap(this.composition);
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("compartment", this.compartment);
            JsonObject comp = new JsonObject();
            comp.putAll(this.composition);
            retVal.put("composition", comp);
            return retVal;
        }

    }

    /**
     * Construct an empty macromolecule catalog.
     *
     * @param name		name of the catalog ("proteins", "rnas", or "dna")
     */
    public Macromolecules(String name) {
        this.name = name;
        this.components = new LinkedHashMap<String, Component>();
        this.macromolecules = new LinkedHashMap<String, Macromolecule>();
    }

    @Override
    public String getName() {
        return this.name;
    }

    /**
     * Add a component.
     *
     * @param component		component to add
     */
    public void addComponent(Component component) {
        this.addUnique(this.components, component.getId(), component, "component");
    }

    /**
     * Add a macromolecule.
     *
     * @param molecule		macromolecule to add
     */
    public void addMacromolecule(Macromolecule molecule) {
        this.addUnique(this.macromolecules, molecule.getId(), molecule, "macromolecule");
    }

    /**
     * @return the components
     */
    public Collection<Component> getComponents() {
        return this.components.values();
    }

    /**
     * @return the macromolecules
     */
    public Collection<Macromolecule> getMacromolecules() {
        return this.macromolecules.values();
    }

    /**
     * @return the macromolecule with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired macromolecule
     */
    public Macromolecule getMacromolecule(String id) {
        return this.macromolecules.get(id);
    }

    /**
     * @return TRUE if the specified macromolecule is in this catalog
     *
     * @param id	ID of the macromolecule to check
     */
    public boolean hasMacromolecule(String id) {
        return this.macromolecules.containsKey(id);
    }

    /**
     * @return TRUE if the specified component is in this catalog
     *
     * @param id	ID of the component to check
     */
    public boolean hasComponent(String id) {
        return this.components.containsKey(id);
    }

    @Override
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("components", toJsonArray(this.components.values()));
        retVal.put("macromolecules", toJsonArray(this.macromolecules.values()));
        return retVal;
    }

}
