/**
 *
 */
package org.theseed.rba.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This is the processes part of an RBA model.  A process (translation, folding, transcription, ...)
 * produces or degrades macromolecules, optionally using a machinery whose capacity limits the flux.
 * The cost of processing each component is described by a processing map.
 */
public class Processes extends SubModel {

    // FIELDS
    /** processes, keyed by ID */
    private final Map<String, Process> processes;
    /** processing maps, keyed by ID */
    private final Map<String, ProcessingMap> processingMaps;

    /**
     * This object describes a set of macromolecules handled by a process and the processing map
     * that gives the cost of handling them.
     */
    public static class Processing implements IJsonItem {

        /** ID of the processing map */
        private final String processingMap;
        /** IDs of the macromolecules handled */
        private final Set<String> inputs;

        public Processing(String processingMap, Collection<String> inputs) {
            this.processingMap = processingMap;
            this.inputs = new LinkedHashSet<String>(inputs);
        }

        /**
         * @return the ID of the processing map
         */
        public String getProcessingMap() {
            return this.processingMap;
        }

        /**
         * @return the IDs of the macromolecules handled
         */
        public Set<String> getInputs() {
            return Collections.unmodifiableSet(this.inputs);
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("processingMap", this.processingMap);
            retVal.put("inputs", new JsonArray(this.inputs));
            return retVal;
        }

    }

    /**
     * This object represents a single process.
     */
    public static class Process implements IJsonItem {

        /** process ID */
        private final String id;
        /** process name */
        private final String name;
        /** machinery macromolecules */
        private final List<SpeciesReference> machinery;
        /** ID of the machinery capacity parameter, or NULL if there is no machinery */
        private String capacity;
        /** macromolecules produced */
        private final List<Processing> productions;
        /** macromolecules degraded */
        private final List<Processing> degradations;

        public Process(String id, String name) {
            this.id = id;
            this.name = name;
            this.machinery = new ArrayList<SpeciesReference>();
            this.capacity = null;
            this.productions = new ArrayList<Processing>();
            this.degradations = new ArrayList<Processing>();
        }

        /**
         * Specify the machinery of this process.
         *
         * @param composition	machinery macromolecules
         * @param capacity		ID of the capacity parameter
         */
        public void setMachinery(List<SpeciesReference> composition, String capacity) {
            this.machinery.clear();
            this.machinery.addAll(composition);
            this.capacity = capacity;
        }

        /**
         * Add a set of macromolecules produced by this process.
         *
         * @param processing	production specification
         */
        public void addProduction(Processing processing) {
            this.productions.add(processing);
        }

        /**
         * Add a set of macromolecules degraded by this process.
         *
         * @param processing	degradation specification
         */
        public void addDegradation(Processing processing) {
            this.degradations.add(processing);
        }

        /**
         * @return the process ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the process name
         */
        public String getName() {
            return this.name;
        }

        /**
         * @return the machinery macromolecules
         */
        public List<SpeciesReference> getMachinery() {
            return Collections.unmodifiableList(this.machinery);
        }

        /**
         * @return the ID of the capacity parameter, or NULL if there is no machinery
         */
        public String getCapacity() {
            return this.capacity;
        }

        /**
         * @return the production specifications
         */
        public List<Processing> getProductions() {
            return Collections.unmodifiableList(this.productions);
        }

        /**
         * @return the degradation specifications
         */
        public List<Processing> getDegradations() {
            return Collections.unmodifiableList(this.degradations);
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("name", this.name);
            if (this.capacity != null) {
                JsonObject machineryObject = new JsonObject();
                machineryObject.put("capacity", this.capacity);
                machineryObject.put("machineryComposition", toJsonArray(this.machinery));
                retVal.put("machinery", machineryObject);
            }
            retVal.put("productions", toJsonArray(this.productions));
            retVal.put("degradations", toJsonArray(this.degradations));
            return retVal;
        }

    }

    /**
     * This object describes the metabolites consumed and produced when a single unit of a component
     * is processed.
     */
    public static class ComponentProcessing implements IJsonItem {

        /** ID of the component */
        private final String component;
        /** amount of machinery time required per unit */
        private final double machineryCost;
        /** metabolites consumed */
        private final List<SpeciesReference> reactants;
        /** metabolites produced */
        private final List<SpeciesReference> products;

        public ComponentProcessing(String component, double machineryCost) {
            this.component = component;
            this.machineryCost = machineryCost;
            this.reactants = new ArrayList<SpeciesReference>();
            this.products = new ArrayList<SpeciesReference>();
        }

        /**
         * Add a metabolite consumed by the processing.
         *
         * @param species	ID of the metabolite
         * @param stoich	amount consumed per unit
         */
        public void addReactant(String species, double stoich) {
            this.reactants.add(new SpeciesReference(species, stoich));
        }

        /**
         * Add a metabolite produced by the processing.
         *
         * @param species	ID of the metabolite
         * @param stoich	amount produced per unit
         */
        public void addProduct(String species, double stoich) {
            this.products.add(new SpeciesReference(species, stoich));
        }

        /**
         * @return the component ID
         */
        public String getComponent() {
            return this.component;
        }

        /**
         * @return the machinery cost per unit
         */
        public double getMachineryCost() {
            return this.machineryCost;
        }

        /**
         * @return the metabolites consumed
         */
        public List<SpeciesReference> getReactants() {
            return Collections.unmodifiableList(this.reactants);
        }

        /**
         * @return the metabolites produced
         */
        public List<SpeciesReference> getProducts() {
            return Collections.unmodifiableList(this.products);
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("component", this.component);
            retVal.put("machineryCost", this.machineryCost);
            retVal.put("reactants", toJsonArray(this.reactants));
            retVal.put("products", toJsonArray(this.products));
            return retVal;
        }

    }

    /**
     * This object is a processing map:  a per-component list of costs for one kind of processing.
     */
    public static class ProcessingMap implements IJsonItem {

        /** ID of the map */
        private final String id;
        /** component processing costs, keyed by component ID */
        private final Map<String, ComponentProcessing> componentProcessings;

        public ProcessingMap(String id) {
            this.id = id;
            this.componentProcessings = new LinkedHashMap<String, ComponentProcessing>();
        }

        /**
         * Add the processing cost of a component.
         *
         * @param processing	component processing cost
         */
        public void addComponentProcessing(ComponentProcessing processing) {
            if (this.componentProcessings.containsKey(processing.getComponent()))
                throw new IllegalArgumentException("Duplicate component \"" + processing.getComponent()
                        + "\" in processing map " + this.id + ".");
            this.componentProcessings.put(processing.getComponent(), processing);
        }

        /**
         * @return the map ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the component processing costs
         */
        public Collection<ComponentProcessing> getComponentProcessings() {
            return this.componentProcessings.values();
        }

        /**
         * @return the processing cost of the specified component, or NULL if there is none
         *
         * @param component		ID of the component of interest
         */
        public ComponentProcessing getComponentProcessing(String component) {
            return this.componentProcessings.get(component);
        }

        @Override
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put("id", this.id);
            retVal.put("componentProcessings", toJsonArray(this.componentProcessings.values()));
            return retVal;
        }

    }

    public Processes() {
        this.processes = new LinkedHashMap<String, Process>();
        this.processingMaps = new LinkedHashMap<String, ProcessingMap>();
    }

    @Override
    public String getName() {
        return "processes";
    }

    /**
     * Add a process.
     *
     * @param process	process to add
     */
    public void addProcess(Process process) {
        this.addUnique(this.processes, process.getId(), process, "process");
    }

    /**
     * Add a processing map.
     *
     * @param map		processing map to add
     */
    public void addProcessingMap(ProcessingMap map) {
        this.addUnique(this.processingMaps, map.getId(), map, "processing map");
    }

    /**
     * @return the processes
     */
    public Collection<Process> getProcesses() {
        return this.processes.values();
    }

    /**
     * @return the process with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired process
     */
    public Process getProcess(String id) {
        return this.processes.get(id);
    }

    /**
     * @return the processing maps
     */
    public Collection<ProcessingMap> getProcessingMaps() {
        return this.processingMaps.values();
    }

    /**
     * @return the processing map with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired map
     */
    public ProcessingMap getProcessingMap(String id) {
        return this.processingMaps.get(id);
    }

    @Override
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("processes", toJsonArray(this.processes.values()));
        retVal.put("processingMaps", toJsonArray(this.processingMaps.values()));
        return retVal;
    }

}
