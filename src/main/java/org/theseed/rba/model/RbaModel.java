/**
 *
 */
package org.theseed.rba.model;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * This object is a complete resource-balance-allocation model.  It consists of nine sub-models that
 * refer to each other by ID, plus the medium (a map of external metabolite prefixes to concentrations)
 * and the directory into which the model should be written.
 */
public class RbaModel {

    // FIELDS
    /** metabolic network */
    private Metabolism metabolism;
    /** compartment density constraints */
    private Density density;
    /** parameter functions and aggregates */
    private Parameters parameters;
    /** protein catalog */
    private Macromolecules proteins;
    /** RNA catalog */
    private Macromolecules rnas;
    /** DNA catalog */
    private Macromolecules dna;
    /** enzymes */
    private Enzymes enzymes;
    /** cellular processes */
    private Processes processes;
    /** growth targets */
    private Targets targets;
    /** medium concentrations, keyed by metabolite prefix */
    private Map<String, Double> medium;
    /** output directory */
    private File outputDir;

    /**
     * Construct an empty model.  The builder fills in the parts.
     */
    public RbaModel() {
        this.metabolism = new Metabolism();
        this.density = new Density();
        this.parameters = new Parameters();
        this.proteins = new Macromolecules("proteins");
        this.rnas = new Macromolecules("rnas");
        this.dna = new Macromolecules("dna");
        this.enzymes = new Enzymes();
        this.processes = new Processes();
        this.targets = new Targets();
        this.medium = new TreeMap<String, Double>();
        this.outputDir = null;
    }

    /**
     * @return the nine sub-models, in output order
     */
    public List<SubModel> getSubModels() {
        return List.of(this.metabolism, this.density, this.parameters, this.proteins, this.rnas, this.dna,
                this.enzymes, this.processes, this.targets);
    }

    /**
     * Verify that every ID reference in the model points to something that exists.
     *
     * @return a list of descriptions of the broken references (empty if the model is consistent)
     */
    public List<String> checkReferences() {
        List<String> retVal = new ArrayList<String>();
        // Density constraints must name real compartments and parameters.
        for (Density.TargetDensity target : this.density.getTargetDensities()) {
            if (! this.metabolism.hasCompartment(target.getCompartment()))
                retVal.add("Density target refers to unknown compartment " + target.getCompartment() + ".");
            this.checkParameter(retVal, target.getUpperBound(), "density of " + target.getCompartment());
        }
        // Aggregates must combine real functions.
        for (Parameters.Aggregate aggregate : this.parameters.getAggregates()) {
            for (String ref : aggregate.getFunctionRefs()) {
                if (! this.parameters.hasFunction(ref))
                    retVal.add("Aggregate " + aggregate.getId() + " refers to unknown function " + ref + ".");
            }
        }
        // Macromolecules must be made of known components and live in known compartments.
        for (Macromolecules catalog : List.of(this.proteins, this.rnas, this.dna)) {
            for (Macromolecules.Macromolecule molecule : catalog.getMacromolecules()) {
                if (! this.metabolism.hasCompartment(molecule.getCompartment()))
                    retVal.add(catalog.getName() + " entry " + molecule.getId() + " is in unknown compartment "
                            + molecule.getCompartment() + ".");
                for (String component : molecule.getComposition().keySet()) {
                    if (! catalog.hasComponent(component))
                        retVal.add(catalog.getName() + " entry " + molecule.getId() + " uses unknown component "
                                + component + ".");
                }
            }
        }
        // Enzymes must catalyze real reactions using real macromolecules.
        for (Enzymes.Enzyme enzyme : this.enzymes.getEnzymes()) {
            if (! this.metabolism.hasReaction(enzyme.getReaction()))
                retVal.add("Enzyme " + enzyme.getId() + " refers to unknown reaction " + enzyme.getReaction() + ".");
            this.checkParameter(retVal, enzyme.getForwardEfficiency(), "enzyme " + enzyme.getId());
            this.checkParameter(retVal, enzyme.getBackwardEfficiency(), "enzyme " + enzyme.getId());
            for (SpeciesReference ref : enzyme.getMachinery())
                this.checkMacromolecule(retVal, ref.getSpecies(), "enzyme " + enzyme.getId());
        }
        // Processes must use real macromolecules, maps, and parameters.
        for (Processes.Process process : this.processes.getProcesses()) {
            String where = "process " + process.getId();
            for (SpeciesReference ref : process.getMachinery())
                this.checkMacromolecule(retVal, ref.getSpecies(), where);
            if (process.getCapacity() != null)
                this.checkParameter(retVal, process.getCapacity(), where);
            List<Processes.Processing> handled = new ArrayList<Processes.Processing>(process.getProductions());
            handled.addAll(process.getDegradations());
            for (Processes.Processing processing : handled) {
                if (this.processes.getProcessingMap(processing.getProcessingMap()) == null)
                    retVal.add(where + " refers to unknown processing map " + processing.getProcessingMap() + ".");
                for (String input : processing.getInputs())
                    this.checkMacromolecule(retVal, input, where);
            }
        }
        // Targets must aim at real entities and use real parameters.
        for (Targets.TargetGroup group : this.targets.getTargetGroups()) {
            String where = "target group " + group.getId();
            for (Targets.TargetValue target : group.getSpeciesTargets()) {
                if (! this.metabolism.hasSpecies(target.getTarget()) && ! this.isMacromolecule(target.getTarget()))
                    retVal.add(where + " refers to unknown species " + target.getTarget() + ".");
                this.checkParameter(retVal, target.getValue(), where);
            }
            for (Targets.TargetValue target : group.getReactionFluxes()) {
                if (! this.metabolism.hasReaction(target.getTarget()))
                    retVal.add(where + " refers to unknown reaction " + target.getTarget() + ".");
                this.checkParameter(retVal, target.getValue(), where);
            }
        }
        return retVal;
    }

    /**
     * Record an error if a parameter does not exist.
     *
     * @param errors	list of errors to update
     * @param id		ID of the parameter
     * @param where		description of the referring entity
     */
    private void checkParameter(List<String> errors, String id, String where) {
        if (! this.parameters.hasParameter(id))
            errors.add(where + " refers to unknown parameter " + id + ".");
    }

    /**
     * Record an error if a macromolecule does not exist.
     *
     * @param errors	list of errors to update
     * @param id		ID of the macromolecule
     * @param where		description of the referring entity
     */
    private void checkMacromolecule(List<String> errors, String id, String where) {
        if (! this.isMacromolecule(id))
            errors.add(where + " refers to unknown macromolecule " + id + ".");
    }

    /**
     * @return TRUE if the specified ID is in one of the macromolecule catalogs
     *
     * @param id	ID to check
     */
    public boolean isMacromolecule(String id) {
        return this.proteins.hasMacromolecule(id) || this.rnas.hasMacromolecule(id) || this.dna.hasMacromolecule(id);
    }

    /**
     * @return the metabolism
     */
    public Metabolism getMetabolism() {
        return this.metabolism;
    }

    /**
     * @param metabolism 	the metabolism to set
     */
    public void setMetabolism(Metabolism metabolism) {
        this.metabolism = metabolism;
    }

    /**
     * @return the density constraints
     */
    public Density getDensity() {
        return this.density;
    }

    /**
     * @param density 	the density constraints to set
     */
    public void setDensity(Density density) {
        this.density = density;
    }

    /**
     * @return the parameters
     */
    public Parameters getParameters() {
        return this.parameters;
    }

    /**
     * @param parameters 	the parameters to set
     */
    public void setParameters(Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @return the protein catalog
     */
    public Macromolecules getProteins() {
        return this.proteins;
    }

    /**
     * @param proteins 	the protein catalog to set
     */
    public void setProteins(Macromolecules proteins) {
        this.proteins = proteins;
    }

    /**
     * @return the RNA catalog
     */
    public Macromolecules getRnas() {
        return this.rnas;
    }

    /**
     * @param rnas 	the RNA catalog to set
     */
    public void setRnas(Macromolecules rnas) {
        this.rnas = rnas;
    }

    /**
     * @return the DNA catalog
     */
    public Macromolecules getDna() {
        return this.dna;
    }

    /**
     * @param dna 	the DNA catalog to set
     */
    public void setDna(Macromolecules dna) {
        this.dna = dna;
    }

    /**
     * @return the enzymes
     */
    public Enzymes getEnzymes() {
        return this.enzymes;
    }

    /**
     * @param enzymes 	the enzymes to set
     */
    public void setEnzymes(Enzymes enzymes) {
        this.enzymes = enzymes;
    }

    /**
     * @return the processes
     */
    public Processes getProcesses() {
        return this.processes;
    }

    /**
     * @param processes 	the processes to set
     */
    public void setProcesses(Processes processes) {
        this.processes = processes;
    }

    /**
     * @return the targets
     */
    public Targets getTargets() {
        return this.targets;
    }

    /**
     * @param targets 	the targets to set
     */
    public void setTargets(Targets targets) {
        this.targets = targets;
    }

    /**
     * @return the medium concentrations, keyed by metabolite prefix
     */
    public Map<String, Double> getMedium() {
        return Collections.unmodifiableMap(this.medium);
    }

    /**
     * @param medium 	the medium concentrations to set
     */
    public void setMedium(Map<String, Double> medium) {
        this.medium = new TreeMap<String, Double>(medium);
    }

    /**
     * @return the output directory
     */
    public File getOutputDir() {
        return this.outputDir;
    }

    /**
     * @param outputDir 	the output directory to set
     */
    public void setOutputDir(File outputDir) {
        this.outputDir = outputDir;
    }

}
