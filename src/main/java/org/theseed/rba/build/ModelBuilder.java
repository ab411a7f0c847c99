/**
 *
 */
package org.theseed.rba.build;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.RbaBuildException;
import org.theseed.rba.model.Density;
import org.theseed.rba.model.Enzymes;
import org.theseed.rba.model.Macromolecules;
import org.theseed.rba.model.Metabolism;
import org.theseed.rba.model.Parameters;
import org.theseed.rba.model.Processes;
import org.theseed.rba.model.RbaModel;
import org.theseed.rba.model.Reaction;
import org.theseed.rba.model.SpeciesReference;
import org.theseed.rba.model.Targets;
import org.theseed.rba.sbml.SbmlData;
import org.theseed.rba.sbml.SbmlEnzyme;
import org.theseed.rba.sbml.SpeciesIds;

/**
 * This object assembles an RBA model from the data extracted from an SBML file, the organism data in
 * the configuration, and the default data.  The sub-models are built in dependency order, and the
 * finished model is checked for broken references before it is returned.  If anything goes wrong,
 * the build fails and no model is returned.
 */
public class ModelBuilder {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelBuilder.class);
    /** build configuration */
    private final RbaConfig config;
    /** data extracted from the SBML model */
    private final SbmlData data;
    /** default data */
    private final DefaultData defaults;
    /** map of metabolite keys to SBML species IDs, for metabolites actually in the model */
    private final Map<String, String> metaboliteMap;
    /** map of SBML species IDs to metabolite target concentrations */
    private final Map<String, Double> metaboliteConcentrations;
    /** map of species IDs to macrocomponent concentrations, for species actually in the model */
    private final Map<String, Double> macrocomponents;
    /** map of gene names to protein references */
    private final Map<String, SpeciesReference> proteinRefs;
    /** IDs of the internal compartments */
    private final List<String> internal;
    /** average protein composition */
    private final Map<String, Double> averageProtein;

    /**
     * Construct a model builder that reads the SBML file named in the configuration.
     *
     * @param config	build configuration
     *
     * @throws IOException			if the SBML file cannot be read
     * @throws RbaBuildException	if the SBML file cannot be used
     */
    public ModelBuilder(RbaConfig config) throws IOException, RbaBuildException {
        this(config, SbmlData.load(config.getSbmlFile(), config));
    }

    /**
     * Construct a model builder for previously-extracted SBML data.
     *
     * @param config	build configuration
     * @param data		data extracted from the SBML model
     */
    public ModelBuilder(RbaConfig config, SbmlData data) {
        this.config = config;
        this.data = data;
        this.defaults = new DefaultData();
        if (config.getMediumConcentration() != null)
            this.defaults.setMediumConcentration(config.getMediumConcentration());
        Set<String> speciesIds = data.getSpecies().stream().map(x -> x.getId()).collect(Collectors.toSet());
        // Resolve the metabolite keys.  Keys that name species missing from the model are ignored.
        this.metaboliteMap = new LinkedHashMap<String, String>();
        this.metaboliteConcentrations = new LinkedHashMap<String, Double>();
        for (Map.Entry<String, RbaConfig.MetaboliteData> entry : config.getMetabolites().entrySet()) {
            String sbmlId = entry.getValue().getSbmlId();
            if (sbmlId == null)
                log.debug("Metabolite {} is not mapped to the model.", entry.getKey());
            else if (! speciesIds.contains(sbmlId))
                log.warn("Metabolite {} is mapped to unknown species {} and will be ignored.", entry.getKey(), sbmlId);
            else {
                this.metaboliteMap.put(entry.getKey(), sbmlId);
                double conc = entry.getValue().getConcentration();
                if (conc != 0.0)
                    this.metaboliteConcentrations.putIfAbsent(sbmlId, conc);
            }
        }
        this.macrocomponents = new LinkedHashMap<String, Double>();
        for (Map.Entry<String, Double> entry : config.getMacrocomponents().entrySet()) {
            if (! speciesIds.contains(entry.getKey()))
                log.warn("Macrocomponent {} is not a species in the model and will be ignored.", entry.getKey());
            else {
                this.macrocomponents.put(entry.getKey(), entry.getValue());
                // A macrocomponent target supersedes a metabolite target.
                this.metaboliteConcentrations.remove(entry.getKey());
            }
        }
        // Map each gene to its protein.
        this.proteinRefs = new LinkedHashMap<String, SpeciesReference>();
        for (RbaConfig.ProteinData protein : config.getProteins())
            this.proteinRefs.put(protein.getGene(), new SpeciesReference(protein.getId(), protein.getStoichiometry()));
        this.internal = data.getCompartments().stream().filter(x -> ! x.isExternal()).map(x -> x.getId())
                .collect(Collectors.toList());
        List<String> sequences = config.getProteins().stream().map(x -> x.getSequence())
                .filter(x -> ! StringUtils.isBlank(x)).collect(Collectors.toList());
        this.averageProtein = this.defaults.averageProtein(sequences);
    }

    /**
     * Build the RBA model.
     *
     * @return the completed model
     *
     * @throws RbaBuildException	if the model cannot be built consistently
     */
    public RbaModel build() throws RbaBuildException {
        RbaModel retVal = new RbaModel();
        try {
            retVal.setMetabolism(this.buildMetabolism());
            retVal.setDensity(this.buildDensity());
            retVal.setParameters(this.buildParameters());
            retVal.setProteins(this.buildProteins());
            retVal.setRnas(this.buildRnas());
            retVal.setDna(this.buildDna());
            retVal.setEnzymes(this.buildEnzymes());
            retVal.setProcesses(this.buildProcesses());
            retVal.setTargets(this.buildTargets());
        } catch (IllegalArgumentException e) {
            throw new RbaBuildException("Model construction failed: " + e.getMessage(), e);
        }
        retVal.setMedium(this.buildMedium());
        retVal.setOutputDir(this.config.getOutputDir());
        // Verify the cross-references.
        List<String> errors = retVal.checkReferences();
        if (! errors.isEmpty()) {
            for (String error : errors)
                log.error("Broken reference: {}", error);
            throw new RbaBuildException(errors.size() + " broken references in the model.  First: " + errors.get(0));
        }
        log.info("Model built: {} reactions, {} enzymes, {} proteins, {} medium entries.",
                retVal.getMetabolism().getReactions().size(), retVal.getEnzymes().getEnzymes().size(),
                retVal.getProteins().getMacromolecules().size(), retVal.getMedium().size());
        return retVal;
    }

    /**
     * @return the metabolism sub-model:  the SBML compartments, species, and expanded reactions, plus
     * 		   the maintenance ATP reaction
     */
    protected Metabolism buildMetabolism() {
        Metabolism retVal = new Metabolism();
        for (Metabolism.Compartment compartment : this.data.getCompartments())
            retVal.addCompartment(compartment);
        for (Metabolism.Species species : this.data.getSpecies())
            retVal.addSpecies(species);
        for (Reaction reaction : this.data.getReactions())
            retVal.addReaction(reaction);
        retVal.addReaction(this.atpmReaction());
        log.info("Metabolism contains {} compartments, {} species, and {} reactions.",
                retVal.getCompartments().size(), retVal.getSpecies().size(), retVal.getReactions().size());
        return retVal;
    }

    /**
     * @return the maintenance ATP reaction (ATP + H2O -> ADP + H + Pi), using only the metabolites
     * 		   present in the model
     */
    private Reaction atpmReaction() {
        Reaction retVal = new Reaction(DefaultData.ATPM_REACTION, false);
        for (String key : List.of("ATP", "H2O")) {
            String id = this.metaboliteMap.get(key);
            if (id != null)
                retVal.addReactant(id, 1.0);
        }
        for (String key : List.of("ADP", "H", "Pi")) {
            String id = this.metaboliteMap.get(key);
            if (id != null)
                retVal.addProduct(id, 1.0);
        }
        return retVal;
    }

    /**
     * @return the density sub-model:  one density bound per internal compartment
     */
    protected Density buildDensity() {
        Density retVal = new Density();
        for (String compartment : this.internal)
            retVal.addTargetDensity(new Density.TargetDensity(compartment, DefaultData.densityId(compartment)));
        return retVal;
    }

    /**
     * @return the parameter sub-model
     *
     * @throws RbaBuildException	if the average protein length is not usable
     */
    protected Parameters buildParameters() throws RbaBuildException {
        Parameters retVal = new Parameters();
        this.defaults.addDensityFunctions(retVal, this.config.getCytosolId(), this.internal);
        double length = this.averageProtein.values().stream().mapToDouble(x -> x).sum();
        this.defaults.addProteinLengthFunction(retVal, length);
        this.defaults.addProcessFunctions(retVal, this.internal);
        // Target concentration functions.
        for (Map.Entry<String, Double> entry : this.macrocomponents.entrySet())
            this.defaults.addConcentrationFunction(retVal, entry.getKey(), entry.getValue());
        for (Map.Entry<String, Double> entry : this.metaboliteConcentrations.entrySet())
            this.defaults.addConcentrationFunction(retVal, entry.getKey(), entry.getValue());
        // Efficiency functions.
        this.defaults.addEfficiencyFunctions(retVal);
        int transporters = 0;
        for (SbmlEnzyme enzyme : this.data.getEnzymes()) {
            if (enzyme.isMembrane()) {
                this.defaults.addTransportAggregate(retVal, enzyme.getReaction(), enzyme.getImportedMetabolites());
                transporters++;
            }
        }
        log.info("{} parameter functions and {} aggregates created ({} transporters).", retVal.getFunctions().size(),
                retVal.getAggregates().size(), transporters);
        return retVal;
    }

    /**
     * @return the protein sub-model
     */
    protected Macromolecules buildProteins() {
        Macromolecules retVal = new Macromolecules("proteins");
        for (String aa : this.defaults.getAminoAcids())
            retVal.addComponent(new Macromolecules.Component(aa, this.defaults.getAminoAcidKey(aa), "amino_acid", 1.0));
        for (RbaConfig.Cofactor cofactor : this.getCofactors())
            retVal.addComponent(new Macromolecules.Component(cofactor.getChebi(), cofactor.getName(), "cofactor", 0.0));
        // Enzymatic proteins.
        for (RbaConfig.ProteinData protein : this.config.getProteins()) {
            if (retVal.hasMacromolecule(protein.getId()))
                log.warn("Protein {} for gene {} is already defined.", protein.getId(), protein.getGene());
            else {
                Map<String, Double> comp = SequenceCompositions.aminoAcids(protein.getSequence(),
                        this.defaults.getAminoAcids());
                for (RbaConfig.Cofactor cofactor : protein.getCofactors())
                    comp.put(cofactor.getChebi(), cofactor.getStoichiometry());
                retVal.addMacromolecule(new Macromolecules.Macromolecule(protein.getId(), protein.getLocation(), comp));
            }
        }
        // Average proteins.
        for (Metabolism.Compartment compartment : this.data.getCompartments())
            retVal.addMacromolecule(new Macromolecules.Macromolecule(DefaultData.averageProteinId(compartment.getId()),
                    compartment.getId(), this.averageProtein));
        // Machinery proteins.
        String cytosol = this.config.getCytosolId();
        for (RbaConfig.MachineryPart part : this.machineryProteins())
            retVal.addMacromolecule(new Macromolecules.Macromolecule(part.getId(), cytosol,
                    SequenceCompositions.aminoAcids(part.getSequence(), this.defaults.getAminoAcids())));
        return retVal;
    }

    /**
     * @return the distinct cofactors of the enzymatic proteins
     */
    private List<RbaConfig.Cofactor> getCofactors() {
        Map<String, RbaConfig.Cofactor> retVal = new LinkedHashMap<String, RbaConfig.Cofactor>();
        for (RbaConfig.ProteinData protein : this.config.getProteins()) {
            for (RbaConfig.Cofactor cofactor : protein.getCofactors())
                retVal.putIfAbsent(cofactor.getChebi(), cofactor);
        }
        return new ArrayList<RbaConfig.Cofactor>(retVal.values());
    }

    /**
     * @return the ribosome and chaperone proteins
     */
    private List<RbaConfig.MachineryPart> machineryProteins() {
        List<RbaConfig.MachineryPart> retVal = new ArrayList<RbaConfig.MachineryPart>(this.config.getRibosome().getProteins());
        retVal.addAll(this.config.getChaperone().getProteins());
        return retVal;
    }

    /**
     * @return the ribosome and chaperone RNAs
     */
    private List<RbaConfig.MachineryPart> machineryRnas() {
        List<RbaConfig.MachineryPart> retVal = new ArrayList<RbaConfig.MachineryPart>(this.config.getRibosome().getRnas());
        retVal.addAll(this.config.getChaperone().getRnas());
        return retVal;
    }

    /**
     * @return the RNA sub-model
     */
    protected Macromolecules buildRnas() {
        Macromolecules retVal = new Macromolecules("rnas");
        retVal.addComponent(new Macromolecules.Component("A", "Adenosine residue", "Nucleotide", 2.9036));
        retVal.addComponent(new Macromolecules.Component("C", "Cytosine residue", "Nucleotide", 2.7017));
        retVal.addComponent(new Macromolecules.Component("G", "Guanine residue", "Nucleotide", 3.0382));
        retVal.addComponent(new Macromolecules.Component("U", "Uracil residue", "Nucleotide", 2.7102));
        String cytosol = this.config.getCytosolId();
        for (Map.Entry<String, String> rna : this.config.getRnas().entrySet())
            retVal.addMacromolecule(new Macromolecules.Macromolecule(rna.getKey(), cytosol,
                    SequenceCompositions.nucleotides(rna.getValue())));
        retVal.addMacromolecule(new Macromolecules.Macromolecule(DefaultData.MRNA, cytosol,
                this.defaults.getMrnaComposition()));
        for (RbaConfig.MachineryPart part : this.machineryRnas())
            retVal.addMacromolecule(new Macromolecules.Macromolecule(part.getId(), cytosol,
                    SequenceCompositions.nucleotides(part.getSequence())));
        return retVal;
    }

    /**
     * @return the DNA sub-model
     */
    protected Macromolecules buildDna() {
        Macromolecules retVal = new Macromolecules("dna");
        retVal.addComponent(new Macromolecules.Component("A", "Adenosine residue", "Nucleotide", 0.0));
        retVal.addComponent(new Macromolecules.Component("C", "Cytosine residue", "Nucleotide", 0.0));
        retVal.addComponent(new Macromolecules.Component("G", "Guanine residue", "Nucleotide", 0.0));
        retVal.addComponent(new Macromolecules.Component("T", "Thymine residue", "Nucleotide", 0.0));
        retVal.addMacromolecule(new Macromolecules.Macromolecule(DefaultData.DNA, this.config.getCytosolId(),
                this.defaults.getDnaComposition()));
        return retVal;
    }

    /**
     * @return the enzyme sub-model:  one enzyme per expanded reaction, plus the maintenance enzyme
     *
     * @throws RbaBuildException	if a gene has no protein and the policy forbids dropping it
     */
    protected Enzymes buildEnzymes() throws RbaBuildException {
        Enzymes retVal = new Enzymes();
        UnresolvedGenePolicy policy = this.config.getUnresolvedGenePolicy();
        int unresolved = 0;
        for (SbmlEnzyme sbmlEnzyme : this.data.getEnzymes()) {
            String forward;
            String backward;
            if (sbmlEnzyme.isMembrane()) {
                forward = DefaultData.transportAggregateId(sbmlEnzyme.getReaction());
                backward = DefaultData.TRANSPORTER_EFFICIENCY;
            } else {
                forward = DefaultData.EFFICIENCY;
                backward = DefaultData.EFFICIENCY;
            }
            Enzymes.Enzyme enzyme = new Enzymes.Enzyme(sbmlEnzyme.getId(), sbmlEnzyme.getReaction(), forward, backward);
            // Resolve the genes.  Two genes for the same protein are combined.
            Map<String, Double> machinery = new LinkedHashMap<String, Double>();
            for (String gene : sbmlEnzyme.getComposition()) {
                SpeciesReference ref = this.proteinRefs.get(gene);
                if (ref == null) {
                    policy.handle(gene, enzyme.getId());
                    unresolved++;
                } else
                    machinery.merge(ref.getSpecies(), ref.getStoichiometry(), Double::sum);
            }
            for (Map.Entry<String, Double> entry : machinery.entrySet())
                enzyme.addMachinery(entry.getKey(), entry.getValue());
            retVal.addEnzyme(enzyme);
        }
        if (unresolved > 0)
            log.info("{} gene references could not be resolved to proteins.", unresolved);
        retVal.addEnzyme(new Enzymes.Enzyme(SbmlEnzyme.enzymeId(DefaultData.ATPM_REACTION), DefaultData.ATPM_REACTION,
                DefaultData.EFFICIENCY, DefaultData.EFFICIENCY));
        return retVal;
    }

    /**
     * @return the process sub-model
     */
    protected Processes buildProcesses() {
        Processes retVal = new Processes();
        DefaultProcesses processes = new DefaultProcesses(this.defaults, this.metaboliteMap);
        // Gather the macromolecule IDs.
        Set<String> proteins = new LinkedHashSet<String>();
        for (RbaConfig.ProteinData protein : this.config.getProteins())
            proteins.add(protein.getId());
        for (Metabolism.Compartment compartment : this.data.getCompartments())
            proteins.add(DefaultData.averageProteinId(compartment.getId()));
        for (RbaConfig.MachineryPart part : this.machineryProteins())
            proteins.add(part.getId());
        Set<String> rnas = new LinkedHashSet<String>(this.config.getRnas().keySet());
        rnas.add(DefaultData.MRNA);
        for (RbaConfig.MachineryPart part : this.machineryRnas())
            rnas.add(part.getId());
        List<String> dnas = List.of(DefaultData.DNA);
        // Create the processes.
        retVal.addProcess(processes.translation(this.config.getRibosome().getComposition(), proteins));
        retVal.addProcess(processes.folding(this.config.getChaperone().getComposition(), proteins));
        retVal.addProcess(processes.transcription(rnas));
        retVal.addProcess(processes.replication(dnas));
        retVal.addProcess(processes.rnaDegradation(rnas));
        // Create the processing maps.
        retVal.addProcessingMap(processes.translationMap(this.getCofactors()));
        retVal.addProcessingMap(processes.foldingMap());
        retVal.addProcessingMap(processes.transcriptionMap());
        retVal.addProcessingMap(processes.rnaDegradationMap());
        retVal.addProcessingMap(processes.replicationMap());
        return retVal;
    }

    /**
     * @return the target sub-model
     */
    protected Targets buildTargets() {
        Targets retVal = new Targets();
        DefaultTargets targets = new DefaultTargets();
        retVal.addTargetGroup(targets.translation(this.internal));
        retVal.addTargetGroup(targets.transcription());
        retVal.addTargetGroup(targets.replication());
        retVal.addTargetGroup(targets.rnaDegradation());
        retVal.addTargetGroup(targets.metaboliteProduction(this.metaboliteConcentrations));
        retVal.addTargetGroup(targets.macrocomponents(this.macrocomponents));
        retVal.addTargetGroup(targets.maintenanceAtp(DefaultData.ATPM_REACTION));
        return retVal;
    }

    /**
     * @return the medium:  the default concentration for each external metabolite, keyed on the
     * 		   metabolite prefix, so that the same nutrient in different compartments has a single entry
     */
    protected Map<String, Double> buildMedium() {
        Map<String, Double> retVal = new TreeMap<String, Double>();
        for (String metabolite : this.data.getExternalMetabolites())
            retVal.put(SpeciesIds.prefix(metabolite), this.defaults.getMediumConcentration());
        return retVal;
    }

    /**
     * @return the SBML data used by this builder
     */
    public SbmlData getData() {
        return this.data;
    }

}
