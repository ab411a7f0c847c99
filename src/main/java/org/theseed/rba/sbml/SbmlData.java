/**
 *
 */
package org.theseed.rba.sbml;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import javax.xml.stream.XMLStreamException;

import org.sbml.jsbml.ListOf;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.SBMLReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.InvalidInputFormatException;
import org.theseed.rba.RbaBuildException;
import org.theseed.rba.association.AnnotationParser;
import org.theseed.rba.association.DnfNormalizer;
import org.theseed.rba.association.EnzymeComposition;
import org.theseed.rba.association.GeneAssociation;
import org.theseed.rba.model.Metabolism;
import org.theseed.rba.model.Reaction;

/**
 * This object contains the RBA-relevant data extracted from an SBML model:  the compartments (classified
 * as internal or external), the species, the reactions, and one enzyme per reaction.  Reactions that can
 * be catalyzed by several enzymes are expanded so that each copy has exactly one.
 *
 * Everything needed is copied out of the SBML model during construction, so the SBML document can be
 * released as soon as the constructor returns.
 */
public class SbmlData {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SbmlData.class);
    /** compartments, in model order */
    private final List<Metabolism.Compartment> compartments;
    /** species, in model order */
    private final List<Metabolism.Species> species;
    /** expanded reactions */
    private final List<Reaction> reactions;
    /** enzymes, parallel to the reactions */
    private final List<SbmlEnzyme> enzymes;
    /** map of reaction IDs to enzymes */
    private final Map<String, SbmlEnzyme> enzymeMap;
    /** IDs of the boundary species */
    private final List<String> externalMetabolites;
    /** IDs of the external compartments */
    private final Set<String> externalCompartments;
    /** number of reactions with no gene association */
    private int missingCount;

    /**
     * This interface describes the options that control the extraction.
     */
    public interface IParms {

        /**
         * @return the ID of the cytosol compartment
         */
        public String getCytosolId();

        /**
         * @return the IDs of compartments to be treated as external
         */
        public List<String> getExternalIds();

        /**
         * @return the policy for reactions with no gene association
         */
        public AnnotationPolicy getAnnotationPolicy();

        /**
         * @return the maximum tolerated fraction of unannotated reactions (for the FRACTION policy)
         */
        public double getMaxMissingFraction();

    }

    /**
     * Read an SBML file and extract its data.
     *
     * @param sbmlFile		SBML file to read
     * @param parms			extraction options
     *
     * @return the extracted data
     *
     * @throws IOException			if the file cannot be read
     * @throws RbaBuildException	if the file is not valid SBML or its annotations cannot be used
     */
    public static SbmlData load(File sbmlFile, IParms parms) throws IOException, RbaBuildException {
        log.info("Reading SBML model from {}.", sbmlFile);
        SBMLDocument document;
        try {
            document = SBMLReader.read(sbmlFile);
        } catch (XMLStreamException e) {
            throw new InvalidInputFormatException("Invalid SBML in " + sbmlFile + ": " + e.getMessage(), e);
        }
        if (document == null || ! document.isSetModel())
            throw new InvalidInputFormatException("SBML file " + sbmlFile + " does not contain a model.");
        return new SbmlData(document.getModel(), parms);
    }

    /**
     * Extract the RBA data from an SBML model.
     *
     * @param model		SBML model to process
     * @param parms		extraction options
     *
     * @throws RbaBuildException	if the model's structure or annotations cannot be used
     */
    public SbmlData(Model model, IParms parms) throws RbaBuildException {
        // Copy the compartments and the species locations.
        List<String> compartmentIds = model.getListOfCompartments().stream().map(x -> x.getId())
                .collect(Collectors.toList());
        Map<String, String> speciesMap = new LinkedHashMap<String, String>();
        for (org.sbml.jsbml.Species spec : model.getListOfSpecies())
            speciesMap.put(spec.getId(), spec.getCompartment());
        // Copy the reactions.
        List<Reaction> original = new ArrayList<Reaction>(model.getReactionCount());
        for (org.sbml.jsbml.Reaction sbmlReaction : model.getListOfReactions())
            original.add(copyReaction(sbmlReaction, speciesMap));
        log.info("{} compartments, {} species, and {} reactions found in model {}.", compartmentIds.size(),
                speciesMap.size(), original.size(), model.getId());
        // Classify the compartments and set up the species.
        CompartmentClassifier classifier = new CompartmentClassifier(parms.getExternalIds());
        this.externalCompartments = classifier.classify(compartmentIds, speciesMap, original);
        this.compartments = compartmentIds.stream()
                .map(x -> new Metabolism.Compartment(x, this.externalCompartments.contains(x)))
                .collect(Collectors.toList());
        this.species = new ArrayList<Metabolism.Species>(speciesMap.size());
        for (org.sbml.jsbml.Species spec : model.getListOfSpecies()) {
            boolean boundary = spec.getBoundaryCondition() || this.externalCompartments.contains(spec.getCompartment());
            this.species.add(new Metabolism.Species(spec.getId(), spec.getCompartment(), boundary));
        }
        this.externalMetabolites = this.species.stream().filter(x -> x.isBoundaryCondition()).map(x -> x.getId())
                .collect(Collectors.toList());
        log.info("{} external metabolites found.", this.externalMetabolites.size());
        // Compute the enzyme compositions.
        List<List<EnzymeComposition>> compositions = this.extractCompositions(model, parms);
        // Expand the reactions and create the enzymes.
        ReactionExpander expander = new ReactionExpander(original.stream().map(x -> x.getId())
                .collect(Collectors.toList()));
        TransportResolver resolver = new TransportResolver(parms.getCytosolId(), this.externalMetabolites);
        this.reactions = new ArrayList<Reaction>(original.size());
        this.enzymes = new ArrayList<SbmlEnzyme>(original.size());
        this.enzymeMap = new LinkedHashMap<String, SbmlEnzyme>(original.size() * 4 / 3 + 1);
        for (int i = 0; i < original.size(); i++) {
            for (ReactionExpander.Binding binding : expander.expand(original.get(i), compositions.get(i))) {
                Reaction reaction = binding.getReaction();
                SbmlEnzyme enzyme = new SbmlEnzyme(reaction.getId(), resolver.isMembrane(reaction),
                        binding.getComposition(), resolver.importedMetabolites(reaction));
                this.reactions.add(reaction);
                this.enzymes.add(enzyme);
                this.enzymeMap.put(reaction.getId(), enzyme);
            }
        }
        log.info("{} reactions after expansion ({} copies added).", this.reactions.size(), expander.getCopyCount());
    }

    /**
     * Copy an SBML reaction into our own reaction object.
     *
     * @param sbmlReaction	SBML reaction to copy
     * @param speciesMap	map of valid species IDs to compartments
     *
     * @return the copied reaction
     *
     * @throws InvalidInputFormatException	if the reaction refers to an unknown species
     */
    private static Reaction copyReaction(org.sbml.jsbml.Reaction sbmlReaction, Map<String, String> speciesMap)
            throws InvalidInputFormatException {
        Reaction retVal = new Reaction(sbmlReaction.getId(), sbmlReaction.getReversible());
        for (org.sbml.jsbml.SpeciesReference ref : checkRefs(sbmlReaction, sbmlReaction.getListOfReactants(), speciesMap))
            retVal.addReactant(ref.getSpecies(), stoichiometry(ref));
        for (org.sbml.jsbml.SpeciesReference ref : checkRefs(sbmlReaction, sbmlReaction.getListOfProducts(), speciesMap))
            retVal.addProduct(ref.getSpecies(), stoichiometry(ref));
        return retVal;
    }

    /**
     * Verify that all the species references in a list point to real species.
     *
     * @param sbmlReaction	reaction containing the list
     * @param refs			list of species references
     * @param speciesMap	map of valid species IDs to compartments
     *
     * @return the list of species references
     *
     * @throws InvalidInputFormatException	if a reference is to an unknown species
     */
    private static ListOf<org.sbml.jsbml.SpeciesReference> checkRefs(org.sbml.jsbml.Reaction sbmlReaction,
            ListOf<org.sbml.jsbml.SpeciesReference> refs, Map<String, String> speciesMap)
            throws InvalidInputFormatException {
        for (org.sbml.jsbml.SpeciesReference ref : refs) {
            if (! speciesMap.containsKey(ref.getSpecies()))
                throw new InvalidInputFormatException("Reaction " + sbmlReaction.getId() + " refers to unknown species \""
                        + ref.getSpecies() + "\".");
        }
        return refs;
    }

    /**
     * @return the stoichiometry of a species reference (1 if it is not set)
     *
     * @param ref		species reference of interest
     */
    private static double stoichiometry(org.sbml.jsbml.SpeciesReference ref) {
        double retVal = ref.getStoichiometry();
        if (! ref.isSetStoichiometry() || Double.isNaN(retVal))
            retVal = 1.0;
        return Math.abs(retVal);
    }

    /**
     * Compute the enzyme compositions for each reaction.
     *
     * @param model		SBML model being processed
     * @param parms		extraction options
     *
     * @return a list, parallel to the model's reactions, of the compositions for each reaction
     *
     * @throws RbaBuildException
     */
    private List<List<EnzymeComposition>> extractCompositions(Model model, IParms parms) throws RbaBuildException {
        AnnotationParser parser = AnnotationParser.select(model);
        DnfNormalizer normalizer = new DnfNormalizer();
        AnnotationPolicy policy = parms.getAnnotationPolicy();
        List<List<EnzymeComposition>> retVal = new ArrayList<List<EnzymeComposition>>(model.getReactionCount());
        this.missingCount = 0;
        for (org.sbml.jsbml.Reaction reaction : model.getListOfReactions()) {
            GeneAssociation association = parser.extract(reaction);
            if (association == null) {
                policy.checkReaction(reaction.getId());
                this.missingCount++;
                association = GeneAssociation.EMPTY;
            }
            retVal.add(normalizer.normalize(association));
        }
        policy.checkTotals(this.missingCount, retVal.size(), parms.getMaxMissingFraction());
        if (this.missingCount > 0)
            log.warn("{} reactions have no gene association and will be treated as spontaneous.", this.missingCount);
        return retVal;
    }

    /**
     * @return the compartments
     */
    public List<Metabolism.Compartment> getCompartments() {
        return Collections.unmodifiableList(this.compartments);
    }

    /**
     * @return the IDs of the compartments
     */
    public List<String> getCompartmentIds() {
        return this.compartments.stream().map(x -> x.getId()).collect(Collectors.toList());
    }

    /**
     * @return the species
     */
    public List<Metabolism.Species> getSpecies() {
        return Collections.unmodifiableList(this.species);
    }

    /**
     * @return the expanded reactions
     */
    public List<Reaction> getReactions() {
        return Collections.unmodifiableList(this.reactions);
    }

    /**
     * @return the enzymes, in the same order as the reactions
     */
    public List<SbmlEnzyme> getEnzymes() {
        return Collections.unmodifiableList(this.enzymes);
    }

    /**
     * @return the enzyme for the specified reaction, or NULL if the reaction is not found
     *
     * @param reactionId	ID of the reaction of interest
     */
    public SbmlEnzyme getEnzyme(String reactionId) {
        return this.enzymeMap.get(reactionId);
    }

    /**
     * @return TRUE if the specified reaction has a membrane enzyme
     *
     * @param reactionId	ID of the reaction of interest
     */
    public boolean hasMembraneEnzyme(String reactionId) {
        SbmlEnzyme enzyme = this.enzymeMap.get(reactionId);
        return (enzyme != null && enzyme.isMembrane());
    }

    /**
     * @return the IDs of the boundary species
     */
    public List<String> getExternalMetabolites() {
        return Collections.unmodifiableList(this.externalMetabolites);
    }

    /**
     * @return the IDs of the external compartments
     */
    public Set<String> getExternalCompartments() {
        return Collections.unmodifiableSet(this.externalCompartments);
    }

    /**
     * @return the number of reactions that had no gene association
     */
    public int getMissingCount() {
        return this.missingCount;
    }

}
