/**
 *
 */
package org.theseed.rba;

import javax.xml.stream.XMLStreamException;

import org.sbml.jsbml.Model;
import org.sbml.jsbml.Reaction;
import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.Species;
import org.sbml.jsbml.SpeciesReference;
import org.sbml.jsbml.ext.fbc.And;
import org.sbml.jsbml.ext.fbc.Association;
import org.sbml.jsbml.ext.fbc.FBCConstants;
import org.sbml.jsbml.ext.fbc.FBCModelPlugin;
import org.sbml.jsbml.ext.fbc.FBCReactionPlugin;
import org.sbml.jsbml.ext.fbc.GeneProduct;
import org.sbml.jsbml.ext.fbc.GeneProductAssociation;
import org.sbml.jsbml.ext.fbc.GeneProductRef;
import org.sbml.jsbml.ext.fbc.LogicalOperator;
import org.sbml.jsbml.ext.fbc.Or;

/**
 * Utilities for building small SBML models in memory for the tests.
 *
 * The standard model has a cytosol "c" and an environment "e".  Glucose and X are exchanged with the
 * environment through sink reactions, glucose is transported into the cytosol, and there are two
 * cytosolic reactions.
 *
 * 	EX_glc		M_glc_e ->
 * 	EX_X		M_X_e ->
 * 	GLCt		M_glc_e -> M_glc_c						g5
 * 	R1			M_glc_c + M_atp_c -> M_adp_c + M_h_c	(g1 and g2) or g3
 * 	R2			M_h2o_c -> M_pi_c						g9
 */
public class SbmlFixtures {

    /** level and version of the test documents */
    private static final int LEVEL = 3;
    private static final int VERSION = 1;

    /**
     * @return a new, empty model
     *
     * @param id	ID of the model
     */
    public static Model newModel(String id) {
        SBMLDocument doc = new SBMLDocument(LEVEL, VERSION);
        return doc.createModel(id);
    }

    /**
     * Add compartments to a model.
     *
     * @param model		model to update
     * @param ids		IDs of the compartments to add
     */
    public static void addCompartments(Model model, String... ids) {
        for (String id : ids) {
            org.sbml.jsbml.Compartment compartment = model.createCompartment(id);
            compartment.setConstant(true);
        }
    }

    /**
     * Add a species to a model.
     *
     * @param model			model to update
     * @param id			ID of the species
     * @param compartment	ID of its compartment
     * @param boundary		TRUE if the species is a boundary condition
     *
     * @return the new species
     */
    public static Species addSpecies(Model model, String id, String compartment, boolean boundary) {
        Species retVal = model.createSpecies(id, model.getCompartment(compartment));
        retVal.setBoundaryCondition(boundary);
        retVal.setHasOnlySubstanceUnits(false);
        retVal.setConstant(false);
        return retVal;
    }

    /**
     * Add a reaction to a model.  All stoichiometries are 1.
     *
     * @param model			model to update
     * @param id			ID of the reaction
     * @param reactants		IDs of the reactant species
     * @param products		IDs of the product species
     *
     * @return the new reaction
     */
    public static Reaction addReaction(Model model, String id, String[] reactants, String[] products) {
        Reaction retVal = model.createReaction(id);
        retVal.setReversible(false);
        for (String reactant : reactants) {
            SpeciesReference ref = retVal.createReactant(model.getSpecies(reactant));
            ref.setStoichiometry(1.0);
            ref.setConstant(true);
        }
        for (String product : products) {
            SpeciesReference ref = retVal.createProduct(model.getSpecies(product));
            ref.setStoichiometry(1.0);
            ref.setConstant(true);
        }
        return retVal;
    }

    /**
     * Store a gene association in the notes of a reaction.
     *
     * @param reaction		reaction to update
     * @param association	association text
     *
     * @throws XMLStreamException
     */
    public static void setNotes(Reaction reaction, String association) throws XMLStreamException {
        reaction.setNotes("<notes><body xmlns=\"http://www.w3.org/1999/xhtml\"><p>SUBSYSTEM: test</p>"
                + "<p>GENE_ASSOCIATION: " + association + "</p></body></notes>");
    }

    /**
     * @return the FBC plugin of a model, creating it if necessary
     *
     * @param model		model of interest
     */
    public static FBCModelPlugin fbc(Model model) {
        return (FBCModelPlugin) model.getPlugin(FBCConstants.shortLabel);
    }

    /**
     * Add a gene product to a model.
     *
     * @param model		model to update
     * @param id		gene product ID
     * @param label		gene label (can be NULL)
     */
    public static void addGeneProduct(Model model, String id, String label) {
        GeneProduct product = fbc(model).createGeneProduct(id);
        if (label != null)
            product.setLabel(label);
    }

    /**
     * Attach an FBC gene product association to a reaction.
     *
     * @param reaction		reaction to update
     * @param association	association tree
     */
    public static void setAssociation(Reaction reaction, Association association) {
        FBCReactionPlugin plugin = (FBCReactionPlugin) reaction.getPlugin(FBCConstants.shortLabel);
        GeneProductAssociation gpa = new GeneProductAssociation(LEVEL, VERSION);
        gpa.setAssociation(association);
        plugin.setGeneProductAssociation(gpa);
    }

    /**
     * @return a gene product reference
     *
     * @param id	ID of the gene product
     */
    public static GeneProductRef ref(String id) {
        GeneProductRef retVal = new GeneProductRef(LEVEL, VERSION);
        retVal.setGeneProduct(id);
        return retVal;
    }

    /**
     * @return an FBC AND of associations
     *
     * @param children		associations to combine
     */
    public static And and(Association... children) {
        And retVal = new And(LEVEL, VERSION);
        fill(retVal, children);
        return retVal;
    }

    /**
     * @return an FBC OR of associations
     *
     * @param children		associations to combine
     */
    public static Or or(Association... children) {
        Or retVal = new Or(LEVEL, VERSION);
        fill(retVal, children);
        return retVal;
    }

    /**
     * Add child associations to a logical operator.
     *
     * @param op			operator to fill
     * @param children		children to add
     */
    private static void fill(LogicalOperator op, Association... children) {
        for (Association child : children)
            op.addAssociation(child);
    }

    /**
     * Create the metabolic network of the standard model, without annotations.
     *
     * @return the unannotated standard model
     */
    public static Model standardNetwork() {
        Model retVal = newModel("standard");
        addCompartments(retVal, "c", "e");
        addSpecies(retVal, "M_glc_e", "e", false);
        addSpecies(retVal, "M_X_e", "e", false);
        addSpecies(retVal, "M_glc_c", "c", false);
        addSpecies(retVal, "M_atp_c", "c", false);
        addSpecies(retVal, "M_adp_c", "c", false);
        addSpecies(retVal, "M_h_c", "c", false);
        addSpecies(retVal, "M_h2o_c", "c", false);
        addSpecies(retVal, "M_pi_c", "c", false);
        addReaction(retVal, "EX_glc", new String[] { "M_glc_e" }, new String[0]);
        addReaction(retVal, "EX_X", new String[] { "M_X_e" }, new String[0]);
        addReaction(retVal, "GLCt", new String[] { "M_glc_e" }, new String[] { "M_glc_c" });
        addReaction(retVal, "R1", new String[] { "M_glc_c", "M_atp_c" }, new String[] { "M_adp_c", "M_h_c" });
        addReaction(retVal, "R2", new String[] { "M_h2o_c" }, new String[] { "M_pi_c" });
        return retVal;
    }

    /**
     * @return the standard model with gene associations in the reaction notes
     *
     * @throws XMLStreamException
     */
    public static Model standardNotesModel() throws XMLStreamException {
        Model retVal = standardNetwork();
        setNotes(retVal.getReaction("GLCt"), "g5");
        setNotes(retVal.getReaction("R1"), "(g1 and g2) or g3");
        setNotes(retVal.getReaction("R2"), "g9");
        return retVal;
    }

    /**
     * @return the standard model with FBC gene product associations
     */
    public static Model standardFbcModel() {
        Model retVal = standardNetwork();
        for (String gene : new String[] { "g1", "g2", "g3", "g5", "g9" })
            addGeneProduct(retVal, "G_" + gene, gene);
        setAssociation(retVal.getReaction("GLCt"), ref("G_g5"));
        setAssociation(retVal.getReaction("R1"), or(and(ref("G_g1"), ref("G_g2")), ref("G_g3")));
        setAssociation(retVal.getReaction("R2"), ref("G_g9"));
        return retVal;
    }

}
