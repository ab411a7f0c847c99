/**
 *
 */
package org.theseed.rba.association;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.ext.fbc.And;
import org.sbml.jsbml.ext.fbc.Association;
import org.sbml.jsbml.ext.fbc.FBCModelPlugin;
import org.sbml.jsbml.ext.fbc.FBCReactionPlugin;
import org.sbml.jsbml.ext.fbc.GeneProduct;
import org.sbml.jsbml.ext.fbc.GeneProductAssociation;
import org.sbml.jsbml.ext.fbc.GeneProductRef;
import org.sbml.jsbml.ext.fbc.LogicalOperator;
import org.sbml.jsbml.ext.fbc.Or;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.UnsupportedAssociationShapeException;

/**
 * This annotation parser reads the FBC gene product associations attached to each reaction.  The
 * gene product IDs in the association are converted to gene names using the model's gene product
 * list, so the resulting associations can be matched against protein data.
 */
public class FbcAnnotationParser implements AnnotationParser {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(FbcAnnotationParser.class);
    /** map of gene product IDs to gene names */
    private final Map<String, String> geneNames;

    /**
     * Construct an FBC annotation parser for a model.
     *
     * @param model		SBML model containing FBC gene products
     */
    public FbcAnnotationParser(Model model) {
        this.geneNames = new HashMap<String, String>();
        FBCModelPlugin fbcModel = (FBCModelPlugin) model.getExtension("fbc");
        if (fbcModel != null) {
            for (GeneProduct product : fbcModel.getListOfGeneProducts())
                this.geneNames.put(product.getId(), computeGeneName(product));
        }
        log.debug("{} gene products found in model {}.", this.geneNames.size(), model.getId());
    }

    /**
     * @return the gene name for a gene product:  the label if there is one, else the name, else the ID
     * 		   without its "G_" prefix
     *
     * @param product	gene product of interest
     */
    protected static String computeGeneName(GeneProduct product) {
        String retVal = product.getLabel();
        if (StringUtils.isBlank(retVal))
            retVal = product.getName();
        if (StringUtils.isBlank(retVal))
            retVal = StringUtils.removeStart(product.getId(), "G_");
        return retVal;
    }

    /**
     * @return TRUE if the model has FBC gene products or FBC reaction associations
     *
     * @param model		SBML model to check
     */
    public static boolean isAvailable(Model model) {
        boolean retVal = false;
        FBCModelPlugin fbcModel = (FBCModelPlugin) model.getExtension("fbc");
        if (fbcModel != null) {
            retVal = fbcModel.getGeneProductCount() > 0;
            final int rN = model.getReactionCount();
            for (int rI = 0; rI < rN && ! retVal; rI++)
                retVal = (getAssociation(model.getReaction(rI)) != null);
        }
        return retVal;
    }

    /**
     * @return the gene product association of a reaction, or NULL if there is none
     *
     * @param reaction	SBML reaction of interest
     */
    private static GeneProductAssociation getAssociation(org.sbml.jsbml.Reaction reaction) {
        GeneProductAssociation retVal = null;
        FBCReactionPlugin fbcReaction = (FBCReactionPlugin) reaction.getExtension("fbc");
        if (fbcReaction != null && fbcReaction.isSetGeneProductAssociation())
            retVal = fbcReaction.getGeneProductAssociation();
        return retVal;
    }

    @Override
    public GeneAssociation extract(org.sbml.jsbml.Reaction reaction) throws UnsupportedAssociationShapeException {
        GeneAssociation retVal = null;
        GeneProductAssociation trigger = getAssociation(reaction);
        if (trigger != null && trigger.getAssociation() != null)
            retVal = this.convert(trigger.getAssociation(), reaction.getId());
        return retVal;
    }

    /**
     * Recursively convert an FBC association tree into a gene association.
     *
     * @param rule			association node to convert
     * @param reactionId	ID of the owning reaction (for error messages)
     *
     * @return the equivalent gene association
     *
     * @throws UnsupportedAssociationShapeException
     */
    private GeneAssociation convert(Association rule, String reactionId) throws UnsupportedAssociationShapeException {
        GeneAssociation retVal;
        if (rule instanceof GeneProductRef) {
            // Here we have a leaf.
            String id = ((GeneProductRef) rule).getGeneProduct();
            String name = this.geneNames.get(id);
            if (name == null) {
                log.warn("Gene product {} in reaction {} is not in the gene product list.", id, reactionId);
                name = StringUtils.removeStart(id, "G_");
            }
            retVal = GeneAssociation.gene(name);
        } else if (rule instanceof And || rule instanceof Or) {
            // Here we have a logical operator.  Convert the children.
            List<GeneAssociation> children = new ArrayList<GeneAssociation>();
            for (Association child : ((LogicalOperator) rule).getListOfAssociations())
                children.add(this.convert(child, reactionId));
            if (rule instanceof Or)
                retVal = new GeneAssociation.Or(children);
            else
                retVal = new GeneAssociation.And(children);
        } else {
            String type = (rule == null ? "empty" : rule.getClass().getSimpleName());
            throw new UnsupportedAssociationShapeException("Reaction " + reactionId + " has an unsupported "
                    + type + " node in its gene product association.");
        }
        return retVal;
    }

}
