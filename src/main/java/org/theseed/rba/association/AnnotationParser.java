/**
 *
 */
package org.theseed.rba.association;

import org.sbml.jsbml.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.MissingAnnotationException;
import org.theseed.rba.UnsupportedAssociationShapeException;

/**
 * An annotation parser extracts the gene association for each reaction of an SBML model.  There are
 * two encodings in use:  the FBC package stores a structured association tree on each reaction, and
 * older COBRA-style models store the association as text in the reaction notes.  A single parser is
 * chosen for the whole document, based on which encoding the model provides.
 */
public interface AnnotationParser {

    /** logging facility */
    static final Logger log = LoggerFactory.getLogger(AnnotationParser.class);

    /**
     * This enumeration describes the supported annotation encodings.
     */
    public static enum Type {
        /** gene product associations in the FBC package */
        FBC {
            @Override
            public boolean isAvailable(Model model) {
                return FbcAnnotationParser.isAvailable(model);
            }

            @Override
            public AnnotationParser create(Model model) {
                return new FbcAnnotationParser(model);
            }
        },
        /** GENE_ASSOCIATION text in reaction notes */
        NOTES {
            @Override
            public boolean isAvailable(Model model) {
                return NoteAnnotationParser.isAvailable(model);
            }

            @Override
            public AnnotationParser create(Model model) {
                return new NoteAnnotationParser();
            }
        };

        /**
         * @return TRUE if the specified model contains annotations in this encoding
         *
         * @param model		SBML model to check
         */
        public abstract boolean isAvailable(Model model);

        /**
         * @return an annotation parser of this type for the specified model
         *
         * @param model		SBML model to be parsed
         */
        public abstract AnnotationParser create(Model model);

    }

    /**
     * Compute the gene association for a reaction.
     *
     * @param reaction	SBML reaction to examine
     *
     * @return the gene association, or NULL if the reaction has no annotation
     *
     * @throws UnsupportedAssociationShapeException		if the association is not made of genes, ANDs, and ORs
     */
    public GeneAssociation extract(org.sbml.jsbml.Reaction reaction) throws UnsupportedAssociationShapeException;

    /**
     * Choose the annotation parser for a model.  The encodings are probed in order, and the first
     * one present is used for every reaction.
     *
     * @param model		SBML model to be parsed
     *
     * @return an annotation parser for the model
     *
     * @throws MissingAnnotationException	if the model has no gene annotations in any known encoding
     */
    public static AnnotationParser select(Model model) throws MissingAnnotationException {
        AnnotationParser retVal = null;
        for (Type type : Type.values()) {
            if (retVal == null && type.isAvailable(model)) {
                log.info("Using {} gene annotations for model {}.", type, model.getId());
                retVal = type.create(model);
            }
        }
        if (retVal == null)
            throw new MissingAnnotationException("Model " + model.getId() + " has neither FBC gene products "
                    + "nor GENE_ASSOCIATION notes to define enzyme compositions.");
        return retVal;
    }

}
