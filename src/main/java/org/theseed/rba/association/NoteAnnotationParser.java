/**
 *
 */
package org.theseed.rba.association;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.xml.XMLNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.UnsupportedAssociationShapeException;

/**
 * This annotation parser reads COBRA-style reaction notes.  The notes are XHTML, and each field is a
 * paragraph of the form "KEY: value".  The gene association is in the GENE_ASSOCIATION field, which
 * contains a text expression such as "(b0001 and b0002) or b0003".
 */
public class NoteAnnotationParser implements AnnotationParser {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NoteAnnotationParser.class);
    /** name of the gene association field */
    public static final String TAG = "GENE_ASSOCIATION";
    /** parser for the association text */
    private final AssociationExpressionParser parser;

    /**
     * Construct a new notes annotation parser.
     */
    public NoteAnnotationParser() {
        this.parser = new AssociationExpressionParser();
    }

    /**
     * @return TRUE if at least one reaction in the model has a GENE_ASSOCIATION note
     *
     * @param model		SBML model to check
     */
    public static boolean isAvailable(Model model) {
        boolean retVal = false;
        final int rN = model.getReactionCount();
        for (int rI = 0; rI < rN && ! retVal; rI++)
            retVal = (findAssociationText(model.getReaction(rI)) != null);
        return retVal;
    }

    /**
     * @return the text of the gene association field for a reaction (without the tag), or NULL if the
     * 		   reaction has no such field
     *
     * @param reaction	SBML reaction of interest
     */
    protected static String findAssociationText(org.sbml.jsbml.Reaction reaction) {
        String retVal = null;
        if (reaction.isSetNotes()) {
            List<String> fields = new ArrayList<String>();
            collectText(reaction.getNotes(), fields);
            for (String field : fields) {
                String[] parts = StringUtils.split(field, ":", 2);
                if (retVal == null && parts.length >= 1 && parts[0].trim().equalsIgnoreCase(TAG))
                    retVal = (parts.length == 2 ? parts[1].trim() : "");
            }
        }
        return retVal;
    }

    /**
     * Recursively collect the non-blank text nodes under an XML node.
     *
     * @param node		XML node to search
     * @param texts		list into which the text strings should be placed
     */
    private static void collectText(XMLNode node, List<String> texts) {
        if (node.isText()) {
            String text = node.getCharacters();
            if (! StringUtils.isBlank(text))
                texts.add(text.trim());
        } else {
            final int n = node.getChildCount();
            for (int i = 0; i < n; i++)
                collectText(node.getChildAt(i), texts);
        }
    }

    @Override
    public GeneAssociation extract(org.sbml.jsbml.Reaction reaction) throws UnsupportedAssociationShapeException {
        GeneAssociation retVal = null;
        String text = findAssociationText(reaction);
        if (text == null)
            log.debug("No gene association note found for reaction {}.", reaction.getId());
        else
            retVal = this.parser.parse(text);
        return retVal;
    }

}
