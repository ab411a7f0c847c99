/**
 *
 */
package org.theseed.rba.association;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.theseed.rba.UnsupportedAssociationShapeException;

/**
 * This object converts a gene association to disjunctive normal form and returns the clauses.  Each
 * clause is an enzyme composition.  ORs are flattened by concatenating the clauses of their children,
 * and ANDs are distributed over the children's clauses by taking the cross product.  Genes are
 * deduplicated inside each clause, and identical clauses are deduplicated across the result, keeping
 * the order in which the clauses are first generated.
 *
 * The result is never empty:  an association with no genes produces a single empty composition,
 * which denotes a spontaneous reaction.
 */
public class DnfNormalizer {

    /** result for an association with no genes */
    private static final List<EnzymeComposition> SPONTANEOUS = Collections.singletonList(EnzymeComposition.EMPTY);

    /**
     * Compute the enzyme compositions for a gene association.
     *
     * @param association	association to normalize
     *
     * @return the list of distinct DNF clauses, in a stable order
     *
     * @throws UnsupportedAssociationShapeException		if the association contains an unknown node type
     */
    public List<EnzymeComposition> normalize(GeneAssociation association) throws UnsupportedAssociationShapeException {
        List<EnzymeComposition> clauses = this.expand(association);
        Set<EnzymeComposition> distinct = new LinkedHashSet<EnzymeComposition>(clauses);
        return new ArrayList<EnzymeComposition>(distinct);
    }

    /**
     * Recursively expand an association node into its clauses.
     *
     * @param node		association node to expand
     *
     * @return the clauses for the node, possibly with duplicates (never empty)
     *
     * @throws UnsupportedAssociationShapeException
     */
    private List<EnzymeComposition> expand(GeneAssociation node) throws UnsupportedAssociationShapeException {
        List<EnzymeComposition> retVal;
        if (node instanceof GeneAssociation.Leaf) {
            String gene = ((GeneAssociation.Leaf) node).getGene();
            retVal = Collections.singletonList(EnzymeComposition.of(gene));
        } else if (node != null && node.isEmpty()) {
            // A subtree with no genes requires nothing, so it is satisfied by the empty clause.
            retVal = SPONTANEOUS;
        } else if (node instanceof GeneAssociation.Or) {
            // An OR is the union of its alternatives.  An empty alternative contributes the empty clause.
            retVal = new ArrayList<EnzymeComposition>();
            for (GeneAssociation child : ((GeneAssociation.Or) node).getChildren())
                retVal.addAll(this.expand(child));
        } else if (node instanceof GeneAssociation.And) {
            // An AND starts with one empty clause and multiplies it by each child.
            retVal = SPONTANEOUS;
            for (GeneAssociation child : ((GeneAssociation.And) node).getChildren())
                retVal = this.distribute(retVal, this.expand(child));
        } else {
            String type = (node == null ? "null" : node.getClass().getSimpleName());
            throw new UnsupportedAssociationShapeException("Unsupported gene association node type " + type + ".");
        }
        return retVal;
    }

    /**
     * @return the cross product of two clause lists
     *
     * @param left		first list of clauses
     * @param right		second list of clauses
     */
    private List<EnzymeComposition> distribute(List<EnzymeComposition> left, List<EnzymeComposition> right) {
        List<EnzymeComposition> retVal = new ArrayList<EnzymeComposition>(left.size() * right.size());
        for (EnzymeComposition leftClause : left) {
            for (EnzymeComposition rightClause : right)
                retVal.add(leftClause.merge(rightClause));
        }
        return retVal;
    }

}
