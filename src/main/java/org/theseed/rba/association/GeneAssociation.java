/**
 *
 */
package org.theseed.rba.association;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * This object represents a Boolean gene association:  a formula over gene IDs that describes which
 * combinations of genes can catalyze a reaction.  A formula is a tree whose leaves are genes and whose
 * interior nodes are ANDs and ORs.  An AND with no children is the empty association, which denotes a
 * reaction that needs no gene at all.
 *
 * Associations are produced by the annotation parsers, consumed once by the {@link DnfNormalizer}, and
 * then discarded.
 */
public abstract class GeneAssociation {

    /** empty association (no genes required) */
    public static final GeneAssociation EMPTY = new And(Collections.emptyList());

    /**
     * Construct a gene association node.
     */
    protected GeneAssociation() { }

    /**
     * @return a leaf node for the specified gene
     *
     * @param gene		ID of the gene
     */
    public static GeneAssociation gene(String gene) {
        return new Leaf(gene);
    }

    /**
     * @return an AND node for the specified sub-associations
     *
     * @param children	sub-associations that must all be satisfied
     */
    public static GeneAssociation and(GeneAssociation... children) {
        return new And(Arrays.asList(children));
    }

    /**
     * @return an OR node for the specified sub-associations
     *
     * @param children	alternative sub-associations
     */
    public static GeneAssociation or(GeneAssociation... children) {
        return new Or(Arrays.asList(children));
    }

    /**
     * @return TRUE if this association contains no genes
     */
    public abstract boolean isEmpty();

    /**
     * This is a single gene in the association.
     */
    public static class Leaf extends GeneAssociation {

        /** ID of the gene */
        private final String gene;

        /**
         * Construct a gene leaf.
         *
         * @param gene		ID of the gene
         */
        public Leaf(String gene) {
            this.gene = gene;
        }

        /**
         * @return the gene ID
         */
        public String getGene() {
            return this.gene;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public String toString() {
            return this.gene;
        }

    }

    /**
     * This is the base class for the two logical operators.  The children are kept in
     * their original order.
     */
    public abstract static class Operator extends GeneAssociation {

        /** sub-associations */
        private final List<GeneAssociation> children;

        /**
         * Construct an operator node.
         *
         * @param children	list of sub-associations
         */
        protected Operator(List<GeneAssociation> children) {
            this.children = Collections.unmodifiableList(new ArrayList<GeneAssociation>(children));
        }

        /**
         * @return the sub-associations of this operator
         */
        public List<GeneAssociation> getChildren() {
            return this.children;
        }

        @Override
        public boolean isEmpty() {
            return this.children.stream().allMatch(x -> x.isEmpty());
        }

        /**
         * @return the keyword used to join the children when displaying the operator
         */
        protected abstract String getKeyword();

        @Override
        public String toString() {
            return this.children.stream().map(x -> x.toString())
                    .collect(Collectors.joining(" " + this.getKeyword() + " ", "(", ")"));
        }

    }

    /**
     * All of the children are required.
     */
    public static class And extends Operator {

        public And(List<GeneAssociation> children) {
            super(children);
        }

        @Override
        protected String getKeyword() {
            return "and";
        }

    }

    /**
     * Any one of the children is sufficient.
     */
    public static class Or extends Operator {

        public Or(List<GeneAssociation> children) {
            super(children);
        }

        @Override
        protected String getKeyword() {
            return "or";
        }

    }

}
