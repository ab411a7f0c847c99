/**
 *
 */
package org.theseed.rba;

/**
 * This exception is thrown when an enzyme refers to a gene that has no protein, and the
 * build has been told not to tolerate that.
 */
public class UnresolvedGeneReferenceException extends RbaBuildException {

    /** serialization version ID */
    private static final long serialVersionUID = 2381577904520713385L;

    /** gene that could not be resolved */
    private final String gene;

    public UnresolvedGeneReferenceException(String gene, String enzymeId) {
        super("Gene \"" + gene + "\" in enzyme " + enzymeId + " has no matching protein.");
        this.gene = gene;
    }

    /**
     * @return the gene that could not be resolved
     */
    public String getGene() {
        return this.gene;
    }

}
