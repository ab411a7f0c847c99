/**
 *
 */
package org.theseed.rba.build;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.UnresolvedGeneReferenceException;

/**
 * This enumeration determines what happens when a gene in an enzyme composition has no protein in
 * the parameter file.  In every case except FAIL the gene is left out of the enzyme machinery.
 */
public enum UnresolvedGenePolicy {
    /** leave the gene out without comment */
    DROP,
    /** leave the gene out and write a warning */
    WARN {
        @Override
        public void handle(String gene, String enzymeId) {
            log.warn("Gene {} in enzyme {} has no matching protein and will be left out.", gene, enzymeId);
        }
    },
    /** abort the build */
    FAIL {
        @Override
        public void handle(String gene, String enzymeId) throws UnresolvedGeneReferenceException {
            throw new UnresolvedGeneReferenceException(gene, enzymeId);
        }
    };

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(UnresolvedGenePolicy.class);

    /**
     * Process a gene with no matching protein.
     *
     * @param gene		name of the unresolved gene
     * @param enzymeId	ID of the enzyme containing the gene
     *
     * @throws UnresolvedGeneReferenceException	if unresolved genes are not tolerated
     */
    public void handle(String gene, String enzymeId) throws UnresolvedGeneReferenceException {
    }

}
