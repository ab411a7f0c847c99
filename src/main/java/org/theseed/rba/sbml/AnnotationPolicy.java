/**
 *
 */
package org.theseed.rba.sbml;

import org.theseed.rba.MissingAnnotationException;

/**
 * This enumeration determines how to handle reactions that have no gene association.  A tolerated
 * reaction gets a single empty enzyme composition (it is treated as spontaneous).
 */
public enum AnnotationPolicy {
    /** fail only if no reaction in the model is annotated */
    GLOBAL {
        @Override
        public void checkTotals(int missing, int total, double maxFraction) throws MissingAnnotationException {
            if (total > 0 && missing >= total)
                throw new MissingAnnotationException("None of the " + total + " reactions has a gene association.");
        }
    },
    /** fail if too large a fraction of the reactions is not annotated */
    FRACTION {
        @Override
        public void checkTotals(int missing, int total, double maxFraction) throws MissingAnnotationException {
            if (total > 0 && missing > maxFraction * total)
                throw new MissingAnnotationException(String.format("%d of %d reactions have no gene association, "
                        + "more than the limit of %4.1f%%.", missing, total, maxFraction * 100.0));
        }
    },
    /** fail on any reaction that is not annotated */
    PER_REACTION {
        @Override
        public void checkReaction(String reactionId) throws MissingAnnotationException {
            throw new MissingAnnotationException("Reaction " + reactionId + " has no gene association.");
        }
    };

    /**
     * Check a single reaction that has no gene association.
     *
     * @param reactionId	ID of the unannotated reaction
     *
     * @throws MissingAnnotationException	if the reaction is not tolerated
     */
    public void checkReaction(String reactionId) throws MissingAnnotationException {
    }

    /**
     * Check the unannotated-reaction count for the whole model.
     *
     * @param missing		number of reactions with no gene association
     * @param total			total number of reactions
     * @param maxFraction	maximum tolerated fraction of unannotated reactions
     *
     * @throws MissingAnnotationException	if the count is not tolerated
     */
    public void checkTotals(int missing, int total, double maxFraction) throws MissingAnnotationException {
    }

}
