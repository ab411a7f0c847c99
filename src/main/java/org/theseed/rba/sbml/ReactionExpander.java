/**
 *
 */
package org.theseed.rba.sbml;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.association.EnzymeComposition;
import org.theseed.rba.model.Reaction;

/**
 * This object expands reactions that can be catalyzed by more than one enzyme.  An RBA model allows only
 * one enzyme per reaction, so a reaction with N alternative enzyme compositions becomes N copies of the
 * reaction, each bound to one composition.  The first copy keeps the original ID.  Copy number N gets the
 * ID "<original>_duplicate_N"; if that ID is already taken, a further counter is added until the ID is
 * unique.
 *
 * One expander should be used for all the reactions of a model, since it tracks the IDs in use.
 */
public class ReactionExpander {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionExpander.class);
    /** set of reaction IDs already in use */
    private final Set<String> usedIds;
    /** number of copies created */
    private int copyCount;

    /**
     * This object binds a reaction to the single enzyme composition that catalyzes it.
     */
    public static class Binding {

        /** reaction being catalyzed */
        private final Reaction reaction;
        /** enzyme composition */
        private final EnzymeComposition composition;

        protected Binding(Reaction reaction, EnzymeComposition composition) {
            this.reaction = reaction;
            this.composition = composition;
        }

        /**
         * @return the reaction
         */
        public Reaction getReaction() {
            return this.reaction;
        }

        /**
         * @return the enzyme composition
         */
        public EnzymeComposition getComposition() {
            return this.composition;
        }

    }

    /**
     * Construct a reaction expander.
     *
     * @param originalIds	IDs of all the reactions in the original model
     */
    public ReactionExpander(Collection<String> originalIds) {
        this.usedIds = new HashSet<String>(originalIds);
        this.copyCount = 0;
    }

    /**
     * Expand a reaction into one copy per enzyme composition.
     *
     * @param reaction		original reaction
     * @param compositions	alternative enzyme compositions (at least one)
     *
     * @return a list of bindings, one per composition
     */
    public List<Binding> expand(Reaction reaction, List<EnzymeComposition> compositions) {
        List<Binding> retVal = new ArrayList<Binding>(compositions.size());
        int n = 0;
        for (EnzymeComposition composition : compositions) {
            n++;
            Reaction copy;
            if (n == 1)
                copy = reaction;
            else {
                copy = reaction.copy(this.newId(reaction.getId(), n));
                this.copyCount++;
            }
            retVal.add(new Binding(copy, composition));
        }
        if (n > 1)
            log.debug("Reaction {} expanded into {} copies.", reaction.getId(), n);
        return retVal;
    }

    /**
     * @return a unique ID for a reaction copy
     *
     * @param baseId	ID of the original reaction
     * @param n			index of the copy's enzyme composition (2 or more)
     */
    private String newId(String baseId, int n) {
        String base = baseId + "_duplicate_" + n;
        String retVal = base;
        for (int m = 2; this.usedIds.contains(retVal); m++)
            retVal = base + "_" + m;
        this.usedIds.add(retVal);
        return retVal;
    }

    /**
     * @return the number of reaction copies created
     */
    public int getCopyCount() {
        return this.copyCount;
    }

}
