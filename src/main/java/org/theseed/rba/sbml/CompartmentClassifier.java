/**
 *
 */
package org.theseed.rba.sbml;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.model.Reaction;

/**
 * This object determines which compartments of a model are external, that is, part of the environment.
 * A compartment is external if every species in it takes part in a sink reaction (a reaction with a
 * single species on one side and nothing on the other), or if it is named in the override list.
 */
public class CompartmentClassifier {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CompartmentClassifier.class);
    /** compartments that are always external */
    private final Set<String> overrides;

    /**
     * Construct a compartment classifier.
     *
     * @param overrides		IDs of compartments to be treated as external regardless of topology
     */
    public CompartmentClassifier(Collection<String> overrides) {
        this.overrides = new TreeSet<String>(overrides);
    }

    /**
     * Compute the set of external compartments.
     *
     * @param compartments		IDs of all the compartments in the model
     * @param speciesMap		map of species IDs to compartment IDs
     * @param reactions			reactions in the model
     *
     * @return the set of external compartment IDs
     */
    public Set<String> classify(Collection<String> compartments, Map<String, String> speciesMap,
            Collection<Reaction> reactions) {
        Set<String> sinkSpecies = sinkSpecies(reactions);
        // Start with all compartments and remove the ones that have a non-sink species.
        Set<String> retVal = new TreeSet<String>(compartments);
        for (Map.Entry<String, String> specEntry : speciesMap.entrySet()) {
            if (! sinkSpecies.contains(specEntry.getKey()))
                retVal.remove(specEntry.getValue());
        }
        log.debug("{} compartments have only sink species.", retVal.size());
        retVal.addAll(this.overrides);
        log.info("External compartments are {}.", retVal);
        return retVal;
    }

    /**
     * @return the set of species that participate in sink reactions
     *
     * @param reactions		reactions to examine
     */
    public static Set<String> sinkSpecies(Collection<Reaction> reactions) {
        Set<String> retVal = new HashSet<String>();
        for (Reaction reaction : reactions) {
            if (reaction.isSink())
                retVal.addAll(reaction.getAllSpecies());
        }
        return retVal;
    }

}
