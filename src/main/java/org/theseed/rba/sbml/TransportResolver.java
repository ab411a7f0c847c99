/**
 *
 */
package org.theseed.rba.sbml;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.theseed.rba.model.Reaction;
import org.theseed.rba.model.SpeciesReference;

/**
 * This object determines which reactions are transport reactions and which metabolites they import into
 * the cytosol.  A reaction is a membrane reaction if its species are in more than one compartment (as
 * indicated by the species ID suffixes).  An imported metabolite is a reactant of a membrane reaction
 * that is outside the cytosol and has the same prefix as one of the external species, where the
 * reaction has at least one product in the cytosol.
 */
public class TransportResolver {

    // FIELDS
    /** ID of the cytosol compartment */
    private final String cytosolId;
    /** prefixes of the external metabolites */
    private final Set<String> externalPrefixes;

    /**
     * Construct a transport resolver.
     *
     * @param cytosolId				ID of the cytosol compartment
     * @param externalMetabolites	IDs of the boundary (external) species
     */
    public TransportResolver(String cytosolId, Collection<String> externalMetabolites) {
        this.cytosolId = cytosolId;
        this.externalPrefixes = externalMetabolites.stream().map(x -> SpeciesIds.prefix(x))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * @return TRUE if the reaction spans more than one compartment
     *
     * @param reaction		reaction of interest
     */
    public boolean isMembrane(Reaction reaction) {
        long compartments = reaction.getAllSpecies().stream().map(x -> SpeciesIds.suffix(x)).distinct().count();
        return (compartments > 1);
    }

    /**
     * @return the list of external metabolites imported into the cytosol by a reaction
     *
     * @param reaction		reaction of interest
     */
    public List<String> importedMetabolites(Reaction reaction) {
        List<String> retVal = new ArrayList<String>();
        if (this.isMembrane(reaction) && this.hasCytosolicProduct(reaction)) {
            for (SpeciesReference reactant : reaction.getReactants()) {
                String id = reactant.getSpecies();
                if (! SpeciesIds.suffix(id).equals(this.cytosolId) &&
                        this.externalPrefixes.contains(SpeciesIds.prefix(id)))
                    retVal.add(id);
            }
        }
        return retVal;
    }

    /**
     * @return TRUE if at least one product of the reaction is in the cytosol
     *
     * @param reaction		reaction of interest
     */
    private boolean hasCytosolicProduct(Reaction reaction) {
        return reaction.getProducts().stream().anyMatch(x -> SpeciesIds.suffix(x.getSpecies()).equals(this.cytosolId));
    }

}
