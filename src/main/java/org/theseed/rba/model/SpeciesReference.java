/**
 *
 */
package org.theseed.rba.model;

import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This is a simple object that connects a species (or macromolecule) to a stoichiometric coefficient.
 * The coefficient is always positive; whether the species is consumed or produced depends on the
 * list in which the reference lives.
 */
public class SpeciesReference implements SubModel.IJsonItem {

    /** ID of the referenced species */
    private final String species;
    /** stoichiometric coefficient */
    private final double stoichiometry;

    /**
     * Construct a species reference.
     *
     * @param species			ID of the species
     * @param stoichiometry		stoichiometric coefficient
     */
    public SpeciesReference(String species, double stoichiometry) {
        this.species = species;
        this.stoichiometry = stoichiometry;
    }

    /**
     * @return the ID of the referenced species
     */
    public String getSpecies() {
        return this.species;
    }

    /**
     * @return the stoichiometric coefficient
     */
    public double getStoichiometry() {
        return this.stoichiometry;
    }

    @Override
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("species", this.species);
        retVal.put("stoichiometry", this.stoichiometry);
        return retVal;
    }

    @Override
    public String toString() {
        String retVal;
        if (this.stoichiometry == 1.0)
            retVal = this.species;
        else
            retVal = String.format("%g*%s", this.stoichiometry, this.species);
        return retVal;
    }

}
