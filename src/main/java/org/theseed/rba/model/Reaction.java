/**
 *
 */
package org.theseed.rba.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object represents a reaction in the metabolism of an RBA model.  It has an ID, a reversibility
 * flag, and ordered lists of reactants and products.
 */
public class Reaction implements SubModel.IJsonItem {

    // FIELDS
    /** reaction ID */
    private final String id;
    /** reversibility flag */
    private final boolean reversible;
    /** reactant list */
    private final List<SpeciesReference> reactants;
    /** product list */
    private final List<SpeciesReference> products;

    /**
     * Construct an empty reaction.
     *
     * @param id			ID of the reaction
     * @param reversible	TRUE if the reaction is reversible
     */
    public Reaction(String id, boolean reversible) {
        this.id = id;
        this.reversible = reversible;
        this.reactants = new ArrayList<SpeciesReference>();
        this.products = new ArrayList<SpeciesReference>();
    }

    /**
     * @return a copy of this reaction with a different ID
     *
     * @param newId		ID to give to the copy
     */
    public Reaction copy(String newId) {
        Reaction retVal = new Reaction(newId, this.reversible);
        retVal.reactants.addAll(this.reactants);
        retVal.products.addAll(this.products);
        return retVal;
    }

    /**
     * Add a reactant to this reaction.
     *
     * @param species		ID of the reactant
     * @param stoich		stoichiometric coefficient
     */
    public void addReactant(String species, double stoich) {
        this.reactants.add(new SpeciesReference(species, stoich));
    }

    /**
     * Add a product to this reaction.
     *
     * @param species		ID of the product
     * @param stoich		stoichiometric coefficient
     */
    public void addProduct(String species, double stoich) {
        this.products.add(new SpeciesReference(species, stoich));
    }

    /**
     * @return the reaction ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return TRUE if this reaction is reversible
     */
    public boolean isReversible() {
        return this.reversible;
    }

    /**
     * @return the reactants of this reaction
     */
    public List<SpeciesReference> getReactants() {
        return Collections.unmodifiableList(this.reactants);
    }

    /**
     * @return the products of this reaction
     */
    public List<SpeciesReference> getProducts() {
        return Collections.unmodifiableList(this.products);
    }

    /**
     * @return the IDs of all the species in this reaction, reactants first
     */
    public List<String> getAllSpecies() {
        return Stream.concat(this.reactants.stream(), this.products.stream()).map(x -> x.getSpecies())
                .collect(Collectors.toList());
    }

    /**
     * @return TRUE if this is a sink reaction, that is, a reaction with a single species and nothing
     * 		   on the other side
     */
    public boolean isSink() {
        return (this.reactants.size() == 1 && this.products.isEmpty()) ||
                (this.reactants.isEmpty() && this.products.size() == 1);
    }

    /**
     * @return the formula for this reaction
     */
    public String getFormula() {
        String arrow = (this.reversible ? " <=> " : " --> ");
        return this.reactants.stream().map(x -> x.toString()).collect(Collectors.joining(" + "))
                + arrow + this.products.stream().map(x -> x.toString()).collect(Collectors.joining(" + "));
    }

    @Override
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("id", this.id);
        retVal.put("reversible", this.reversible);
        retVal.put("reactants", SubModel.toJsonArray(this.reactants));
        retVal.put("products", SubModel.toJsonArray(this.products));
        return retVal;
    }

    @Override
    public String toString() {
        return "Reaction " + this.id;
    }

}
