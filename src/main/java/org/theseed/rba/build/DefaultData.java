/**
 *
 */
package org.theseed.rba.build;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.theseed.rba.RbaBuildException;
import org.theseed.rba.model.Parameters;

/**
 * This object contains the default biological data used to fill in an RBA model:  the standard
 * identifiers, the elementary macromolecule components, and the default parameter functions.  A new
 * instance is created for each build.
 *
 * The parameter values are typical of a fast-growing bacterium.  They are meant to be replaced by
 * calibrated values once the model is in use.
 */
public class DefaultData {

    // FIELDS
    /** map of amino acid one-letter codes to metabolite keys */
    private final Map<String, String> aminoAcids;
    /** average mRNA composition */
    private final Map<String, Double> mrnaComposition;
    /** average DNA composition */
    private final Map<String, Double> dnaComposition;
    /** medium concentration for external metabolites */
    private double mediumConcentration;

    /** ID of the maintenance ATP reaction */
    public static final String ATPM_REACTION = "R_maintenance_atp";
    /** ID of the average mRNA */
    public static final String MRNA = "mrna";
    /** ID of the average DNA */
    public static final String DNA = "dna";
    /** ID of the default enzyme efficiency */
    public static final String EFFICIENCY = "default_efficiency";
    /** ID of the default transporter efficiency */
    public static final String TRANSPORTER_EFFICIENCY = "default_transporter_efficiency";
    /** ID of the amino acid concentration function */
    public static final String AMINO_ACID_CONCENTRATION = "amino_acid_concentration";
    /** ID of the inverse average protein length function */
    public static final String INVERSE_PROTEIN_LENGTH = "inverse_average_protein_length";
    /** ID of the ribosome capacity function */
    public static final String RIBOSOME_CAPACITY = "ribosome_capacity";
    /** ID of the chaperone efficiency function */
    public static final String CHAPERONE_EFFICIENCY = "chaperone_efficiency";
    /** ID of the mRNA concentration function */
    public static final String MRNA_CONCENTRATION = "mrna_concentration";
    /** ID of the DNA concentration function */
    public static final String DNA_CONCENTRATION = "dna_concentration";
    /** ID of the mRNA degradation flux function */
    public static final String MRNA_DEGRADATION = "mrna_degradation_flux";
    /** ID of the maintenance ATP flux function */
    public static final String MAINTENANCE_ATP = "maintenance_atp";
    /** default medium concentration */
    public static final double MEDIUM_CONCENTRATION = 10.0;
    /** fraction of the protein mass in the cytosol when there are other internal compartments */
    public static final double CYTOSOL_PROTEIN_FRACTION = 0.8;
    /** fraction of the proteins in each compartment that are not enzymes */
    public static final double NON_ENZYMATIC_FRACTION = 0.1;
    /** length of the average protein when no protein sequences are available */
    public static final double DEFAULT_PROTEIN_LENGTH = 300.0;

    /** one-letter codes and metabolite keys of the amino acids */
    private static final String[][] AMINO_ACIDS = new String[][] {
        { "A", "ALA" }, { "C", "CYS" }, { "D", "ASP" }, { "E", "GLU" }, { "F", "PHE" },
        { "G", "GLY" }, { "H", "HIS" }, { "I", "ILE" }, { "K", "LYS" }, { "L", "LEU" },
        { "M", "MET" }, { "N", "ASN" }, { "P", "PRO" }, { "Q", "GLN" }, { "R", "ARG" },
        { "S", "SER" }, { "T", "THR" }, { "V", "VAL" }, { "W", "TRP" }, { "Y", "TYR" }
    };

    /**
     * Construct the default data.
     */
    public DefaultData() {
        this.aminoAcids = new LinkedHashMap<String, String>(AMINO_ACIDS.length * 4 / 3 + 1);
        for (String[] aa : AMINO_ACIDS)
            this.aminoAcids.put(aa[0], aa[1]);
        this.mrnaComposition = new LinkedHashMap<String, Double>();
        this.mrnaComposition.put("A", 0.2818);
        this.mrnaComposition.put("C", 0.2181);
        this.mrnaComposition.put("G", 0.2171);
        this.mrnaComposition.put("U", 0.283);
        this.dnaComposition = new LinkedHashMap<String, Double>();
        this.dnaComposition.put("A", 0.2818);
        this.dnaComposition.put("C", 0.2181);
        this.dnaComposition.put("G", 0.2171);
        this.dnaComposition.put("T", 0.283);
        this.mediumConcentration = MEDIUM_CONCENTRATION;
    }

    /**
     * @return the one-letter codes of the amino acids
     */
    public Set<String> getAminoAcids() {
        return Collections.unmodifiableSet(this.aminoAcids.keySet());
    }

    /**
     * @return the metabolite key for an amino acid
     *
     * @param aa	one-letter code of the amino acid
     */
    public String getAminoAcidKey(String aa) {
        return this.aminoAcids.get(aa);
    }

    /**
     * @return the average protein composition for a set of protein sequences; if there are no
     * 		   sequences, each amino acid is given an equal share of the default length
     *
     * @param sequences		protein sequences to average
     */
    public Map<String, Double> averageProtein(Collection<String> sequences) {
        Map<String, Double> retVal = new TreeMap<String, Double>();
        if (sequences.isEmpty()) {
            double share = DEFAULT_PROTEIN_LENGTH / this.aminoAcids.size();
            for (String aa : this.aminoAcids.keySet())
                retVal.put(aa, share);
        } else {
            for (String sequence : sequences) {
                Map<String, Double> counts = SequenceCompositions.aminoAcids(sequence, this.aminoAcids.keySet());
                for (Map.Entry<String, Double> count : counts.entrySet())
                    retVal.merge(count.getKey(), count.getValue(), Double::sum);
            }
            final double n = sequences.size();
            retVal.replaceAll((k, v) -> v / n);
        }
        return retVal;
    }

    /**
     * @return the average mRNA composition
     */
    public Map<String, Double> getMrnaComposition() {
        return Collections.unmodifiableMap(this.mrnaComposition);
    }

    /**
     * @return the average DNA composition
     */
    public Map<String, Double> getDnaComposition() {
        return Collections.unmodifiableMap(this.dnaComposition);
    }

    /**
     * @return the medium concentration for external metabolites
     */
    public double getMediumConcentration() {
        return this.mediumConcentration;
    }

    /**
     * Override the medium concentration.
     *
     * @param mediumConcentration	new concentration to use
     */
    public void setMediumConcentration(double mediumConcentration) {
        this.mediumConcentration = mediumConcentration;
    }

    /**
     * @return the ID of the average protein for a compartment
     *
     * @param compartment	ID of the compartment
     */
    public static String averageProteinId(String compartment) {
        return "average_protein_" + compartment;
    }

    /**
     * @return the ID of the density bound for a compartment
     *
     * @param compartment	ID of the compartment
     */
    public static String densityId(String compartment) {
        return compartment + "_density";
    }

    /**
     * @return the ID of the protein fraction function for a compartment
     *
     * @param compartment	ID of the compartment
     */
    public static String proteinFractionId(String compartment) {
        return "fraction_protein_" + compartment;
    }

    /**
     * @return the ID of the non-enzymatic protein target for a compartment
     *
     * @param compartment	ID of the compartment
     */
    public static String nonEnzymaticProteinsId(String compartment) {
        return "nonenzymatic_proteins_" + compartment;
    }

    /**
     * @return the ID of the efficiency aggregate for a membrane reaction
     *
     * @param reaction	ID of the reaction
     */
    public static String transportAggregateId(String reaction) {
        return reaction + "_efficiency";
    }

    /**
     * @return the ID of a concentration target function
     *
     * @param speciesId		ID of the species whose concentration is targeted
     */
    public static String concentrationId(String speciesId) {
        return speciesId + "_concentration";
    }

    /**
     * Add the density functions.  Each internal compartment gets a share of the total protein mass,
     * and its density bound is the amino acid concentration times that share.
     *
     * @param parms			parameter sub-model to update
     * @param cytosol		ID of the cytosol compartment
     * @param internal		IDs of the internal (non-external) compartments
     */
    public void addDensityFunctions(Parameters parms, String cytosol, List<String> internal) {
        parms.addFunction(new Parameters.Function(AMINO_ACID_CONCENTRATION, Parameters.LINEAR)
                .set("LINEAR_CONSTANT", 4.8972).set("LINEAR_COEF", 0.2).set("X_MIN", 0.0).set("X_MAX", 2.5)
                .set("Y_MIN", 0.0).set("Y_MAX", 1e5));
        // Compute the protein fractions.
        final int n = internal.size();
        boolean hasCytosol = internal.contains(cytosol);
        double cytosolFraction = 0.0;
        double otherFraction = 0.0;
        if (! hasCytosol)
            otherFraction = 1.0 / n;
        else if (n == 1)
            cytosolFraction = 1.0;
        else {
            cytosolFraction = CYTOSOL_PROTEIN_FRACTION;
            otherFraction = (1.0 - CYTOSOL_PROTEIN_FRACTION) / (n - 1);
        }
        for (String compartment : internal) {
            double fraction = (compartment.equals(cytosol) ? cytosolFraction : otherFraction);
            parms.addFunction(Parameters.Function.constant(proteinFractionId(compartment), fraction));
            parms.addAggregate(new Parameters.Aggregate(densityId(compartment), Parameters.MULTIPLICATION,
                    List.of(AMINO_ACID_CONCENTRATION, proteinFractionId(compartment))));
        }
    }

    /**
     * Add the inverse average protein length function.
     *
     * @param parms			parameter sub-model to update
     * @param length		average protein length
     *
     * @throws RbaBuildException	if the average protein has no residues
     */
    public void addProteinLengthFunction(Parameters parms, double length) throws RbaBuildException {
        if (! (length > 0.0) || Double.isInfinite(length))
            throw new RbaBuildException("Average protein length is " + length
                    + ".  No protein sequence contains a recognized amino acid.");
        parms.addFunction(Parameters.Function.constant(INVERSE_PROTEIN_LENGTH, 1.0 / length));
    }

    /**
     * Add the functions used by the processes and the process targets.
     *
     * @param parms			parameter sub-model to update
     * @param internal		IDs of the internal (non-external) compartments
     */
    public void addProcessFunctions(Parameters parms, List<String> internal) {
        parms.addFunction(new Parameters.Function(RIBOSOME_CAPACITY, Parameters.MICHAELIS_MENTEN)
                .set("kmax", 54000.0).set("Km", 0.5));
        parms.addFunction(Parameters.Function.constant(CHAPERONE_EFFICIENCY, 36000.0));
        for (String compartment : internal) {
            String fractionId = "nonenzymatic_fraction_" + compartment;
            parms.addFunction(Parameters.Function.constant(fractionId, NON_ENZYMATIC_FRACTION));
            parms.addAggregate(new Parameters.Aggregate(nonEnzymaticProteinsId(compartment), Parameters.MULTIPLICATION,
                    List.of(AMINO_ACID_CONCENTRATION, proteinFractionId(compartment), fractionId,
                            INVERSE_PROTEIN_LENGTH)));
        }
        parms.addFunction(Parameters.Function.constant(MRNA_CONCENTRATION, 10.0));
        parms.addFunction(Parameters.Function.constant(DNA_CONCENTRATION, 0.0807));
        parms.addFunction(Parameters.Function.constant(MRNA_DEGRADATION, 1.0));
        parms.addFunction(new Parameters.Function(MAINTENANCE_ATP, Parameters.LINEAR)
                .set("LINEAR_CONSTANT", 8.39).set("LINEAR_COEF", 0.0).set("X_MIN", 0.25).set("X_MAX", 1.5)
                .set("Y_MIN", 0.0).set("Y_MAX", 1e5));
    }

    /**
     * Add a concentration target function for a metabolite.
     *
     * @param parms				parameter sub-model to update
     * @param speciesId			ID of the targeted species
     * @param concentration		target concentration
     */
    public void addConcentrationFunction(Parameters parms, String speciesId, double concentration) {
        parms.addFunction(Parameters.Function.constant(concentrationId(speciesId), concentration));
    }

    /**
     * Add the generic enzyme and transporter efficiency functions.
     *
     * @param parms			parameter sub-model to update
     */
    public void addEfficiencyFunctions(Parameters parms) {
        parms.addFunction(Parameters.Function.constant(EFFICIENCY, 12600.0));
        parms.addFunction(Parameters.Function.constant(TRANSPORTER_EFFICIENCY, 3600.0));
    }

    /**
     * Add the efficiency aggregate for a membrane reaction.  Each imported metabolite contributes a
     * Michaelis-Menten factor based on its concentration in the medium.
     *
     * @param parms			parameter sub-model to update
     * @param reaction		ID of the membrane reaction
     * @param imported		IDs of the metabolites it imports
     */
    public void addTransportAggregate(Parameters parms, String reaction, List<String> imported) {
        List<String> refs = new ArrayList<String>(imported.size() + 1);
        refs.add(TRANSPORTER_EFFICIENCY);
        for (String metabolite : imported) {
            String factorId = reaction + "_" + metabolite + "_transport_factor";
            parms.addFunction(new Parameters.Function(factorId, Parameters.MICHAELIS_MENTEN)
                    .set("kmax", 1.0).set("Km", 0.8).setVariable(metabolite));
            refs.add(factorId);
        }
        parms.addAggregate(new Parameters.Aggregate(transportAggregateId(reaction), Parameters.MULTIPLICATION, refs));
    }

}
