/**
 *
 */
package org.theseed.rba.build;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.theseed.rba.model.Processes;
import org.theseed.rba.model.SpeciesReference;

/**
 * This object builds the default cellular processes and their processing maps.  The metabolites
 * consumed and produced by each processing step are specified by metabolite key, and are resolved
 * to SBML species through the metabolite map.  A metabolite that is not in the model is left out.
 */
public class DefaultProcesses {

    // FIELDS
    /** default data */
    private final DefaultData defaults;
    /** map of metabolite keys to SBML species IDs */
    private final Map<String, String> metaboliteMap;

    /** ID of the translation processing map */
    public static final String TRANSLATION_MAP = "translation";
    /** ID of the folding processing map */
    public static final String FOLDING_MAP = "folding";
    /** ID of the transcription processing map */
    public static final String TRANSCRIPTION_MAP = "transcription";
    /** ID of the RNA degradation processing map */
    public static final String RNA_DEGRADATION_MAP = "rna_degradation";
    /** ID of the replication processing map */
    public static final String REPLICATION_MAP = "replication";

    /** nucleotide codes and the metabolite keys for their triphosphates and monophosphates */
    private static final String[][] RNA_NUCLEOTIDES = new String[][] {
        { "A", "ATP", "AMP" }, { "C", "CTP", "CMP" }, { "G", "GTP", "GMP" }, { "U", "UTP", "UMP" }
    };
    /** DNA nucleotide codes and the metabolite keys for their triphosphates */
    private static final String[][] DNA_NUCLEOTIDES = new String[][] {
        { "A", "dATP" }, { "C", "dCTP" }, { "G", "dGTP" }, { "T", "dTTP" }
    };

    /**
     * Construct a process builder.
     *
     * @param defaults			default data
     * @param metaboliteMap		map of metabolite keys to SBML species IDs (resolved metabolites only)
     */
    public DefaultProcesses(DefaultData defaults, Map<String, String> metaboliteMap) {
        this.defaults = defaults;
        this.metaboliteMap = metaboliteMap;
    }

    /**
     * @return the translation process
     *
     * @param machinery		ribosome composition
     * @param proteins		IDs of all the proteins
     */
    public Processes.Process translation(List<SpeciesReference> machinery, Collection<String> proteins) {
        Processes.Process retVal = new Processes.Process("P_TA", "Translation");
        retVal.setMachinery(machinery, DefaultData.RIBOSOME_CAPACITY);
        retVal.addProduction(new Processes.Processing(TRANSLATION_MAP, proteins));
        return retVal;
    }

    /**
     * @return the folding process
     *
     * @param machinery		chaperone composition
     * @param proteins		IDs of all the proteins
     */
    public Processes.Process folding(List<SpeciesReference> machinery, Collection<String> proteins) {
        Processes.Process retVal = new Processes.Process("P_CHP", "Folding");
        retVal.setMachinery(machinery, DefaultData.CHAPERONE_EFFICIENCY);
        retVal.addProduction(new Processes.Processing(FOLDING_MAP, proteins));
        return retVal;
    }

    /**
     * @return the transcription process
     *
     * @param rnas		IDs of all the RNAs
     */
    public Processes.Process transcription(Collection<String> rnas) {
        Processes.Process retVal = new Processes.Process("P_TSC", "Transcription");
        retVal.addProduction(new Processes.Processing(TRANSCRIPTION_MAP, rnas));
        return retVal;
    }

    /**
     * @return the replication process
     *
     * @param dnas		IDs of all the DNA macromolecules
     */
    public Processes.Process replication(Collection<String> dnas) {
        Processes.Process retVal = new Processes.Process("P_REP", "Replication");
        retVal.addProduction(new Processes.Processing(REPLICATION_MAP, dnas));
        return retVal;
    }

    /**
     * @return the RNA degradation process
     *
     * @param rnas		IDs of all the RNAs
     */
    public Processes.Process rnaDegradation(Collection<String> rnas) {
        Processes.Process retVal = new Processes.Process("P_RNA_DEG", "RNA degradation");
        retVal.addDegradation(new Processes.Processing(RNA_DEGRADATION_MAP, rnas));
        return retVal;
    }

    /**
     * @return the translation processing map.  Each amino acid costs the amino acid itself plus two
     * 		   GTP; each cofactor costs one molecule of the cofactor.
     *
     * @param cofactors		cofactors of the enzymatic proteins
     */
    public Processes.ProcessingMap translationMap(Collection<RbaConfig.Cofactor> cofactors) {
        Processes.ProcessingMap retVal = new Processes.ProcessingMap(TRANSLATION_MAP);
        for (String aa : this.defaults.getAminoAcids()) {
            Processes.ComponentProcessing cost = new Processes.ComponentProcessing(aa, 1.0);
            this.addReactant(cost, this.defaults.getAminoAcidKey(aa), 1.0);
            this.addReactant(cost, "GTP", 2.0);
            this.addReactant(cost, "H2O", 2.0);
            this.addProduct(cost, "GDP", 2.0);
            this.addProduct(cost, "Pi", 2.0);
            this.addProduct(cost, "H", 2.0);
            retVal.addComponentProcessing(cost);
        }
        for (RbaConfig.Cofactor cofactor : cofactors) {
            if (retVal.getComponentProcessing(cofactor.getChebi()) == null) {
                Processes.ComponentProcessing cost = new Processes.ComponentProcessing(cofactor.getChebi(), 0.0);
                this.addReactant(cost, cofactor.getChebi(), 1.0);
                retVal.addComponentProcessing(cost);
            }
        }
        return retVal;
    }

    /**
     * @return the folding processing map.  Folding consumes chaperone time but no metabolites.
     */
    public Processes.ProcessingMap foldingMap() {
        Processes.ProcessingMap retVal = new Processes.ProcessingMap(FOLDING_MAP);
        for (String aa : this.defaults.getAminoAcids())
            retVal.addComponentProcessing(new Processes.ComponentProcessing(aa, 1.0));
        return retVal;
    }

    /**
     * @return the transcription processing map.  Each nucleotide costs one triphosphate and
     * 		   releases a pyrophosphate.
     */
    public Processes.ProcessingMap transcriptionMap() {
        Processes.ProcessingMap retVal = new Processes.ProcessingMap(TRANSCRIPTION_MAP);
        for (String[] nucleotide : RNA_NUCLEOTIDES) {
            Processes.ComponentProcessing cost = new Processes.ComponentProcessing(nucleotide[0], 1.0);
            this.addReactant(cost, nucleotide[1], 1.0);
            this.addProduct(cost, "PPi", 1.0);
            retVal.addComponentProcessing(cost);
        }
        return retVal;
    }

    /**
     * @return the RNA degradation processing map.  Each nucleotide is hydrolyzed to its monophosphate.
     */
    public Processes.ProcessingMap rnaDegradationMap() {
        Processes.ProcessingMap retVal = new Processes.ProcessingMap(RNA_DEGRADATION_MAP);
        for (String[] nucleotide : RNA_NUCLEOTIDES) {
            Processes.ComponentProcessing cost = new Processes.ComponentProcessing(nucleotide[0], 1.0);
            this.addReactant(cost, "H2O", 1.0);
            this.addProduct(cost, nucleotide[2], 1.0);
            this.addProduct(cost, "H", 1.0);
            retVal.addComponentProcessing(cost);
        }
        return retVal;
    }

    /**
     * @return the replication processing map.  Each nucleotide costs one deoxy-triphosphate and
     * 		   releases a pyrophosphate.
     */
    public Processes.ProcessingMap replicationMap() {
        Processes.ProcessingMap retVal = new Processes.ProcessingMap(REPLICATION_MAP);
        for (String[] nucleotide : DNA_NUCLEOTIDES) {
            Processes.ComponentProcessing cost = new Processes.ComponentProcessing(nucleotide[0], 1.0);
            this.addReactant(cost, nucleotide[1], 1.0);
            this.addProduct(cost, "PPi", 1.0);
            retVal.addComponentProcessing(cost);
        }
        return retVal;
    }

    /**
     * Add a consumed metabolite to a processing cost, if the metabolite is in the model.
     *
     * @param cost		processing cost to update
     * @param key		metabolite key
     * @param stoich	amount consumed
     */
    private void addReactant(Processes.ComponentProcessing cost, String key, double stoich) {
        String id = this.metaboliteMap.get(key);
        if (id != null)
            cost.addReactant(id, stoich);
    }

    /**
     * Add a produced metabolite to a processing cost, if the metabolite is in the model.
     *
     * @param cost		processing cost to update
     * @param key		metabolite key
     * @param stoich	amount produced
     */
    private void addProduct(Processes.ComponentProcessing cost, String key, double stoich) {
        String id = this.metaboliteMap.get(key);
        if (id != null)
            cost.addProduct(id, stoich);
    }

}
