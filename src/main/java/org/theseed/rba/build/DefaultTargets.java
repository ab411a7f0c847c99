/**
 *
 */
package org.theseed.rba.build;

import java.util.Collection;
import java.util.Map;

import org.theseed.rba.model.Targets;

/**
 * This object builds the default target groups.  Each target refers to a parameter function created
 * by the default data, so the parameters must be built with the same compartment lists.
 */
public class DefaultTargets {

    /**
     * @return the translation targets:  the non-enzymatic protein content of each internal compartment
     *
     * @param internal		IDs of the internal compartments
     */
    public Targets.TargetGroup translation(Collection<String> internal) {
        Targets.TargetGroup retVal = new Targets.TargetGroup("translation_targets");
        for (String compartment : internal)
            retVal.addConcentration(DefaultData.averageProteinId(compartment),
                    DefaultData.nonEnzymaticProteinsId(compartment));
        return retVal;
    }

    /**
     * @return the transcription target:  the mRNA concentration
     */
    public Targets.TargetGroup transcription() {
        Targets.TargetGroup retVal = new Targets.TargetGroup("transcription_targets");
        retVal.addConcentration(DefaultData.MRNA, DefaultData.MRNA_CONCENTRATION);
        return retVal;
    }

    /**
     * @return the replication target:  the DNA concentration
     */
    public Targets.TargetGroup replication() {
        Targets.TargetGroup retVal = new Targets.TargetGroup("replication_targets");
        retVal.addConcentration(DefaultData.DNA, DefaultData.DNA_CONCENTRATION);
        return retVal;
    }

    /**
     * @return the RNA degradation target:  the mRNA degradation flux
     */
    public Targets.TargetGroup rnaDegradation() {
        Targets.TargetGroup retVal = new Targets.TargetGroup("rna_degradation");
        retVal.addDegradationFlux(DefaultData.MRNA, DefaultData.MRNA_DEGRADATION);
        return retVal;
    }

    /**
     * @return the metabolite production targets:  the concentration of each metabolite that has one
     *
     * @param concentrations	map of SBML species IDs to target concentrations
     */
    public Targets.TargetGroup metaboliteProduction(Map<String, Double> concentrations) {
        Targets.TargetGroup retVal = new Targets.TargetGroup("metabolite_production");
        for (String speciesId : concentrations.keySet())
            retVal.addConcentration(speciesId, DefaultData.concentrationId(speciesId));
        return retVal;
    }

    /**
     * @return the macrocomponent targets
     *
     * @param macrocomponents	map of SBML species IDs to target concentrations
     */
    public Targets.TargetGroup macrocomponents(Map<String, Double> macrocomponents) {
        Targets.TargetGroup retVal = new Targets.TargetGroup("macrocomponents");
        for (String speciesId : macrocomponents.keySet())
            retVal.addConcentration(speciesId, DefaultData.concentrationId(speciesId));
        return retVal;
    }

    /**
     * @return the maintenance ATP target:  a fixed flux through the maintenance reaction
     *
     * @param reaction		ID of the maintenance reaction
     */
    public Targets.TargetGroup maintenanceAtp(String reaction) {
        Targets.TargetGroup retVal = new Targets.TargetGroup("maintenance_atp");
        retVal.addReactionFlux(reaction, DefaultData.MAINTENANCE_ATP);
        return retVal;
    }

}
