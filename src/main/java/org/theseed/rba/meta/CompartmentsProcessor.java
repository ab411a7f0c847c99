/**
 *
 */
package org.theseed.rba.meta;

import java.io.PrintWriter;
import java.util.Map;
import java.util.TreeMap;

import org.theseed.rba.model.Metabolism;
import org.theseed.rba.sbml.SbmlData;

/**
 * This command reports the compartments of the SBML model, showing which ones were classified as
 * external and how many species each contains.
 *
 * The positional parameter is the name of the JSON parameter file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --sbml		name of the SBML file, overriding the parameter file
 */
public class CompartmentsProcessor extends BaseModelReportProcessor {

    @Override
    protected boolean needsSbml() {
        return true;
    }

    @Override
    protected void runReporter(SbmlData data, PrintWriter writer) throws Exception {
        // Count the species and boundary species in each compartment.
        Map<String, int[]> counts = new TreeMap<String, int[]>();
        for (Metabolism.Species species : data.getSpecies()) {
            int[] count = counts.computeIfAbsent(species.getCompartment(), x -> new int[2]);
            count[0]++;
            if (species.isBoundaryCondition())
                count[1]++;
        }
        writer.println("compartment\texternal\tspecies\tboundary");
        for (Metabolism.Compartment compartment : data.getCompartments()) {
            int[] count = counts.getOrDefault(compartment.getId(), new int[2]);
            String eFlag = (compartment.isExternal() ? "Y" : "");
            writer.println(compartment.getId() + "\t" + eFlag + "\t" + count[0] + "\t" + count[1]);
        }
    }

}
