/**
 *
 */
package org.theseed.rba.meta;

import java.io.IOException;
import java.io.PrintWriter;

import org.theseed.rba.build.ModelWriter;
import org.theseed.rba.sbml.SbmlData;

/**
 * This command writes the protein table from a parameter file:  one line per gene, with the protein
 * it encodes and the protein's location, stoichiometry, length, and cofactors.  The SBML file is not read.
 *
 * The positional parameter is the name of the JSON parameter file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 */
public class ProteinsProcessor extends BaseModelReportProcessor {

    @Override
    protected void validateModelReportParms() throws IOException, ParseFailureException {
        if (this.getConfig().getProteins().isEmpty())
            throw new ParseFailureException("Parameter file does not contain any proteins.");
    }

    @Override
    protected boolean needsSbml() {
        return false;
    }

    @Override
    protected void runReporter(SbmlData data, PrintWriter writer) throws Exception {
        new ModelWriter().exportProteins(this.getConfig(), writer);
    }

}
