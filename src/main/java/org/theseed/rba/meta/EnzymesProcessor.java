/**
 *
 */
package org.theseed.rba.meta;

import java.io.PrintWriter;
import java.util.List;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.model.Reaction;
import org.theseed.rba.sbml.SbmlData;
import org.theseed.rba.sbml.SbmlEnzyme;

/**
 * This command lists the reactions of the SBML model after multi-enzyme reactions have been expanded.
 * For each reaction we show its enzyme, the genes forming the enzyme, whether it is a transporter,
 * the metabolites it imports, and the reaction formula.
 *
 * The positional parameter is the name of the JSON parameter file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --sbml			name of the SBML file, overriding the parameter file
 * --missing		policy for reactions with no gene association, overriding the parameter file
 * --membrane		only list membrane reactions
 */
public class EnzymesProcessor extends BaseModelReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(EnzymesProcessor.class);

    // COMMAND-LINE OPTIONS

    /** if specified, only membrane reactions are listed */
    @Option(name = "--membrane", usage = "if specified, only transport reactions will be listed")
    private boolean membraneOnly;

    @Override
    protected void setReporterDefaults() {
        this.membraneOnly = false;
    }

    @Override
    protected boolean needsSbml() {
        return true;
    }

    @Override
    protected void runReporter(SbmlData data, PrintWriter writer) throws Exception {
        List<Reaction> reactions = data.getReactions();
        writer.println("reaction_id\tenzyme_id\tgenes\tmembrane\timported\tformula");
        int count = 0;
        for (Reaction reaction : reactions) {
            SbmlEnzyme enzyme = data.getEnzyme(reaction.getId());
            if (! this.membraneOnly || enzyme.isMembrane()) {
                String mFlag = (enzyme.isMembrane() ? "Y" : "");
                writer.println(reaction.getId() + "\t" + enzyme.getId() + "\t" + enzyme.getComposition() + "\t"
                        + mFlag + "\t" + String.join(", ", enzyme.getImportedMetabolites()) + "\t"
                        + reaction.getFormula());
                count++;
            }
        }
        log.info("{} of {} reactions listed.", count, reactions.size());
    }

}
