/**
 *
 */
package org.theseed.rba.meta;

import java.io.File;
import java.io.IOException;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.build.ModelBuilder;
import org.theseed.rba.build.ModelWriter;
import org.theseed.rba.model.RbaModel;
import org.theseed.rba.sbml.SbmlData;

/**
 * This command builds an RBA model from a parameter file and the SBML file it names, and writes the
 * model to the output directory.
 *
 * The positional parameter is the name of the JSON parameter file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -D	output directory, overriding the parameter file
 *
 * --sbml		name of the SBML file, overriding the parameter file
 * --missing	policy for reactions with no gene association, overriding the parameter file
 * --genes		policy for genes with no protein, overriding the parameter file
 * --proteins	if specified, a file to receive the protein table
 */
public class BuildProcessor extends BaseModelProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BuildProcessor.class);

    // COMMAND-LINE OPTIONS

    /** output directory override */
    @Option(name = "-D", aliases = { "--outDir" }, metaVar = "modelDir", usage = "output directory (overrides parameter file)")
    private File outDir;

    /** protein table output file */
    @Option(name = "--proteins", metaVar = "proteins.tsv", usage = "if specified, file to receive the protein table")
    private File proteinFile;

    @Override
    protected void setModelDefaults() {
        this.outDir = null;
        this.proteinFile = null;
    }

    @Override
    protected void validateModelParms() throws IOException, ParseFailureException {
        if (this.outDir != null)
            this.getConfig().setOutputDir(this.outDir);
        if (this.outDir != null && this.outDir.exists() && ! this.outDir.isDirectory())
            throw new ParseFailureException("Output location " + this.outDir + " is not a directory.");
    }

    @Override
    protected void runCommand() throws Exception {
        SbmlData data = this.loadSbml();
        ModelBuilder builder = new ModelBuilder(this.getConfig(), data);
        RbaModel model = builder.build();
        ModelWriter writer = new ModelWriter();
        writer.write(model);
        if (this.proteinFile != null)
            writer.exportProteins(this.getConfig(), this.proteinFile);
    }

}
