/**
 *
 */
package org.theseed.rba.meta;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.sbml.SbmlData;

/**
 * This is a base class for tab-delimited reports about the inputs of an RBA model build.  A report can
 * work from the parameter file alone, or it can ask for the SBML network to be extracted first.  In the
 * latter case the extraction happens after the output file is opened, so that option errors are found
 * before the (possibly slow) SBML read.
 *
 * The positional parameter is the name of the JSON parameter file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT (parent directories are created as needed)
 *
 * --sbml		name of the SBML file, overriding the parameter file
 * --missing	policy for reactions with no gene association, overriding the parameter file
 * --genes		policy for genes with no protein, overriding the parameter file
 */
public abstract class BaseModelReportProcessor extends BaseModelProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseModelReportProcessor.class);

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, usage = "output file for report (if not STDOUT)")
    private File outFile;

    @Override
    protected void setModelDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    /**
     * Set the option defaults for the subclass.  The default does nothing.
     */
    protected void setReporterDefaults() { }

    @Override
    protected void validateModelParms() throws IOException, ParseFailureException {
        if (this.outFile != null && this.outFile.isDirectory())
            throw new ParseFailureException("Report output file " + this.outFile + " is a directory.");
        this.validateModelReportParms();
    }

    /**
     * Validate and process the subclass parameters and options.  The default does nothing.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected void validateModelReportParms() throws IOException, ParseFailureException { }

    /**
     * @return TRUE if the report needs the data extracted from the SBML file
     */
    protected abstract boolean needsSbml();

    @Override
    protected final void runCommand() throws Exception {
        PrintWriter writer;
        if (this.outFile == null) {
            log.info("Report will be written to the standard output.");
            writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        } else {
            log.info("Report will be written to {}.", this.outFile);
            writer = new PrintWriter(new OutputStreamWriter(FileUtils.openOutputStream(this.outFile),
                    StandardCharsets.UTF_8));
        }
        try {
            SbmlData data = (this.needsSbml() ? this.loadSbml() : null);
            this.runReporter(data, writer);
        } finally {
            // Standard output stays open for the caller.
            if (this.outFile == null)
                writer.flush();
            else
                writer.close();
        }
    }

    /**
     * Produce the report.
     *
     * @param data		data extracted from the SBML file, or NULL if the report does not use it
     * @param writer	print writer to receive the report
     *
     * @throws Exception
     */
    protected abstract void runReporter(SbmlData data, PrintWriter writer) throws Exception;

}
