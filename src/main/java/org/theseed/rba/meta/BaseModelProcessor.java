/**
 *
 */
package org.theseed.rba.meta;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.InvalidInputFormatException;
import org.theseed.rba.RbaBuildException;
import org.theseed.rba.build.RbaConfig;
import org.theseed.rba.build.UnresolvedGenePolicy;
import org.theseed.rba.sbml.AnnotationPolicy;
import org.theseed.rba.sbml.SbmlData;

/**
 * This is a base class for commands that work from an RBA parameter file.
 *
 * The positional parameter is the name of the JSON parameter file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --sbml		name of the SBML file, overriding the parameter file
 * --missing	policy for reactions with no gene association, overriding the parameter file
 * --genes		policy for genes with no protein, overriding the parameter file
 */
public abstract class BaseModelProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseModelProcessor.class);
    /** build configuration */
    private RbaConfig config;

    // COMMAND-LINE OPTIONS

    /** SBML file override */
    @Option(name = "--sbml", metaVar = "model.xml", usage = "SBML file (overrides parameter file)")
    private File sbmlFile;

    /** annotation policy override */
    @Option(name = "--missing", usage = "policy for reactions with no gene association")
    private AnnotationPolicy annotationPolicy;

    /** unresolved gene policy override */
    @Option(name = "--genes", usage = "policy for genes with no matching protein")
    private UnresolvedGenePolicy genePolicy;

    /** parameter file */
    @Argument(index = 0, metaVar = "parms.json", usage = "JSON parameter file for the model", required = true)
    private File parmFile;

    @Override
    protected final void setDefaults() {
        this.sbmlFile = null;
        this.annotationPolicy = null;
        this.genePolicy = null;
        this.setModelDefaults();
    }

    /**
     * Set the default options for the subclass.
     */
    protected abstract void setModelDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (! this.parmFile.canRead())
            throw new FileNotFoundException("Parameter file " + this.parmFile + " is not found or unreadable.");
        try {
            this.config = RbaConfig.load(this.parmFile);
        } catch (InvalidInputFormatException e) {
            throw new ParseFailureException(e.getMessage());
        }
        if (this.sbmlFile != null)
            this.config.setSbmlFile(this.sbmlFile);
        if (this.annotationPolicy != null)
            this.config.setAnnotationPolicy(this.annotationPolicy);
        if (this.genePolicy != null)
            this.config.setUnresolvedGenePolicy(this.genePolicy);
        this.validateModelParms();
        return true;
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateModelParms() throws IOException, ParseFailureException;

    /**
     * Read the SBML file named in the configuration.
     *
     * @return the data extracted from the SBML file
     *
     * @throws IOException
     * @throws RbaBuildException
     */
    protected SbmlData loadSbml() throws IOException, RbaBuildException {
        File sbml = this.config.getSbmlFile();
        if (! sbml.canRead())
            throw new FileNotFoundException("SBML file " + sbml + " is not found or unreadable.");
        return SbmlData.load(sbml, this.config);
    }

    /**
     * @return the build configuration
     */
    protected RbaConfig getConfig() {
        return this.config;
    }

}
