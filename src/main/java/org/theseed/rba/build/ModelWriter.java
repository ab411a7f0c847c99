/**
 *
 */
package org.theseed.rba.build;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.model.RbaModel;
import org.theseed.rba.model.SubModel;

import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object writes a finished RBA model to its output directory.  Each sub-model is written as a
 * pretty-printed JSON file named after the sub-model, and the medium is written as a two-column
 * tab-delimited file.
 */
public class ModelWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelWriter.class);
    /** name of the medium file */
    public static final String MEDIUM_FILE = "medium.tsv";

    /**
     * Write a model to its output directory, creating the directory if necessary.
     *
     * @param model		model to write
     *
     * @throws IOException
     */
    public void write(RbaModel model) throws IOException {
        File outDir = model.getOutputDir();
        if (outDir == null)
            throw new IOException("No output directory specified for model.");
        FileUtils.forceMkdir(outDir);
        for (SubModel subModel : model.getSubModels()) {
            File outFile = new File(outDir, subModel.getName() + ".json");
            String json = Jsoner.prettyPrint(subModel.toJson().toJson());
            FileUtils.writeStringToFile(outFile, json, StandardCharsets.UTF_8);
            log.debug("Sub-model {} written to {}.", subModel.getName(), outFile);
        }
        File mediumFile = new File(outDir, MEDIUM_FILE);
        try (PrintWriter writer = new PrintWriter(mediumFile, StandardCharsets.UTF_8)) {
            writer.println("Metabolite\tConcentration");
            for (Map.Entry<String, Double> entry : model.getMedium().entrySet())
                writer.println(entry.getKey() + "\t" + entry.getValue());
        }
        log.info("Model written to {}.", outDir);
    }

    /**
     * Write the protein table for a configuration.  There is one line per gene, giving the protein
     * it encodes and the protein's location, stoichiometry, length, and cofactors.
     *
     * @param config	configuration containing the proteins
     * @param outFile	output file
     *
     * @throws IOException
     */
    public void exportProteins(RbaConfig config, File outFile) throws IOException {
        try (PrintWriter writer = new PrintWriter(outFile, StandardCharsets.UTF_8)) {
            this.exportProteins(config, writer);
        }
        log.info("{} proteins written to {}.", config.getProteins().size(), outFile);
    }

    /**
     * Write the protein table for a configuration to a print writer.
     *
     * @param config	configuration containing the proteins
     * @param writer	print writer to receive the table
     */
    public void exportProteins(RbaConfig config, PrintWriter writer) {
        writer.println("gene\tprotein\tlocation\tstoichiometry\tlength\tcofactors");
        for (RbaConfig.ProteinData protein : config.getProteins()) {
            String cofactors = protein.getCofactors().stream()
                    .map(x -> x.getChebi() + ":" + x.getStoichiometry()).collect(Collectors.joining(", "));
            int length = (protein.getSequence() == null ? 0 : protein.getSequence().length());
            writer.println(protein.getGene() + "\t" + protein.getId() + "\t" + protein.getLocation() + "\t"
                    + protein.getStoichiometry() + "\t" + length + "\t" + cofactors);
        }
    }

}
