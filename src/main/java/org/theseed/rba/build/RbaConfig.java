/**
 *
 */
package org.theseed.rba.build;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.rba.InvalidInputFormatException;
import org.theseed.rba.model.SpeciesReference;
import org.theseed.rba.sbml.AnnotationPolicy;
import org.theseed.rba.sbml.SbmlData;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object contains the organism-specific data and the build options for an RBA model.  It is
 * normally read from a JSON parameter file.  Relative file names in the parameter file are resolved
 * against the directory containing it.
 *
 * The parameter file is a JSON object with the following keys, all optional except "sbml_file".
 *
 * sbml_file				name of the SBML file containing the metabolic network
 * output_dir				name of the directory to receive the model (default "model")
 * cytosol_id				ID of the cytosol compartment (default "c")
 * external_ids				list of compartment IDs that must be treated as external
 * metabolites				object mapping each metabolite key to an object with "sbml_id" and "concentration"
 * macrocomponents			object mapping species IDs to target concentrations
 * proteins					list of enzymatic proteins, each with "gene", "id", "location", "stoichiometry",
 * 							"sequence", and "cofactors"
 * rnas						object mapping RNA IDs to sequences
 * ribosome					machinery object with "proteins" and "rnas" lists
 * chaperone				machinery object with "proteins" and "rnas" lists
 * medium_concentration		concentration of each external metabolite in the medium
 * annotation_policy		GLOBAL, FRACTION, or PER_REACTION (default GLOBAL)
 * max_missing_fraction		maximum fraction of unannotated reactions for FRACTION (default 0.5)
 * unresolved_gene_policy	DROP, WARN, or FAIL (default WARN)
 */
public class RbaConfig implements SbmlData.IParms {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RbaConfig.class);
    /** SBML input file */
    private File sbmlFile;
    /** output directory */
    private File outputDir;
    /** cytosol compartment ID */
    private String cytosolId;
    /** compartments that must be treated as external */
    private List<String> externalIds;
    /** metabolite map, keyed on metabolite key */
    private Map<String, MetaboliteData> metabolites;
    /** macrocomponent target concentrations, keyed on species ID */
    private Map<String, Double> macrocomponents;
    /** enzymatic proteins */
    private List<ProteinData> proteins;
    /** RNA sequences, keyed on RNA ID */
    private Map<String, String> rnas;
    /** ribosome composition */
    private MachineryData ribosome;
    /** chaperone composition */
    private MachineryData chaperone;
    /** medium concentration override, or NULL to use the default */
    private Double mediumConcentration;
    /** policy for unannotated reactions */
    private AnnotationPolicy annotationPolicy;
    /** maximum fraction of unannotated reactions */
    private double maxMissingFraction;
    /** policy for genes with no protein */
    private UnresolvedGenePolicy unresolvedGenePolicy;

    /**
     * This enumeration contains the keys of the parameter file.
     */
    private static enum ConfigKeys implements JsonKey {
        SBML_FILE(""), OUTPUT_DIR("model"), CYTOSOL_ID("c"), EXTERNAL_IDS(new JsonArray()),
        METABOLITES(new JsonObject()), MACROCOMPONENTS(new JsonObject()), PROTEINS(new JsonArray()),
        RNAS(new JsonObject()), RIBOSOME(new JsonObject()), CHAPERONE(new JsonObject()),
        MEDIUM_CONCENTRATION(0.0), ANNOTATION_POLICY("GLOBAL"), MAX_MISSING_FRACTION(0.5),
        UNRESOLVED_GENE_POLICY("WARN");

        private final Object m_value;

        private ConfigKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        /** This is the default value used when the key is not found.
         */
        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * This enumeration contains the keys of the objects nested in the parameter file.
     */
    private static enum ItemKeys implements JsonKey {
        GENE(""), ID(""), LOCATION(""), STOICHIOMETRY(1.0), SEQUENCE(""), COFACTORS(new JsonArray()),
        CHEBI(""), NAME(""), PROTEINS(new JsonArray()), RNAS(new JsonArray()), SBML_ID(""),
        CONCENTRATION(0.0);

        private final Object m_value;

        private ItemKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        /** This is the default value used when the key is not found.
         */
        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * This object describes a cofactor of a protein.
     */
    public static class Cofactor {

        /** CHEBI identifier */
        private final String chebi;
        /** cofactor name */
        private final String name;
        /** number of cofactor molecules per protein */
        private final double stoichiometry;

        /**
         * Construct a cofactor descriptor.
         *
         * @param chebi				CHEBI identifier of the cofactor
         * @param name				name of the cofactor
         * @param stoichiometry		number of cofactor molecules per protein
         */
        public Cofactor(String chebi, String name, double stoichiometry) {
            this.chebi = chebi;
            this.name = name;
            this.stoichiometry = stoichiometry;
        }

        /**
         * Create a cofactor descriptor from JSON.
         *
         * @param json		JSON object describing the cofactor
         *
         * @throws InvalidInputFormatException
         */
        protected Cofactor(JsonObject json) throws InvalidInputFormatException {
            this(json.getStringOrDefault(ItemKeys.CHEBI), json.getStringOrDefault(ItemKeys.NAME),
                    number(json, ItemKeys.STOICHIOMETRY, "cofactor"));
        }

        /**
         * @return the CHEBI identifier
         */
        public String getChebi() {
            return this.chebi;
        }

        /**
         * @return the cofactor name
         */
        public String getName() {
            return this.name;
        }

        /**
         * @return the number of cofactor molecules per protein
         */
        public double getStoichiometry() {
            return this.stoichiometry;
        }

        @Override
        public String toString() {
            return this.name + " (" + this.chebi + ")";
        }

    }

    /**
     * This object describes an enzymatic protein and the gene that encodes it.
     */
    public static class ProteinData {

        /** name of the encoding gene */
        private final String gene;
        /** macromolecule ID of the protein */
        private final String id;
        /** compartment containing the protein */
        private final String location;
        /** number of copies of the protein in an enzyme */
        private final double stoichiometry;
        /** amino acid sequence */
        private final String sequence;
        /** cofactors */
        private final List<Cofactor> cofactors;

        /**
         * Construct a protein descriptor.
         *
         * @param gene				name of the encoding gene
         * @param id				macromolecule ID (if blank, the gene name is used)
         * @param location			compartment containing the protein
         * @param stoichiometry		number of copies of the protein per enzyme
         * @param sequence			amino acid sequence
         */
        public ProteinData(String gene, String id, String location, double stoichiometry, String sequence) {
            this.gene = gene;
            this.id = StringUtils.defaultIfBlank(id, gene);
            this.location = location;
            this.stoichiometry = stoichiometry;
            this.sequence = sequence;
            this.cofactors = new ArrayList<Cofactor>();
        }

        /**
         * Add a cofactor to this protein.
         *
         * @param cofactor	cofactor to add
         *
         * @return this object, for chaining
         */
        public ProteinData addCofactor(Cofactor cofactor) {
            this.cofactors.add(cofactor);
            return this;
        }

        /**
         * @return the name of the encoding gene
         */
        public String getGene() {
            return this.gene;
        }

        /**
         * @return the macromolecule ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the compartment containing the protein
         */
        public String getLocation() {
            return this.location;
        }

        /**
         * @return the number of copies per enzyme
         */
        public double getStoichiometry() {
            return this.stoichiometry;
        }

        /**
         * @return the amino acid sequence
         */
        public String getSequence() {
            return this.sequence;
        }

        /**
         * @return the cofactors
         */
        public List<Cofactor> getCofactors() {
            return Collections.unmodifiableList(this.cofactors);
        }

    }

    /**
     * This object describes one component of a piece of cellular machinery.
     */
    public static class MachineryPart {

        /** macromolecule ID */
        private final String id;
        /** sequence */
        private final String sequence;
        /** number of copies in the machinery */
        private final double stoichiometry;

        /**
         * Construct a machinery component.
         *
         * @param id				macromolecule ID
         * @param sequence			protein or RNA sequence
         * @param stoichiometry		number of copies in the machinery
         */
        public MachineryPart(String id, String sequence, double stoichiometry) {
            this.id = id;
            this.sequence = sequence;
            this.stoichiometry = stoichiometry;
        }

        /**
         * @return the macromolecule ID
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the sequence
         */
        public String getSequence() {
            return this.sequence;
        }

        /**
         * @return the number of copies in the machinery
         */
        public double getStoichiometry() {
            return this.stoichiometry;
        }

    }

    /**
     * This object describes a piece of cellular machinery (such as the ribosome) made of proteins and RNAs.
     */
    public static class MachineryData {

        /** protein components */
        private final List<MachineryPart> proteins;
        /** RNA components */
        private final List<MachineryPart> rnas;

        /**
         * Construct an empty machinery descriptor.
         */
        public MachineryData() {
            this.proteins = new ArrayList<MachineryPart>();
            this.rnas = new ArrayList<MachineryPart>();
        }

        /**
         * Create a machinery descriptor from JSON.
         *
         * @param json		JSON object describing the machinery
         * @param name		name of the machinery, for error messages
         *
         * @throws InvalidInputFormatException
         */
        protected MachineryData(JsonObject json, String name) throws InvalidInputFormatException {
            this();
            for (JsonObject part : objects(json.getCollectionOrDefault(ItemKeys.PROTEINS), name + " protein"))
                this.proteins.add(readPart(part, name));
            for (JsonObject part : objects(json.getCollectionOrDefault(ItemKeys.RNAS), name + " RNA"))
                this.rnas.add(readPart(part, name));
        }

        /**
         * @return a machinery component read from JSON
         *
         * @param part		JSON object describing the component
         * @param name		name of the machinery, for error messages
         *
         * @throws InvalidInputFormatException
         */
        private static MachineryPart readPart(JsonObject part, String name) throws InvalidInputFormatException {
            return new MachineryPart(part.getStringOrDefault(ItemKeys.ID), part.getStringOrDefault(ItemKeys.SEQUENCE),
                    number(part, ItemKeys.STOICHIOMETRY, name + " component"));
        }

        /**
         * Add a protein component.
         *
         * @param part		protein component to add
         *
         * @return this object, for chaining
         */
        public MachineryData addProtein(MachineryPart part) {
            this.proteins.add(part);
            return this;
        }

        /**
         * Add an RNA component.
         *
         * @param part		RNA component to add
         *
         * @return this object, for chaining
         */
        public MachineryData addRna(MachineryPart part) {
            this.rnas.add(part);
            return this;
        }

        /**
         * @return the protein components
         */
        public List<MachineryPart> getProteins() {
            return Collections.unmodifiableList(this.proteins);
        }

        /**
         * @return the RNA components
         */
        public List<MachineryPart> getRnas() {
            return Collections.unmodifiableList(this.rnas);
        }

        /**
         * @return the machinery composition, proteins first
         */
        public List<SpeciesReference> getComposition() {
            List<SpeciesReference> retVal = new ArrayList<SpeciesReference>(this.proteins.size() + this.rnas.size());
            for (MachineryPart part : this.proteins)
                retVal.add(new SpeciesReference(part.getId(), part.getStoichiometry()));
            for (MachineryPart part : this.rnas)
                retVal.add(new SpeciesReference(part.getId(), part.getStoichiometry()));
            return retVal;
        }

    }

    /**
     * This object maps a metabolite key used by the default data to an SBML species.
     */
    public static class MetaboliteData {

        /** SBML species ID, or NULL if the metabolite is not in the model */
        private final String sbmlId;
        /** target concentration, or 0 if there is none */
        private final double concentration;

        /**
         * Construct a metabolite mapping.
         *
         * @param sbmlId			SBML species ID (blank if the metabolite is not in the model)
         * @param concentration		target concentration (0 for none)
         */
        public MetaboliteData(String sbmlId, double concentration) {
            this.sbmlId = StringUtils.trimToNull(sbmlId);
            this.concentration = concentration;
        }

        /**
         * @return the SBML species ID, or NULL if the metabolite is not in the model
         */
        public String getSbmlId() {
            return this.sbmlId;
        }

        /**
         * @return the target concentration (0 if there is none)
         */
        public double getConcentration() {
            return this.concentration;
        }

    }

    /**
     * Construct a configuration with all default values.
     */
    public RbaConfig() {
        this.sbmlFile = null;
        this.outputDir = new File("model");
        this.cytosolId = "c";
        this.externalIds = new ArrayList<String>();
        this.metabolites = new LinkedHashMap<String, MetaboliteData>();
        this.macrocomponents = new LinkedHashMap<String, Double>();
        this.proteins = new ArrayList<ProteinData>();
        this.rnas = new LinkedHashMap<String, String>();
        this.ribosome = new MachineryData();
        this.chaperone = new MachineryData();
        this.mediumConcentration = null;
        this.annotationPolicy = AnnotationPolicy.GLOBAL;
        this.maxMissingFraction = 0.5;
        this.unresolvedGenePolicy = UnresolvedGenePolicy.WARN;
    }

    /**
     * Load a configuration from a JSON parameter file.
     *
     * @param parmFile		parameter file to read
     *
     * @return the configuration described by the file
     *
     * @throws IOException					if the file cannot be read
     * @throws InvalidInputFormatException	if the file is not a valid parameter file
     */
    public static RbaConfig load(File parmFile) throws IOException, InvalidInputFormatException {
        JsonObject json;
        try (FileReader reader = new FileReader(parmFile)) {
            Object parsed = Jsoner.deserialize(reader);
            if (! (parsed instanceof JsonObject))
                throw new InvalidInputFormatException("Parameter file " + parmFile + " does not contain a JSON object.");
            json = (JsonObject) parsed;
        } catch (JsonException e) {
            throw new InvalidInputFormatException("JSON error in " + parmFile + ": " + e.toString(), e);
        }
        RbaConfig retVal = new RbaConfig();
        try {
            retVal.parse(json, parmFile.getAbsoluteFile().getParentFile());
        } catch (ClassCastException e) {
            // A string, list or object was found where a different type was expected.
            throw new InvalidInputFormatException("Value of the wrong type in parameter file " + parmFile + ": "
                    + e.getMessage(), e);
        }
        log.info("Parameters loaded from {}: {} proteins, {} RNAs, {} metabolites.", parmFile,
                retVal.proteins.size(), retVal.rnas.size(), retVal.metabolites.size());
        return retVal;
    }

    /**
     * Fill this configuration from a parsed parameter file.
     *
     * @param json		parameter file contents
     * @param baseDir	directory for resolving relative file names
     *
     * @throws InvalidInputFormatException
     */
    private void parse(JsonObject json, File baseDir) throws InvalidInputFormatException {
        String sbmlName = json.getStringOrDefault(ConfigKeys.SBML_FILE);
        if (StringUtils.isBlank(sbmlName))
            throw new InvalidInputFormatException("Parameter file does not specify an SBML file.");
        this.sbmlFile = resolve(baseDir, sbmlName);
        this.outputDir = resolve(baseDir, json.getStringOrDefault(ConfigKeys.OUTPUT_DIR));
        this.cytosolId = json.getStringOrDefault(ConfigKeys.CYTOSOL_ID);
        for (Object id : (Collection<?>) json.getCollectionOrDefault(ConfigKeys.EXTERNAL_IDS))
            this.externalIds.add(id.toString());
        JsonObject metaboliteMap = json.getMapOrDefault(ConfigKeys.METABOLITES);
        for (Map.Entry<String, Object> entry : metaboliteMap.entrySet()) {
            String context = "metabolite " + entry.getKey();
            JsonObject metabolite = object(entry.getValue(), context);
            this.metabolites.put(entry.getKey(), new MetaboliteData(metabolite.getStringOrDefault(ItemKeys.SBML_ID),
                    number(metabolite, ItemKeys.CONCENTRATION, context)));
        }
        JsonObject macroMap = json.getMapOrDefault(ConfigKeys.MACROCOMPONENTS);
        for (Map.Entry<String, Object> entry : macroMap.entrySet()) {
            if (! (entry.getValue() instanceof Number))
                throw new InvalidInputFormatException("Macrocomponent " + entry.getKey()
                        + " does not have a numeric concentration.");
            this.macrocomponents.put(entry.getKey(), ((Number) entry.getValue()).doubleValue());
        }
        for (JsonObject protein : objects(json.getCollectionOrDefault(ConfigKeys.PROTEINS), "protein")) {
            String gene = protein.getStringOrDefault(ItemKeys.GENE);
            if (StringUtils.isBlank(gene))
                throw new InvalidInputFormatException("Protein entry in parameter file has no gene name.");
            ProteinData data = new ProteinData(gene, protein.getStringOrDefault(ItemKeys.ID),
                    StringUtils.defaultIfBlank(protein.getStringOrDefault(ItemKeys.LOCATION), this.cytosolId),
                    number(protein, ItemKeys.STOICHIOMETRY, "protein " + gene),
                    protein.getStringOrDefault(ItemKeys.SEQUENCE));
            for (JsonObject cofactor : objects(protein.getCollectionOrDefault(ItemKeys.COFACTORS),
                    "cofactor of protein " + gene))
                data.addCofactor(new Cofactor(cofactor));
            this.proteins.add(data);
        }
        JsonObject rnaMap = json.getMapOrDefault(ConfigKeys.RNAS);
        for (Map.Entry<String, Object> entry : rnaMap.entrySet())
            this.rnas.put(entry.getKey(), entry.getValue().toString());
        this.ribosome = new MachineryData(json.getMapOrDefault(ConfigKeys.RIBOSOME), "ribosome");
        this.chaperone = new MachineryData(json.getMapOrDefault(ConfigKeys.CHAPERONE), "chaperone");
        if (json.containsKey(ConfigKeys.MEDIUM_CONCENTRATION.getKey()))
            this.mediumConcentration = number(json, ConfigKeys.MEDIUM_CONCENTRATION, "parameter file");
        try {
            this.annotationPolicy = AnnotationPolicy.valueOf(
                    json.getStringOrDefault(ConfigKeys.ANNOTATION_POLICY).toUpperCase());
            this.unresolvedGenePolicy = UnresolvedGenePolicy.valueOf(
                    json.getStringOrDefault(ConfigKeys.UNRESOLVED_GENE_POLICY).toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputFormatException("Invalid policy in parameter file: " + e.getMessage(), e);
        }
        this.maxMissingFraction = number(json, ConfigKeys.MAX_MISSING_FRACTION, "parameter file");
    }

    /**
     * @return the JSON objects in a JSON list
     *
     * @param list		list to scan
     * @param context	description of the list items, for error messages
     *
     * @throws InvalidInputFormatException	if an item is not a JSON object
     */
    private static List<JsonObject> objects(Collection<?> list, String context) throws InvalidInputFormatException {
        List<JsonObject> retVal = new ArrayList<JsonObject>(list.size());
        for (Object item : list)
            retVal.add(object(item, context));
        return retVal;
    }

    /**
     * @return a JSON value as a JSON object
     *
     * @param value		value to check
     * @param context	description of the value, for error messages
     *
     * @throws InvalidInputFormatException	if the value is not a JSON object
     */
    private static JsonObject object(Object value, String context) throws InvalidInputFormatException {
        if (! (value instanceof JsonObject))
            throw new InvalidInputFormatException("Entry for " + context + " in parameter file is not a JSON object.");
        return (JsonObject) value;
    }

    /**
     * @return a numeric value from a JSON object, or the key's default if the key is absent
     *
     * @param json		JSON object containing the value
     * @param key		key of the value
     * @param context	description of the object, for error messages
     *
     * @throws InvalidInputFormatException	if the value is present but not a number
     */
    private static double number(JsonObject json, JsonKey key, String context) throws InvalidInputFormatException {
        Object value = (json.containsKey(key.getKey()) ? json.get(key.getKey()) : key.getValue());
        if (! (value instanceof Number))
            throw new InvalidInputFormatException("Value of \"" + key.getKey() + "\" for " + context
                    + " must be a number.");
        return ((Number) value).doubleValue();
    }

    /**
     * @return a file name resolved against a base directory
     *
     * @param baseDir	base directory
     * @param name		file name (absolute or relative)
     */
    private static File resolve(File baseDir, String name) {
        File retVal = new File(name);
        if (! retVal.isAbsolute())
            retVal = new File(baseDir, name);
        return retVal;
    }

    /**
     * @return the SBML file
     */
    public File getSbmlFile() {
        return this.sbmlFile;
    }

    /**
     * @param sbmlFile 	the SBML file to set
     */
    public void setSbmlFile(File sbmlFile) {
        this.sbmlFile = sbmlFile;
    }

    /**
     * @return the output directory
     */
    public File getOutputDir() {
        return this.outputDir;
    }

    /**
     * @param outputDir 	the output directory to set
     */
    public void setOutputDir(File outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public String getCytosolId() {
        return this.cytosolId;
    }

    /**
     * @param cytosolId 	the cytosol compartment ID to set
     */
    public void setCytosolId(String cytosolId) {
        this.cytosolId = cytosolId;
    }

    @Override
    public List<String> getExternalIds() {
        return this.externalIds;
    }

    /**
     * @param externalIds 	the external compartment overrides to set
     */
    public void setExternalIds(List<String> externalIds) {
        this.externalIds = new ArrayList<String>(externalIds);
    }

    /**
     * @return the metabolite map, keyed on metabolite key
     */
    public Map<String, MetaboliteData> getMetabolites() {
        return this.metabolites;
    }

    /**
     * Specify the SBML species for a metabolite key.
     *
     * @param key				metabolite key
     * @param sbmlId			SBML species ID
     * @param concentration		target concentration (0 for none)
     */
    public void putMetabolite(String key, String sbmlId, double concentration) {
        this.metabolites.put(key, new MetaboliteData(sbmlId, concentration));
    }

    /**
     * @return the macrocomponent target concentrations, keyed on species ID
     */
    public Map<String, Double> getMacrocomponents() {
        return this.macrocomponents;
    }

    /**
     * Specify a macrocomponent target concentration.
     *
     * @param speciesId			SBML species ID
     * @param concentration		target concentration
     */
    public void putMacrocomponent(String speciesId, double concentration) {
        this.macrocomponents.put(speciesId, concentration);
    }

    /**
     * @return the enzymatic proteins
     */
    public List<ProteinData> getProteins() {
        return this.proteins;
    }

    /**
     * Add an enzymatic protein.
     *
     * @param protein	protein to add
     */
    public void addProtein(ProteinData protein) {
        this.proteins.add(protein);
    }

    /**
     * @return the RNA sequences, keyed on RNA ID
     */
    public Map<String, String> getRnas() {
        return this.rnas;
    }

    /**
     * Specify an RNA sequence.
     *
     * @param id			RNA ID
     * @param sequence		RNA sequence
     */
    public void putRna(String id, String sequence) {
        this.rnas.put(id, sequence);
    }

    /**
     * @return the ribosome composition
     */
    public MachineryData getRibosome() {
        return this.ribosome;
    }

    /**
     * @param ribosome 	the ribosome composition to set
     */
    public void setRibosome(MachineryData ribosome) {
        this.ribosome = ribosome;
    }

    /**
     * @return the chaperone composition
     */
    public MachineryData getChaperone() {
        return this.chaperone;
    }

    /**
     * @param chaperone 	the chaperone composition to set
     */
    public void setChaperone(MachineryData chaperone) {
        this.chaperone = chaperone;
    }

    /**
     * @return the medium concentration override, or NULL if the default should be used
     */
    public Double getMediumConcentration() {
        return this.mediumConcentration;
    }

    /**
     * @param mediumConcentration 	the medium concentration to set
     */
    public void setMediumConcentration(Double mediumConcentration) {
        this.mediumConcentration = mediumConcentration;
    }

    @Override
    public AnnotationPolicy getAnnotationPolicy() {
        return this.annotationPolicy;
    }

    /**
     * @param annotationPolicy 	the annotation policy to set
     */
    public void setAnnotationPolicy(AnnotationPolicy annotationPolicy) {
        this.annotationPolicy = annotationPolicy;
    }

    @Override
    public double getMaxMissingFraction() {
        return this.maxMissingFraction;
    }

    /**
     * @param maxMissingFraction 	the maximum fraction of unannotated reactions to set
     */
    public void setMaxMissingFraction(double maxMissingFraction) {
        this.maxMissingFraction = maxMissingFraction;
    }

    /**
     * @return the policy for genes with no protein
     */
    public UnresolvedGenePolicy getUnresolvedGenePolicy() {
        return this.unresolvedGenePolicy;
    }

    /**
     * @param unresolvedGenePolicy 	the unresolved-gene policy to set
     */
    public void setUnresolvedGenePolicy(UnresolvedGenePolicy unresolvedGenePolicy) {
        this.unresolvedGenePolicy = unresolvedGenePolicy;
    }

}
