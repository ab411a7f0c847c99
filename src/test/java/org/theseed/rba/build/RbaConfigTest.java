/**
 *
 */
package org.theseed.rba.build;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.theseed.rba.InvalidInputFormatException;
import org.theseed.rba.sbml.AnnotationPolicy;

/**
 * Tests for loading build parameter files.
 */
public class RbaConfigTest {

    /** directory containing the test parameter files */
    private static final File RESOURCES = new File("src/test/resources");

    @Test
    public void testLoad() throws IOException, InvalidInputFormatException {
        RbaConfig config = RbaConfig.load(new File(RESOURCES, "parms.json"));
        File base = RESOURCES.getAbsoluteFile();
        assertThat(config.getSbmlFile(), equalTo(new File(base, "ecoli_core.xml")));
        assertThat(config.getOutputDir(), equalTo(new File(base, "rba_out")));
        assertThat(config.getCytosolId(), equalTo("c"));
        assertThat(config.getExternalIds(), contains("e"));
        assertThat(config.getAnnotationPolicy(), equalTo(AnnotationPolicy.FRACTION));
        assertThat(config.getMaxMissingFraction(), closeTo(0.25, 1e-9));
        assertThat(config.getUnresolvedGenePolicy(), equalTo(UnresolvedGenePolicy.DROP));
        assertThat(config.getMediumConcentration(), closeTo(20.0, 1e-9));
        // Metabolites.
        assertThat(config.getMetabolites().keySet(), containsInAnyOrder("ATP", "GLC", "ALA"));
        assertThat(config.getMetabolites().get("GLC").getSbmlId(), equalTo("M_glc__D_c"));
        assertThat(config.getMetabolites().get("GLC").getConcentration(), closeTo(1.5, 1e-9));
        assertThat(config.getMetabolites().get("ALA").getSbmlId(), nullValue());
        assertThat(config.getMetabolites().get("ALA").getConcentration(), equalTo(0.0));
        assertThat(config.getMacrocomponents(), hasEntry("M_adp_c", 0.25));
        // Proteins.
        List<RbaConfig.ProteinData> proteins = config.getProteins();
        assertThat(proteins.size(), equalTo(2));
        RbaConfig.ProteinData thrL = proteins.get(0);
        assertThat(thrL.getGene(), equalTo("b0001"));
        assertThat(thrL.getId(), equalTo("ThrL"));
        assertThat(thrL.getStoichiometry(), equalTo(2.0));
        assertThat(thrL.getCofactors().size(), equalTo(1));
        assertThat(thrL.getCofactors().get(0).getChebi(), equalTo("CHEBI:30413"));
        assertThat(thrL.getCofactors().get(0).getName(), equalTo("heme"));
        RbaConfig.ProteinData thrA = proteins.get(1);
        assertThat(thrA.getId(), equalTo("b0002"));
        assertThat(thrA.getLocation(), equalTo("c"));
        assertThat(thrA.getStoichiometry(), equalTo(1.0));
        assertThat(thrA.getCofactors(), empty());
        // RNAs and machinery.
        assertThat(config.getRnas().keySet(), contains("tRNA_ala"));
        assertThat(config.getRibosome().getProteins().get(0).getId(), equalTo("rpsA"));
        assertThat(config.getRibosome().getRnas().get(0).getStoichiometry(), equalTo(1.0));
        assertThat(config.getRibosome().getComposition().stream().map(x -> x.getSpecies())
                .collect(Collectors.toList()), contains("rpsA", "rrsA"));
        assertThat(config.getChaperone().getProteins().get(0).getStoichiometry(), equalTo(14.0));
        assertThat(config.getChaperone().getRnas(), empty());
    }

    @Test
    public void testDefaults() {
        RbaConfig config = new RbaConfig();
        assertThat(config.getSbmlFile(), nullValue());
        assertThat(config.getOutputDir(), equalTo(new File("model")));
        assertThat(config.getCytosolId(), equalTo("c"));
        assertThat(config.getExternalIds(), empty());
        assertThat(config.getAnnotationPolicy(), equalTo(AnnotationPolicy.GLOBAL));
        assertThat(config.getUnresolvedGenePolicy(), equalTo(UnresolvedGenePolicy.WARN));
        assertThat(config.getMediumConcentration(), nullValue());
    }

    @Test
    public void testErrors() {
        assertThrows(InvalidInputFormatException.class, () -> RbaConfig.load(new File(RESOURCES, "bad_policy.json")));
        assertThrows(InvalidInputFormatException.class, () -> RbaConfig.load(new File(RESOURCES, "no_sbml.json")));
        assertThrows(InvalidInputFormatException.class, () -> RbaConfig.load(new File(RESOURCES, "not_json.json")));
        assertThrows(IOException.class, () -> RbaConfig.load(new File(RESOURCES, "missing.json")));
    }

    @Test
    public void testBadValues() {
        InvalidInputFormatException e = assertThrows(InvalidInputFormatException.class,
                () -> RbaConfig.load(new File(RESOURCES, "null_concentration.json")));
        assertThat(e.getMessage(), containsString("concentration"));
        e = assertThrows(InvalidInputFormatException.class,
                () -> RbaConfig.load(new File(RESOURCES, "bad_macro.json")));
        assertThat(e.getMessage(), containsString("M_adp_c"));
        e = assertThrows(InvalidInputFormatException.class,
                () -> RbaConfig.load(new File(RESOURCES, "bad_protein.json")));
        assertThat(e.getMessage(), containsString("protein"));
        assertThrows(InvalidInputFormatException.class, () -> RbaConfig.load(new File(RESOURCES, "bad_section.json")));
    }

}
