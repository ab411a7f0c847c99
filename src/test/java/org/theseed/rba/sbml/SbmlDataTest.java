/**
 *
 */
package org.theseed.rba.sbml;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.sbml.jsbml.Model;
import org.theseed.rba.InvalidInputFormatException;
import org.theseed.rba.MissingAnnotationException;
import org.theseed.rba.SbmlFixtures;
import org.theseed.rba.association.EnzymeComposition;
import org.theseed.rba.model.Metabolism;
import org.theseed.rba.model.Reaction;

/**
 * Tests for extracting RBA data from SBML models.
 */
public class SbmlDataTest {

    /**
     * Extraction options for the tests.
     */
    private static class Parms implements SbmlData.IParms {

        private AnnotationPolicy policy;
        private double maxFraction;
        private List<String> externals;

        public Parms(AnnotationPolicy policy) {
            this.policy = policy;
            this.maxFraction = 0.5;
            this.externals = new ArrayList<String>();
        }

        @Override
        public String getCytosolId() {
            return "c";
        }

        @Override
        public List<String> getExternalIds() {
            return this.externals;
        }

        @Override
        public AnnotationPolicy getAnnotationPolicy() {
            return this.policy;
        }

        @Override
        public double getMaxMissingFraction() {
            return this.maxFraction;
        }

    }

    /**
     * Verify the data extracted from the standard model.
     *
     * @param data		extracted data to check
     */
    private static void checkStandard(SbmlData data) {
        assertThat(data.getCompartmentIds(), contains("c", "e"));
        assertThat(data.getExternalCompartments(), contains("e"));
        List<Metabolism.Compartment> comps = data.getCompartments();
        assertThat(comps.get(0).isExternal(), equalTo(false));
        assertThat(comps.get(1).isExternal(), equalTo(true));
        assertThat(data.getExternalMetabolites(), contains("M_glc_e", "M_X_e"));
        List<String> reactionIds = data.getReactions().stream().map(x -> x.getId()).collect(Collectors.toList());
        assertThat(reactionIds, contains("EX_glc", "EX_X", "GLCt", "R1", "R1_duplicate_2", "R2"));
        assertThat(data.getEnzymes().size(), equalTo(6));
        assertThat(data.getEnzyme("R1").getComposition(), equalTo(EnzymeComposition.of("g1", "g2")));
        assertThat(data.getEnzyme("R1_duplicate_2").getComposition(), equalTo(EnzymeComposition.of("g3")));
        assertThat(data.getEnzyme("R1_duplicate_2").getId(), equalTo("R1_duplicate_2_enzyme"));
        assertThat(data.getEnzyme("EX_glc").getComposition().isEmpty(), equalTo(true));
        // The transporter imports glucose.
        SbmlEnzyme transport = data.getEnzyme("GLCt");
        assertThat(transport.isMembrane(), equalTo(true));
        assertThat(transport.getImportedMetabolites(), contains("M_glc_e"));
        assertThat(data.hasMembraneEnzyme("GLCt"), equalTo(true));
        assertThat(data.hasMembraneEnzyme("R1"), equalTo(false));
        assertThat(data.hasMembraneEnzyme("R9"), equalTo(false));
        assertThat(data.getEnzyme("R9"), nullValue());
        assertThat(data.getMissingCount(), equalTo(2));
        Reaction r1 = data.getReactions().get(3);
        assertThat(r1.getAllSpecies(), contains("M_glc_c", "M_atp_c", "M_adp_c", "M_h_c"));
    }

    @Test
    public void testNotesModel() throws Exception {
        SbmlData data = new SbmlData(SbmlFixtures.standardNotesModel(), new Parms(AnnotationPolicy.GLOBAL));
        checkStandard(data);
    }

    @Test
    public void testFbcModel() throws Exception {
        SbmlData data = new SbmlData(SbmlFixtures.standardFbcModel(), new Parms(AnnotationPolicy.GLOBAL));
        checkStandard(data);
    }

    @Test
    public void testAnnotationPolicies() throws Exception {
        Model model = SbmlFixtures.standardNotesModel();
        // The exchange reactions have no notes.
        assertThrows(MissingAnnotationException.class, () -> new SbmlData(model, new Parms(AnnotationPolicy.PER_REACTION)));
        Parms parms = new Parms(AnnotationPolicy.FRACTION);
        SbmlData data = new SbmlData(model, parms);
        assertThat(data.getMissingCount(), equalTo(2));
        parms.maxFraction = 0.3;
        assertThrows(MissingAnnotationException.class, () -> new SbmlData(model, parms));
        // With no annotations at all, the model is rejected.
        Model bare = SbmlFixtures.standardNetwork();
        assertThrows(MissingAnnotationException.class, () -> new SbmlData(bare, new Parms(AnnotationPolicy.GLOBAL)));
    }

    @Test
    public void testBoundaryAndOverrides() throws Exception {
        Model model = SbmlFixtures.standardNotesModel();
        SbmlFixtures.addCompartments(model, "p");
        SbmlFixtures.addSpecies(model, "M_glc_p", "p", true);
        SbmlFixtures.addSpecies(model, "M_h_p", "p", false);
        SbmlFixtures.addReaction(model, "GLCpts", new String[] { "M_glc_p", "M_h_p" }, new String[] { "M_glc_c", "M_h_c" });
        SbmlFixtures.setNotes(model.getReaction("GLCpts"), "g6 or g7");
        Parms parms = new Parms(AnnotationPolicy.GLOBAL);
        SbmlData data = new SbmlData(model, parms);
        assertThat(data.getExternalCompartments(), contains("e"));
        assertThat(data.getExternalMetabolites(), contains("M_glc_e", "M_X_e", "M_glc_p"));
        assertThat(data.getEnzyme("GLCpts").getImportedMetabolites(), contains("M_glc_p"));
        assertThat(data.getEnzyme("GLCpts_duplicate_2").getImportedMetabolites(), contains("M_glc_p"));
        // Forcing "p" external makes all its species boundary species.
        parms.externals.add("p");
        data = new SbmlData(model, parms);
        assertThat(data.getExternalCompartments(), contains("e", "p"));
        assertThat(data.getExternalMetabolites(), contains("M_glc_e", "M_X_e", "M_glc_p", "M_h_p"));
    }

    @Test
    public void testStoichiometry() throws Exception {
        Model model = SbmlFixtures.standardNotesModel();
        model.getReaction("R1").getReactant(0).setStoichiometry(-2.0);
        model.getReaction("R1").getProduct(0).setStoichiometry(Double.NaN);
        SbmlData data = new SbmlData(model, new Parms(AnnotationPolicy.GLOBAL));
        Reaction r1 = data.getReactions().get(3);
        assertThat(r1.getReactants().get(0).getStoichiometry(), equalTo(2.0));
        assertThat(r1.getProducts().get(0).getStoichiometry(), equalTo(1.0));
    }

    @Test
    public void testUnknownSpecies() throws Exception {
        Model model = SbmlFixtures.standardNotesModel();
        org.sbml.jsbml.SpeciesReference ref = new org.sbml.jsbml.SpeciesReference(3, 1);
        ref.setSpecies("M_bogus_c");
        ref.setStoichiometry(1.0);
        model.getReaction("R2").addReactant(ref);
        assertThrows(InvalidInputFormatException.class, () -> new SbmlData(model, new Parms(AnnotationPolicy.GLOBAL)));
    }

}
