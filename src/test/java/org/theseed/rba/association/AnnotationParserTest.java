/**
 *
 */
package org.theseed.rba.association;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import javax.xml.stream.XMLStreamException;

import org.junit.jupiter.api.Test;
import org.sbml.jsbml.Model;
import org.theseed.rba.MissingAnnotationException;
import org.theseed.rba.SbmlFixtures;
import org.theseed.rba.UnsupportedAssociationShapeException;

/**
 * Tests for extracting gene associations from SBML reactions.
 */
public class AnnotationParserTest {

    /**
     * @return the DNF clauses for a reaction's association
     *
     * @param parser		annotation parser to use
     * @param model			model containing the reaction
     * @param reactionId	ID of the reaction
     *
     * @throws UnsupportedAssociationShapeException
     */
    private static List<EnzymeComposition> clauses(AnnotationParser parser, Model model, String reactionId)
            throws UnsupportedAssociationShapeException {
        GeneAssociation assoc = parser.extract(model.getReaction(reactionId));
        return new DnfNormalizer().normalize(assoc);
    }

    @Test
    public void testFbcParser() throws Exception {
        Model model = SbmlFixtures.standardFbcModel();
        assertThat(FbcAnnotationParser.isAvailable(model), equalTo(true));
        AnnotationParser parser = AnnotationParser.select(model);
        assertThat(parser, instanceOf(FbcAnnotationParser.class));
        assertThat(clauses(parser, model, "R1"), contains(EnzymeComposition.of("g1", "g2"),
                EnzymeComposition.of("g3")));
        assertThat(clauses(parser, model, "GLCt"), contains(EnzymeComposition.of("g5")));
        assertThat(parser.extract(model.getReaction("EX_glc")), nullValue());
    }

    @Test
    public void testGeneNames() throws Exception {
        Model model = SbmlFixtures.standardNetwork();
        SbmlFixtures.addGeneProduct(model, "G_b0001", "thrL");
        SbmlFixtures.addGeneProduct(model, "G_b0002", null);
        SbmlFixtures.fbc(model).getGeneProduct("G_b0002").setName("thrA");
        SbmlFixtures.addGeneProduct(model, "G_b0003", null);
        SbmlFixtures.setAssociation(model.getReaction("R1"), SbmlFixtures.and(SbmlFixtures.ref("G_b0001"),
                SbmlFixtures.ref("G_b0002"), SbmlFixtures.ref("G_b0003")));
        // A reference to a product not in the list falls back to the stripped ID.
        SbmlFixtures.setAssociation(model.getReaction("R2"), SbmlFixtures.ref("G_b0099"));
        AnnotationParser parser = new FbcAnnotationParser(model);
        assertThat(clauses(parser, model, "R1"), contains(EnzymeComposition.of("thrL", "thrA", "b0003")));
        assertThat(clauses(parser, model, "R2"), contains(EnzymeComposition.of("b0099")));
    }

    @Test
    public void testNotesParser() throws Exception {
        Model model = SbmlFixtures.standardNotesModel();
        assertThat(FbcAnnotationParser.isAvailable(model), equalTo(false));
        assertThat(NoteAnnotationParser.isAvailable(model), equalTo(true));
        AnnotationParser parser = AnnotationParser.select(model);
        assertThat(parser, instanceOf(NoteAnnotationParser.class));
        assertThat(clauses(parser, model, "R1"), contains(EnzymeComposition.of("g1", "g2"),
                EnzymeComposition.of("g3")));
        assertThat(clauses(parser, model, "R2"), contains(EnzymeComposition.of("g9")));
        assertThat(parser.extract(model.getReaction("EX_X")), nullValue());
    }

    @Test
    public void testBlankNote() throws XMLStreamException, UnsupportedAssociationShapeException {
        Model model = SbmlFixtures.standardNetwork();
        SbmlFixtures.setNotes(model.getReaction("R1"), "");
        AnnotationParser parser = new NoteAnnotationParser();
        GeneAssociation assoc = parser.extract(model.getReaction("R1"));
        assertThat(assoc.isEmpty(), equalTo(true));
        assertThat(new DnfNormalizer().normalize(assoc), contains(EnzymeComposition.EMPTY));
    }

    @Test
    public void testMissing() {
        Model model = SbmlFixtures.standardNetwork();
        assertThat(NoteAnnotationParser.isAvailable(model), equalTo(false));
        assertThrows(MissingAnnotationException.class, () -> AnnotationParser.select(model));
    }

}
