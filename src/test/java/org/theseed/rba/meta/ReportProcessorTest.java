/**
 *
 */
package org.theseed.rba.meta;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sbml.jsbml.SBMLWriter;
import org.theseed.rba.SbmlFixtures;

/**
 * Tests for the report commands.
 */
public class ReportProcessorTest {

    /** test parameter file */
    private static final File PARMS = new File("src/test/resources", "parms.json");

    @Test
    public void testProteinReport(@TempDir File tempDir) throws Exception {
        // The output directory does not exist yet.
        File outFile = new File(tempDir, "reports/proteins.tsv");
        ProteinsProcessor processor = new ProteinsProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), PARMS.getPath() });
        assertThat(ok, equalTo(true));
        processor.run();
        List<String> lines = FileUtils.readLines(outFile, StandardCharsets.UTF_8);
        assertThat(lines.size(), equalTo(3));
        assertThat(lines.get(0), startsWith("gene\tprotein\t"));
        assertThat(lines.get(1), startsWith("b0001\tThrL\tc\t2.0\t"));
        assertThat(lines.get(2), startsWith("b0002\tb0002\tc\t"));
    }

    @Test
    public void testBadOutput(@TempDir File tempDir) {
        ProteinsProcessor processor = new ProteinsProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", tempDir.getPath(), PARMS.getPath() });
        assertThat(ok, equalTo(false));
    }

    @Test
    public void testCompartmentReport(@TempDir File tempDir) throws Exception {
        File sbmlFile = new File(tempDir, "model.xml");
        new SBMLWriter().writeSBML(SbmlFixtures.standardNotesModel().getSBMLDocument(), sbmlFile);
        File outFile = new File(tempDir, "compartments.tsv");
        CompartmentsProcessor processor = new CompartmentsProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "--sbml", sbmlFile.getPath(),
                "--missing", "GLOBAL", PARMS.getPath() });
        assertThat(ok, equalTo(true));
        processor.run();
        List<String> lines = FileUtils.readLines(outFile, StandardCharsets.UTF_8);
        assertThat(lines, contains("compartment\texternal\tspecies\tboundary", "c\t\t6\t0", "e\tY\t2\t2"));
    }

}
