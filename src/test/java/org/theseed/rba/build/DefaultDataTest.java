/**
 *
 */
package org.theseed.rba.build;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.theseed.rba.RbaBuildException;
import org.theseed.rba.model.Parameters;

/**
 * Tests for the default data and sequence compositions.
 */
public class DefaultDataTest {

    @Test
    public void testCompositions() {
        DefaultData defaults = new DefaultData();
        Map<String, Double> counts = SequenceCompositions.aminoAcids("mkkAX*", defaults.getAminoAcids());
        assertThat(counts.size(), equalTo(3));
        assertThat(counts, hasEntry("K", 2.0));
        assertThat(counts, hasEntry("M", 1.0));
        assertThat(SequenceCompositions.aminoAcids(null, defaults.getAminoAcids()).isEmpty(), equalTo(true));
        Map<String, Double> bases = SequenceCompositions.nucleotides("ACGTUNu");
        assertThat(bases, hasEntry("U", 3.0));
        assertThat(bases, hasEntry("A", 1.0));
        assertThat(bases.containsKey("N"), equalTo(false));
        assertThat(defaults.getAminoAcidKey("W"), equalTo("TRP"));
    }

    @Test
    public void testAverageProtein() {
        DefaultData defaults = new DefaultData();
        Map<String, Double> avg = defaults.averageProtein(Arrays.asList("MKK", "MA"));
        assertThat(avg, hasEntry("M", 1.0));
        assertThat(avg, hasEntry("K", 1.0));
        assertThat(avg, hasEntry("A", 0.5));
        Map<String, Double> empty = defaults.averageProtein(Collections.emptyList());
        assertThat(empty.size(), equalTo(20));
        double total = empty.values().stream().mapToDouble(x -> x).sum();
        assertThat(total, closeTo(DefaultData.DEFAULT_PROTEIN_LENGTH, 1e-6));
    }

    @Test
    public void testProteinLength() throws RbaBuildException {
        DefaultData defaults = new DefaultData();
        Parameters parms = new Parameters();
        defaults.addProteinLengthFunction(parms, 250.0);
        assertThat(parms.getFunction(DefaultData.INVERSE_PROTEIN_LENGTH).get("CONSTANT"), closeTo(0.004, 1e-9));
        Map<String, Double> blank = defaults.averageProtein(Arrays.asList("XXX", "*"));
        double length = blank.values().stream().mapToDouble(x -> x).sum();
        assertThrows(RbaBuildException.class, () -> defaults.addProteinLengthFunction(new Parameters(), length));
    }

    @Test
    public void testDensityFunctions() {
        DefaultData defaults = new DefaultData();
        Parameters parms = new Parameters();
        List<String> internal = Arrays.asList("c", "p", "im");
        defaults.addDensityFunctions(parms, "c", internal);
        assertThat(parms.getFunction(DefaultData.proteinFractionId("c")).get("CONSTANT"), closeTo(0.8, 1e-9));
        assertThat(parms.getFunction(DefaultData.proteinFractionId("p")).get("CONSTANT"), closeTo(0.1, 1e-9));
        assertThat(parms.getFunction(DefaultData.proteinFractionId("im")).get("CONSTANT"), closeTo(0.1, 1e-9));
        assertThat(parms.getAggregate(DefaultData.densityId("p")).getFunctionRefs(),
                contains(DefaultData.AMINO_ACID_CONCENTRATION, DefaultData.proteinFractionId("p")));
        // Without a cytosol, the fractions are equal.
        parms = new Parameters();
        defaults.addDensityFunctions(parms, "c", Arrays.asList("x", "y"));
        assertThat(parms.getFunction(DefaultData.proteinFractionId("x")).get("CONSTANT"), closeTo(0.5, 1e-9));
    }

}
