/**
 *
 */
package org.theseed.rba.sbml;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.theseed.rba.model.Reaction;

/**
 * Tests for the classification of compartments as internal or external.
 */
public class CompartmentClassifierTest {

    /**
     * @return a reaction with the specified reactants and products
     *
     * @param id			reaction ID
     * @param reactants		reactant species IDs
     * @param products		product species IDs
     */
    private static Reaction reaction(String id, String[] reactants, String[] products) {
        Reaction retVal = new Reaction(id, false);
        for (String reactant : reactants)
            retVal.addReactant(reactant, 1.0);
        for (String product : products)
            retVal.addProduct(product, 1.0);
        return retVal;
    }

    @Test
    public void testSinkClassification() {
        Map<String, String> speciesMap = new LinkedHashMap<String, String>();
        speciesMap.put("X_e", "e");
        speciesMap.put("glc_e", "e");
        speciesMap.put("glc_c", "c");
        speciesMap.put("o2_p", "p");
        speciesMap.put("o2_c", "c");
        List<Reaction> reactions = Arrays.asList(
                reaction("EX_X", new String[] { "X_e" }, new String[0]),
                reaction("EX_glc", new String[0], new String[] { "glc_e" }),
                reaction("GLCt", new String[] { "glc_e" }, new String[] { "glc_c" }),
                reaction("O2t", new String[] { "o2_p" }, new String[] { "o2_c" }));
        assertThat(CompartmentClassifier.sinkSpecies(reactions), containsInAnyOrder("X_e", "glc_e"));
        CompartmentClassifier classifier = new CompartmentClassifier(Collections.emptyList());
        Set<String> external = classifier.classify(Arrays.asList("c", "e", "p"), speciesMap, reactions);
        assertThat(external, contains("e"));
        // The override list is unioned with the topology result.
        classifier = new CompartmentClassifier(Arrays.asList("p"));
        external = classifier.classify(Arrays.asList("c", "e", "p"), speciesMap, reactions);
        assertThat(external, contains("e", "p"));
    }

    @Test
    public void testPartialSinks() {
        // One species in "e" is not in a sink reaction, so "e" stays internal.
        Map<String, String> speciesMap = new LinkedHashMap<String, String>();
        speciesMap.put("X_e", "e");
        speciesMap.put("Y_e", "e");
        List<Reaction> reactions = Arrays.asList(
                reaction("EX_X", new String[] { "X_e" }, new String[0]),
                reaction("R1", new String[] { "X_e" }, new String[] { "Y_e" }));
        CompartmentClassifier classifier = new CompartmentClassifier(Collections.emptyList());
        assertThat(classifier.classify(Arrays.asList("e"), speciesMap, reactions), empty());
    }

    @Test
    public void testEmptyCompartment() {
        // A compartment with no species at all has nothing that disqualifies it.
        CompartmentClassifier classifier = new CompartmentClassifier(Collections.emptyList());
        Map<String, String> speciesMap = new LinkedHashMap<String, String>();
        speciesMap.put("A_c", "c");
        List<Reaction> reactions = Arrays.asList(reaction("R1", new String[] { "A_c" }, new String[] { "A_c" }));
        assertThat(classifier.classify(Arrays.asList("c", "x"), speciesMap, reactions), contains("x"));
    }

}
