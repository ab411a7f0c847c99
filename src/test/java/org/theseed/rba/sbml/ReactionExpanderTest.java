/**
 *
 */
package org.theseed.rba.sbml;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.rba.association.EnzymeComposition;
import org.theseed.rba.model.Reaction;

/**
 * Tests for splitting reactions with alternative enzymes.
 */
public class ReactionExpanderTest {

    /**
     * @return a simple reaction A_c --> B_c
     *
     * @param id	ID for the reaction
     */
    private static Reaction reaction(String id) {
        Reaction retVal = new Reaction(id, true);
        retVal.addReactant("A_c", 2.0);
        retVal.addProduct("B_c", 1.0);
        return retVal;
    }

    @Test
    public void testExpansion() {
        ReactionExpander expander = new ReactionExpander(Arrays.asList("R1", "R2"));
        Reaction r1 = reaction("R1");
        List<EnzymeComposition> comps = Arrays.asList(EnzymeComposition.of("g1", "g2"), EnzymeComposition.of("g3"),
                EnzymeComposition.of("g4"));
        List<ReactionExpander.Binding> bindings = expander.expand(r1, comps);
        assertThat(bindings.size(), equalTo(3));
        assertThat(bindings.get(0).getReaction(), sameInstance(r1));
        assertThat(bindings.get(1).getReaction().getId(), equalTo("R1_duplicate_2"));
        assertThat(bindings.get(2).getReaction().getId(), equalTo("R1_duplicate_3"));
        for (int i = 0; i < 3; i++) {
            ReactionExpander.Binding binding = bindings.get(i);
            assertThat(binding.getComposition(), equalTo(comps.get(i)));
            Reaction copy = binding.getReaction();
            assertThat(copy.isReversible(), equalTo(true));
            assertThat(copy.getFormula(), equalTo(r1.getFormula()));
        }
        assertThat(expander.getCopyCount(), equalTo(2));
        // A single composition means no copies.
        Reaction r2 = reaction("R2");
        bindings = expander.expand(r2, Collections.singletonList(EnzymeComposition.EMPTY));
        assertThat(bindings.size(), equalTo(1));
        assertThat(bindings.get(0).getReaction(), sameInstance(r2));
        assertThat(bindings.get(0).getComposition().isEmpty(), equalTo(true));
        assertThat(expander.getCopyCount(), equalTo(2));
    }

    @Test
    public void testCollision() {
        // The model already has a reaction with the natural copy ID.
        ReactionExpander expander = new ReactionExpander(Arrays.asList("R1", "R1_duplicate_2", "R1_duplicate_2_2"));
        List<ReactionExpander.Binding> bindings = expander.expand(reaction("R1"),
                Arrays.asList(EnzymeComposition.of("g1"), EnzymeComposition.of("g2")));
        assertThat(bindings.get(1).getReaction().getId(), equalTo("R1_duplicate_2_3"));
        // Every ID produced is distinct.
        ReactionExpander.Binding again = expander.expand(reaction("R1_duplicate"),
                Arrays.asList(EnzymeComposition.of("g1"), EnzymeComposition.of("g2"))).get(1);
        assertThat(again.getReaction().getId(), equalTo("R1_duplicate_duplicate_2"));
    }

}
