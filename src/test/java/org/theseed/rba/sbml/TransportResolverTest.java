/**
 *
 */
package org.theseed.rba.sbml;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.theseed.rba.model.Reaction;

/**
 * Tests for identifying transport reactions and their imported metabolites.
 */
public class TransportResolverTest {

    @Test
    public void testSpeciesIds() {
        assertThat(SpeciesIds.prefix("M_glc__D_e"), equalTo("M_glc__D"));
        assertThat(SpeciesIds.suffix("M_glc__D_e"), equalTo("e"));
        assertThat(SpeciesIds.suffix("glucose"), equalTo(""));
    }

    @Test
    public void testImports() {
        TransportResolver resolver = new TransportResolver("c", Arrays.asList("Z_e", "M_glc_e"));
        // Z_e is imported into the cytosol.
        Reaction r1 = new Reaction("R1", false);
        r1.addReactant("Z_e", 1.0);
        r1.addProduct("Y_c", 1.0);
        assertThat(resolver.isMembrane(r1), equalTo(true));
        assertThat(resolver.importedMetabolites(r1), contains("Z_e"));
        // The periplasmic form of glucose matches the external prefix.
        Reaction r2 = new Reaction("R2", false);
        r2.addReactant("M_glc_p", 1.0);
        r2.addReactant("M_h_p", 1.0);
        r2.addProduct("M_glc_c", 1.0);
        r2.addProduct("M_h_c", 1.0);
        assertThat(resolver.importedMetabolites(r2), contains("M_glc_p"));
        // No cytosolic product means nothing is imported.
        Reaction r3 = new Reaction("R3", false);
        r3.addReactant("M_glc_e", 1.0);
        r3.addProduct("M_glc_p", 1.0);
        assertThat(resolver.isMembrane(r3), equalTo(true));
        assertThat(resolver.importedMetabolites(r3), empty());
        // A reaction inside a single compartment is not a membrane reaction.
        Reaction r4 = new Reaction("R4", false);
        r4.addReactant("M_glc_c", 1.0);
        r4.addProduct("Y_c", 1.0);
        assertThat(resolver.isMembrane(r4), equalTo(false));
        assertThat(resolver.importedMetabolites(r4), empty());
        // Export reactions import nothing.
        Reaction r5 = new Reaction("R5", false);
        r5.addReactant("Y_c", 1.0);
        r5.addProduct("Y_e", 1.0);
        assertThat(resolver.importedMetabolites(r5), empty());
    }

}
