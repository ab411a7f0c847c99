/**
 *
 */
package org.theseed.rba.association;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.theseed.rba.UnsupportedAssociationShapeException;

/**
 * Tests for conversion of gene associations to disjunctive normal form.
 */
public class DnfNormalizerTest {

    /** gene names used for the random expressions */
    private static final String[] GENES = new String[] { "g1", "g2", "g3", "g4" };

    /**
     * @return TRUE if an association is satisfied by a set of present genes
     *
     * @param node		association to evaluate
     * @param present	genes that are present
     */
    private static boolean evaluate(GeneAssociation node, Set<String> present) {
        boolean retVal;
        if (node instanceof GeneAssociation.Leaf)
            retVal = present.contains(((GeneAssociation.Leaf) node).getGene());
        else if (node.isEmpty())
            retVal = true;
        else if (node instanceof GeneAssociation.Or) {
            retVal = false;
            for (GeneAssociation child : ((GeneAssociation.Or) node).getChildren())
                retVal = retVal || evaluate(child, present);
        } else {
            retVal = true;
            for (GeneAssociation child : ((GeneAssociation.And) node).getChildren())
                retVal = retVal && evaluate(child, present);
        }
        return retVal;
    }

    /**
     * @return TRUE if a list of clauses is satisfied by a set of present genes
     *
     * @param clauses	DNF clauses
     * @param present	genes that are present
     */
    private static boolean evaluate(List<EnzymeComposition> clauses, Set<String> present) {
        return clauses.stream().anyMatch(x -> present.containsAll(x.getGenes()));
    }

    /**
     * @return a random association tree
     *
     * @param rand		randomizer
     * @param depth		maximum remaining depth
     */
    private static GeneAssociation randomTree(Random rand, int depth) {
        GeneAssociation retVal;
        int choice = rand.nextInt(8);
        if (depth == 0 || choice < 2)
            retVal = GeneAssociation.gene(GENES[rand.nextInt(GENES.length)]);
        else if (choice == 2)
            retVal = (rand.nextBoolean() ? GeneAssociation.and() : GeneAssociation.or());
        else {
            int n = rand.nextInt(3) + 1;
            List<GeneAssociation> children = new ArrayList<GeneAssociation>(n);
            for (int i = 0; i < n; i++)
                children.add(randomTree(rand, depth - 1));
            if (rand.nextBoolean())
                retVal = new GeneAssociation.And(children);
            else
                retVal = new GeneAssociation.Or(children);
        }
        return retVal;
    }

    @Test
    public void testTruthTables() throws UnsupportedAssociationShapeException {
        DnfNormalizer normalizer = new DnfNormalizer();
        Random rand = new Random(1234567L);
        for (int trial = 0; trial < 200; trial++) {
            GeneAssociation tree = randomTree(rand, 4);
            List<EnzymeComposition> clauses = normalizer.normalize(tree);
            assertThat(tree.toString(), clauses, not(empty()));
            assertThat(tree.toString(), new HashSet<EnzymeComposition>(clauses).size(), equalTo(clauses.size()));
            // Check every assignment of the four genes.
            for (int mask = 0; mask < 16; mask++) {
                Set<String> present = new HashSet<String>();
                for (int i = 0; i < GENES.length; i++) {
                    if ((mask & (1 << i)) != 0)
                        present.add(GENES[i]);
                }
                assertThat(tree + " with " + present, evaluate(clauses, present), equalTo(evaluate(tree, present)));
            }
        }
    }

    @Test
    public void testSimpleForms() throws UnsupportedAssociationShapeException {
        DnfNormalizer normalizer = new DnfNormalizer();
        GeneAssociation g1 = GeneAssociation.gene("g1");
        GeneAssociation g2 = GeneAssociation.gene("g2");
        GeneAssociation g3 = GeneAssociation.gene("g3");
        List<EnzymeComposition> clauses = normalizer.normalize(g1);
        assertThat(clauses, contains(EnzymeComposition.of("g1")));
        clauses = normalizer.normalize(GeneAssociation.or(GeneAssociation.and(g1, g2), g3));
        assertThat(clauses, contains(EnzymeComposition.of("g1", "g2"), EnzymeComposition.of("g3")));
        // Distribution of AND over OR.
        clauses = normalizer.normalize(GeneAssociation.and(g1, GeneAssociation.or(g2, g3)));
        assertThat(clauses, contains(EnzymeComposition.of("g1", "g2"), EnzymeComposition.of("g1", "g3")));
        // Nested ORs and ANDs flatten.
        clauses = normalizer.normalize(GeneAssociation.or(g1, GeneAssociation.or(g2, GeneAssociation.or(g3))));
        assertThat(clauses, contains(EnzymeComposition.of("g1"), EnzymeComposition.of("g2"), EnzymeComposition.of("g3")));
        clauses = normalizer.normalize(GeneAssociation.and(g1, GeneAssociation.and(g2, GeneAssociation.and(g3))));
        assertThat(clauses, contains(EnzymeComposition.of("g1", "g2", "g3")));
        // Repeated literals and repeated clauses collapse.
        clauses = normalizer.normalize(GeneAssociation.and(g1, g1, g2));
        assertThat(clauses, contains(EnzymeComposition.of("g1", "g2")));
        clauses = normalizer.normalize(GeneAssociation.or(GeneAssociation.and(g1, g2), GeneAssociation.and(g2, g1), g1));
        assertThat(clauses, contains(EnzymeComposition.of("g1", "g2"), EnzymeComposition.of("g1")));
    }

    @Test
    public void testIdempotence() throws UnsupportedAssociationShapeException {
        DnfNormalizer normalizer = new DnfNormalizer();
        Random rand = new Random(42L);
        for (int trial = 0; trial < 50; trial++) {
            List<EnzymeComposition> clauses = normalizer.normalize(randomTree(rand, 3));
            // Rebuild the clauses as an OR of ANDs and normalize again.
            List<GeneAssociation> terms = new ArrayList<GeneAssociation>();
            for (EnzymeComposition clause : clauses) {
                List<GeneAssociation> genes = new ArrayList<GeneAssociation>();
                for (String gene : clause)
                    genes.add(GeneAssociation.gene(gene));
                terms.add(new GeneAssociation.And(genes));
            }
            List<EnzymeComposition> again = normalizer.normalize(new GeneAssociation.Or(terms));
            assertThat(new HashSet<EnzymeComposition>(again), equalTo(new HashSet<EnzymeComposition>(clauses)));
        }
    }

    @Test
    public void testEmpty() throws UnsupportedAssociationShapeException {
        DnfNormalizer normalizer = new DnfNormalizer();
        List<EnzymeComposition> clauses = normalizer.normalize(GeneAssociation.EMPTY);
        assertThat(clauses, contains(EnzymeComposition.EMPTY));
        assertThat(clauses.get(0).isEmpty(), equalTo(true));
        clauses = normalizer.normalize(GeneAssociation.or());
        assertThat(clauses, contains(EnzymeComposition.EMPTY));
        clauses = normalizer.normalize(GeneAssociation.and(GeneAssociation.or(), GeneAssociation.and()));
        assertThat(clauses, contains(EnzymeComposition.EMPTY));
    }

    @Test
    public void testEmptyAlternatives() throws UnsupportedAssociationShapeException {
        DnfNormalizer normalizer = new DnfNormalizer();
        GeneAssociation g1 = GeneAssociation.gene("g1");
        GeneAssociation g2 = GeneAssociation.gene("g2");
        // An empty alternative makes the OR satisfiable with no genes at all.
        List<EnzymeComposition> clauses = normalizer.normalize(GeneAssociation.or(g1, GeneAssociation.EMPTY));
        assertThat(clauses, contains(EnzymeComposition.of("g1"), EnzymeComposition.EMPTY));
        clauses = normalizer.normalize(GeneAssociation.or(GeneAssociation.and(), g1, GeneAssociation.or()));
        assertThat(clauses, contains(EnzymeComposition.EMPTY, EnzymeComposition.of("g1")));
        // An empty conjunct changes nothing.
        clauses = normalizer.normalize(GeneAssociation.and(g1, GeneAssociation.or(), g2));
        assertThat(clauses, contains(EnzymeComposition.of("g1", "g2")));
        clauses = normalizer.normalize(GeneAssociation.and(g1, GeneAssociation.or(g2, GeneAssociation.and())));
        assertThat(clauses, contains(EnzymeComposition.of("g1", "g2"), EnzymeComposition.of("g1")));
    }

    @Test
    public void testBadShape() {
        DnfNormalizer normalizer = new DnfNormalizer();
        GeneAssociation strange = new GeneAssociation() {
            @Override
            public boolean isEmpty() {
                return false;
            }
        };
        assertThrows(UnsupportedAssociationShapeException.class,
                () -> normalizer.normalize(GeneAssociation.or(GeneAssociation.gene("g1"), strange)));
    }

}
