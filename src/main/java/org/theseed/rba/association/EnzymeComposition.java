/**
 *
 */
package org.theseed.rba.association;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An enzyme composition is the set of genes that together form one enzyme.  It corresponds to
 * a single AND clause of a gene association in disjunctive normal form.  The genes are kept
 * sorted, so two compositions with the same genes are equal regardless of the order in which
 * the genes were found.  An empty composition denotes a spontaneous reaction.
 */
public class EnzymeComposition implements Comparable<EnzymeComposition>, Iterable<String> {

    // FIELDS
    /** genes in this composition */
    private final SortedSet<String> genes;

    /** the empty composition */
    public static final EnzymeComposition EMPTY = new EnzymeComposition(Collections.emptySet());

    /**
     * Construct an enzyme composition from a collection of genes.
     *
     * @param genes		genes in the composition (duplicates are ignored)
     */
    public EnzymeComposition(Collection<String> genes) {
        this.genes = Collections.unmodifiableSortedSet(new TreeSet<String>(genes));
    }

    /**
     * @return an enzyme composition containing the specified genes
     *
     * @param genes		genes in the composition
     */
    public static EnzymeComposition of(String... genes) {
        return new EnzymeComposition(Arrays.asList(genes));
    }

    /**
     * @return a new composition containing the genes in this one plus the genes in another
     *
     * @param other		other composition to merge in
     */
    public EnzymeComposition merge(EnzymeComposition other) {
        Set<String> union = new TreeSet<String>(this.genes);
        union.addAll(other.genes);
        return new EnzymeComposition(union);
    }

    /**
     * @return the genes in this composition
     */
    public SortedSet<String> getGenes() {
        return this.genes;
    }

    /**
     * @return TRUE if this composition has no genes
     */
    public boolean isEmpty() {
        return this.genes.isEmpty();
    }

    /**
     * @return the number of genes in this composition
     */
    public int size() {
        return this.genes.size();
    }

    @Override
    public Iterator<String> iterator() {
        return this.genes.iterator();
    }

    @Override
    public int compareTo(EnzymeComposition o) {
        int retVal = this.genes.size() - o.genes.size();
        if (retVal == 0) {
            Iterator<String> iter2 = o.genes.iterator();
            for (Iterator<String> iter1 = this.genes.iterator(); iter1.hasNext() && retVal == 0; )
                retVal = iter1.next().compareTo(iter2.next());
        }
        return retVal;
    }

    @Override
    public int hashCode() {
        return this.genes.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        EnzymeComposition other = (EnzymeComposition) obj;
        return this.genes.equals(other.genes);
    }

    @Override
    public String toString() {
        return String.join(" and ", this.genes);
    }

}
