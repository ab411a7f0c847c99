/**
 *
 */
package org.theseed.rba.build;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * These are utility methods for converting sequences into macromolecule compositions.
 */
public class SequenceCompositions {

    /**
     * Count the amino acids in a protein sequence.  Only the residues in the specified alphabet are
     * counted; stops and ambiguity codes are ignored.
     *
     * @param sequence		protein sequence
     * @param aminoAcids	one-letter codes of the amino acids to count
     *
     * @return a map from each amino acid found to its number of occurrences
     */
    public static Map<String, Double> aminoAcids(String sequence, Collection<String> aminoAcids) {
        Map<String, Double> retVal = new TreeMap<String, Double>();
        if (sequence != null) {
            final int n = sequence.length();
            for (int i = 0; i < n; i++) {
                String aa = String.valueOf(Character.toUpperCase(sequence.charAt(i)));
                if (aminoAcids.contains(aa))
                    retVal.merge(aa, 1.0, Double::sum);
            }
        }
        return retVal;
    }

    /**
     * Count the nucleotides in an RNA sequence.  A "T" is counted as a "U", so that DNA-style
     * sequences of RNA genes can be used directly.
     *
     * @param sequence		RNA sequence
     *
     * @return a map from each nucleotide found to its number of occurrences
     */
    public static Map<String, Double> nucleotides(String sequence) {
        Map<String, Double> retVal = new TreeMap<String, Double>();
        if (sequence != null) {
            final int n = sequence.length();
            for (int i = 0; i < n; i++) {
                char base = Character.toUpperCase(sequence.charAt(i));
                switch (base) {
                case 'T' :
                case 'U' :
                    retVal.merge("U", 1.0, Double::sum);
                    break;
                case 'A' :
                case 'C' :
                case 'G' :
                    retVal.merge(String.valueOf(base), 1.0, Double::sum);
                    break;
                default :
                    // Ambiguity codes are skipped.
                }
            }
        }
        return retVal;
    }

}
