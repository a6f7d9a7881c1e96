/*
 * Copyright 2016-2019 The Hong Kong University of Science and Technology
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package peptigram.Search;

import peptigram.ConfigurationException;
import peptigram.Types.Occurrence;

import java.util.ArrayList;
import java.util.List;

/**
 * Ungapped search of one peptide against one protein. Only substitutions are tolerated, so every hit has the length of the peptide.
 */
public class SequenceMatcher {

    /**
     * Slides the peptide over the protein one residue at a time and keeps every window whose
     * Hamming distance to the peptide is within the budget.
     *
     * @param peptide non-empty peptide sequence
     * @param protSeq protein sequence
     * @param budget maximum number of substituted residues
     * @return hits in increasing start order; overlapping hits are all kept
     */
    public static List<Occurrence> findOccurrences(String peptide, String protSeq, int budget) {
        checkBudget(budget);
        int pepLen = peptide.length();
        if (pepLen > protSeq.length()) {
            return new ArrayList<>(0);
        }

        List<Occurrence> occurrenceList = new ArrayList<>();
        for (int i = 0; i <= protSeq.length() - pepLen; i++) {
            int mismatches = countMismatches(peptide, protSeq, i, budget);
            if (mismatches <= budget) {
                occurrenceList.add(new Occurrence(peptide, i + 1, i + pepLen, mismatches, protSeq.substring(i, i + pepLen)));
            }
        }
        return occurrenceList;
    }

    /**
     * Counts positions where the peptide differs from the protein window starting at the 0-based offset.
     * Counting stops as soon as the count exceeds limit, so a result above limit is only a lower bound.
     */
    public static int countMismatches(String peptide, String protSeq, int offset, int limit) {
        int mismatches = 0;
        for (int j = 0; j < peptide.length(); j++) {
            if (peptide.charAt(j) != protSeq.charAt(offset + j)) {
                mismatches++;
                if (mismatches > limit) {
                    break;
                }
            }
        }
        return mismatches;
    }

    static void checkBudget(int budget) {
        if (budget < 0) {
            throw new ConfigurationException("mutations", "mismatch budget must be non-negative but was " + budget);
        }
    }
}
