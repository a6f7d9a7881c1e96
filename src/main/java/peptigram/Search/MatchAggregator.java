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

import peptigram.Types.Occurrence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class MatchAggregator {

    /**
     * Searches every peptide against the protein and merges the hits into one list
     * sorted by start, shorter spans first at equal start. Hits are not deduplicated.
     */
    public static List<Occurrence> aggregate(Collection<String> peptides, String protSeq, int budget) {
        SequenceMatcher.checkBudget(budget);
        List<Occurrence> occurrenceList = new ArrayList<>();
        for (String peptide : peptides) {
            occurrenceList.addAll(SequenceMatcher.findOccurrences(peptide, protSeq, budget));
        }
        occurrenceList.sort(Occurrence.START_THEN_SPAN); // stable, so peptide order breaks remaining ties
        return occurrenceList;
    }
}
