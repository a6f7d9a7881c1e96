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

package peptigram.Types;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;

import java.util.List;

public class ProteinLayout {

    public final ProteinSequence protein;
    private final ImmutableList<Occurrence> occurrenceList;
    private final RowAssignment rowAssignment;
    private final ImmutableListMultimap<String, Occurrence> peptideOccurrenceMap;

    public ProteinLayout(ProteinSequence protein, List<Occurrence> occurrenceList, RowAssignment rowAssignment) {
        this.protein = protein;
        this.occurrenceList = ImmutableList.copyOf(occurrenceList);
        this.rowAssignment = rowAssignment;
        peptideOccurrenceMap = Multimaps.index(this.occurrenceList, o -> o.peptide);
    }

    public ImmutableList<Occurrence> getOccurrenceList() {
        return occurrenceList;
    }

    public RowAssignment getRowAssignment() {
        return rowAssignment;
    }

    public boolean isEmpty() {
        return occurrenceList.isEmpty();
    }

    public int exactNum() {
        int num = 0;
        for (Occurrence occurrence : occurrenceList) {
            if (occurrence.isExact()) {
                ++num;
            }
        }
        return num;
    }

    public ImmutableListMultimap<String, Occurrence> getPeptideOccurrenceMap() {
        return peptideOccurrenceMap;
    }
}
