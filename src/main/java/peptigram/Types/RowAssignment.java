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

import java.util.List;

/**
 * Occurrences of one protein split into a fixed number of rows. Rows may be empty.
 */
public class RowAssignment {

    private final ImmutableList<ImmutableList<Occurrence>> rows;

    public RowAssignment(List<? extends List<Occurrence>> rowList) {
        ImmutableList.Builder<ImmutableList<Occurrence>> builder = ImmutableList.builder();
        for (List<Occurrence> row : rowList) {
            builder.add(ImmutableList.copyOf(row));
        }
        rows = builder.build();
    }

    public int rowNum() {
        return rows.size();
    }

    public ImmutableList<Occurrence> getRow(int rowIdx) {
        return rows.get(rowIdx);
    }

    public ImmutableList<ImmutableList<Occurrence>> getRows() {
        return rows;
    }

    public int occurrenceNum() {
        int num = 0;
        for (List<Occurrence> row : rows) {
            num += row.size();
        }
        return num;
    }

    // -1 if the occurrence is not placed
    int rowOf(Occurrence occurrence) {
        for (int i = 0; i < rows.size(); ++i) {
            if (rows.get(i).contains(occurrence)) {
                return i;
            }
        }
        return -1;
    }
}
