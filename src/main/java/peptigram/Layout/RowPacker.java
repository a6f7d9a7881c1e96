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

package peptigram.Layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import peptigram.ConfigurationException;
import peptigram.Types.LayoutConfig;
import peptigram.Types.Occurrence;
import peptigram.Types.RowAssignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy first-fit assignment of sorted occurrences to a fixed number of rows.
 * <p>
 * An occurrence goes to the first row whose last occurrence ends more than {@code minGap} residues
 * before it starts. When no row has room it is forced into the row that frees up soonest, so rows may
 * overlap but nothing is dropped and the row count never grows.
 */
public class RowPacker {

    private static final Logger logger = LoggerFactory.getLogger(RowPacker.class);

    public static RowAssignment pack(List<Occurrence> occurrenceList, LayoutConfig config) {
        if (config == null) {
            throw new ConfigurationException("max_rows", "no layout config given");
        }
        if (config.maxRows <= 0) {
            throw new ConfigurationException("max_rows", "must be positive but was " + config.maxRows);
        }

        int maxRows = config.maxRows;
        List<List<Occurrence>> rows = new ArrayList<>(maxRows);
        for (int i = 0; i < maxRows; i++) {
            rows.add(new ArrayList<>());
        }
        int[] rowEndPositions = new int[maxRows]; // 0-based end of the last occurrence in each row

        int overflowNum = 0;
        for (Occurrence occurrence : occurrenceList) {
            int startPos = occurrence.start - 1;
            int endPos = occurrence.end - 1;

            boolean assigned = false;
            for (int rowIdx = 0; rowIdx < maxRows; rowIdx++) {
                if (startPos - rowEndPositions[rowIdx] > config.minGap) { // positions lie in [0, length)
                    rows.get(rowIdx).add(occurrence);
                    rowEndPositions[rowIdx] = endPos;
                    assigned = true;
                    break;
                }
            }

            if (!assigned) {
                int bestRow = 0;
                for (int rowIdx = 1; rowIdx < maxRows; rowIdx++) {
                    if (rowEndPositions[rowIdx] < rowEndPositions[bestRow]) {
                        bestRow = rowIdx;
                    }
                }
                rows.get(bestRow).add(occurrence);
                rowEndPositions[bestRow] = Math.max(rowEndPositions[bestRow], endPos);
                ++overflowNum;
            }
        }

        if (overflowNum > 0) {
            logger.debug("{} of {} occurrences forced into a busy row.", overflowNum, occurrenceList.size());
        }
        return new RowAssignment(rows);
    }
}
