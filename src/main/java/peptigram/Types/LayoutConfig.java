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

import peptigram.ConfigurationException;

/**
 * Row layout settings: how many rows a protein gets and the residue gap required between neighbours in a row.
 */
public class LayoutConfig {

    public static final int DEFAULT_MAX_ROWS = 2;
    public static final int DEFAULT_MIN_GAP = 10;

    public final int maxRows;
    public final int minGap;

    public LayoutConfig() {
        this(DEFAULT_MAX_ROWS, DEFAULT_MIN_GAP);
    }

    public LayoutConfig(int maxRows, int minGap) {
        if (maxRows <= 0) {
            throw new ConfigurationException("max_rows", "must be positive but was " + maxRows);
        }
        if (minGap < 0) {
            throw new ConfigurationException("min_gap", "must be non-negative but was " + minGap);
        }
        this.maxRows = maxRows;
        this.minGap = minGap;
    }

    @Override
    public String toString() {
        return "max_rows=" + maxRows + ", min_gap=" + minGap;
    }
}
