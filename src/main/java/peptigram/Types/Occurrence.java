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

import java.util.Comparator;
import java.util.Locale;

/**
 * One approximate hit of a peptide within a protein. Positions are 1-based and inclusive.
 */
public class Occurrence {

    // start ascending, then shorter spans first
    public static final Comparator<Occurrence> START_THEN_SPAN = Comparator.comparingInt((Occurrence o) -> o.start).thenComparingInt(o -> o.end - o.start);

    public final String peptide;
    public final int start;
    public final int end;
    public final int mismatches;
    public final String matchedSeq;

    private final int hashCode;

    public Occurrence(String peptide, int start, int end, int mismatches, String matchedSeq) {
        this.peptide = peptide;
        this.start = start;
        this.end = end;
        this.mismatches = mismatches;
        this.matchedSeq = matchedSeq;

        String toString = peptide + "@" + start + "-" + end + ":" + matchedSeq;
        hashCode = toString.hashCode();
    }

    public int length() {
        return end - start + 1;
    }

    public boolean isExact() {
        return mismatches == 0;
    }

    public String getLabel() {
        if (mismatches > 0) {
            return String.format(Locale.US, "%s (%d mut) [%d-%d]", peptide, mismatches, start, end);
        } else {
            return String.format(Locale.US, "%s [%d-%d]", peptide, start, end);
        }
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof Occurrence) {
            Occurrence temp = (Occurrence) other;
            return temp.start == start && temp.end == end && temp.mismatches == mismatches && temp.peptide.contentEquals(peptide) && temp.matchedSeq.contentEquals(matchedSeq);
        } else {
            return false;
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s[%d-%d,%d mut,%s]", peptide, start, end, mismatches, matchedSeq);
    }
}
