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

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import org.junit.Test;
import peptigram.ConfigurationException;
import peptigram.Types.Occurrence;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


public class TestMatchAggregator {

    @Test
    public void sortsByStartThenSpan() {
        List<Occurrence> occurrences = MatchAggregator.aggregate(Arrays.asList("VLATG", "KV", "VL"), "MKVLATG", 0);
        assertThat(occurrences, contains(
            new Occurrence("KV", 2, 3, 0, "KV"),
            new Occurrence("VL", 3, 4, 0, "VL"),
            new Occurrence("VLATG", 3, 7, 0, "VLATG")
        ));
    }

    @Test
    public void samePeptideTwiceIsNotDeduplicated() {
        List<Occurrence> occurrences = MatchAggregator.aggregate(Arrays.asList("KVL", "KVL"), "MKVLATG", 0);
        assertThat(occurrences.size(), is(2));
        assertThat(occurrences.get(0), is(occurrences.get(1)));
    }

    @Test
    public void differentPeptidesOnSameSpan() {
        List<Occurrence> occurrences = MatchAggregator.aggregate(Arrays.asList("KVI", "KVL"), "MKVLATG", 1);
        assertThat(occurrences.size(), is(2));
        // equal keys keep peptide order
        assertThat(occurrences.get(0).peptide, is("KVI"));
        assertThat(occurrences.get(0).mismatches, is(1));
        assertThat(occurrences.get(1).peptide, is("KVL"));
        assertThat(occurrences.get(1).mismatches, is(0));
    }

    @Test
    public void noPeptides() {
        assertThat(MatchAggregator.aggregate(Collections.emptyList(), "MKVLATG", 0), is(empty()));
    }

    @Test
    public void budgetCheckedWithoutPeptides() {
        try {
            MatchAggregator.aggregate(Collections.emptyList(), "MKVLATG", -2);
            fail("expected ConfigurationException");
        } catch (ConfigurationException ex) {
            assertThat(ex.getParameterName(), is("mutations"));
        }
    }
}
