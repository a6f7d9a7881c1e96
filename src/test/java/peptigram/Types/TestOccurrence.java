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

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;


public class TestOccurrence {

    @Test
    public void label() {
        assertThat(new Occurrence("KVL", 2, 4, 0, "KVL").getLabel(), is("KVL [2-4]"));
        assertThat(new Occurrence("KVI", 2, 4, 1, "KVL").getLabel(), is("KVI (1 mut) [2-4]"));
    }

    @Test
    public void equality() {
        Occurrence a = new Occurrence("KVL", 2, 4, 0, "KVL");
        assertThat(a, is(new Occurrence("KVL", 2, 4, 0, "KVL")));
        assertThat(a.hashCode(), is(new Occurrence("KVL", 2, 4, 0, "KVL").hashCode()));
        assertThat(a, is(not(new Occurrence("KVL", 3, 5, 0, "KVL"))));
        assertThat(a.length(), is(3));
        assertThat(a.isExact(), is(true));
    }

    @Test
    public void startThenSpanOrder() {
        Occurrence longer = new Occurrence("AAAA", 3, 6, 0, "AAAA");
        Occurrence shorter = new Occurrence("AA", 3, 4, 0, "AA");
        Occurrence first = new Occurrence("AAAAAA", 1, 6, 0, "AAAAAA");
        List<Occurrence> list = new ArrayList<>(Arrays.asList(longer, shorter, first));
        list.sort(Occurrence.START_THEN_SPAN);
        assertThat(list, contains(first, shorter, longer));
    }

    @Test
    public void layoutConfigDefaults() {
        LayoutConfig config = new LayoutConfig();
        assertThat(config.maxRows, is(2));
        assertThat(config.minGap, is(10));
    }

    @Test
    public void peptideGrouping() {
        Occurrence a = new Occurrence("KV", 2, 3, 0, "KV");
        Occurrence b = new Occurrence("AA", 5, 6, 0, "AA");
        Occurrence c = new Occurrence("KV", 8, 9, 1, "KA");
        ProteinLayout layout = new ProteinLayout(new ProteinSequence("P1", "MKVLAAGKA"), Arrays.asList(a, b, c), new RowAssignment(Arrays.asList(Arrays.asList(a, b, c))));
        assertThat(layout.getPeptideOccurrenceMap().get("KV"), contains(a, c));
        assertThat(layout.getPeptideOccurrenceMap().get("AA"), contains(b));
        assertThat(layout.getRowAssignment().rowOf(c), is(0));
        assertThat(layout.isEmpty(), is(false));
    }

    @Test
    public void layoutDoesNotFollowSourceList() {
        Occurrence a = new Occurrence("KV", 2, 3, 0, "KV");
        List<Occurrence> source = new ArrayList<>(Arrays.asList(a));
        ProteinLayout layout = new ProteinLayout(new ProteinSequence("P1", "MKVL"), source, new RowAssignment(Arrays.asList(source)));
        source.clear();

        assertThat(layout.getOccurrenceList(), contains(a));
        assertThat(layout.getPeptideOccurrenceMap().get("KV"), contains(a));
        assertThat(layout.getPeptideOccurrenceMap(), is(sameInstance(layout.getPeptideOccurrenceMap())));
        assertThat(layout.getRowAssignment().getRow(0), contains(a));
    }
}
