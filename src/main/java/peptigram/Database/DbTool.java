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

package peptigram.Database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads protein databases in FASTA format and plain peptide lists.
 */
public class DbTool {

    private static final Logger logger = LoggerFactory.getLogger(DbTool.class);

    private final Map<String, String> proteinSequenceMap;
    private final Map<String, String> proteinAnnotateMap = new LinkedHashMap<>();

    public DbTool(String dbPath) throws IOException {
        proteinSequenceMap = readFasta(dbPath, proteinAnnotateMap);
    }

    public Map<String, String> getProteinSequenceMap() {
        return proteinSequenceMap;
    }

    public Map<String, String> getProteinAnnotateMap() {
        return proteinAnnotateMap;
    }

    public static Map<String, String> readFasta(String dbPath) throws IOException {
        return readFasta(dbPath, new LinkedHashMap<>());
    }

    // The protein ID is the first token of the header line, the rest is kept as annotation.
    private static Map<String, String> readFasta(String dbPath, Map<String, String> annotateMap) throws IOException {
        File dbFile = new File(dbPath);
        if (!dbFile.exists()) {
            throw new FileNotFoundException("The protein database " + dbPath + " not found.");
        }

        Map<String, String> proteinSequenceMap = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(new FileReader(dbFile))) {
            String id = null;
            StringBuilder sb = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                if (line.startsWith(">")) {
                    if (id != null) {
                        putProtein(proteinSequenceMap, id, sb.toString());
                    }
                    String[] parts = line.substring(1).trim().split("\\s+", 2);
                    id = parts[0];
                    annotateMap.put(id, parts.length > 1 ? parts[1] : "");
                    sb.setLength(0);
                } else if (id != null) {
                    sb.append(line.toUpperCase(Locale.US));
                }
            }
            if (id != null) {
                putProtein(proteinSequenceMap, id, sb.toString());
            }
        }
        return proteinSequenceMap;
    }

    private static void putProtein(Map<String, String> proteinSequenceMap, String id, String seq) {
        if (proteinSequenceMap.put(id, seq) != null) {
            logger.warn("Protein {} appears more than once, keeping the last sequence.", id);
        }
    }

    /**
     * One peptide per line; blank lines are skipped.
     */
    public static List<String> readPeptides(String peptidePath) throws IOException {
        File peptideFile = new File(peptidePath);
        if (!peptideFile.exists()) {
            throw new FileNotFoundException("The peptide file " + peptidePath + " not found.");
        }

        List<String> peptideList = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new FileReader(peptideFile))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    peptideList.add(line.toUpperCase(Locale.US));
                }
            }
        }
        return peptideList;
    }
}
