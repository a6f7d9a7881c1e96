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

package peptigram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import peptigram.Database.DbTool;
import peptigram.Layout.RowPacker;
import peptigram.Output.LayoutWriter;
import peptigram.Parameter.Parameter;
import peptigram.Search.MatchAggregator;
import peptigram.Types.*;

import java.io.File;
import java.util.*;

public class PeptiGram {
    private static final Logger logger = LoggerFactory.getLogger(PeptiGram.class);
    public static final String versionStr = "1.0.0";
    public static final String defaultOutputDir = "peptide_plots";

    private final List<ProteinLayout> proteinLayoutList = new ArrayList<>();

    public static void main(String[] args) {
        long startTime = System.nanoTime();
        if (args.length != 1) {
            help();
        }
        String parameterPath = args[0].trim();
        logger.info("Running PeptiGram version {}.", versionStr);

        int exitCode = 0;
        try {
            new PeptiGram(parameterPath);
        } catch (ConfigurationException ex) {
            logger.error(ex.getMessage());
            exitCode = 1;
        } catch (Exception ex) {
            logger.error("PeptiGram failed.", ex);
            exitCode = 1;
        }

        double totalSecond = (double) (System.nanoTime() - startTime) * 1e-9;
        logger.info("Running time: {} seconds.", totalSecond);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
        logger.info("Done!");
    }

    PeptiGram(String parameterPath) throws Exception {
        Map<String, String> parameterMap = new Parameter(parameterPath).returnParameterMap();
        if (Parameter.getInt(parameterMap, "debug", 0) == 1) {
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(ch.qos.logback.classic.Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        // all parameters are checked before any input is read
        String dbPath = Parameter.getRequired(parameterMap, "db");
        String peptidePath = Parameter.getRequired(parameterMap, "peptides");
        int mutations = Parameter.getInt(parameterMap, "mutations", 0);
        LayoutConfig layoutConfig = new LayoutConfig(Parameter.getInt(parameterMap, "max_rows", LayoutConfig.DEFAULT_MAX_ROWS), Parameter.getInt(parameterMap, "min_gap", LayoutConfig.DEFAULT_MIN_GAP));
        if (mutations < 0) {
            throw new ConfigurationException("mutations", "mismatch budget must be non-negative but was " + mutations);
        }
        String outputDir = parameterMap.getOrDefault("output_dir", defaultOutputDir);

        logger.info("Reading protein database and peptides...");
        DbTool dbTool = new DbTool(dbPath);
        Map<String, String> proteinSequenceMap = dbTool.getProteinSequenceMap();
        Map<String, String> proteinAnnotateMap = dbTool.getProteinAnnotateMap();
        List<String> peptideList = DbTool.readPeptides(peptidePath);
        logger.info("Loaded {} proteins and {} peptides.", proteinSequenceMap.size(), peptideList.size());
        logger.info("Searching with {} mutations allowed, layout {}.", mutations, layoutConfig);

        LayoutWriter layoutWriter = new LayoutWriter(outputDir);
        for (String protId : proteinSequenceMap.keySet()) {
            ProteinSequence protein = new ProteinSequence(protId, proteinSequenceMap.get(protId));
            logger.info("Processing {} ({} aa)", protId, protein.length());
            logger.debug("  {}", proteinAnnotateMap.getOrDefault(protId, ""));

            ProteinLayout layout = mapProtein(protein, peptideList, mutations, layoutConfig);
            logger.info("  Found {} peptide matches ({} exact)", layout.getOccurrenceList().size(), layout.exactNum());
            if (layout.isEmpty()) {
                continue;
            }
            proteinLayoutList.add(layout);
            File outputFile = layoutWriter.write(layout);
            logger.info("  Saved layout to {}", outputFile.getPath());
        }
    }

    /**
     * Finds every peptide in the protein and packs the hits into rows.
     */
    public static ProteinLayout mapProtein(ProteinSequence protein, List<String> peptideList, int mutations, LayoutConfig layoutConfig) {
        if (layoutConfig == null) {
            throw new ConfigurationException("max_rows", "no layout config given");
        }
        List<Occurrence> occurrenceList = MatchAggregator.aggregate(peptideList, protein.seq, mutations);
        RowAssignment rowAssignment = RowPacker.pack(occurrenceList, layoutConfig);
        return new ProteinLayout(protein, occurrenceList, rowAssignment);
    }

    List<ProteinLayout> getProteinLayoutList() {
        return proteinLayoutList;
    }

    private static void help() {
        String helpStr = "PeptiGram version " + versionStr + "\r\n"
                + "Peptide distribution across source proteins, tolerating substitutions.\r\n"
                + "java -jar PeptiGram.jar parameter.def\r\n"
                + "Parameters: db, peptides, mutations (0), max_rows (2), min_gap (10), output_dir (" + defaultOutputDir + "), debug (0)\r\n";
        System.out.print(helpStr);
        System.exit(1);
    }
}
