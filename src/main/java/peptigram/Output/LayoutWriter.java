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

package peptigram.Output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import peptigram.Types.Occurrence;
import peptigram.Types.ProteinLayout;
import peptigram.Types.RowAssignment;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Writes the row layout of one protein as a tab-separated file for a renderer to pick up.
 */
public class LayoutWriter {

    public static final String HEADER = "row\tpeptide\tstart\tend\tmismatches\tmatched_seq\tlabel";
    public static final String FILE_SUFFIX = "_peptide_distribution.tsv";

    private static final Logger logger = LoggerFactory.getLogger(LayoutWriter.class);

    private final File outputDir;
    private final Set<String> usedFileNames = new HashSet<>();

    public LayoutWriter(String outputDir) throws IOException {
        this.outputDir = new File(outputDir);
        if (!this.outputDir.isDirectory() && !this.outputDir.mkdirs()) {
            throw new IOException("Cannot create the output directory " + outputDir);
        }
    }

    public File write(ProteinLayout layout) throws IOException {
        File outputFile = new File(outputDir, uniqueFileName(layout.protein.protId) + FILE_SUFFIX);
        RowAssignment rowAssignment = layout.getRowAssignment();
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(outputFile))) {
            writer.write(HEADER + "\n");
            for (int rowIdx = 0; rowIdx < rowAssignment.rowNum(); rowIdx++) {
                for (Occurrence occurrence : rowAssignment.getRow(rowIdx)) {
                    writer.write(String.format(Locale.US, "%d\t%s\t%d\t%d\t%d\t%s\t%s\n", rowIdx, occurrence.peptide, occurrence.start, occurrence.end, occurrence.mismatches, occurrence.matchedSeq, occurrence.getLabel()));
                }
            }
        }
        return outputFile;
    }

    // Distinct IDs may clean up to the same name; later ones get a numeric suffix.
    private String uniqueFileName(String protId) {
        String baseName = toFileName(protId);
        String fileName = baseName;
        int copyNum = 1;
        while (!usedFileNames.add(fileName)) {
            ++copyNum;
            fileName = baseName + "_" + copyNum;
        }
        if (copyNum > 1) {
            logger.warn("File name {} is already taken, writing the layout of {} to {} instead.", baseName, protId, fileName);
        }
        return fileName;
    }

    static String toFileName(String protId) {
        return protId.replaceAll("[\\\\/:*?\"<>|\\s]", "_");
    }
}
