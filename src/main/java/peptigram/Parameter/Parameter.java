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

package peptigram.Parameter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import peptigram.ConfigurationException;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a parameter file of {@code key = value} lines. A {@code #} at the start of a line or after whitespace
 * starts a comment; a {@code #} inside a value such as a path is kept.
 */
public class Parameter {

    private static final Logger logger = LoggerFactory.getLogger(Parameter.class);
    private static final Pattern keyValuePattern = Pattern.compile("^([^=]+)=(.*)$");
    private static final Pattern commentPattern = Pattern.compile("(^|\\s)#.*$");

    private final Map<String, String> parameterMap = new HashMap<>();

    public Parameter(String parameterPath) throws IOException {
        File parameterFile = new File(parameterPath);
        if (!parameterFile.exists()) {
            throw new FileNotFoundException("The parameter file " + parameterPath + " not found.");
        }

        try (BufferedReader reader = new BufferedReader(new FileReader(parameterFile))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = commentPattern.matcher(line).replaceFirst("").trim();
                if (line.isEmpty()) {
                    continue;
                }
                Matcher matcher = keyValuePattern.matcher(line);
                if (matcher.matches()) {
                    parameterMap.put(matcher.group(1).trim(), matcher.group(2).trim());
                } else {
                    logger.warn("Ignoring malformed parameter line: {}", line);
                }
            }
        }
    }

    public Map<String, String> returnParameterMap() {
        return parameterMap;
    }

    public static String getRequired(Map<String, String> parameterMap, String key) {
        String value = parameterMap.get(key);
        if (value == null || value.isEmpty()) {
            throw new ConfigurationException(key, "missing from the parameter file");
        }
        return value;
    }

    public static int getInt(Map<String, String> parameterMap, String key, int defaultValue) {
        String value = parameterMap.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(key, "expected an integer but was " + value, ex);
        }
    }
}
