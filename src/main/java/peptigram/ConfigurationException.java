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

import java.util.Locale;

/**
 * Raised for an invalid run parameter before any matching or packing starts.
 */
public class ConfigurationException extends IllegalArgumentException {

    private final String parameterName;

    public ConfigurationException(String parameterName, String message) {
        super(String.format(Locale.US, "Invalid parameter %s: %s", parameterName, message));
        this.parameterName = parameterName;
    }

    public ConfigurationException(String parameterName, String message, Throwable cause) {
        super(String.format(Locale.US, "Invalid parameter %s: %s", parameterName, message), cause);
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
