/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.vizprep.exception;

/**
 * VizPrep error code
 */
public enum VizPrepErrorCode {
    /**
     * Configuration Error 400 ~ 500
     */
    ERROR_VIZPREP_CONFIG(400, "Errors happen when loading vizprep config"),

    /*
     * File/System error: 1001 - 1050
     */
    ERROR_INPUT_NOT_FOUND(1001, "The input data is not found"), ERROR_LOAD_TABLE(1002,
            "Could not load the input data into a table"), ERROR_WRITE_OUTPUT(1003, "Could not write the output file"),

    /*
     * Preprocessing error: 1151 - 1200
     */
    ERROR_DEGENERATE_COLUMN(1151, "The column has no non-missing value to compute an imputation statistic"), ERROR_NAME_COLLISION(
            1152, "Encoding produces a duplicated column name"), ERROR_ZERO_VARIANCE(1153,
            "The column has zero variance and cannot be scaled"),

    /*
     * Column lookup and visualization error: 1301 - 1350
     */
    ERROR_UNKNOWN_COLUMN(1301, "The referenced column does not exist in the table"), ERROR_UNSUPPORTED_VISUALIZATION(
            1302, "The requested visualization is not supported for the column types");

    /**
     * code
     */
    private final int code;

    /**
     * description
     */
    private final String description;

    /**
     * Constructor, not public
     * 
     * @param code
     *            the code
     * @param description
     *            the description
     */
    private VizPrepErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * description getter
     * 
     * @return description
     */
    public String getDescription() {
        return description;
    }

    /**
     * code getter
     * 
     * @return code
     */
    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code + ": " + description;
    }

}
