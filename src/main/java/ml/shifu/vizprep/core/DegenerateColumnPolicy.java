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
package ml.shifu.vizprep.core;

/**
 * What to do with a column which has no non-missing value, so no mean or mode can be computed to impute it.
 */
public enum DegenerateColumnPolicy {
    /**
     * Raise ERROR_DEGENERATE_COLUMN.
     */
    FAIL,
    /**
     * Leave the column as is and report it. The preprocessor drops such columns from the prepared table.
     */
    SKIP
}
