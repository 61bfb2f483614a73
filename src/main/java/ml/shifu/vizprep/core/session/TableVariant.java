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
package ml.shifu.vizprep.core.session;

/**
 * Which table of a session a visualization request targets.
 */
public enum TableVariant {
    /**
     * Table as loaded, may have missing values and categorical columns.
     */
    RAW,
    /**
     * Output of preprocessing, fully numeric.
     */
    PREPARED;

    public static TableVariant of(String variant) {
        for(TableVariant tv: values()) {
            if(tv.name().equalsIgnoreCase(variant)) {
                return tv;
            }
        }
        throw new IllegalArgumentException("Cannot find TableVariant " + variant);
    }
}
