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
package ml.shifu.vizprep.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;

/**
 * {@link CommonUtils} is used to for almost all kinds of utility functions over columns and tables.
 */
public final class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Distinct non-missing values of a column in first-appearance order.
     * 
     * @param column
     *            any column
     * @return distinct values as strings, numerical values use {@link Double#toString(double)}
     */
    public static List<String> distinctValues(Column column) {
        Set<String> distinct = new LinkedHashSet<String>();
        for(Object value: column.getValues()) {
            if(value != null) {
                distinct.add(value.toString());
            }
        }
        return new ArrayList<String>(distinct);
    }

    /**
     * Map from distinct value to its rank in first-appearance order, starting from 0.
     */
    public static Map<String, Integer> categoryCodes(Column column) {
        Map<String, Integer> codes = new LinkedHashMap<String, Integer>();
        for(String value: distinctValues(column)) {
            codes.put(value, codes.size());
        }
        return codes;
    }

    /**
     * Count of each distinct non-missing value, ordered by descending count. Values with the same count keep their
     * first-appearance order.
     * 
     * @param column
     *            any column
     * @return ordered value counts
     */
    public static Map<String, Long> valueCounts(Column column) {
        final Map<String, Long> counts = new LinkedHashMap<String, Long>();
        for(Object value: column.getValues()) {
            if(value == null) {
                continue;
            }
            String key = value.toString();
            Long count = counts.get(key);
            counts.put(key, count == null ? 1L : count + 1L);
        }

        List<Entry<String, Long>> entries = new ArrayList<Entry<String, Long>>(counts.entrySet());
        // stable sort keeps first-appearance order among ties
        Collections.sort(entries, new Comparator<Entry<String, Long>>() {
            @Override
            public int compare(Entry<String, Long> o1, Entry<String, Long> o2) {
                return o2.getValue().compareTo(o1.getValue());
            }
        });

        Map<String, Long> ordered = new LinkedHashMap<String, Long>();
        for(Entry<String, Long> entry: entries) {
            ordered.put(entry.getKey(), entry.getValue());
        }
        return ordered;
    }

    /**
     * Non-missing values of a numerical column in row order.
     */
    public static List<Double> numericValues(Column column) {
        List<Double> values = new ArrayList<Double>(column.size());
        for(int i = 0; i < column.size(); i++) {
            Double value = column.getDouble(i);
            if(value != null) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Copy of the table without the given columns, other columns keep their order.
     */
    public static Table dropColumns(Table table, Set<String> columnNames) {
        List<Column> kept = new ArrayList<Column>(table.getColumnCount());
        for(Column column: table.getColumns()) {
            if(!columnNames.contains(column.getName())) {
                kept.add(column);
            }
        }
        return new Table(kept);
    }
}
