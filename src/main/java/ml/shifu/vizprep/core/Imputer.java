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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;
import ml.shifu.vizprep.util.Constants;
import ml.shifu.vizprep.util.Environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fill missing values column by column: numerical columns with the mean of the valid values, categorical columns
 * with the most frequent value. Mode ties are broken by the value encountered first in row order.
 * 
 * <p>
 * The input table is never changed, a new table is returned.
 */
public class Imputer {

    private static final Logger log = LoggerFactory.getLogger(Imputer.class);

    private final DegenerateColumnPolicy degeneratePolicy;

    private final TypeClassifier classifier;

    public Imputer() {
        this(Environment.getEnum(Constants.VIZPREP_IMPUTER_DEGENERATE_POLICY, DegenerateColumnPolicy.class,
                DegenerateColumnPolicy.FAIL));
    }

    public Imputer(DegenerateColumnPolicy degeneratePolicy) {
        this(degeneratePolicy, new TypeClassifier());
    }

    public Imputer(DegenerateColumnPolicy degeneratePolicy, TypeClassifier classifier) {
        this.degeneratePolicy = degeneratePolicy;
        this.classifier = classifier;
    }

    public Table impute(Table table) {
        return impute(table, new ArrayList<String>());
    }

    /**
     * Impute all columns of the table.
     * 
     * @param table
     *            input table, not changed
     * @param degenerateColumns
     *            names of columns skipped because they have no valid value are added here, only with
     *            {@link DegenerateColumnPolicy#SKIP}
     * @return new table with no missing value except in skipped columns
     * @throws VizPrepException
     *             with ERROR_DEGENERATE_COLUMN under {@link DegenerateColumnPolicy#FAIL}
     */
    public Table impute(Table table, Collection<String> degenerateColumns) {
        List<Column> imputed = new ArrayList<Column>(table.getColumnCount());
        for(Column column: table.getColumns()) {
            int missingCount = column.getMissingCount();
            if(missingCount == 0) {
                imputed.add(column);
                continue;
            }

            if(missingCount == column.size()) {
                String msg = "Column '" + column.getName() + "' has no non-missing value, cannot impute it.";
                if(degeneratePolicy == DegenerateColumnPolicy.FAIL) {
                    throw new VizPrepException(VizPrepErrorCode.ERROR_DEGENERATE_COLUMN, "impute", column.getName(),
                            msg);
                }
                log.warn("{} Column is skipped.", msg);
                degenerateColumns.add(column.getName());
                imputed.add(column);
                continue;
            }

            Object fill = classifier.classify(column).isNumerical() ? mean(column) : mode(column);
            log.debug("Impute {} missing values of column {} with {}.", missingCount, column.getName(), fill);
            imputed.add(fill(column, fill));
        }
        return new Table(imputed);
    }

    private static Column fill(Column column, Object fill) {
        List<Object> values = new ArrayList<Object>(column.size());
        for(Object value: column.getValues()) {
            values.add(value == null ? fill : value);
        }
        return column.withValues(values);
    }

    static Double mean(Column column) {
        return new BasicStatsCalculator(column).getMean();
    }

    /**
     * Most frequent non-missing value, the first encountered one wins a tie.
     */
    static String mode(Column column) {
        Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
        for(Object value: column.getValues()) {
            if(value != null) {
                Integer count = counts.get(value.toString());
                counts.put(value.toString(), count == null ? 1 : count + 1);
            }
        }

        String mode = null;
        int maxCount = 0;
        for(Entry<String, Integer> entry: counts.entrySet()) {
            if(entry.getValue() > maxCount) {
                mode = entry.getKey();
                maxCount = entry.getValue();
            }
        }
        return mode;
    }
}
