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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;
import ml.shifu.vizprep.util.CommonUtils;
import ml.shifu.vizprep.util.Constants;
import ml.shifu.vizprep.util.Environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-hot encoder. Each categorical column is replaced in place by one indicator column per distinct value, named
 * {@code column + delimiter + value} and ordered by first appearance of the value. Numerical columns pass through.
 * 
 * <p>
 * A missing categorical cell gives 0 in every indicator of its column, no extra category is created for it.
 */
public class Encoder {

    private static final Logger log = LoggerFactory.getLogger(Encoder.class);

    private final String nameDelimiter;

    private final TypeClassifier classifier;

    public Encoder() {
        this(Environment.getProperty(Constants.VIZPREP_ENCODER_NAME_DELIMITER, Constants.DEFAULT_INDICATOR_DELIMITER));
    }

    public Encoder(String nameDelimiter) {
        this.nameDelimiter = nameDelimiter == null ? "" : nameDelimiter;
        this.classifier = new TypeClassifier();
    }

    /**
     * @param table
     *            input table, not changed
     * @return new table with the same row count and numNumerical + sum of categorical cardinalities columns
     * @throws VizPrepException
     *             with ERROR_NAME_COLLISION if a generated indicator name clashes with another output column
     */
    public Table encode(Table table) {
        Set<String> names = new LinkedHashSet<String>();
        List<Column> encoded = new ArrayList<Column>();
        for(Column column: table.getColumns()) {
            if(classifier.classify(column).isNumerical()) {
                addColumn(names, encoded, column, column.getName());
                continue;
            }

            List<String> categories = CommonUtils.distinctValues(column);
            if(categories.isEmpty()) {
                log.warn("Column '{}' has no category, no indicator column is generated for it.", column.getName());
            }
            for(String category: categories) {
                addColumn(names, encoded, indicator(column, category), column.getName());
            }
            log.debug("Column {} is encoded into {} indicator columns.", column.getName(), categories.size());
        }
        return new Table(encoded);
    }

    public String indicatorName(String columnName, String category) {
        return columnName + nameDelimiter + category;
    }

    private Column indicator(Column column, String category) {
        List<Double> flags = new ArrayList<Double>(column.size());
        for(Object value: column.getValues()) {
            flags.add(value != null && category.equals(value.toString()) ? 1d : 0d);
        }
        return Column.indicator(indicatorName(column.getName(), category), flags);
    }

    private static void addColumn(Set<String> names, List<Column> encoded, Column column, String sourceColumn) {
        if(!names.add(column.getName())) {
            throw new VizPrepException(VizPrepErrorCode.ERROR_NAME_COLLISION, "encode", sourceColumn,
                    "Encoding column '" + sourceColumn + "' produces column name '" + column.getName()
                            + "' which already exists.");
        }
        encoded.add(column);
    }
}
