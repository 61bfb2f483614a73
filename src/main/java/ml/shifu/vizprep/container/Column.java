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
package ml.shifu.vizprep.container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ml.shifu.vizprep.container.obj.ColumnType;

import com.google.common.base.Preconditions;

/**
 * {@link Column} is one named, typed and immutable column of a {@link Table}.
 * 
 * <p>
 * Numerical cells are stored as {@link Double}, categorical cells as {@link String}. A missing cell is stored as
 * null; NaN and infinite numerical input is treated as missing.
 * 
 * <p>
 * Columns created by the one-hot encoding step are flagged as indicator columns, they are numerical 0/1 flags and
 * are never scaled.
 */
public class Column {

    private final String name;

    private final ColumnType columnType;

    private final List<Object> values;

    private final boolean indicator;

    private Column(String name, ColumnType columnType, List<Object> values, boolean indicator) {
        Preconditions.checkArgument(name != null, "Column name should not be null.");
        Preconditions.checkArgument(columnType != null, "Column type of %s should not be null.", name);
        this.name = name;
        this.columnType = columnType;
        this.values = Collections.unmodifiableList(values);
        this.indicator = indicator;
    }

    /**
     * Create a numerical column, null, NaN or infinite values are kept as missing.
     * 
     * @param name
     *            column name
     * @param values
     *            cell values
     * @return the new column
     */
    public static Column numerical(String name, List<? extends Number> values) {
        Preconditions.checkArgument(values != null, "Values of column %s should not be null.", name);
        List<Object> cells = new ArrayList<Object>(values.size());
        for(Number value: values) {
            if(value == null || !Double.isFinite(value.doubleValue())) {
                cells.add(null);
            } else {
                cells.add(value.doubleValue());
            }
        }
        return new Column(name, ColumnType.N, cells, false);
    }

    /**
     * Create a categorical column, null values are kept as missing.
     * 
     * @param name
     *            column name
     * @param values
     *            cell values
     * @return the new column
     */
    public static Column categorical(String name, List<String> values) {
        Preconditions.checkArgument(values != null, "Values of column %s should not be null.", name);
        return new Column(name, ColumnType.C, new ArrayList<Object>(values), false);
    }

    /**
     * Create a 0/1 indicator column produced by one-hot encoding.
     * 
     * @param name
     *            indicator column name
     * @param flags
     *            one flag per row
     * @return the new indicator column
     */
    public static Column indicator(String name, List<Double> flags) {
        Preconditions.checkArgument(flags != null, "Values of column %s should not be null.", name);
        return new Column(name, ColumnType.N, new ArrayList<Object>(flags), true);
    }

    /**
     * Copy of this column with other values, keeping name, type and indicator flag.
     */
    public Column withValues(List<?> newValues) {
        Preconditions.checkArgument(newValues != null, "Values of column %s should not be null.", name);
        List<Object> cells = new ArrayList<Object>(newValues.size());
        for(Object value: newValues) {
            cells.add(checkCell(value));
        }
        return new Column(name, columnType, cells, indicator);
    }

    private Object checkCell(Object value) {
        if(value == null) {
            return null;
        }
        if(columnType.isNumerical()) {
            Preconditions.checkArgument(value instanceof Number, "Column %s is numerical, but got value %s.", name,
                    value);
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        Preconditions.checkArgument(value instanceof String, "Column %s is categorical, but got value %s.", name,
                value);
        return value;
    }

    public String getName() {
        return name;
    }

    public ColumnType getColumnType() {
        return columnType;
    }

    public boolean isNumerical() {
        return columnType.isNumerical();
    }

    public boolean isCategorical() {
        return columnType.isCategorical();
    }

    public boolean isIndicator() {
        return indicator;
    }

    /**
     * @return read-only view of the cell values, missing cells are null
     */
    public List<Object> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public Object getValue(int row) {
        return values.get(row);
    }

    public boolean isMissing(int row) {
        return values.get(row) == null;
    }

    public Double getDouble(int row) {
        Preconditions.checkState(isNumerical(), "Column %s is not numerical.", name);
        return (Double) values.get(row);
    }

    public String getString(int row) {
        Preconditions.checkState(isCategorical(), "Column %s is not categorical.", name);
        return (String) values.get(row);
    }

    public int getMissingCount() {
        int missing = 0;
        for(Object value: values) {
            if(value == null) {
                missing++;
            }
        }
        return missing;
    }

    @Override
    public String toString() {
        return "Column [name=" + name + ", type=" + columnType + ", indicator=" + indicator + ", size="
                + values.size() + "]";
    }
}
