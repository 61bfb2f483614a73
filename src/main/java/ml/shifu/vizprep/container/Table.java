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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.vizprep.container.obj.ColumnType;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;

import com.google.common.base.Preconditions;

/**
 * {@link Table} is an ordered sequence of uniquely named {@link Column}s with the same row count.
 * 
 * <p>
 * Tables are read-only once built; every preprocessing step creates a new table instead of changing its input.
 */
public class Table {

    private final Map<String, Column> columns;

    private final List<String> columnNames;

    private final int rowCount;

    public Table(List<Column> columnList) {
        Preconditions.checkArgument(columnList != null, "Column list should not be null.");
        Map<String, Column> columnMap = new LinkedHashMap<String, Column>();
        int rows = -1;
        for(Column column: columnList) {
            Preconditions.checkArgument(!columnMap.containsKey(column.getName()), "Duplicated column name %s.",
                    column.getName());
            if(rows < 0) {
                rows = column.size();
            }
            Preconditions.checkArgument(rows == column.size(),
                    "Column %s has %s rows while other columns have %s rows.", column.getName(), column.size(), rows);
            columnMap.put(column.getName(), column);
        }
        this.columns = Collections.unmodifiableMap(columnMap);
        this.columnNames = Collections.unmodifiableList(new ArrayList<String>(columnMap.keySet()));
        this.rowCount = rows < 0 ? 0 : rows;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return column names in declaration order
     */
    public List<String> getColumnNames() {
        return columnNames;
    }

    public List<Column> getColumns() {
        return new ArrayList<Column>(columns.values());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Lookup column by name.
     * 
     * @param name
     *            column name
     * @return the column
     * @throws VizPrepException
     *             with {@link VizPrepErrorCode#ERROR_UNKNOWN_COLUMN} if no such column
     */
    public Column getColumn(String name) {
        Column column = columns.get(name);
        if(column == null) {
            throw new VizPrepException(VizPrepErrorCode.ERROR_UNKNOWN_COLUMN, "getColumn", name, "Column '" + name
                    + "' does not exist in the table, available columns: " + columnNames);
        }
        return column;
    }

    /**
     * Lookup column by zero-based position.
     */
    public Column getColumn(int index) {
        if(index < 0 || index >= columnNames.size()) {
            throw new VizPrepException(VizPrepErrorCode.ERROR_UNKNOWN_COLUMN, "getColumn", String.valueOf(index),
                    "Column index " + index + " is out of range [0, " + columnNames.size() + ").");
        }
        return columns.get(columnNames.get(index));
    }

    public ColumnType getColumnType(String name) {
        return getColumn(name).getColumnType();
    }

    public List<Object> getValues(String name) {
        return getColumn(name).getValues();
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnNames.size();
    }

    @Override
    public String toString() {
        return "Table [columns=" + columnNames + ", rows=" + rowCount + "]";
    }

    public static class Builder {

        private final List<Column> columnList = new ArrayList<Column>();

        public Builder add(Column column) {
            columnList.add(column);
            return this;
        }

        public Builder numerical(String name, List<? extends Number> values) {
            return add(Column.numerical(name, values));
        }

        public Builder categorical(String name, List<String> values) {
            return add(Column.categorical(name, values));
        }

        public Table build() {
            return new Table(columnList);
        }
    }
}
