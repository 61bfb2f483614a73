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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.container.obj.ColumnType;

/**
 * Classify columns as categorical or numerical.
 * 
 * <p>
 * Classification follows the native storage type of the column only. Numeric-looking strings stay categorical and
 * an all-missing or empty column keeps the type it was declared with.
 */
public class TypeClassifier {

    public ColumnType classify(Column column) {
        return column.getColumnType();
    }

    /**
     * @throws ml.shifu.vizprep.exception.VizPrepException
     *             with ERROR_UNKNOWN_COLUMN if the table has no such column
     */
    public ColumnType classifyColumn(Table table, String name) {
        return classify(table.getColumn(name));
    }

    /**
     * Type of all columns in declaration order.
     */
    public Map<String, ColumnType> classifyAll(Table table) {
        Map<String, ColumnType> types = new LinkedHashMap<String, ColumnType>();
        for(Column column: table.getColumns()) {
            types.put(column.getName(), classify(column));
        }
        return types;
    }

    public List<String> getNumericalColumns(Table table) {
        return getColumns(table, ColumnType.N);
    }

    public List<String> getCategoricalColumns(Table table) {
        return getColumns(table, ColumnType.C);
    }

    private List<String> getColumns(Table table, ColumnType type) {
        List<String> names = new ArrayList<String>();
        for(Column column: table.getColumns()) {
            if(classify(column) == type) {
                names.add(column.getName());
            }
        }
        return names;
    }
}
