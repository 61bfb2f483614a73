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
package ml.shifu.vizprep.core.viz;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.util.CommonUtils;

import com.google.common.base.Preconditions;

/**
 * Build {@link DataSeries} out of table columns. Rows with a missing cell in any involved column are left out.
 */
public final class SeriesExtractor {

    private SeriesExtractor() {
    }

    /**
     * Single series of value counts, labels ordered by descending count.
     */
    public static DataSeries frequencySeries(Column column, String color) {
        Map<String, Long> counts = CommonUtils.valueCounts(column);
        List<String> labels = new ArrayList<String>(counts.size());
        List<Double> values = new ArrayList<Double>(counts.size());
        for(Entry<String, Long> entry: counts.entrySet()) {
            labels.add(entry.getKey());
            values.add(entry.getValue().doubleValue());
        }
        return DataSeries.labeled(column.getName(), color, labels, values);
    }

    /**
     * Single series of the valid values of a numerical column in row order.
     */
    public static DataSeries numericSeries(Column column, String color) {
        return DataSeries.values(column.getName(), color, CommonUtils.numericValues(column));
    }

    /**
     * One series per category of the categorical column holding the numerical values of its rows. Series follow first
     * appearance order of the categories and take their color by that rank.
     */
    public static List<DataSeries> groupedSeries(Column category, Column numeric, ColorPalette palette) {
        Preconditions.checkArgument(category.isCategorical(), "Column %s is not categorical.", category.getName());
        Preconditions.checkArgument(numeric.isNumerical(), "Column %s is not numerical.", numeric.getName());

        Map<String, List<Double>> groups = new LinkedHashMap<String, List<Double>>();
        for(String value: CommonUtils.distinctValues(category)) {
            groups.put(value, new ArrayList<Double>());
        }
        for(int i = 0; i < category.size(); i++) {
            String group = category.getString(i);
            Double value = numeric.getDouble(i);
            if(group != null && value != null) {
                groups.get(group).add(value);
            }
        }

        List<DataSeries> series = new ArrayList<DataSeries>(groups.size());
        int rank = 0;
        for(Entry<String, List<Double>> entry: groups.entrySet()) {
            series.add(DataSeries.values(entry.getKey(), palette.colorAt(rank++), entry.getValue()));
        }
        return series;
    }

    /**
     * Single series of (x, y) points, categorical cells are replaced by their category code.
     */
    public static DataSeries pointSeries(Column x, Column y, String color) {
        Map<String, Integer> xCodes = codesOf(x);
        Map<String, Integer> yCodes = codesOf(y);
        List<Double> positions = new ArrayList<Double>();
        List<Double> values = new ArrayList<Double>();
        for(int i = 0; i < x.size(); i++) {
            if(!x.isMissing(i) && !y.isMissing(i)) {
                positions.add(coordinate(x, i, xCodes));
                values.add(coordinate(y, i, yCodes));
            }
        }
        return DataSeries.points(x.getName() + " vs " + y.getName(), color, positions, values);
    }

    /**
     * (x, y) points split into one series per category of the hue column, hue being x or y. Categorical cells are
     * replaced by their category code.
     */
    public static List<DataSeries> huePointSeries(Column x, Column y, Column hue, ColorPalette palette) {
        Preconditions.checkArgument(hue.isCategorical(), "Hue column %s is not categorical.", hue.getName());
        Map<String, Integer> xCodes = codesOf(x);
        Map<String, Integer> yCodes = codesOf(y);

        Map<String, List<Double>> positions = new LinkedHashMap<String, List<Double>>();
        Map<String, List<Double>> values = new LinkedHashMap<String, List<Double>>();
        for(String value: CommonUtils.distinctValues(hue)) {
            positions.put(value, new ArrayList<Double>());
            values.put(value, new ArrayList<Double>());
        }
        for(int i = 0; i < x.size(); i++) {
            if(x.isMissing(i) || y.isMissing(i)) {
                continue;
            }
            String group = hue.getString(i);
            positions.get(group).add(coordinate(x, i, xCodes));
            values.get(group).add(coordinate(y, i, yCodes));
        }

        List<DataSeries> series = new ArrayList<DataSeries>(positions.size());
        int rank = 0;
        for(String group: positions.keySet()) {
            series.add(DataSeries.points(group, palette.colorAt(rank++), positions.get(group), values.get(group)));
        }
        return series;
    }

    private static Map<String, Integer> codesOf(Column column) {
        return column.isCategorical() ? CommonUtils.categoryCodes(column) : null;
    }

    private static Double coordinate(Column column, int row, Map<String, Integer> codes) {
        if(column.isNumerical()) {
            return column.getDouble(row);
        }
        return codes.get(column.getString(row)).doubleValue();
    }
}
