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
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * One data series of a chart.
 * 
 * <ul>
 * <li>labels: category label per value, for bar and pie charts</li>
 * <li>positions: x coordinate per value, for scatter and strip charts</li>
 * <li>values: counts, measurements or y coordinates</li>
 * </ul>
 * labels and positions are either empty or as long as values.
 */
public class DataSeries {

    private final String name;

    private final String color;

    private final List<String> labels;

    private final List<Double> positions;

    private final List<Double> values;

    public DataSeries(String name, String color, List<String> labels, List<Double> positions, List<Double> values) {
        Preconditions.checkArgument(values != null, "Values of series %s should not be null.", name);
        Preconditions.checkArgument(labels == null || labels.isEmpty() || labels.size() == values.size(),
                "Labels of series %s do not match its values.", name);
        Preconditions.checkArgument(positions == null || positions.isEmpty() || positions.size() == values.size(),
                "Positions of series %s do not match its values.", name);
        this.name = name;
        this.color = color;
        this.labels = copyOf(labels);
        this.positions = copyOf(positions);
        this.values = copyOf(values);
    }

    private static <T> List<T> copyOf(List<T> list) {
        if(list == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<T>(list));
    }

    public static DataSeries labeled(String name, String color, List<String> labels, List<Double> values) {
        return new DataSeries(name, color, labels, null, values);
    }

    public static DataSeries values(String name, String color, List<Double> values) {
        return new DataSeries(name, color, null, null, values);
    }

    public static DataSeries points(String name, String color, List<Double> positions, List<Double> values) {
        return new DataSeries(name, color, null, positions, values);
    }

    public String getName() {
        return name;
    }

    public String getColor() {
        return color;
    }

    public List<String> getLabels() {
        return labels;
    }

    public List<Double> getPositions() {
        return positions;
    }

    public List<Double> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "DataSeries [name=" + name + ", color=" + color + ", size=" + values.size() + "]";
    }
}
