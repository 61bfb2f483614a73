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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Resolved visualization handed to a {@link ChartRenderer}: strategy, title, axis labels, ordered data series and
 * strategy specific metadata (summary statistics, category codes, colors, ...).
 * 
 * <p>
 * {@link #getColumns()} lists the table columns the spec was built from, all of them exist in that table.
 * 
 * <pre>{@code
 * ChartSpec spec = ChartSpec.builder(ChartStrategy.FREQUENCY_BAR)
 *     .title("city Histogram")
 *     .xLabel("city")
 *     .yLabel("Count")
 *     .column("city")
 *     .series(DataSeries.labeled("city", null, labels, counts))
 *     .metadata("annotateCounts", true)
 *     .build();
 * }</pre>
 */
public class ChartSpec {

    private final ChartStrategy strategy;
    private final String title;
    private final String xLabel;
    private final String yLabel;
    private final List<String> columns;
    private final List<DataSeries> series;
    private final Map<String, Object> metadata;

    private ChartSpec(Builder builder) {
        this.strategy = builder.strategy;
        this.title = builder.title;
        this.xLabel = builder.xLabel;
        this.yLabel = builder.yLabel;
        this.columns = Collections.unmodifiableList(new ArrayList<String>(builder.columns));
        this.series = Collections.unmodifiableList(new ArrayList<DataSeries>(builder.series));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(builder.metadata));
    }

    public static Builder builder(ChartStrategy strategy) {
        return new Builder(strategy);
    }

    public ChartStrategy getStrategy() {
        return strategy;
    }

    public String getTitle() {
        return title;
    }

    @JsonProperty("xLabel")
    public String getXLabel() {
        return xLabel;
    }

    @JsonProperty("yLabel")
    public String getYLabel() {
        return yLabel;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<DataSeries> getSeries() {
        return series;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "ChartSpec [strategy=" + strategy + ", title=" + title + ", columns=" + columns + ", series="
                + series.size() + "]";
    }

    public static class Builder {

        private final ChartStrategy strategy;
        private String title;
        private String xLabel;
        private String yLabel;
        private final List<String> columns = new ArrayList<String>();
        private final List<DataSeries> series = new ArrayList<DataSeries>();
        private final Map<String, Object> metadata = new LinkedHashMap<String, Object>();

        private Builder(ChartStrategy strategy) {
            Preconditions.checkArgument(strategy != null, "Chart strategy should not be null.");
            this.strategy = strategy;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder xLabel(String xLabel) {
            this.xLabel = xLabel;
            return this;
        }

        public Builder yLabel(String yLabel) {
            this.yLabel = yLabel;
            return this;
        }

        public Builder column(String column) {
            if(!this.columns.contains(column)) {
                this.columns.add(column);
            }
            return this;
        }

        public Builder series(DataSeries dataSeries) {
            this.series.add(dataSeries);
            return this;
        }

        public Builder series(List<DataSeries> dataSeries) {
            this.series.addAll(dataSeries);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public ChartSpec build() {
            Preconditions.checkState(!columns.isEmpty(), "Chart spec %s references no column.", title);
            return new ChartSpec(this);
        }
    }
}
