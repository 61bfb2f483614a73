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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.container.obj.ColumnType;
import ml.shifu.vizprep.core.BasicStatsCalculator;
import ml.shifu.vizprep.core.TypeClassifier;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;
import ml.shifu.vizprep.util.CommonUtils;
import ml.shifu.vizprep.util.Constants;
import ml.shifu.vizprep.util.Environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Objects;

/**
 * Resolve a {@link VisualizationRequest} over a table into a {@link ChartSpec}.
 * 
 * <p>
 * The decision only depends on the requested kind and the type signature of the referenced columns, it is looked up
 * in a single dispatch table. A combination which is not in the table is not supported.
 * 
 * <pre>
 * kind               signature   strategy
 * DISTRIBUTION       C           FREQUENCY_BAR
 * DISTRIBUTION       N           DENSITY_HISTOGRAM
 * PAIRED_COMPARISON  C,N / N,C   GROUPED_BOX_PLOT
 * PAIRED_COMPARISON  N,N         BOX_PLOT
 * CORRELATION        C,C         CATEGORY_SCATTER
 * CORRELATION        C,N / N,C   STRIP
 * CORRELATION        N,N         SCATTER
 * PROPORTION         C           PIE
 * </pre>
 */
public class VisualizationSelector {

    private static final Logger log = LoggerFactory.getLogger(VisualizationSelector.class);

    private static final String OPERATION = "resolveVisualization";

    private static final Map<Signature, ChartStrategy> DISPATCH_TABLE;

    static {
        Map<Signature, ChartStrategy> table = new LinkedHashMap<Signature, ChartStrategy>();
        register(table, VisualizationKind.DISTRIBUTION, ChartStrategy.FREQUENCY_BAR, ColumnType.C);
        register(table, VisualizationKind.DISTRIBUTION, ChartStrategy.DENSITY_HISTOGRAM, ColumnType.N);
        register(table, VisualizationKind.PAIRED_COMPARISON, ChartStrategy.GROUPED_BOX_PLOT, ColumnType.C,
                ColumnType.N);
        register(table, VisualizationKind.PAIRED_COMPARISON, ChartStrategy.GROUPED_BOX_PLOT, ColumnType.N,
                ColumnType.C);
        register(table, VisualizationKind.PAIRED_COMPARISON, ChartStrategy.BOX_PLOT, ColumnType.N, ColumnType.N);
        register(table, VisualizationKind.CORRELATION, ChartStrategy.CATEGORY_SCATTER, ColumnType.C, ColumnType.C);
        register(table, VisualizationKind.CORRELATION, ChartStrategy.STRIP, ColumnType.C, ColumnType.N);
        register(table, VisualizationKind.CORRELATION, ChartStrategy.STRIP, ColumnType.N, ColumnType.C);
        register(table, VisualizationKind.CORRELATION, ChartStrategy.SCATTER, ColumnType.N, ColumnType.N);
        register(table, VisualizationKind.PROPORTION, ChartStrategy.PIE, ColumnType.C);
        DISPATCH_TABLE = Collections.unmodifiableMap(table);
    }

    private static void register(Map<Signature, ChartStrategy> table, VisualizationKind kind,
            ChartStrategy strategy, ColumnType... types) {
        table.put(new Signature(kind, Arrays.asList(types)), strategy);
    }

    private final TypeClassifier classifier = new TypeClassifier();

    private final ColorPalette groupPalette;

    private final ColorPalette slicePalette;

    private final double jitterWidth;

    public VisualizationSelector() {
        this(ColorPalette.DEFAULT, ColorPalette.SET3, Environment.getDouble(Constants.VIZPREP_VIZ_JITTER_WIDTH,
                Constants.DEFAULT_JITTER_WIDTH));
    }

    public VisualizationSelector(ColorPalette groupPalette, ColorPalette slicePalette, double jitterWidth) {
        this.groupPalette = groupPalette;
        this.slicePalette = slicePalette;
        this.jitterWidth = jitterWidth;
    }

    /**
     * Every legal (kind, signature) combination with the strategy it resolves to.
     */
    public static Map<Signature, ChartStrategy> supportedCombinations() {
        return DISPATCH_TABLE;
    }

    /**
     * Look up the strategy for a kind and column types.
     * 
     * @return the strategy, null if the combination is not supported
     */
    public static ChartStrategy lookup(VisualizationKind kind, ColumnType... types) {
        return DISPATCH_TABLE.get(new Signature(kind, Arrays.asList(types)));
    }

    /**
     * Resolve the request against the given table.
     * 
     * @param table
     *            raw or prepared table the request targets
     * @param request
     *            the visualization request
     * @return chart spec only referencing columns of the table
     * @throws VizPrepException
     *             with ERROR_UNKNOWN_COLUMN if a referenced column is not in the table, or
     *             ERROR_UNSUPPORTED_VISUALIZATION if the kind does not fit the column types
     */
    public ChartSpec resolveVisualization(Table table, VisualizationRequest request) {
        List<Column> columns = new ArrayList<Column>(request.getColumns().size());
        List<ColumnType> types = new ArrayList<ColumnType>(request.getColumns().size());
        for(String name: request.getColumns()) {
            if(!table.hasColumn(name)) {
                throw new VizPrepException(VizPrepErrorCode.ERROR_UNKNOWN_COLUMN, OPERATION, name, "Column '" + name
                        + "' does not exist in the table, available columns: " + table.getColumnNames());
            }
            Column column = table.getColumn(name);
            columns.add(column);
            types.add(classifier.classify(column));
        }

        ChartStrategy strategy = DISPATCH_TABLE.get(new Signature(request.getKind(), types));
        if(strategy == null) {
            throw new VizPrepException(VizPrepErrorCode.ERROR_UNSUPPORTED_VISUALIZATION, OPERATION,
                    request.getX(), request.getKind() + " is not supported for column(s) " + request.getColumns()
                            + " of type " + types + ".");
        }
        log.debug("Resolve {} with signature {} to {}.", request, types, strategy);

        Column x = columns.get(0);
        Column y = columns.size() > 1 ? columns.get(1) : null;
        switch(strategy) {
            case FREQUENCY_BAR:
                return frequencyBar(x);
            case DENSITY_HISTOGRAM:
                return densityHistogram(x);
            case GROUPED_BOX_PLOT:
                return groupedBoxPlot(x, y);
            case BOX_PLOT:
                return boxPlot(x, y);
            case CATEGORY_SCATTER:
                return categoryScatter(x, y);
            case STRIP:
                return strip(x, y);
            case SCATTER:
                return scatter(x, y);
            case PIE:
                return pie(x);
            default:
                throw new IllegalStateException("Strategy " + strategy + " has no builder.");
        }
    }

    private ChartSpec frequencyBar(Column column) {
        return ChartSpec.builder(ChartStrategy.FREQUENCY_BAR).title(column.getName() + " Histogram")
                .xLabel(column.getName()).yLabel("Count").column(column.getName())
                .series(SeriesExtractor.frequencySeries(column, groupPalette.colorAt(0)))
                .metadata(Constants.META_ANNOTATE_COUNTS, true)
                .metadata(Constants.META_MISSING_COUNT, column.getMissingCount()).build();
    }

    private ChartSpec densityHistogram(Column column) {
        return ChartSpec.builder(ChartStrategy.DENSITY_HISTOGRAM).title(column.getName() + " Histogram")
                .xLabel(column.getName()).yLabel("Frequency").column(column.getName())
                .series(SeriesExtractor.numericSeries(column, groupPalette.colorAt(0)))
                .metadata(Constants.META_KDE, true)
                .metadata(Constants.META_SUMMARY, new BasicStatsCalculator(column).toColumnStats()).build();
    }

    private ChartSpec groupedBoxPlot(Column x, Column y) {
        boolean groupOnX = x.isCategorical();
        Column category = groupOnX ? x : y;
        Column numeric = groupOnX ? y : x;
        return pairedBuilder(ChartStrategy.GROUPED_BOX_PLOT, x, y, "Boxplot")
                .series(SeriesExtractor.groupedSeries(category, numeric, groupPalette))
                .metadata(Constants.META_GROUP_AXIS, groupOnX ? "x" : "y")
                .metadata(Constants.META_HUE_COLUMN, category.getName()).build();
    }

    private ChartSpec boxPlot(Column x, Column y) {
        return pairedBuilder(ChartStrategy.BOX_PLOT, x, y, "Boxplot")
                .series(SeriesExtractor.numericSeries(x, groupPalette.colorAt(0)))
                .series(SeriesExtractor.numericSeries(y, groupPalette.colorAt(1))).build();
    }

    private ChartSpec categoryScatter(Column x, Column y) {
        return pairedBuilder(ChartStrategy.CATEGORY_SCATTER, x, y, "Scatterplot")
                .series(SeriesExtractor.huePointSeries(x, y, x, groupPalette))
                .metadata(Constants.META_HUE_COLUMN, x.getName())
                .metadata(Constants.META_X_CATEGORIES, CommonUtils.distinctValues(x))
                .metadata(Constants.META_Y_CATEGORIES, CommonUtils.distinctValues(y)).build();
    }

    private ChartSpec strip(Column x, Column y) {
        boolean groupOnX = x.isCategorical();
        Column category = groupOnX ? x : y;
        return pairedBuilder(ChartStrategy.STRIP, x, y, "Scatterplot")
                .series(SeriesExtractor.huePointSeries(x, y, category, groupPalette))
                .metadata(Constants.META_HUE_COLUMN, category.getName())
                .metadata(groupOnX ? Constants.META_X_CATEGORIES : Constants.META_Y_CATEGORIES,
                        CommonUtils.distinctValues(category))
                .metadata(Constants.META_JITTER_AXIS, groupOnX ? "x" : "y")
                .metadata(Constants.META_JITTER_WIDTH, jitterWidth).build();
    }

    private ChartSpec scatter(Column x, Column y) {
        return pairedBuilder(ChartStrategy.SCATTER, x, y, "Scatterplot").series(
                SeriesExtractor.pointSeries(x, y, groupPalette.colorAt(0))).build();
    }

    private ChartSpec pie(Column column) {
        DataSeries slices = SeriesExtractor.frequencySeries(column, null);
        double total = 0d;
        for(Double count: slices.getValues()) {
            total += count;
        }
        List<Double> percentages = new ArrayList<Double>(slices.size());
        for(Double count: slices.getValues()) {
            percentages.add(count * 100d / total);
        }
        return ChartSpec.builder(ChartStrategy.PIE).title(column.getName() + " Pie Chart").column(column.getName())
                .series(slices).metadata(Constants.META_PERCENTAGES, percentages)
                .metadata(Constants.META_LABEL_FORMAT, Constants.PIE_LABEL_FORMAT)
                .metadata(Constants.META_START_ANGLE, Constants.PIE_START_ANGLE)
                .metadata(Constants.META_SLICE_COLORS, slicePalette.take(slices.size()))
                .metadata(Constants.META_EQUAL_AXIS, true)
                .metadata(Constants.META_MISSING_COUNT, column.getMissingCount()).build();
    }

    private static ChartSpec.Builder pairedBuilder(ChartStrategy strategy, Column x, Column y, String chartName) {
        return ChartSpec.builder(strategy).title(x.getName() + " vs " + y.getName() + " " + chartName)
                .xLabel(x.getName()).yLabel(y.getName()).column(x.getName()).column(y.getName());
    }

    /**
     * Dispatch key: requested kind plus the types of the referenced columns in request order.
     */
    public static class Signature {

        private final VisualizationKind kind;

        private final List<ColumnType> types;

        public Signature(VisualizationKind kind, List<ColumnType> types) {
            this.kind = kind;
            this.types = Collections.unmodifiableList(new ArrayList<ColumnType>(types));
        }

        public VisualizationKind getKind() {
            return kind;
        }

        public List<ColumnType> getTypes() {
            return types;
        }

        @Override
        public boolean equals(Object obj) {
            if(this == obj) {
                return true;
            }
            if(!(obj instanceof Signature)) {
                return false;
            }
            Signature other = (Signature) obj;
            return kind == other.kind && types.equals(other.types);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(kind, types);
        }

        @Override
        public String toString() {
            return kind + types.toString();
        }
    }
}
