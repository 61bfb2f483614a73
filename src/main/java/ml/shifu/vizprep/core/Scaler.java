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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;
import ml.shifu.vizprep.util.Constants;
import ml.shifu.vizprep.util.Environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Z-score scaler, {@code (x - mean) / stdDev} with the sample standard deviation. Indicator columns produced by
 * {@link Encoder} are 0/1 flags and are never scaled. Missing cells stay missing; a column without any valid value,
 * like one of a header-only table, is returned as is.
 */
public class Scaler {

    private static final Logger log = LoggerFactory.getLogger(Scaler.class);

    private final ZeroVariancePolicy zeroVariancePolicy;

    public Scaler() {
        this(Environment.getEnum(Constants.VIZPREP_SCALER_ZERO_VARIANCE_POLICY, ZeroVariancePolicy.class,
                ZeroVariancePolicy.FAIL));
    }

    public Scaler(ZeroVariancePolicy zeroVariancePolicy) {
        this.zeroVariancePolicy = zeroVariancePolicy;
    }

    /**
     * Scale all numerical, non-indicator columns.
     */
    public Table scale(Table table) {
        List<String> names = new ArrayList<String>();
        for(Column column: table.getColumns()) {
            if(column.isNumerical() && !column.isIndicator()) {
                names.add(column.getName());
            }
        }
        return scale(table, names);
    }

    /**
     * Scale the given numerical columns, other columns pass through.
     * 
     * @param table
     *            input table, not changed
     * @param columnNames
     *            columns to scale, indicator columns among them are skipped
     * @return new table
     * @throws VizPrepException
     *             with ERROR_UNKNOWN_COLUMN if a name is not in the table, or ERROR_ZERO_VARIANCE for a constant column
     *             under {@link ZeroVariancePolicy#FAIL}
     */
    public Table scale(Table table, Collection<String> columnNames) {
        Set<String> targets = new HashSet<String>();
        for(String name: columnNames) {
            Column column = table.getColumn(name);
            Preconditions.checkArgument(column.isNumerical(), "Column %s is not numerical and cannot be scaled.", name);
            if(column.isIndicator()) {
                log.debug("Column {} is an indicator column, skip scaling.", name);
                continue;
            }
            targets.add(name);
        }

        List<Column> scaled = new ArrayList<Column>(table.getColumnCount());
        for(Column column: table.getColumns()) {
            scaled.add(targets.contains(column.getName()) ? scale(column) : column);
        }
        return new Table(scaled);
    }

    private Column scale(Column column) {
        BasicStatsCalculator stats = new BasicStatsCalculator(column);
        if(stats.getCount() == 0L) {
            log.debug("Column {} has no valid value, nothing to scale.", column.getName());
            return column;
        }
        double mean = stats.getMean();
        double stdDev = stats.getStdDev();
        if(Double.isNaN(stdDev) || stdDev <= Constants.ZERO_VARIANCE_EPS) {
            String msg = "Column '" + column.getName() + "' has zero variance (stdDev=" + stdDev + ").";
            if(zeroVariancePolicy == ZeroVariancePolicy.FAIL) {
                throw new VizPrepException(VizPrepErrorCode.ERROR_ZERO_VARIANCE, "scale", column.getName(), msg);
            }
            log.warn("{} Column is kept unscaled.", msg);
            return column;
        }

        List<Double> values = new ArrayList<Double>(column.size());
        for(int i = 0; i < column.size(); i++) {
            Double value = column.getDouble(i);
            values.add(value == null ? null : computeZScore(value, mean, stdDev));
        }
        log.debug("Column {} is scaled with mean {} and stdDev {}.", column.getName(), mean, stdDev);
        return column.withValues(values);
    }

    public static double computeZScore(double var, double mean, double stdDev) {
        return (var - mean) / stdDev;
    }
}
