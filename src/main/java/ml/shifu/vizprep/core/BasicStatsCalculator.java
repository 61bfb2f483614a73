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

import java.util.List;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.obj.ColumnStats;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Calculator, it helps to calculate the count, mean, standard deviation, min, max and quartiles of a numerical
 * column. Missing and non-finite values are skipped.
 * 
 * <p>
 * Standard deviation is the sample one (n - 1 denominator) and is NaN with less than two values. Quartiles use
 * linear interpolation between closest ranks.
 */
public class BasicStatsCalculator {

    /**
     * logger
     */
    private static Logger log = LoggerFactory.getLogger(BasicStatsCalculator.class);

    private final DescriptiveStatistics stats;

    private long missingCount = 0L;

    public BasicStatsCalculator(Column column) {
        Preconditions.checkArgument(column.isNumerical(), "Column %s is not numerical.", column.getName());
        this.stats = newStatistics();
        for(int i = 0; i < column.size(); i++) {
            add(column.getDouble(i));
        }
        log.debug("Stats of column {} with {} valid and {} missing values.", column.getName(), stats.getN(),
                missingCount);
    }

    public BasicStatsCalculator(List<Double> values) {
        this.stats = newStatistics();
        for(Double value: values) {
            add(value);
        }
    }

    private static DescriptiveStatistics newStatistics() {
        DescriptiveStatistics statistics = new DescriptiveStatistics();
        statistics.setPercentileImpl(new Percentile().withEstimationType(EstimationType.R_7));
        return statistics;
    }

    private void add(Double value) {
        if(value == null || !Double.isFinite(value)) {
            missingCount++;
        } else {
            stats.addValue(value);
        }
    }

    public long getCount() {
        return stats.getN();
    }

    public long getMissingCount() {
        return missingCount;
    }

    /**
     * @return mean of valid values, NaN if there is none
     */
    public double getMean() {
        return stats.getMean();
    }

    /**
     * @return sample standard deviation, NaN with less than two valid values
     */
    public double getStdDev() {
        if(stats.getN() < 2) {
            return Double.NaN;
        }
        return stats.getStandardDeviation();
    }

    public double getMin() {
        return stats.getMin();
    }

    public double getMax() {
        return stats.getMax();
    }

    /**
     * @param p
     *            percentile in (0, 100]
     * @return the percentile, NaN if there is no valid value
     */
    public double getPercentile(double p) {
        return stats.getPercentile(p);
    }

    /**
     * Describe-style summary of the values.
     */
    public ColumnStats toColumnStats() {
        ColumnStats columnStats = new ColumnStats();
        columnStats.setCount(getCount());
        columnStats.setMissingCount(missingCount);
        if(getCount() > 0) {
            columnStats.setMean(getMean());
            columnStats.setMin(getMin());
            columnStats.setP25th(getPercentile(25d));
            columnStats.setMedian(getPercentile(50d));
            columnStats.setP75th(getPercentile(75d));
            columnStats.setMax(getMax());
        }
        if(getCount() > 1) {
            columnStats.setStdDev(getStdDev());
        }
        return columnStats;
    }
}
