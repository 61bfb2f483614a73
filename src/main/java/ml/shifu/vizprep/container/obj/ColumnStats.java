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
package ml.shifu.vizprep.container.obj;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ColumnStats is the describe-style summary of a numerical column: count, mean, standard deviation, min, quartiles
 * and max. Missing values are not part of the count and are kept in missingCount.
 * 
 * <p>
 * All statistics except the counts are null when there is no valid value; stdDev is null with less than two values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnStats {

    /**
     * Number of valid (non-missing) values
     */
    private Long count;

    /**
     * Missing count
     */
    private Long missingCount;

    /**
     * Mean value of such column
     */
    private Double mean;

    /**
     * Sample standard deviation
     */
    private Double stdDev;

    /**
     * Min value of such column
     */
    private Double min;

    /**
     * the 25 percentile value of the column
     */
    private Double p25th;

    /**
     * Median value of such column
     */
    private Double median;

    /**
     * the 75 percentile value of the column
     */
    private Double p75th;

    /**
     * Max value of such column
     */
    private Double max;

    public Long getCount() {
        return count;
    }

    public void setCount(Long count) {
        this.count = count;
    }

    public Long getMissingCount() {
        return missingCount;
    }

    public void setMissingCount(Long missingCount) {
        this.missingCount = missingCount;
    }

    public Double getMean() {
        return mean;
    }

    public void setMean(Double mean) {
        this.mean = mean;
    }

    @JsonProperty("std")
    public Double getStdDev() {
        return stdDev;
    }

    public void setStdDev(Double stdDev) {
        this.stdDev = stdDev;
    }

    public Double getMin() {
        return min;
    }

    public void setMin(Double min) {
        this.min = min;
    }

    @JsonProperty("25%")
    public Double getP25th() {
        return p25th;
    }

    public void setP25th(Double p25th) {
        this.p25th = p25th;
    }

    @JsonProperty("50%")
    public Double getMedian() {
        return median;
    }

    public void setMedian(Double median) {
        this.median = median;
    }

    @JsonProperty("75%")
    public Double getP75th() {
        return p75th;
    }

    public void setP75th(Double p75th) {
        this.p75th = p75th;
    }

    public Double getMax() {
        return max;
    }

    public void setMax(Double max) {
        this.max = max;
    }

    @Override
    public String toString() {
        return "ColumnStats [count=" + count + ", missingCount=" + missingCount + ", mean=" + mean + ", std="
                + stdDev + ", min=" + min + ", 25%=" + p25th + ", 50%=" + median + ", 75%=" + p75th + ", max="
                + max + "]";
    }
}
