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

/**
 * Rendering strategies a {@link ChartSpec} can resolve to.
 */
public enum ChartStrategy {
    /**
     * Bar per distinct value with count annotations.
     */
    FREQUENCY_BAR,
    /**
     * Histogram with a density overlay and summary statistics.
     */
    DENSITY_HISTOGRAM,
    /**
     * Box per category of the categorical column over the numerical column.
     */
    GROUPED_BOX_PLOT,
    /**
     * Two plain boxes, one per numerical column.
     */
    BOX_PLOT,
    /**
     * Scatter with both axes category coded, colored by x categories.
     */
    CATEGORY_SCATTER,
    /**
     * Jittered one dimensional scatter grouped by category.
     */
    STRIP,
    /**
     * Plain scatter.
     */
    SCATTER,
    /**
     * Slice per distinct value with percentage labels.
     */
    PIE
}
