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
package ml.shifu.vizprep.util;

/**
 * Global constants class
 */
public interface Constants {

    public static final String version = "0.1.0";

    public static final String DEFAULT_DELIMITER = ",";

    public static final String DEFAULT_INDICATOR_DELIMITER = "_";

    public static final double DEFAULT_JITTER_WIDTH = 0.1d;

    /**
     * Standard deviation at or below this is taken as zero variance.
     */
    public static final double ZERO_VARIANCE_EPS = 1e-10;

    /*
     * Config keys, see vizprep.config
     */
    public static final String VIZPREP_IMPUTER_DEGENERATE_POLICY = "vizprep.imputer.degeneratePolicy";

    public static final String VIZPREP_SCALER_ZERO_VARIANCE_POLICY = "vizprep.scaler.zeroVariancePolicy";

    public static final String VIZPREP_ENCODER_NAME_DELIMITER = "vizprep.encoder.nameDelimiter";

    public static final String VIZPREP_VIZ_JITTER_WIDTH = "vizprep.viz.jitterWidth";

    public static final String VIZPREP_LOADER_DELIMITER = "vizprep.loader.delimiter";

    public static final String VIZPREP_LOADER_MISSING_VALUES = "vizprep.loader.missingValues";

    public static final String DEFAULT_MISSING_VALUES = ",NA,N/A,NaN,null";

    /*
     * Chart metadata keys
     */
    public static final String META_MISSING_COUNT = "missingCount";
    public static final String META_ANNOTATE_COUNTS = "annotateCounts";
    public static final String META_KDE = "kde";
    public static final String META_SUMMARY = "summary";
    public static final String META_GROUP_AXIS = "groupAxis";
    public static final String META_HUE_COLUMN = "hueColumn";
    public static final String META_X_CATEGORIES = "xCategories";
    public static final String META_Y_CATEGORIES = "yCategories";
    public static final String META_JITTER_AXIS = "jitterAxis";
    public static final String META_JITTER_WIDTH = "jitterWidth";
    public static final String META_PERCENTAGES = "percentages";
    public static final String META_LABEL_FORMAT = "labelFormat";
    public static final String META_START_ANGLE = "startAngle";
    public static final String META_SLICE_COLORS = "sliceColors";
    public static final String META_EQUAL_AXIS = "equalAxis";

    public static final String PIE_LABEL_FORMAT = "%1.1f%%";

    public static final int PIE_START_ANGLE = 90;

}
