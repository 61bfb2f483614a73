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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.util.CommonUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Preprocessor, runs {@link Imputer}, {@link Encoder} and {@link Scaler} in this fixed order and produces the fully
 * numeric prepared table from the raw one.
 * 
 * <p>
 * Imputation runs first so that encoding never sees a missing category, scaling runs last and only on the columns
 * which were numerical before encoding. The first failure of any step is propagated; the raw table is never
 * changed.
 */
public class Preprocessor {

    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    private final Imputer imputer;

    private final Encoder encoder;

    private final Scaler scaler;

    private final TypeClassifier classifier = new TypeClassifier();

    public Preprocessor() {
        this(new Imputer(), new Encoder(), new Scaler());
    }

    public Preprocessor(Imputer imputer, Encoder encoder, Scaler scaler) {
        this.imputer = imputer;
        this.encoder = encoder;
        this.scaler = scaler;
    }

    /**
     * @param raw
     *            raw table as loaded
     * @return new prepared table, fully numeric with no missing value
     * @throws ml.shifu.vizprep.exception.VizPrepException
     *             with ERROR_DEGENERATE_COLUMN, ERROR_NAME_COLLISION or ERROR_ZERO_VARIANCE naming the column
     */
    public Table preprocess(Table raw) {
        log.info("Step Start: preprocess {}", raw);
        long start = System.currentTimeMillis();

        Set<String> degenerateColumns = new LinkedHashSet<String>();
        Table imputed = imputer.impute(raw, degenerateColumns);
        if(!degenerateColumns.isEmpty()) {
            log.warn("Columns {} have no valid value and are dropped from the prepared table.", degenerateColumns);
            imputed = CommonUtils.dropColumns(imputed, degenerateColumns);
        }

        // indicators are not measurements, only columns numerical before encoding are scaled
        List<String> toScale = new ArrayList<String>();
        for(Column column: imputed.getColumns()) {
            if(classifier.classify(column).isNumerical() && !column.isIndicator()) {
                toScale.add(column.getName());
            }
        }

        Table encoded = encoder.encode(imputed);
        Table prepared = scaler.scale(encoded, toScale);

        log.info("Step Finished: preprocess into {} with {} ms", prepared, (System.currentTimeMillis() - start));
        return prepared;
    }
}
