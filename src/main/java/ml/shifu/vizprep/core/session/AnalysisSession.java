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
package ml.shifu.vizprep.core.session;

import java.io.IOException;

import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.core.Preprocessor;
import ml.shifu.vizprep.core.viz.ChartRenderer;
import ml.shifu.vizprep.core.viz.ChartSpec;
import ml.shifu.vizprep.core.viz.VisualizationRequest;
import ml.shifu.vizprep.core.viz.VisualizationSelector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Keeps the raw and the prepared table alive for one analysis session. Every request names the table variant it
 * targets, so the result never depends on the order of earlier requests.
 * 
 * <p>
 * A session created with a {@link Preprocessor} builds the prepared table on first use, so raw-only sessions never
 * pay for (or fail on) preprocessing. Sessions are meant for a single thread.
 */
public class AnalysisSession {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSession.class);

    private final Table raw;

    private final Preprocessor preprocessor;

    private Table prepared;

    private final VisualizationSelector selector;

    public AnalysisSession(Table raw, Table prepared, VisualizationSelector selector) {
        Preconditions.checkArgument(raw != null, "Raw table should not be null.");
        Preconditions.checkArgument(prepared != null, "Prepared table should not be null.");
        this.raw = raw;
        this.preprocessor = null;
        this.prepared = prepared;
        this.selector = selector;
    }

    /**
     * Session whose prepared table is computed from the raw one the first time it is needed.
     */
    public AnalysisSession(Table raw, Preprocessor preprocessor, VisualizationSelector selector) {
        Preconditions.checkArgument(raw != null, "Raw table should not be null.");
        Preconditions.checkArgument(preprocessor != null, "Preprocessor should not be null.");
        this.raw = raw;
        this.preprocessor = preprocessor;
        this.selector = selector;
    }

    /**
     * Preprocess the raw table and open a session over both tables.
     */
    public static AnalysisSession open(Table raw) {
        return open(raw, new Preprocessor(), new VisualizationSelector());
    }

    public static AnalysisSession open(Table raw, Preprocessor preprocessor, VisualizationSelector selector) {
        AnalysisSession session = new AnalysisSession(raw, preprocessor, selector);
        session.getPrepared();
        return session;
    }

    public Table getRaw() {
        return raw;
    }

    /**
     * @throws ml.shifu.vizprep.exception.VizPrepException
     *             if the prepared table is built now and preprocessing fails
     */
    public Table getPrepared() {
        if(prepared == null) {
            log.debug("Build prepared table of {}.", raw);
            prepared = preprocessor.preprocess(raw);
        }
        return prepared;
    }

    public Table getTable(TableVariant variant) {
        Preconditions.checkArgument(variant != null, "Table variant should not be null.");
        return variant == TableVariant.RAW ? raw : getPrepared();
    }

    public ChartSpec resolve(TableVariant variant, VisualizationRequest request) {
        return selector.resolveVisualization(getTable(variant), request);
    }

    /**
     * Resolve the request and hand the spec to the renderer.
     * 
     * @return the rendered spec
     */
    public ChartSpec visualize(TableVariant variant, VisualizationRequest request, ChartRenderer renderer)
            throws IOException {
        ChartSpec spec = resolve(variant, request);
        log.info("Render {} over {} table.", spec, variant);
        renderer.render(spec);
        return spec;
    }
}
