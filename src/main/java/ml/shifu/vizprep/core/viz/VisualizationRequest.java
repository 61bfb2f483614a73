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
 * One or two column references plus the requested {@link VisualizationKind}. For paired kinds the first column is the
 * x axis and the second one the y axis; both may be the same column.
 */
public class VisualizationRequest {

    private final VisualizationKind kind;

    private final List<String> columns;

    private VisualizationRequest(VisualizationKind kind, List<String> columns) {
        Preconditions.checkArgument(kind != null, "Visualization kind should not be null.");
        Preconditions.checkArgument(columns.size() == kind.getArity(), "%s needs %s column(s), but got %s.", kind,
                kind.getArity(), columns);
        for(String column: columns) {
            Preconditions.checkArgument(column != null, "Column reference should not be null.");
        }
        this.kind = kind;
        this.columns = Collections.unmodifiableList(new ArrayList<String>(columns));
    }

    public static VisualizationRequest of(VisualizationKind kind, String... columns) {
        List<String> list = new ArrayList<String>();
        Collections.addAll(list, columns);
        return new VisualizationRequest(kind, list);
    }

    public static VisualizationRequest distribution(String column) {
        return of(VisualizationKind.DISTRIBUTION, column);
    }

    public static VisualizationRequest proportion(String column) {
        return of(VisualizationKind.PROPORTION, column);
    }

    public static VisualizationRequest comparison(String x, String y) {
        return of(VisualizationKind.PAIRED_COMPARISON, x, y);
    }

    public static VisualizationRequest correlation(String x, String y) {
        return of(VisualizationKind.CORRELATION, x, y);
    }

    public VisualizationKind getKind() {
        return kind;
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getX() {
        return columns.get(0);
    }

    /**
     * @return the y column, null for single column kinds
     */
    public String getY() {
        return columns.size() > 1 ? columns.get(1) : null;
    }

    @Override
    public String toString() {
        return "VisualizationRequest [kind=" + kind + ", columns=" + columns + "]";
    }
}
