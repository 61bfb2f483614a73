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
 * Kind of visualization a user asks for. {@link #PAIRED_COMPARISON} and {@link #CORRELATION} are the box-plot and
 * scatter sub-kinds of a paired comparison of two columns.
 */
public enum VisualizationKind {
    DISTRIBUTION(1), PAIRED_COMPARISON(2), CORRELATION(2), PROPORTION(1);

    /**
     * number of columns needed
     */
    private final int arity;

    private VisualizationKind(int arity) {
        this.arity = arity;
    }

    public int getArity() {
        return arity;
    }

    public boolean isPaired() {
        return arity == 2;
    }

    /**
     * Lookup by name, case insensitive, also accepting short names used on command line.
     */
    public static VisualizationKind of(String kind) {
        if("comparison".equalsIgnoreCase(kind) || "boxplot".equalsIgnoreCase(kind)) {
            return PAIRED_COMPARISON;
        }
        if("scatter".equalsIgnoreCase(kind)) {
            return CORRELATION;
        }
        if("histogram".equalsIgnoreCase(kind)) {
            return DISTRIBUTION;
        }
        if("pie".equalsIgnoreCase(kind)) {
            return PROPORTION;
        }
        for(VisualizationKind vk: values()) {
            if(vk.name().equalsIgnoreCase(kind)) {
                return vk;
            }
        }
        throw new IllegalArgumentException("Cannot find VisualizationKind " + kind);
    }
}
