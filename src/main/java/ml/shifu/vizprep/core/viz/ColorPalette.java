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

import com.google.common.base.Preconditions;

/**
 * Fixed-size color palette. Colors are assigned by rank: rank i gets color {@code i % size()}, so the first
 * {@link #size()} categories get distinct colors and later ones cycle through the palette again. The same input
 * order always gives the same colors.
 */
public class ColorPalette {

    /**
     * Default qualitative palette for category groups.
     */
    public static final ColorPalette DEFAULT = new ColorPalette("default", Arrays.asList("#4C72B0", "#DD8452",
            "#55A868", "#C44E52", "#8172B3", "#937860", "#DA8BC3", "#8C8C8C", "#CCB974", "#64B5CD"));

    /**
     * Light qualitative palette for pie slices.
     */
    public static final ColorPalette SET3 = new ColorPalette("set3", Arrays.asList("#8DD3C7", "#FFFFB3", "#BEBADA",
            "#FB8072", "#80B1D3", "#FDB462", "#B3DE69", "#FCCDE5", "#D9D9D9", "#BC80BD", "#CCEBC5", "#FFED6F"));

    private final String name;

    private final List<String> colors;

    public ColorPalette(String name, List<String> colors) {
        Preconditions.checkArgument(colors != null && !colors.isEmpty(), "Palette %s should have colors.", name);
        this.name = name;
        this.colors = Collections.unmodifiableList(new ArrayList<String>(colors));
    }

    public String getName() {
        return name;
    }

    public int size() {
        return colors.size();
    }

    public String colorAt(int rank) {
        Preconditions.checkArgument(rank >= 0, "Color rank should be non-negative, but got %s.", rank);
        return colors.get(rank % colors.size());
    }

    /**
     * Assign colors to categories by their position in the list.
     */
    public Map<String, String> assign(List<String> categories) {
        Map<String, String> assigned = new LinkedHashMap<String, String>();
        for(String category: categories) {
            if(!assigned.containsKey(category)) {
                assigned.put(category, colorAt(assigned.size()));
            }
        }
        return assigned;
    }

    /**
     * Colors for the first n ranks.
     */
    public List<String> take(int n) {
        List<String> taken = new ArrayList<String>(n);
        for(int i = 0; i < n; i++) {
            taken.add(colorAt(i));
        }
        return taken;
    }
}
