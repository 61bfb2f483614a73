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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;

import org.testng.Assert;
import org.testng.annotations.Test;

public class CommonUtilsTest {

    private final Column color = Column.categorical("color",
            Arrays.asList("red", "blue", null, "red", "green", "blue"));

    @Test
    public void testDistinctValues() {
        Assert.assertEquals(CommonUtils.distinctValues(color), Arrays.asList("red", "blue", "green"));
        Assert.assertEquals(CommonUtils.distinctValues(Column.numerical("n", Arrays.asList(2, 1, 2))),
                Arrays.asList("2.0", "1.0"));
    }

    @Test
    public void testCategoryCodes() {
        Map<String, Integer> codes = CommonUtils.categoryCodes(color);

        Assert.assertEquals(codes.get("red"), Integer.valueOf(0));
        Assert.assertEquals(codes.get("blue"), Integer.valueOf(1));
        Assert.assertEquals(codes.get("green"), Integer.valueOf(2));
    }

    @Test
    public void testValueCounts() {
        Map<String, Long> counts = CommonUtils.valueCounts(color);

        // red and blue tie, red comes first
        Assert.assertEquals(new ArrayList<String>(counts.keySet()), Arrays.asList("red", "blue", "green"));
        Assert.assertEquals(counts.get("blue"), Long.valueOf(2L));
        Assert.assertEquals(counts.get("green"), Long.valueOf(1L));

        Column skewed = Column.categorical("c", Arrays.asList("a", "b", "b", "c", "b"));
        Assert.assertEquals(new ArrayList<String>(CommonUtils.valueCounts(skewed).keySet()),
                Arrays.asList("b", "a", "c"));
    }

    @Test
    public void testNumericValues() {
        List<Double> values = CommonUtils.numericValues(Column.numerical("n", Arrays.asList(1d, null, 3d)));

        Assert.assertEquals(values, Arrays.asList(1d, 3d));
    }

    @Test
    public void testDropColumns() {
        Table table = Table.builder().numerical("a", Arrays.asList(1d)).numerical("b", Arrays.asList(2d))
                .numerical("c", Arrays.asList(3d)).build();

        Table dropped = CommonUtils.dropColumns(table, Collections.singleton("b"));

        Assert.assertEquals(dropped.getColumnNames(), Arrays.asList("a", "c"));
        Assert.assertEquals(table.getColumnCount(), 3);
    }
}
