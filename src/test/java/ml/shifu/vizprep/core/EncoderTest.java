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

import java.util.Arrays;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;

import org.testng.Assert;
import org.testng.annotations.Test;

public class EncoderTest {

    @Test
    public void testOneHot() {
        Table table = Table.builder().categorical("color", Arrays.asList("red", "blue", "red", "green"))
                .numerical("size", Arrays.asList(1d, 2d, 3d, 4d)).build();

        Table encoded = new Encoder("_").encode(table);

        Assert.assertEquals(encoded.getColumnNames(),
                Arrays.asList("color_red", "color_blue", "color_green", "size"));
        Assert.assertEquals(encoded.getValues("color_red"), Arrays.<Object> asList(1d, 0d, 1d, 0d));
        Assert.assertEquals(encoded.getValues("color_blue"), Arrays.<Object> asList(0d, 1d, 0d, 0d));
        Assert.assertEquals(encoded.getValues("color_green"), Arrays.<Object> asList(0d, 0d, 0d, 1d));
        Assert.assertTrue(encoded.getColumn("color_red").isIndicator());
        Assert.assertSame(encoded.getColumn("size"), table.getColumn("size"));
        Assert.assertEquals(encoded.getRowCount(), table.getRowCount());
    }

    @Test
    public void testColumnCount() {
        Table table = Table.builder().numerical("a", Arrays.asList(1d, 2d, 3d))
                .categorical("b", Arrays.asList("x", "y", "x")).numerical("c", Arrays.asList(1d, 2d, 3d))
                .categorical("d", Arrays.asList("p", "q", "r")).build();

        Table encoded = new Encoder("_").encode(table);

        // 2 numerical + 2 + 3 categories
        Assert.assertEquals(encoded.getColumnCount(), 7);
        for(int row = 0; row < encoded.getRowCount(); row++) {
            double sum = 0d;
            for(Column column: encoded.getColumns()) {
                if(column.isIndicator() && column.getName().startsWith("d_")) {
                    sum += column.getDouble(row);
                }
            }
            Assert.assertEquals(sum, 1d, 1e-12);
        }
    }

    @Test
    public void testMissingCategoryGivesZeros() {
        Table table = Table.builder().categorical("city", Arrays.asList("NY", null, "LA")).build();

        Table encoded = new Encoder("_").encode(table);

        Assert.assertEquals(encoded.getColumnNames(), Arrays.asList("city_NY", "city_LA"));
        Assert.assertEquals(encoded.getColumn("city_NY").getDouble(1), 0d, 1e-12);
        Assert.assertEquals(encoded.getColumn("city_LA").getDouble(1), 0d, 1e-12);
    }

    @Test
    public void testNameDelimiter() {
        Encoder encoder = new Encoder(".");
        Table table = Table.builder().categorical("city", Arrays.asList("NY")).build();

        Assert.assertEquals(encoder.encode(table).getColumnNames(), Arrays.asList("city.NY"));
        Assert.assertEquals(encoder.indicatorName("a", "b"), "a.b");
    }

    @Test
    public void testNameCollision() {
        Table table = Table.builder().categorical("a", Arrays.asList("b", "c"))
                .numerical("a_b", Arrays.asList(1d, 2d)).build();
        try {
            new Encoder("_").encode(table);
            Assert.fail("a_b is generated twice");
        } catch (VizPrepException e) {
            Assert.assertEquals(e.getError(), VizPrepErrorCode.ERROR_NAME_COLLISION);
            Assert.assertEquals(e.getOperation(), "encode");
            Assert.assertEquals(e.getColumnName(), "a_b");
        }
    }

    @Test
    public void testEncodeIsPure() {
        Table table = Table.builder().categorical("city", Arrays.asList("NY", "LA")).build();

        new Encoder("_").encode(table);

        Assert.assertEquals(table.getColumnNames(), Arrays.asList("city"));
    }
}
