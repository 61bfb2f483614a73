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
import java.util.Arrays;
import java.util.Map;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.container.obj.ColumnType;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;

import org.testng.Assert;
import org.testng.annotations.Test;

public class TypeClassifierTest {

    private final TypeClassifier classifier = new TypeClassifier();

    private final Table table = Table.builder().numerical("age", Arrays.asList(25, 30, null))
            .categorical("zip", Arrays.asList("95131", "10001", "95131"))
            .numerical("empty", Arrays.asList((Double) null, null, null))
            .categorical("note", Arrays.asList((String) null, null, null)).build();

    @Test
    public void testNumericStringsStayCategorical() {
        Assert.assertEquals(classifier.classifyColumn(table, "zip"), ColumnType.C);
    }

    @Test
    public void testAllMissingColumnKeepsDeclaredType() {
        Assert.assertEquals(classifier.classifyColumn(table, "empty"), ColumnType.N);
        Assert.assertEquals(classifier.classifyColumn(table, "note"), ColumnType.C);
        Assert.assertEquals(classifier.classify(Column.categorical("none", new ArrayList<String>())), ColumnType.C);
    }

    @Test
    public void testClassifyIsStable() {
        ColumnType first = classifier.classifyColumn(table, "age");
        for(int i = 0; i < 10; i++) {
            Assert.assertEquals(classifier.classifyColumn(table, "age"), first);
        }
    }

    @Test
    public void testClassifyAll() {
        Map<String, ColumnType> types = classifier.classifyAll(table);

        Assert.assertEquals(new ArrayList<String>(types.keySet()), table.getColumnNames());
        Assert.assertEquals(classifier.getNumericalColumns(table), Arrays.asList("age", "empty"));
        Assert.assertEquals(classifier.getCategoricalColumns(table), Arrays.asList("zip", "note"));
    }

    @Test
    public void testUnknownColumn() {
        try {
            classifier.classifyColumn(table, "income");
            Assert.fail("income is not a column");
        } catch (VizPrepException e) {
            Assert.assertEquals(e.getError(), VizPrepErrorCode.ERROR_UNKNOWN_COLUMN);
        }
    }
}
