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

import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.container.obj.ColumnType;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;

import org.testng.Assert;
import org.testng.annotations.Test;

public class CsvTableLoaderTest {

    @Test
    public void testLoadCommaFile() {
        CsvTableLoader loader = new CsvTableLoader(null);
        Table table = loader.load("src/test/resources/data/people.csv");

        Assert.assertEquals(loader.getDelimiter(), ",");
        Assert.assertEquals(table.getColumnNames(), Arrays.asList("age", "city", "income", "member"));
        Assert.assertEquals(table.getRowCount(), 5);
        Assert.assertEquals(table.getColumnType("age"), ColumnType.N);
        Assert.assertEquals(table.getColumnType("city"), ColumnType.C);
        Assert.assertEquals(table.getColumnType("income"), ColumnType.N);

        Assert.assertTrue(table.getColumn("age").isMissing(1));
        Assert.assertTrue(table.getColumn("income").isMissing(2));
        Assert.assertTrue(table.getColumn("member").isMissing(3));
        Assert.assertEquals(table.getColumn("city").getString(3), "San Francisco, CA");
        Assert.assertEquals(table.getColumn("income").getDouble(0), 52000.5d, 1e-12);
    }

    @Test
    public void testLoadSemicolonFile() {
        CsvTableLoader loader = new CsvTableLoader(null);
        Table table = loader.load("src/test/resources/data/semicolon.csv");

        Assert.assertEquals(loader.getDelimiter(), ";");
        // blank line is skipped
        Assert.assertEquals(table.getRowCount(), 3);
        Column code = table.getColumn("code");
        Assert.assertTrue(code.isCategorical());
        Assert.assertEquals(code.getString(0), "007");
        Assert.assertTrue(code.isMissing(2));
        Assert.assertTrue(table.getColumn("score").isMissing(2));
    }

    @Test
    public void testFileNotFound() {
        try {
            new CsvTableLoader(",").load("src/test/resources/data/not-exist.csv");
            Assert.fail("file does not exist");
        } catch (VizPrepException e) {
            Assert.assertEquals(e.getError(), VizPrepErrorCode.ERROR_INPUT_NOT_FOUND);
        }
    }

    @Test
    public void testTooManyFields() {
        try {
            new CsvTableLoader(",").parse(Arrays.asList("a,b", "1,2,3"), "inline");
            Assert.fail("second line has too many fields");
        } catch (VizPrepException e) {
            Assert.assertEquals(e.getError(), VizPrepErrorCode.ERROR_LOAD_TABLE);
        }
    }

    @Test
    public void testDuplicatedHeader() {
        try {
            new CsvTableLoader(",").parse(Arrays.asList("a,a", "1,2"), "inline");
            Assert.fail("header is duplicated");
        } catch (VizPrepException e) {
            Assert.assertEquals(e.getError(), VizPrepErrorCode.ERROR_LOAD_TABLE);
        }
    }

    @Test
    public void testShortLineIsPaddedWithMissing() {
        Table table = new CsvTableLoader(",").parse(Arrays.asList("a,b", "1"), "inline");

        Assert.assertEquals(table.getRowCount(), 1);
        Assert.assertTrue(table.getColumn("b").isMissing(0));
    }

    @Test
    public void testSplitLine() {
        CsvTableLoader loader = new CsvTableLoader(",");
        List<String> fields = loader.splitLine("1,\"a, \"\"b\"\"\",,x");

        Assert.assertEquals(fields, Arrays.asList("1", "a, \"b\"", "", "x"));
    }

    @Test
    public void testWrite() throws Exception {
        Table table = Table.builder().numerical("x", Arrays.asList(1d, null))
                .categorical("name", Arrays.asList("a,b", "q\"r")).build();
        StringWriter writer = new StringWriter();

        new CsvTableLoader(",").write(table, writer);

        Assert.assertEquals(writer.toString(), "x,name\n1.0,\"a,b\"\n,\"q\"\"r\"\n");
    }

    @Test
    public void testTypeSuffixIsNotNumber() {
        Table table = new CsvTableLoader(",").parse(Arrays.asList("code,hex", "1d,0x10", "2f,0x20", "3D,0x30"),
                "inline");

        Assert.assertTrue(table.getColumn("code").isCategorical());
        Assert.assertEquals(table.getValues("code"), Arrays.<Object> asList("1d", "2f", "3D"));
        Assert.assertTrue(table.getColumn("hex").isCategorical());
    }

    @Test
    public void testNumberFormats() {
        Table table = new CsvTableLoader(",").parse(Arrays.asList("n", "-.5", "+3e2", " 7 ", "1.25E-1"), "inline");

        Assert.assertTrue(table.getColumn("n").isNumerical());
        Assert.assertEquals(table.getValues("n"), Arrays.<Object> asList(-0.5d, 300d, 7d, 0.125d));
    }

    @Test
    public void testNonFiniteValues() {
        Table table = new CsvTableLoader(",").parse(Arrays.asList("big,word", "1e999,Infinity", "2,-Infinity"),
                "inline");

        // overflow stays numerical but missing, Infinity text is a category
        Column big = table.getColumn("big");
        Assert.assertTrue(big.isNumerical());
        Assert.assertTrue(big.isMissing(0));
        Assert.assertEquals(big.getDouble(1), 2d, 1e-12);
        Assert.assertTrue(table.getColumn("word").isCategorical());
    }
}
