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
package ml.shifu.vizprep;

import java.io.File;
import java.io.StringWriter;
import java.util.List;

import ml.shifu.vizprep.util.JSONUtils;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.fasterxml.jackson.databind.JsonNode;

public class VizPrepCLITest {

    private static final String DATA = "src/test/resources/data/people.csv";

    @Test
    public void testColumns() {
        StringWriter out = new StringWriter();

        Assert.assertEquals(VizPrepCLI.run(new String[] { "columns", "-f", DATA }, out), 0);

        String[] lines = out.toString().trim().split("\\r?\\n");
        Assert.assertEquals(lines.length, 4);
        Assert.assertEquals(lines[0], "0\tage\tNumerical");
        Assert.assertEquals(lines[1], "1\tcity\tCategorical");
    }

    @Test
    public void testPreprocess() throws Exception {
        File output = File.createTempFile("prepared", ".csv");
        output.deleteOnExit();

        Assert.assertEquals(VizPrepCLI.run(new String[] { "preprocess", "-f", DATA, "-o", output.getPath() },
                new StringWriter()), 0);

        List<String> lines = FileUtils.readLines(output, "UTF-8");
        Assert.assertEquals(lines.size(), 6);
        Assert.assertTrue(lines.get(0).startsWith("age,city_NY,city_LA,"), lines.get(0));
        Assert.assertTrue(lines.get(0).endsWith("income,member_yes,member_no"), lines.get(0));
        Assert.assertFalse(lines.get(1).contains(",,"), lines.get(1));
    }

    @Test
    public void testViz() throws Exception {
        StringWriter out = new StringWriter();

        Assert.assertEquals(VizPrepCLI.run(new String[] { "viz", "-f", DATA, "-k", "proportion", "-x", "1" }, out),
                0);

        JsonNode node = JSONUtils.readTree(out.toString());
        Assert.assertEquals(node.get("strategy").asText(), "PIE");
        Assert.assertEquals(node.get("columns").get(0).asText(), "city");
    }

    @Test
    public void testVizPrepared() throws Exception {
        StringWriter out = new StringWriter();

        Assert.assertEquals(VizPrepCLI.run(new String[] { "viz", "-f", DATA, "-k", "correlation", "-x", "age", "-y",
                "city_LA", "-v", "prepared" }, out), 0);

        Assert.assertEquals(JSONUtils.readTree(out.toString()).get("strategy").asText(), "SCATTER");
    }

    @Test
    public void testFailures() {
        StringWriter out = new StringWriter();

        Assert.assertEquals(VizPrepCLI.run(new String[] { "viz", "-f", DATA, "-k", "proportion", "-x", "age" }, out),
                1);
        Assert.assertEquals(VizPrepCLI.run(new String[] { "viz", "-f", DATA, "-k", "pie", "-x", "weight" }, out), 1);
        Assert.assertEquals(VizPrepCLI.run(new String[] { "viz", "-f", DATA, "-k", "comparison", "-x", "age" }, out),
                1);
        Assert.assertEquals(VizPrepCLI.run(new String[] { "plot", "-f", DATA }, out), 1);
        Assert.assertEquals(VizPrepCLI.run(new String[] { "columns" }, out), 1);
        Assert.assertEquals(VizPrepCLI.run(new String[] { "columns", "-f", "not-exist.csv" }, out), 1);
        Assert.assertEquals(VizPrepCLI.run(new String[0], out), 1);
    }

    @Test
    public void testRawVizDoesNotPreprocess() throws Exception {
        File data = File.createTempFile("constant", ".csv");
        data.deleteOnExit();
        FileUtils.writeStringToFile(data, "n,c\n1,a\n1,b\n", "UTF-8");
        StringWriter out = new StringWriter();

        Assert.assertEquals(VizPrepCLI.run(new String[] { "viz", "-f", data.getPath(), "-k", "distribution", "-x",
                "c" }, out), 0);
        Assert.assertEquals(JSONUtils.readTree(out.toString()).get("strategy").asText(), "FREQUENCY_BAR");

        // same data fails once the prepared table is requested
        Assert.assertEquals(VizPrepCLI.run(new String[] { "viz", "-f", data.getPath(), "-k", "distribution", "-x",
                "n", "-v", "prepared" }, new StringWriter()), 1);
    }
}
