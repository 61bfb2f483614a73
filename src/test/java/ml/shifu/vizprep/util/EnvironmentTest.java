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

import java.io.IOException;

import ml.shifu.vizprep.core.DegenerateColumnPolicy;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;

import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.Test;

/**
 * EnvironmentTest class
 */
public class EnvironmentTest {

    private static final String TEST_KEY = "vizprep.test.policy";

    @Test
    public void testLoadVizPrepConfig() throws IOException {
        // template shipped at the project root, under conf/
        Environment.setProperty(Environment.VIZPREP_HOME, ".");
        Environment.loadVizPrepConfig();

        Assert.assertEquals(Environment.getProperty(Constants.VIZPREP_IMPUTER_DEGENERATE_POLICY), "FAIL");
        Assert.assertEquals(Environment.getDouble(Constants.VIZPREP_VIZ_JITTER_WIDTH, 0.5d), 0.1d, 1e-12);
        Assert.assertEquals(Environment.getProperty(Constants.VIZPREP_ENCODER_NAME_DELIMITER), "_");
    }

    @Test
    public void testDefaults() {
        Assert.assertEquals(Environment.getDouble("vizprep.test.notSet", 0.5d), 0.5d, 1e-12);
        Assert.assertNull(Environment.getProperty("vizprep.test.notSet"));
        Assert.assertEquals(Environment.getProperty("vizprep.test.notSet", "x"), "x");
    }

    @Test
    public void testGetEnum() {
        Environment.setProperty(TEST_KEY, " skip ");
        Assert.assertEquals(Environment.getEnum(TEST_KEY, DegenerateColumnPolicy.class, DegenerateColumnPolicy.FAIL),
                DegenerateColumnPolicy.SKIP);

        Environment.removeProperty(TEST_KEY);
        Assert.assertEquals(Environment.getEnum(TEST_KEY, DegenerateColumnPolicy.class, DegenerateColumnPolicy.FAIL),
                DegenerateColumnPolicy.FAIL);
    }

    @Test
    public void testInvalidEnum() {
        Environment.setProperty(TEST_KEY, "IGNORE");
        try {
            Environment.getEnum(TEST_KEY, DegenerateColumnPolicy.class, DegenerateColumnPolicy.FAIL);
            Assert.fail("IGNORE is not a policy");
        } catch (VizPrepException e) {
            Assert.assertEquals(e.getError(), VizPrepErrorCode.ERROR_VIZPREP_CONFIG);
        } finally {
            Environment.removeProperty(TEST_KEY);
        }
    }

    @AfterClass
    public void tearDown() {
        Environment.removeProperty(TEST_KEY);
    }
}
