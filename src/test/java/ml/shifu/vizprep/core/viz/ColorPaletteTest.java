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

import java.util.Arrays;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ColorPaletteTest {

    @Test
    public void testColorAtCycles() {
        ColorPalette palette = ColorPalette.DEFAULT;

        Assert.assertEquals(palette.size(), 10);
        Assert.assertEquals(palette.colorAt(0), "#4C72B0");
        Assert.assertEquals(palette.colorAt(10), palette.colorAt(0));
        Assert.assertEquals(palette.colorAt(13), palette.colorAt(3));
    }

    @Test
    public void testAssign() {
        ColorPalette palette = new ColorPalette("rgb", Arrays.asList("red", "green", "blue"));

        Map<String, String> colors = palette.assign(Arrays.asList("x", "y", "x", "z", "w"));

        Assert.assertEquals(colors.size(), 4);
        Assert.assertEquals(colors.get("x"), "red");
        Assert.assertEquals(colors.get("z"), "blue");
        Assert.assertEquals(colors.get("w"), "red");
    }

    @Test
    public void testTake() {
        Assert.assertEquals(ColorPalette.SET3.take(14).size(), 14);
        Assert.assertEquals(ColorPalette.SET3.take(14).get(12), ColorPalette.SET3.colorAt(0));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyPalette() {
        new ColorPalette("empty", Arrays.<String> asList());
    }
}
