// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package org.measure.common.quantity.text;

import java.util.Locale;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class UnitFormatterTest {

  @Test
  public void testDigitsAfterRadix() {
    assertEquals("1,234.57 m", UnitFormatter.format(1234.5678, "m", Locale.US, 2));
    assertEquals("1,234.6 m", UnitFormatter.format(1234.5678, "m", Locale.US, 1));
    assertEquals("1,235 m", UnitFormatter.format(1234.5678, "m", Locale.US, 0));
    assertEquals("1.5 m", UnitFormatter.format(1.5, "m", Locale.US, 2));
    assertEquals("-2 m", UnitFormatter.format(-2, "m", Locale.US, 2));
  }

  @Test
  public void testSmallValuesKeepSignificantDigits() {
    assertEquals("0.0012 m", UnitFormatter.format(0.0012345, "m", Locale.US, 2));
    assertEquals("0.123 m", UnitFormatter.format(0.12345, "m", Locale.US, 3));
    assertEquals("0.1 m", UnitFormatter.format(0.12345, "m", Locale.US, 0));
  }

  @Test
  public void testScientificNotation() {
    assertScientific(UnitFormatter.format(1.5e-7, "m", Locale.US, 2));
    assertScientific(UnitFormatter.format(2.5e20, "m", Locale.US, 2));
  }

  @Test
  public void testSpecialValues() {
    assertEquals("0 m", UnitFormatter.format(0, "m", Locale.US, 2));
    assertEquals("NaN m", UnitFormatter.format(Double.NaN, "m", Locale.US, 2));
    assertEquals("Infinity m", UnitFormatter.format(Double.POSITIVE_INFINITY, "m", Locale.US, 2));
  }

  @Test
  public void testLocalized() {
    assertEquals("1,5 м", UnitFormatter.format(1.5, "м", Locale.forLanguageTag("ru-RU"), 2));
    assertEquals("1.234,5 m", UnitFormatter.format(1234.5, "m", Locale.GERMANY, 2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeDigitsRejected() {
    UnitFormatter.format(1, "m", Locale.US, -1);
  }

  @Test
  public void testFormatArgs() {
    assertArrayEquals(new Object[] {1.5, "m", "x", 2},
        UnitFormatter.formatArgs(1.5, "m", "x", 2));
    assertEquals("m = 1.50", UnitFormatter.format(Locale.US, "%2$s = %1$.2f",
        UnitFormatter.formatArgs(1.5, "m")));
    assertEquals("1,50 м", UnitFormatter.format(Locale.forLanguageTag("ru-RU"), "%.2f %s",
        UnitFormatter.formatArgs(1.5, "м")));
  }

  private static void assertScientific(String formatted) {
    assertTrue(formatted, formatted.contains("E"));
    assertTrue(formatted, formatted.endsWith(" m"));
  }
}
