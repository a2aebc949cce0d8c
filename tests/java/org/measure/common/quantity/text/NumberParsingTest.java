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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class NumberParsingTest {

  private static final Locale RUSSIAN = Locale.forLanguageTag("ru-RU");

  @Test
  public void testUnitedStates() {
    assertEquals(5.5, NumberParsing.parse("5.5", Locale.US), 0);
    assertEquals(-5.5, NumberParsing.parse("-5.5", Locale.US), 0);
    assertEquals(5.5, NumberParsing.parse("+5.5", Locale.US), 0);
    assertEquals(0.5, NumberParsing.parse(".5", Locale.US), 0);
    assertEquals(1234567.25, NumberParsing.parse("1,234,567.25", Locale.US), 0);
    assertEquals(1.5e-3, NumberParsing.parse("1.5e-3", Locale.US), 0);
    assertEquals(2e10, NumberParsing.parse("2E+10", Locale.US), 0);
  }

  @Test
  public void testRussian() {
    assertEquals(5.5, NumberParsing.parse("5,5", RUSSIAN), 0);
    assertEquals(1234.5, NumberParsing.parse("1 234,5", RUSSIAN), 0);
    assertEquals(1234.5, NumberParsing.parse("1\u00a0234,5", RUSSIAN), 0);
    assertMalformed("1,23 4", RUSSIAN);
  }

  @Test
  public void testGermany() {
    assertEquals(1234.5, NumberParsing.parse("1.234,5", Locale.GERMANY), 0);
  }

  @Test
  public void testMalformed() {
    assertMalformed("", Locale.US);
    assertMalformed("-", Locale.US);
    assertMalformed(".", Locale.US);
    assertMalformed("1.2.3", Locale.US);
    assertMalformed("1.2,3", Locale.US);
    assertMalformed(",5", Locale.US);
    assertMalformed("1e", Locale.US);
    assertMalformed("1e+", Locale.US);
    assertMalformed("abc", Locale.US);
    assertMalformed("5.5", RUSSIAN);
  }

  private static void assertMalformed(String text, Locale locale) {
    try {
      NumberParsing.parse(text, locale);
      fail(String.format("expected '%s' to be rejected in %s", text, locale));
    } catch (NumberFormatException e) {
      // expected
    }
  }
}
