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

import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

import org.junit.Before;
import org.junit.Test;

import org.measure.common.quantity.Length;
import org.measure.common.quantity.LengthUnit;
import org.measure.common.quantity.Mass;
import org.measure.common.quantity.MassUnit;
import org.measure.common.quantity.i18n.AbbreviationRegistry;
import org.measure.common.quantity.i18n.UnitSystem;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class QuantityParserTest {

  private static final Locale RUSSIAN = Locale.forLanguageTag("ru-RU");

  private AbbreviationRegistry registry;
  private QuantityParser<Length, LengthUnit> lengths;
  private QuantityParser<Mass, MassUnit> masses;

  @Before
  public void setUp() {
    registry = AbbreviationRegistry.builder().build();
    registry.register(LengthUnit.METER, Locale.US, "m");
    registry.register(LengthUnit.MILE, Locale.US, "mi");
    registry.register(LengthUnit.MILLIMETER, Locale.US, "mm");
    registry.register(LengthUnit.FOOT, Locale.US, "ft", "'");
    registry.register(LengthUnit.INCH, Locale.US, "in", "\"");
    registry.register(LengthUnit.METER, RUSSIAN, "м");
    registry.register(MassUnit.LONG_TON, Locale.US, "long tn");
    registry.register(MassUnit.POUND, Locale.US, "lb");

    lengths = new QuantityParser<Length, LengthUnit>(Length.DIMENSION, registry);
    masses = new QuantityParser<Mass, MassUnit>(Mass.DIMENSION, registry);
  }

  @Test
  public void testSinglePair() {
    assertEquals(Length.fromMeters(5.5), lengths.parse("5.5 m", Locale.US));
    assertEquals(Length.fromMeters(5.5), lengths.parse("5.5m", Locale.US));
    assertEquals(Length.fromMeters(-5.5), lengths.parse("-5.5 m", Locale.US));
  }

  @Test
  public void testLongestAbbreviationWins() {
    assertEquals(Length.fromMiles(2), lengths.parse("2 mi", Locale.US));
    assertEquals(Length.fromMillimeters(2), lengths.parse("2mm", Locale.US));
    assertEquals(Length.fromMiles(2).add(Length.fromMeters(3)),
        lengths.parse("2mi 3m", Locale.US));
  }

  @Test
  public void testPairsAreSummed() {
    Length expected = Length.fromFeet(1).add(Length.fromInches(2));
    assertEquals(expected, lengths.parse("1ft 2in", Locale.US));
    assertEquals(expected, lengths.parse("1 ft, 2 in", Locale.US));
    assertEquals(expected, lengths.parse("1 ft and 2 in", Locale.US));
    assertEquals(expected, lengths.parse("1'2\"", Locale.US));
    assertEquals(Length.fromFeet(1).add(Length.fromFeet(1)), lengths.parse("1 ft 1 ft", Locale.US));
  }

  @Test
  public void testAbbreviationWithSpaces() {
    assertEquals(Mass.fromLongTons(2), masses.parse("2 long tn", Locale.US));
    assertEquals(Mass.fromLongTons(1).add(Mass.fromPounds(3)),
        masses.parse("1 long tn, 3 lb", Locale.US));
  }

  @Test
  public void testNumberWithoutUnitContributesNothing() {
    assertEquals(Length.fromMeters(3), lengths.parse("5 and 3 m", Locale.US));
  }

  @Test
  public void testCultureSeparators() {
    assertEquals(Length.fromMeters(1234.5), lengths.parse("1 234,5 м", RUSSIAN));
    assertEquals(Length.fromMeters(1234.5), lengths.parse("1,234.5 m", Locale.US));
  }

  @Test
  public void testEmptyInput() {
    assertFailure(ParseError.Kind.EMPTY_INPUT, lengths.tryParse("", Locale.US));
    assertFailure(ParseError.Kind.EMPTY_INPUT, lengths.tryParse(" \t ", Locale.US));
  }

  @Test(expected = NullPointerException.class)
  public void testNullInput() {
    lengths.tryParse(null, Locale.US);
  }

  @Test
  public void testUnrecognizedUnit() {
    ParseError error = assertFailure(ParseError.Kind.UNRECOGNIZED_UNIT,
        lengths.tryParse("1 m 2 zz", Locale.US));
    assertEquals("2", error.getMatchedValue().get());
    assertEquals("zz", error.getMatchedUnit().get());
    assertEquals(Locale.US, error.getLocale().get());
    assertEquals("1 m 2 zz", error.getInput());
  }

  @Test
  public void testUnitsOfAnotherDimensionAreUnrecognized() {
    assertFailure(ParseError.Kind.UNRECOGNIZED_UNIT, lengths.tryParse("2 lb", Locale.US));
  }

  @Test
  public void testMalformedNumber() {
    ParseError error = assertFailure(ParseError.Kind.MALFORMED_NUMBER,
        lengths.tryParse("1.2.3 m", Locale.US));
    assertEquals("1.2.3", error.getMatchedValue().get());
    assertTrue(error.getCause().get() instanceof NumberFormatException);
  }

  @Test
  public void testInvalidFragment() {
    ParseError error = assertFailure(ParseError.Kind.INVALID_FRAGMENT,
        lengths.tryParse("1 m plus 2 m", Locale.US));
    assertEquals("1", error.getMatchedValue().get());
    assertEquals("m", error.getMatchedUnit().get());

    error = assertFailure(ParseError.Kind.INVALID_FRAGMENT,
        lengths.tryParse("about 2 m", Locale.US));
    assertFalse(error.getMatchedValue().isPresent());

    assertFailure(ParseError.Kind.INVALID_FRAGMENT, lengths.tryParse("2 m tall", Locale.US));
  }

  @Test
  public void testDetachedSignIsInvalidFragment() {
    assertFailure(ParseError.Kind.INVALID_FRAGMENT, lengths.tryParse("- 5 m", Locale.US));
    assertFailure(ParseError.Kind.INVALID_FRAGMENT, lengths.tryParse("+ 5 m", Locale.US));

    ParseError error = assertFailure(ParseError.Kind.INVALID_FRAGMENT,
        lengths.tryParse("5 m - 3 m", Locale.US));
    assertEquals("5", error.getMatchedValue().get());
    assertEquals("m", error.getMatchedUnit().get());

    assertEquals(Length.fromMeters(2), lengths.parse("5 m -3 m", Locale.US));
  }

  @Test
  public void testPairPatternIsMemoizedPerView() {
    UnitSystem view = registry.getCached(Locale.US);
    Pattern pattern = QuantityParser.pairPattern(view, LengthUnit.class, Locale.US);
    assertSame(pattern, QuantityParser.pairPattern(view, LengthUnit.class, Locale.US));
    assertNotSame(pattern, QuantityParser.pairPattern(view, MassUnit.class, Locale.US));
    assertNotSame(pattern, QuantityParser.pairPattern(view, LengthUnit.class, Locale.GERMANY));

    registry.register(LengthUnit.YARD, Locale.US, "yd");
    UnitSystem updated = registry.getCached(Locale.US);
    assertNotSame(view, updated);
    assertNotSame(pattern, QuantityParser.pairPattern(updated, LengthUnit.class, Locale.US));
  }

  @Test
  public void testNoMatches() {
    assertFailure(ParseError.Kind.NO_MATCHES, lengths.tryParse("42", Locale.US));
    assertFailure(ParseError.Kind.NO_MATCHES, lengths.tryParse("1, 2 and 3", Locale.US));
  }

  @Test
  public void testParseThrows() {
    try {
      lengths.parse("2 zz", Locale.US);
      fail();
    } catch (QuantityParseException e) {
      assertEquals(ParseError.Kind.UNRECOGNIZED_UNIT, e.getKind());
    }
  }

  @Test
  public void testNullLocaleUsesFallbackAbbreviations() {
    assertEquals(Length.fromFeet(3), lengths.parse("3 ft", null));
    assertFailure(ParseError.Kind.UNRECOGNIZED_UNIT, lengths.tryParse("3 м", null));
  }

  @Test
  public void testRegistryChangesAreSeen() {
    assertFailure(ParseError.Kind.UNRECOGNIZED_UNIT, lengths.tryParse("2 yd", Locale.US));
    registry.register(LengthUnit.YARD, Locale.US, "yd");
    assertEquals(Length.fromYards(2), lengths.parse("2 yd", Locale.US));
  }

  @Test
  public void testParseUnit() {
    assertSame(LengthUnit.FOOT, lengths.parseUnit("ft", Locale.US));
    assertSame(LengthUnit.FOOT, lengths.parseUnit(" ' ", Locale.US));
    assertSame(LengthUnit.METER, lengths.parseUnit("м", RUSSIAN));
    assertSame(MassUnit.LONG_TON, masses.parseUnit("long tn", null));
    assertFailure(ParseError.Kind.UNRECOGNIZED_UNIT, lengths.tryParseUnit("feet", Locale.US));
    assertFailure(ParseError.Kind.EMPTY_INPUT, lengths.tryParseUnit(" ", Locale.US));
  }

  @Test
  public void testPairPattern() {
    DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.US);
    assertTrue(QuantityParser.pairPattern(symbols, ImmutableList.of("m", "mm"))
        .matcher("12.5 mm").matches());
    assertTrue(QuantityParser.pairPattern(symbols, ImmutableList.<String>of())
        .matcher("12.5 zz").matches());
    assertFalse(QuantityParser.pairPattern(symbols, ImmutableList.of("m"))
        .matcher("12 and").matches());
  }

  private static ParseError assertFailure(ParseError.Kind kind, ParseResult<?> result) {
    assertFalse(result.isSuccess());
    ParseError error = result.getError().get();
    assertEquals(kind, error.getKind());
    return error;
  }
}
