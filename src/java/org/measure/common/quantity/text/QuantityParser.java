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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.Lists;

import org.measure.common.quantity.Dimension;
import org.measure.common.quantity.Quantity;
import org.measure.common.quantity.Unit;
import org.measure.common.quantity.i18n.AbbreviationRegistry;
import org.measure.common.quantity.i18n.UnitSystem;

/**
 * Parses free-form text holding one or more {@code <number> <unit>} pairs into a single quantity,
 * eg: {@code "5.5 m"}, {@code "1ft 2in"} or {@code "1 ft, 2 in"}.  Pairs may be separated by
 * whitespace, commas or the word {@code and}; their values are summed.
 *
 * <p>Numbers are read with the separators of the requested culture, see {@link NumberParsing}.
 * Unit tokens are matched against the culture's abbreviations first, longest first, so that
 * abbreviations containing spaces such as {@code long tn} are recognized.
 *
 * <p>Text between pairs may only hold separators.  Letters other than the word {@code and} and
 * sign characters not attached to a number, as in {@code "- 5 m"}, fail with
 * {@link ParseError.Kind#INVALID_FRAGMENT}.  Other punctuation between pairs is ignored.
 *
 * @param <Q> the quantity type produced
 * @param <U> the unit type of the quantity
 */
@ThreadSafe
public final class QuantityParser<Q extends Quantity<Q, U>, U extends Enum<U> & Unit<U>> {

  private static final Logger LOG = Logger.getLogger(QuantityParser.class.getName());

  private static final Splitter FRAGMENT_SPLITTER =
      Splitter.on(Pattern.compile("[\\s,]+")).omitEmptyStrings();

  private static final String SEPARATOR_WORD = "and";

  private static final Comparator<String> LONGEST_FIRST = new Comparator<String>() {
    @Override public int compare(String a, String b) {
      int byLength = b.length() - a.length();
      return byLength != 0 ? byLength : a.compareTo(b);
    }
  };

  private static final int PATTERN_CACHE_SIZE = 256;

  // Keyed by culture view, so a registry mutation, which publishes new views, misses the cache.
  private static final LoadingCache<PatternKey, Pattern> PAIR_PATTERNS =
      CacheBuilder.newBuilder()
          .maximumSize(PATTERN_CACHE_SIZE)
          .build(new CacheLoader<PatternKey, Pattern>() {
            @Override public Pattern load(PatternKey key) {
              return pairPattern(DecimalFormatSymbols.getInstance(key.numberLocale),
                  key.units.getAllAbbreviations(key.unitType));
            }
          });

  private final Dimension<Q, U> dimension;
  private final AbbreviationRegistry registry;

  public QuantityParser(Dimension<Q, U> dimension, AbbreviationRegistry registry) {
    this.dimension = Preconditions.checkNotNull(dimension);
    this.registry = Preconditions.checkNotNull(registry);
  }

  /**
   * Creates a parser for a dimension backed by the {@link AbbreviationRegistry#getDefault()
   * default registry}.
   */
  public static <Q extends Quantity<Q, U>, U extends Enum<U> & Unit<U>> QuantityParser<Q, U> of(
      Dimension<Q, U> dimension) {
    return new QuantityParser<Q, U>(dimension, AbbreviationRegistry.getDefault());
  }

  /**
   * Parses text into a quantity.
   *
   * @param text the text to parse
   * @param locale the culture of the text, or {@code null} for the default format locale's number
   *     symbols and the registry's fallback abbreviations
   * @return the sum of the quantities in {@code text}
   * @throws NullPointerException if {@code text} is null
   * @throws QuantityParseException if {@code text} cannot be parsed
   */
  public Q parse(String text, @Nullable Locale locale) {
    return tryParse(text, locale).getOrThrow();
  }

  /**
   * Parses text into a quantity, reporting failure as a value rather than an exception.
   *
   * @see #parse(String, Locale)
   */
  public ParseResult<Q> tryParse(String text, @Nullable Locale locale) {
    Preconditions.checkNotNull(text);
    ParseResult<Q> result = doParse(text, locale);
    if (!result.isSuccess() && LOG.isLoggable(Level.FINE)) {
      LOG.fine(String.format("Failed to parse %s: %s", dimension, result.getError().get()));
    }
    return result;
  }

  private ParseResult<Q> doParse(String text, @Nullable Locale locale) {
    String input = text.trim();
    if (input.isEmpty()) {
      return failure(ParseError.Kind.EMPTY_INPUT, text, locale, null, null, null);
    }

    Locale numberLocale = UnitFormatter.resolve(locale);
    DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(numberLocale);
    UnitSystem units = registry.getCached(locale);
    Matcher matcher = pairPattern(units, dimension.getUnitType(), numberLocale).matcher(input);

    List<String[]> pairs = Lists.newArrayList();
    int position = 0;
    String lastValue = null;
    String lastUnit = null;
    while (matcher.find()) {
      if (!isSeparator(input.substring(position, matcher.start()), symbols)) {
        return failure(ParseError.Kind.INVALID_FRAGMENT, text, locale, lastValue, lastUnit, null);
      }
      lastValue = matcher.group(1);
      lastUnit = matcher.group(2);
      pairs.add(new String[] {lastValue, lastUnit});
      position = matcher.end();
    }
    if (!isSeparator(input.substring(position), symbols)) {
      return failure(ParseError.Kind.INVALID_FRAGMENT, text, locale, lastValue, lastUnit, null);
    }

    Q total = null;
    for (String[] pair : pairs) {
      String valueText = pair[0];
      String unitText = pair[1];
      U unit = units.parse(dimension.getUnitType(), unitText);
      if (unit.isUndefined()) {
        return failure(ParseError.Kind.UNRECOGNIZED_UNIT, text, locale, valueText, unitText, null);
      }
      double value;
      try {
        value = NumberParsing.parse(valueText, symbols);
      } catch (NumberFormatException e) {
        return failure(ParseError.Kind.MALFORMED_NUMBER, text, locale, valueText, unitText, e);
      }
      Q quantity = dimension.from(value, unit);
      total = total == null ? quantity : total.add(quantity);
    }

    if (total == null) {
      return failure(ParseError.Kind.NO_MATCHES, text, locale, null, null, null);
    }
    return ParseResult.success(total);
  }

  /**
   * Resolves a single unit abbreviation.
   *
   * @param text the abbreviation, matched exactly after trimming
   * @param locale the culture, or {@code null} for the registry's fallback culture
   * @return the unit
   * @throws NullPointerException if {@code text} is null
   * @throws QuantityParseException if {@code text} is blank or not a known abbreviation
   */
  public U parseUnit(String text, @Nullable Locale locale) {
    return tryParseUnit(text, locale).getOrThrow();
  }

  public ParseResult<U> tryParseUnit(String text, @Nullable Locale locale) {
    Preconditions.checkNotNull(text);
    if (text.trim().isEmpty()) {
      return failure(ParseError.Kind.EMPTY_INPUT, text, locale, null, null, null);
    }
    U unit = registry.parse(dimension.getUnitType(), text, locale);
    if (unit.isUndefined()) {
      return failure(ParseError.Kind.UNRECOGNIZED_UNIT, text, locale, null, text.trim(), null);
    }
    return ParseResult.success(unit);
  }

  private static <T> ParseResult<T> failure(ParseError.Kind kind, String input,
      @Nullable Locale locale, @Nullable String value, @Nullable String unit,
      @Nullable Throwable cause) {
    return ParseResult.failure(ParseError.builder(kind, input)
        .locale(locale)
        .matchedValue(value)
        .matchedUnit(unit)
        .cause(cause)
        .build());
  }

  private static boolean isSeparator(String gap, DecimalFormatSymbols symbols) {
    for (String token : FRAGMENT_SPLITTER.split(gap)) {
      if (token.equalsIgnoreCase(SEPARATOR_WORD)) {
        continue;
      }
      for (int i = 0; i < token.length(); i++) {
        char c = token.charAt(i);
        if (Character.isLetter(c) || isSign(c, symbols)) {
          return false;
        }
      }
    }
    return true;
  }

  // A sign detached from its number would otherwise be dropped.
  private static boolean isSign(char c, DecimalFormatSymbols symbols) {
    return c == '-' || c == '+' || c == symbols.getMinusSign();
  }

  /**
   * Returns the memoized pair pattern for the abbreviations of {@code unitType} in a culture view.
   */
  @VisibleForTesting
  static Pattern pairPattern(UnitSystem units, Class<?> unitType, Locale numberLocale) {
    return PAIR_PATTERNS.getUnchecked(new PatternKey(units, unitType, numberLocale));
  }

  /**
   * Builds the pattern matching one {@code <number> <unit>} pair.  Group 1 is the number and group
   * 2 the unit.
   */
  static Pattern pairPattern(DecimalFormatSymbols symbols, Collection<String> abbreviations) {
    char decimalSeparator = symbols.getDecimalSeparator();
    char groupingSeparator = symbols.getGroupingSeparator();

    StringBuilder numberChars = new StringBuilder("\\d.,")
        .append(escape(decimalSeparator))
        .append(escape(groupingSeparator));
    if (Character.isSpaceChar(groupingSeparator) || Character.isWhitespace(groupingSeparator)) {
      numberChars.append("\\s");
    }
    String value = String.format("([-+]?(?=\\d|%s\\d)[%s]*\\d(?:[eE][-+]?\\d+)?)",
        escape(decimalSeparator), numberChars);

    List<String> known = new ArrayList<String>(abbreviations);
    StringBuilder unit = new StringBuilder("\\s*(");
    if (!known.isEmpty()) {
      Collections.sort(known, LONGEST_FIRST);
      unit.append("(?:");
      String separator = "";
      for (String abbreviation : known) {
        unit.append(separator).append(Pattern.quote(abbreviation));
        separator = "|";
      }
      unit.append(")(?=[\\s\\d,]|$)|");
    }
    unit.append("(?!").append(SEPARATOR_WORD).append("(?:[\\s\\d,]|$))[^\\s\\d,]+)");
    return Pattern.compile(value + unit);
  }

  private static String escape(char c) {
    return String.format("\\x{%x}", (int) c);
  }

  /**
   * Identifies a compiled pair pattern: the abbreviations of one unit type in a culture view, and
   * the locale whose number symbols the pattern accepts.
   */
  private static final class PatternKey {
    private final UnitSystem units;
    private final Class<?> unitType;
    private final Locale numberLocale;

    PatternKey(UnitSystem units, Class<?> unitType, Locale numberLocale) {
      this.units = units;
      this.unitType = unitType;
      this.numberLocale = numberLocale;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof PatternKey)) {
        return false;
      }
      PatternKey that = (PatternKey) o;
      return units == that.units
          && unitType == that.unitType
          && numberLocale.equals(that.numberLocale);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(System.identityHashCode(units), unitType, numberLocale);
    }
  }
}
