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

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ObjectArrays;

/**
 * Formats quantity values together with a unit abbreviation.
 *
 * <p>Values are printed with grouping and at most the requested number of digits after the radix,
 * eg: {@code 1,234.57 m}.  Values below one keep that many significant digits so small magnitudes
 * are not rounded away, eg: {@code 0.0012 m}.  Magnitudes below {@value #SMALL} or from
 * {@value #LARGE} up are printed in scientific notation.
 */
public final class UnitFormatter {

  static final double SMALL = 1e-3;
  static final double LARGE = 1e15;

  private UnitFormatter() {
    // utility
  }

  /**
   * Formats a value and unit abbreviation separated by a space.
   *
   * @param value the magnitude to format
   * @param abbreviation the unit abbreviation to append
   * @param locale the locale whose number symbols to use, or {@code null} for the default format
   *     locale
   * @param significantDigitsAfterRadix the maximum number of digits after the radix
   * @return the formatted quantity
   */
  public static String format(double value, String abbreviation, @Nullable Locale locale,
      int significantDigitsAfterRadix) {
    Preconditions.checkNotNull(abbreviation);
    Preconditions.checkArgument(significantDigitsAfterRadix >= 0,
        "Digits after the radix must be non-negative, got %s", significantDigitsAfterRadix);
    return formatNumber(value, locale, significantDigitsAfterRadix) + " " + abbreviation;
  }

  static String formatNumber(double value, @Nullable Locale locale, int digits) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return String.valueOf(value);
    }
    DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(resolve(locale));
    if (value == 0) {
      return String.valueOf(symbols.getZeroDigit());
    }

    double magnitude = Math.abs(value);
    if (magnitude < SMALL || magnitude >= LARGE) {
      return decimalFormat("0." + Strings.repeat("#", Math.max(1, digits)) + "E0", symbols)
          .format(value);
    }
    if (magnitude < 1) {
      BigDecimal rounded =
          new BigDecimal(value).round(new MathContext(Math.max(1, digits), RoundingMode.HALF_UP));
      return decimalFormat("0.###################", symbols).format(rounded);
    }
    return decimalFormat(digits == 0 ? "#,##0" : "#,##0." + Strings.repeat("#", digits), symbols)
        .format(value);
  }

  private static DecimalFormat decimalFormat(String pattern, DecimalFormatSymbols symbols) {
    DecimalFormat format = new DecimalFormat(pattern, symbols);
    format.setRoundingMode(RoundingMode.HALF_UP);
    return format;
  }

  /**
   * Builds the arguments for a custom format template: the value and the abbreviation, followed
   * by {@code args}.
   */
  public static Object[] formatArgs(double value, String abbreviation, Object... args) {
    Preconditions.checkNotNull(args);
    return ObjectArrays.concat(new Object[] {value, abbreviation}, args, Object.class);
  }

  /**
   * Applies a {@link java.util.Formatter} template.
   *
   * @param locale the locale to format with, or {@code null} for the default format locale
   * @param format the template
   * @param args the template arguments
   * @return the formatted string
   */
  public static String format(@Nullable Locale locale, String format, Object... args) {
    return String.format(resolve(locale), Preconditions.checkNotNull(format), args);
  }

  static Locale resolve(@Nullable Locale locale) {
    return locale == null ? Locale.getDefault(Locale.Category.FORMAT) : locale;
  }
}
