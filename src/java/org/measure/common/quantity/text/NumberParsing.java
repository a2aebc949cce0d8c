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

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Reads decimal numbers written with a culture's separators, eg: {@code 1,234.5} in {@code en-US}
 * or {@code 1 234,5} in {@code ru-RU}.
 *
 * <p>Group separators are accepted anywhere in the integer part and nowhere else.  When a culture
 * groups digits with a space character any whitespace is accepted as a group separator, since
 * text typed by hand rarely carries the no-break space such cultures specify.
 */
public final class NumberParsing {

  private NumberParsing() {
    // utility
  }

  public static double parse(String text, @Nullable Locale locale) throws NumberFormatException {
    return parse(text, DecimalFormatSymbols.getInstance(UnitFormatter.resolve(locale)));
  }

  /**
   * Parses a number with an optional sign, group separators, a decimal separator and an exponent.
   *
   * @param text the number to parse
   * @param symbols the separators to expect
   * @return the number
   * @throws NumberFormatException if {@code text} is not a number in the given format
   */
  public static double parse(String text, DecimalFormatSymbols symbols)
      throws NumberFormatException {
    Preconditions.checkNotNull(text);
    Preconditions.checkNotNull(symbols);

    String number = text.trim();
    if (number.isEmpty()) {
      throw new NumberFormatException("Empty number");
    }

    StringBuilder canonical = new StringBuilder(number.length());
    int start = 0;
    char first = number.charAt(0);
    if (first == '-' || first == '+' || first == symbols.getMinusSign()) {
      canonical.append(first == '+' ? '+' : '-');
      start = 1;
    }

    String exponent = null;
    int end = number.length();
    int e = indexOfExponent(number, start);
    if (e >= 0) {
      exponent = number.substring(e + 1);
      end = e;
    }

    String mantissa = number.substring(start, end);
    char decimalSeparator = symbols.getDecimalSeparator();
    int radix = mantissa.indexOf(decimalSeparator);
    if (radix >= 0 && mantissa.indexOf(decimalSeparator, radix + 1) >= 0) {
      throw malformed(text, "more than one decimal separator");
    }

    String integerPart = radix < 0 ? mantissa : mantissa.substring(0, radix);
    String fractionPart = radix < 0 ? "" : mantissa.substring(radix + 1);
    appendIntegerDigits(canonical, integerPart, symbols.getGroupingSeparator(), text);
    if (integerPart.isEmpty() && fractionPart.isEmpty()) {
      throw malformed(text, "no digits");
    }
    if (!fractionPart.isEmpty()) {
      if (!isDigits(fractionPart)) {
        throw malformed(text, "invalid fraction");
      }
      canonical.append('.').append(fractionPart);
    }
    if (exponent != null) {
      String digits = exponent.startsWith("-") || exponent.startsWith("+")
          ? exponent.substring(1) : exponent;
      if (digits.isEmpty() || !isDigits(digits)) {
        throw malformed(text, "invalid exponent");
      }
      canonical.append('E').append(exponent);
    }
    return Double.parseDouble(canonical.toString());
  }

  private static int indexOfExponent(String number, int start) {
    for (int i = start; i < number.length(); i++) {
      char c = number.charAt(i);
      if (c == 'e' || c == 'E') {
        return i;
      }
    }
    return -1;
  }

  private static void appendIntegerDigits(StringBuilder canonical, String integerPart,
      char groupingSeparator, String text) {
    boolean spaceGrouping = Character.isSpaceChar(groupingSeparator)
        || Character.isWhitespace(groupingSeparator);
    boolean sawDigit = false;
    for (int i = 0; i < integerPart.length(); i++) {
      char c = integerPart.charAt(i);
      if (isDigit(c)) {
        canonical.append(c);
        sawDigit = true;
      } else if (c == groupingSeparator
          || (spaceGrouping && (Character.isWhitespace(c) || Character.isSpaceChar(c)))) {
        if (!sawDigit) {
          throw malformed(text, "group separator before the first digit");
        }
      } else {
        throw malformed(text, "unexpected character '" + c + "'");
      }
    }
    if (!sawDigit) {
      canonical.append('0');
    }
  }

  private static boolean isDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (!isDigit(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static NumberFormatException malformed(String text, String reason) {
    return new NumberFormatException(String.format("Not a number (%s): \"%s\"", reason, text));
  }
}
