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

package org.measure.common.quantity;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.math.DoubleMath;

import org.measure.common.quantity.i18n.AbbreviationRegistry;
import org.measure.common.quantity.text.ParseResult;
import org.measure.common.quantity.text.QuantityParser;

/**
 * An amount of time, stored in seconds.  A month is 30 days and a year 365 days.
 */
public final class Duration extends Quantity<Duration, DurationUnit> {

  private static final double MINUTE = 60;
  private static final double HOUR = 60 * MINUTE;
  private static final double DAY = 24 * HOUR;

  public static final Dimension<Duration, DurationUnit> DIMENSION =
      Dimension.<Duration, DurationUnit>builder("Duration", DurationUnit.class)
          .baseUnit(DurationUnit.SECOND)
          .scale(DurationUnit.NANOSECOND, 1e-9)
          .scale(DurationUnit.MICROSECOND, 1e-6)
          .scale(DurationUnit.MILLISECOND, 1e-3)
          .scale(DurationUnit.MINUTE, MINUTE)
          .scale(DurationUnit.HOUR, HOUR)
          .scale(DurationUnit.DAY, DAY)
          .scale(DurationUnit.WEEK, 7 * DAY)
          .scale(DurationUnit.MONTH, 30 * DAY)
          .scale(DurationUnit.YEAR, 365 * DAY)
          .factory(new Function<Double, Duration>() {
            @Override public Duration apply(Double seconds) {
              return new Duration(seconds);
            }
          })
          .build();

  public static final Duration ZERO = new Duration(0);

  private static final int WHOLE_TOLERANCE_ULPS = 4;

  public Duration(double seconds) {
    super(seconds);
  }

  @Override
  public Dimension<Duration, DurationUnit> getDimension() {
    return DIMENSION;
  }

  public static Duration from(double value, DurationUnit unit) {
    return DIMENSION.from(value, unit);
  }

  /**
   * Creates a duration from a {@code java.util.concurrent} amount.
   *
   * @param amount the number of {@code timeUnit}s
   * @param timeUnit the unit {@code amount} is expressed in
   * @return the duration
   */
  public static Duration of(long amount, TimeUnit timeUnit) {
    return from(amount, DurationUnit.of(Preconditions.checkNotNull(timeUnit)));
  }

  public static Duration fromNanoseconds(double nanoseconds) {
    return from(nanoseconds, DurationUnit.NANOSECOND);
  }

  public static Duration fromMicroseconds(double microseconds) {
    return from(microseconds, DurationUnit.MICROSECOND);
  }

  public static Duration fromMilliseconds(double milliseconds) {
    return from(milliseconds, DurationUnit.MILLISECOND);
  }

  public static Duration fromSeconds(double seconds) {
    return from(seconds, DurationUnit.SECOND);
  }

  public static Duration fromMinutes(double minutes) {
    return from(minutes, DurationUnit.MINUTE);
  }

  public static Duration fromHours(double hours) {
    return from(hours, DurationUnit.HOUR);
  }

  public static Duration fromDays(double days) {
    return from(days, DurationUnit.DAY);
  }

  public static Duration fromWeeks(double weeks) {
    return from(weeks, DurationUnit.WEEK);
  }

  public static Duration fromMonths(double months) {
    return from(months, DurationUnit.MONTH);
  }

  public static Duration fromYears(double years) {
    return from(years, DurationUnit.YEAR);
  }

  public double getNanoseconds() {
    return as(DurationUnit.NANOSECOND);
  }

  public double getMicroseconds() {
    return as(DurationUnit.MICROSECOND);
  }

  public double getMilliseconds() {
    return as(DurationUnit.MILLISECOND);
  }

  public double getSeconds() {
    return getBaseValue();
  }

  public double getMinutes() {
    return as(DurationUnit.MINUTE);
  }

  public double getHours() {
    return as(DurationUnit.HOUR);
  }

  public double getDays() {
    return as(DurationUnit.DAY);
  }

  public double getWeeks() {
    return as(DurationUnit.WEEK);
  }

  public double getMonths() {
    return as(DurationUnit.MONTH);
  }

  public double getYears() {
    return as(DurationUnit.YEAR);
  }

  /**
   * Converts to a whole number of {@code timeUnit}s, truncating any fraction.  An amount within a
   * few ulps of a whole number is taken to be that number, so that conversion error in the stored
   * seconds does not truncate {@code of(n, unit).to(unit)} to {@code n - 1}.
   *
   * @param timeUnit the unit to express this duration in
   * @return the truncated amount, saturated at {@code Long.MIN_VALUE} and {@code Long.MAX_VALUE}
   */
  public long to(TimeUnit timeUnit) {
    double amount = as(DurationUnit.of(Preconditions.checkNotNull(timeUnit)));
    double nearest = Math.rint(amount);
    if (DoubleMath.isMathematicalInteger(nearest)
        && DoubleMath.fuzzyEquals(amount, nearest, WHOLE_TOLERANCE_ULPS * Math.ulp(nearest))) {
      return (long) nearest;
    }
    return (long) amount;
  }

  public static Duration parse(String text) {
    return parse(text, null);
  }

  public static Duration parse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parse(text, locale);
  }

  public static ParseResult<Duration> tryParse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).tryParse(text, locale);
  }

  public static DurationUnit parseUnit(String text) {
    return parseUnit(text, null);
  }

  public static DurationUnit parseUnit(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parseUnit(text, locale);
  }

  public static String getAbbreviation(DurationUnit unit, @Nullable Locale locale) {
    return AbbreviationRegistry.getDefault().getDefaultAbbreviation(unit, locale);
  }
}
