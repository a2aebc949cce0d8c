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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;

import org.measure.common.quantity.i18n.AbbreviationRegistry;
import org.measure.common.quantity.text.UnitFormatter;

/**
 * Represents an amount of a physical dimension and facilitates unambiguous communication of
 * measurements.  The magnitude is always held in the dimension's base unit; every other unit is a
 * view computed on demand by {@link #as(Enum)}.
 *
 * <p>Arithmetic operates directly on base magnitudes and never throws.  In particular division by
 * a zero quantity or a zero scalar yields an IEEE 754 infinity or NaN.
 *
 * <p>Equality and ordering compare base magnitudes exactly, with the semantics of
 * {@link Double#equals(Object)} and {@link Double#compare(double, double)}: there is no epsilon, so
 * two quantities reached through different conversions may differ in the last bit and compare
 * unequal.
 *
 * @param <Q> the concrete quantity type
 * @param <U> the type of unit that this quantity is expressed in
 */
@Immutable
public abstract class Quantity<Q extends Quantity<Q, U>, U extends Enum<U> & Unit<U>>
    implements Comparable<Q> {

  /**
   * Number of digits after the radix shown by {@link #toString()}.
   */
  public static final int DEFAULT_SIGNIFICANT_DIGITS = 2;

  private final double baseValue;

  protected Quantity(double baseValue) {
    this.baseValue = baseValue;
  }

  /**
   * Returns the dimension describing this quantity's units and conversions.
   */
  public abstract Dimension<Q, U> getDimension();

  /**
   * Returns the magnitude in the dimension's base unit.
   */
  public double getBaseValue() {
    return baseValue;
  }

  /**
   * Converts this quantity to a magnitude in {@code unit}.
   *
   * @param unit the unit to express this quantity in
   * @return the magnitude in {@code unit}
   * @throws UnsupportedUnitException if {@code unit} is the undefined sentinel
   */
  public double as(U unit) {
    return getDimension().getConversions().fromBase(baseValue, unit);
  }

  public Q negate() {
    return create(-baseValue);
  }

  public Q add(Q other) {
    return create(baseValue + other.getBaseValue());
  }

  public Q subtract(Q other) {
    return create(baseValue - other.getBaseValue());
  }

  public Q multiply(double scalar) {
    return create(baseValue * scalar);
  }

  public Q divide(double scalar) {
    return create(baseValue / scalar);
  }

  /**
   * Divides this quantity by another of the same dimension.
   *
   * @param other the divisor
   * @return the dimensionless ratio of the two base magnitudes; infinite or NaN if {@code other} is
   *     zero
   */
  public double divide(Q other) {
    return baseValue / other.getBaseValue();
  }

  /**
   * Multiplies a quantity by a scalar with the scalar on the left-hand side.
   */
  public static <Q extends Quantity<Q, U>, U extends Enum<U> & Unit<U>> Q multiply(double scalar,
      Q quantity) {
    return quantity.getDimension().fromBase(scalar * quantity.getBaseValue());
  }

  public boolean isLessThan(Q other) {
    return compareTo(other) < 0;
  }

  public boolean isGreaterThan(Q other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(Q other) {
    return Double.compare(baseValue, other.getBaseValue());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    Quantity<?, ?> other = (Quantity<?, ?>) obj;
    return Double.doubleToLongBits(baseValue) == Double.doubleToLongBits(other.baseValue);
  }

  @Override
  public int hashCode() {
    long bits = Double.doubleToLongBits(baseValue);
    return (int) (bits ^ (bits >>> 32));
  }

  /**
   * Formats this quantity in its base unit with {@link #DEFAULT_SIGNIFICANT_DIGITS} digits after
   * the radix; eg: {@code 1,234.57 m}.
   */
  @Override
  public String toString() {
    return toString(getDimension().getBaseUnit());
  }

  public String toString(U unit) {
    return toString(unit, null);
  }

  public String toString(U unit, @Nullable Locale locale) {
    return toString(unit, locale, DEFAULT_SIGNIFICANT_DIGITS);
  }

  /**
   * Formats this quantity in the given unit.
   *
   * @param unit the unit to express the value in
   * @param locale the locale for number formatting and the unit abbreviation, or {@code null} for
   *     the default format locale and the registry's fallback abbreviations
   * @param significantDigitsAfterRadix the maximum number of digits after the radix
   * @return the value followed by a space and the unit's abbreviation
   */
  public String toString(U unit, @Nullable Locale locale, int significantDigitsAfterRadix) {
    return toString(unit, locale, significantDigitsAfterRadix, AbbreviationRegistry.getDefault());
  }

  /**
   * Formats this quantity in the given unit, abbreviated as {@code registry} abbreviates it.
   *
   * @see #toString(Enum, Locale, int)
   */
  public String toString(U unit, @Nullable Locale locale, int significantDigitsAfterRadix,
      AbbreviationRegistry registry) {
    Preconditions.checkNotNull(registry);
    return UnitFormatter.format(as(unit), registry.getDefaultAbbreviation(unit, locale), locale,
        significantDigitsAfterRadix);
  }

  /**
   * Formats this quantity with a {@link java.util.Formatter} template.  The value and the unit
   * abbreviation are supplied as the first two format arguments ahead of {@code args}; eg:
   * {@code "%.1f %s"}.
   *
   * @param unit the unit to express the value in
   * @param locale the locale for formatting, or {@code null} for defaults
   * @param format the format template
   * @param args additional format arguments
   * @return the formatted string
   */
  public String toString(U unit, @Nullable Locale locale, String format, Object... args) {
    Preconditions.checkNotNull(format);
    return UnitFormatter.format(locale, format, UnitFormatter.formatArgs(as(unit),
        AbbreviationRegistry.getDefault().getDefaultAbbreviation(unit, locale), args));
  }

  private Q create(double value) {
    return getDimension().fromBase(value);
  }
}
