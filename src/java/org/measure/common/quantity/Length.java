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

import com.google.common.base.Function;

import org.measure.common.quantity.i18n.AbbreviationRegistry;
import org.measure.common.quantity.text.ParseResult;
import org.measure.common.quantity.text.QuantityParser;

/**
 * A distance, stored in meters.  Covers the SI multiples in common use together with the U.S.
 * customary and British imperial units.
 */
public final class Length extends Quantity<Length, LengthUnit> {

  public static final Dimension<Length, LengthUnit> DIMENSION =
      Dimension.<Length, LengthUnit>builder("Length", LengthUnit.class)
          .baseUnit(LengthUnit.METER)
          .scale(LengthUnit.CENTIMETER, 1e-2)
          .scale(LengthUnit.DECIMAL_DEGREE, 111194.92664455873)
          .scale(LengthUnit.DECIMETER, 1e-1)
          .scale(LengthUnit.FOOT, 0.3048)
          .scale(LengthUnit.INCH, 2.54e-2)
          .scale(LengthUnit.KILOMETER, 1e3)
          .scale(LengthUnit.MICROINCH, 2.54e-8)
          .scale(LengthUnit.MICROMETER, 1e-6)
          .scale(LengthUnit.MIL, 2.54e-5)
          .scale(LengthUnit.MILE, 1609.34)
          .scale(LengthUnit.MILLIMETER, 1e-3)
          .scale(LengthUnit.NANOMETER, 1e-9)
          .scale(LengthUnit.YARD, 0.9144)
          .factory(new Function<Double, Length>() {
            @Override public Length apply(Double meters) {
              return new Length(meters);
            }
          })
          .build();

  public static final Length ZERO = new Length(0);

  public Length(double meters) {
    super(meters);
  }

  @Override
  public Dimension<Length, LengthUnit> getDimension() {
    return DIMENSION;
  }

  public static Length from(double value, LengthUnit unit) {
    return DIMENSION.from(value, unit);
  }

  public static Length fromCentimeters(double centimeters) {
    return from(centimeters, LengthUnit.CENTIMETER);
  }

  public static Length fromDecimalDegrees(double decimalDegrees) {
    return from(decimalDegrees, LengthUnit.DECIMAL_DEGREE);
  }

  public static Length fromDecimeters(double decimeters) {
    return from(decimeters, LengthUnit.DECIMETER);
  }

  public static Length fromFeet(double feet) {
    return from(feet, LengthUnit.FOOT);
  }

  public static Length fromInches(double inches) {
    return from(inches, LengthUnit.INCH);
  }

  public static Length fromKilometers(double kilometers) {
    return from(kilometers, LengthUnit.KILOMETER);
  }

  public static Length fromMeters(double meters) {
    return from(meters, LengthUnit.METER);
  }

  public static Length fromMicroinches(double microinches) {
    return from(microinches, LengthUnit.MICROINCH);
  }

  public static Length fromMicrometers(double micrometers) {
    return from(micrometers, LengthUnit.MICROMETER);
  }

  public static Length fromMils(double mils) {
    return from(mils, LengthUnit.MIL);
  }

  public static Length fromMiles(double miles) {
    return from(miles, LengthUnit.MILE);
  }

  public static Length fromMillimeters(double millimeters) {
    return from(millimeters, LengthUnit.MILLIMETER);
  }

  public static Length fromNanometers(double nanometers) {
    return from(nanometers, LengthUnit.NANOMETER);
  }

  public static Length fromYards(double yards) {
    return from(yards, LengthUnit.YARD);
  }

  public double getCentimeters() {
    return as(LengthUnit.CENTIMETER);
  }

  public double getDecimalDegrees() {
    return as(LengthUnit.DECIMAL_DEGREE);
  }

  public double getDecimeters() {
    return as(LengthUnit.DECIMETER);
  }

  public double getFeet() {
    return as(LengthUnit.FOOT);
  }

  public double getInches() {
    return as(LengthUnit.INCH);
  }

  public double getKilometers() {
    return as(LengthUnit.KILOMETER);
  }

  public double getMeters() {
    return getBaseValue();
  }

  public double getMicroinches() {
    return as(LengthUnit.MICROINCH);
  }

  public double getMicrometers() {
    return as(LengthUnit.MICROMETER);
  }

  public double getMils() {
    return as(LengthUnit.MIL);
  }

  public double getMiles() {
    return as(LengthUnit.MILE);
  }

  public double getMillimeters() {
    return as(LengthUnit.MILLIMETER);
  }

  public double getNanometers() {
    return as(LengthUnit.NANOMETER);
  }

  public double getYards() {
    return as(LengthUnit.YARD);
  }

  /**
   * Parses one or more {@code <quantity> <unit>} pairs, eg: {@code "5.5 m"} or {@code "1ft 2in"},
   * into their sum.
   *
   * @see QuantityParser#parse(String, Locale)
   */
  public static Length parse(String text) {
    return parse(text, null);
  }

  public static Length parse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parse(text, locale);
  }

  public static ParseResult<Length> tryParse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).tryParse(text, locale);
  }

  public static LengthUnit parseUnit(String text) {
    return parseUnit(text, null);
  }

  public static LengthUnit parseUnit(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parseUnit(text, locale);
  }

  public static String getAbbreviation(LengthUnit unit, @Nullable Locale locale) {
    return AbbreviationRegistry.getDefault().getDefaultAbbreviation(unit, locale);
  }
}
