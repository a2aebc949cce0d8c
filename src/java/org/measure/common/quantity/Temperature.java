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
 * A thermodynamic temperature, stored in kelvins.  Most scales are offset from absolute zero, so
 * their conversions carry an offset as well as a scale.
 *
 * <p>Arithmetic operates on kelvins: adding 10 °C to 10 °C yields 566.3 K (293.15 °C), not
 * 20 °C.  Temperature differences should be added and subtracted in kelvins or rankines.
 */
public final class Temperature extends Quantity<Temperature, TemperatureUnit> {

  private static final double ICE_POINT = 273.15;

  public static final Dimension<Temperature, TemperatureUnit> DIMENSION =
      Dimension.<Temperature, TemperatureUnit>builder("Temperature", TemperatureUnit.class)
          .baseUnit(TemperatureUnit.KELVIN)
          .affine(TemperatureUnit.DEGREE_CELSIUS, 1, ICE_POINT)
          .affine(TemperatureUnit.DEGREE_DELISLE, -2.0 / 3, ICE_POINT + 100)
          .affine(TemperatureUnit.DEGREE_FAHRENHEIT, 5.0 / 9, 459.67 * 5 / 9)
          .affine(TemperatureUnit.DEGREE_NEWTON, 100.0 / 33, ICE_POINT)
          .scale(TemperatureUnit.DEGREE_RANKINE, 5.0 / 9)
          .affine(TemperatureUnit.DEGREE_REAUMUR, 5.0 / 4, ICE_POINT)
          .affine(TemperatureUnit.DEGREE_ROEMER, 40.0 / 21, ICE_POINT - 7.5 * 40 / 21)
          .factory(new Function<Double, Temperature>() {
            @Override public Temperature apply(Double kelvins) {
              return new Temperature(kelvins);
            }
          })
          .build();

  public static final Temperature ZERO = new Temperature(0);

  public Temperature(double kelvins) {
    super(kelvins);
  }

  @Override
  public Dimension<Temperature, TemperatureUnit> getDimension() {
    return DIMENSION;
  }

  public static Temperature from(double value, TemperatureUnit unit) {
    return DIMENSION.from(value, unit);
  }

  public static Temperature fromDegreesCelsius(double degreesCelsius) {
    return from(degreesCelsius, TemperatureUnit.DEGREE_CELSIUS);
  }

  public static Temperature fromDegreesDelisle(double degreesDelisle) {
    return from(degreesDelisle, TemperatureUnit.DEGREE_DELISLE);
  }

  public static Temperature fromDegreesFahrenheit(double degreesFahrenheit) {
    return from(degreesFahrenheit, TemperatureUnit.DEGREE_FAHRENHEIT);
  }

  public static Temperature fromDegreesNewton(double degreesNewton) {
    return from(degreesNewton, TemperatureUnit.DEGREE_NEWTON);
  }

  public static Temperature fromDegreesRankine(double degreesRankine) {
    return from(degreesRankine, TemperatureUnit.DEGREE_RANKINE);
  }

  public static Temperature fromDegreesReaumur(double degreesReaumur) {
    return from(degreesReaumur, TemperatureUnit.DEGREE_REAUMUR);
  }

  public static Temperature fromDegreesRoemer(double degreesRoemer) {
    return from(degreesRoemer, TemperatureUnit.DEGREE_ROEMER);
  }

  public static Temperature fromKelvins(double kelvins) {
    return from(kelvins, TemperatureUnit.KELVIN);
  }

  public double getDegreesCelsius() {
    return as(TemperatureUnit.DEGREE_CELSIUS);
  }

  public double getDegreesDelisle() {
    return as(TemperatureUnit.DEGREE_DELISLE);
  }

  public double getDegreesFahrenheit() {
    return as(TemperatureUnit.DEGREE_FAHRENHEIT);
  }

  public double getDegreesNewton() {
    return as(TemperatureUnit.DEGREE_NEWTON);
  }

  public double getDegreesRankine() {
    return as(TemperatureUnit.DEGREE_RANKINE);
  }

  public double getDegreesReaumur() {
    return as(TemperatureUnit.DEGREE_REAUMUR);
  }

  public double getDegreesRoemer() {
    return as(TemperatureUnit.DEGREE_ROEMER);
  }

  public double getKelvins() {
    return getBaseValue();
  }

  public static Temperature parse(String text) {
    return parse(text, null);
  }

  public static Temperature parse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parse(text, locale);
  }

  public static ParseResult<Temperature> tryParse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).tryParse(text, locale);
  }

  public static TemperatureUnit parseUnit(String text) {
    return parseUnit(text, null);
  }

  public static TemperatureUnit parseUnit(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parseUnit(text, locale);
  }

  public static String getAbbreviation(TemperatureUnit unit, @Nullable Locale locale) {
    return AbbreviationRegistry.getDefault().getDefaultAbbreviation(unit, locale);
  }
}
