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
 * Force per unit area, stored in pascals.
 */
public final class Pressure extends Quantity<Pressure, PressureUnit> {

  private static final double STANDARD_ATMOSPHERE = 101325;
  private static final double STANDARD_GRAVITY = 9.80665;

  public static final Dimension<Pressure, PressureUnit> DIMENSION =
      Dimension.<Pressure, PressureUnit>builder("Pressure", PressureUnit.class)
          .baseUnit(PressureUnit.PASCAL)
          .scale(PressureUnit.ATMOSPHERE, STANDARD_ATMOSPHERE)
          .scale(PressureUnit.BAR, 1e5)
          .scale(PressureUnit.CENTIBAR, 1e3)
          .scale(PressureUnit.DECAPASCAL, 1e1)
          .scale(PressureUnit.DECIBAR, 1e4)
          .scale(PressureUnit.GIGAPASCAL, 1e9)
          .scale(PressureUnit.HECTOPASCAL, 1e2)
          .scale(PressureUnit.KILOBAR, 1e8)
          .scale(PressureUnit.KILOGRAM_FORCE_PER_SQUARE_CENTIMETER, STANDARD_GRAVITY * 1e4)
          .scale(PressureUnit.KILOPASCAL, 1e3)
          .scale(PressureUnit.MEGABAR, 1e11)
          .scale(PressureUnit.MEGAPASCAL, 1e6)
          .scale(PressureUnit.MICROPASCAL, 1e-6)
          .scale(PressureUnit.MILLIBAR, 1e2)
          .scale(PressureUnit.NEWTON_PER_SQUARE_METER, 1)
          .scale(PressureUnit.PSI, 6894.757293168)
          .scale(PressureUnit.TECHNICAL_ATMOSPHERE, STANDARD_GRAVITY * 1e4)
          .scale(PressureUnit.TORR, STANDARD_ATMOSPHERE / 760)
          .factory(new Function<Double, Pressure>() {
            @Override public Pressure apply(Double pascals) {
              return new Pressure(pascals);
            }
          })
          .build();

  public static final Pressure ZERO = new Pressure(0);

  public Pressure(double pascals) {
    super(pascals);
  }

  @Override
  public Dimension<Pressure, PressureUnit> getDimension() {
    return DIMENSION;
  }

  public static Pressure from(double value, PressureUnit unit) {
    return DIMENSION.from(value, unit);
  }

  public static Pressure fromAtmospheres(double atmospheres) {
    return from(atmospheres, PressureUnit.ATMOSPHERE);
  }

  public static Pressure fromBars(double bars) {
    return from(bars, PressureUnit.BAR);
  }

  public static Pressure fromCentibars(double centibars) {
    return from(centibars, PressureUnit.CENTIBAR);
  }

  public static Pressure fromDecapascals(double decapascals) {
    return from(decapascals, PressureUnit.DECAPASCAL);
  }

  public static Pressure fromDecibars(double decibars) {
    return from(decibars, PressureUnit.DECIBAR);
  }

  public static Pressure fromGigapascals(double gigapascals) {
    return from(gigapascals, PressureUnit.GIGAPASCAL);
  }

  public static Pressure fromHectopascals(double hectopascals) {
    return from(hectopascals, PressureUnit.HECTOPASCAL);
  }

  public static Pressure fromKilobars(double kilobars) {
    return from(kilobars, PressureUnit.KILOBAR);
  }

  public static Pressure fromKilogramsForcePerSquareCentimeter(double kgfPerSquareCentimeter) {
    return from(kgfPerSquareCentimeter, PressureUnit.KILOGRAM_FORCE_PER_SQUARE_CENTIMETER);
  }

  public static Pressure fromKilopascals(double kilopascals) {
    return from(kilopascals, PressureUnit.KILOPASCAL);
  }

  public static Pressure fromMegabars(double megabars) {
    return from(megabars, PressureUnit.MEGABAR);
  }

  public static Pressure fromMegapascals(double megapascals) {
    return from(megapascals, PressureUnit.MEGAPASCAL);
  }

  public static Pressure fromMicropascals(double micropascals) {
    return from(micropascals, PressureUnit.MICROPASCAL);
  }

  public static Pressure fromMillibars(double millibars) {
    return from(millibars, PressureUnit.MILLIBAR);
  }

  public static Pressure fromNewtonsPerSquareMeter(double newtonsPerSquareMeter) {
    return from(newtonsPerSquareMeter, PressureUnit.NEWTON_PER_SQUARE_METER);
  }

  public static Pressure fromPascals(double pascals) {
    return from(pascals, PressureUnit.PASCAL);
  }

  public static Pressure fromPsi(double psi) {
    return from(psi, PressureUnit.PSI);
  }

  public static Pressure fromTechnicalAtmospheres(double technicalAtmospheres) {
    return from(technicalAtmospheres, PressureUnit.TECHNICAL_ATMOSPHERE);
  }

  public static Pressure fromTorrs(double torrs) {
    return from(torrs, PressureUnit.TORR);
  }

  public double getAtmospheres() {
    return as(PressureUnit.ATMOSPHERE);
  }

  public double getBars() {
    return as(PressureUnit.BAR);
  }

  public double getCentibars() {
    return as(PressureUnit.CENTIBAR);
  }

  public double getDecapascals() {
    return as(PressureUnit.DECAPASCAL);
  }

  public double getDecibars() {
    return as(PressureUnit.DECIBAR);
  }

  public double getGigapascals() {
    return as(PressureUnit.GIGAPASCAL);
  }

  public double getHectopascals() {
    return as(PressureUnit.HECTOPASCAL);
  }

  public double getKilobars() {
    return as(PressureUnit.KILOBAR);
  }

  public double getKilogramsForcePerSquareCentimeter() {
    return as(PressureUnit.KILOGRAM_FORCE_PER_SQUARE_CENTIMETER);
  }

  public double getKilopascals() {
    return as(PressureUnit.KILOPASCAL);
  }

  public double getMegabars() {
    return as(PressureUnit.MEGABAR);
  }

  public double getMegapascals() {
    return as(PressureUnit.MEGAPASCAL);
  }

  public double getMicropascals() {
    return as(PressureUnit.MICROPASCAL);
  }

  public double getMillibars() {
    return as(PressureUnit.MILLIBAR);
  }

  public double getNewtonsPerSquareMeter() {
    return as(PressureUnit.NEWTON_PER_SQUARE_METER);
  }

  public double getPascals() {
    return getBaseValue();
  }

  public double getPsi() {
    return as(PressureUnit.PSI);
  }

  public double getTechnicalAtmospheres() {
    return as(PressureUnit.TECHNICAL_ATMOSPHERE);
  }

  public double getTorrs() {
    return as(PressureUnit.TORR);
  }

  public static Pressure parse(String text) {
    return parse(text, null);
  }

  public static Pressure parse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parse(text, locale);
  }

  public static ParseResult<Pressure> tryParse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).tryParse(text, locale);
  }

  public static PressureUnit parseUnit(String text) {
    return parseUnit(text, null);
  }

  public static PressureUnit parseUnit(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parseUnit(text, locale);
  }

  public static String getAbbreviation(PressureUnit unit, @Nullable Locale locale) {
    return AbbreviationRegistry.getDefault().getDefaultAbbreviation(unit, locale);
  }
}
