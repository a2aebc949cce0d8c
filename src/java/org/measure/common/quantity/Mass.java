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
 * An amount of matter, stored in kilograms.  Avoirdupois units use the international definition
 * of the pound (0.45359237 kg).
 */
public final class Mass extends Quantity<Mass, MassUnit> {

  public static final Dimension<Mass, MassUnit> DIMENSION =
      Dimension.<Mass, MassUnit>builder("Mass", MassUnit.class)
          .baseUnit(MassUnit.KILOGRAM)
          .scale(MassUnit.CENTIGRAM, 1e-5)
          .scale(MassUnit.DECAGRAM, 1e-2)
          .scale(MassUnit.DECIGRAM, 1e-4)
          .scale(MassUnit.GRAM, 1e-3)
          .scale(MassUnit.HECTOGRAM, 1e-1)
          .scale(MassUnit.KILOTONNE, 1e6)
          .scale(MassUnit.LONG_TON, 1016.0469088)
          .scale(MassUnit.MEGATONNE, 1e9)
          .scale(MassUnit.MICROGRAM, 1e-9)
          .scale(MassUnit.MILLIGRAM, 1e-6)
          .scale(MassUnit.NANOGRAM, 1e-12)
          .scale(MassUnit.OUNCE, 0.028349523125)
          .scale(MassUnit.POUND, 0.45359237)
          .scale(MassUnit.SHORT_TON, 907.18474)
          .scale(MassUnit.STONE, 6.35029318)
          .scale(MassUnit.TONNE, 1e3)
          .factory(new Function<Double, Mass>() {
            @Override public Mass apply(Double kilograms) {
              return new Mass(kilograms);
            }
          })
          .build();

  public static final Mass ZERO = new Mass(0);

  public Mass(double kilograms) {
    super(kilograms);
  }

  @Override
  public Dimension<Mass, MassUnit> getDimension() {
    return DIMENSION;
  }

  public static Mass from(double value, MassUnit unit) {
    return DIMENSION.from(value, unit);
  }

  public static Mass fromCentigrams(double centigrams) {
    return from(centigrams, MassUnit.CENTIGRAM);
  }

  public static Mass fromDecagrams(double decagrams) {
    return from(decagrams, MassUnit.DECAGRAM);
  }

  public static Mass fromDecigrams(double decigrams) {
    return from(decigrams, MassUnit.DECIGRAM);
  }

  public static Mass fromGrams(double grams) {
    return from(grams, MassUnit.GRAM);
  }

  public static Mass fromHectograms(double hectograms) {
    return from(hectograms, MassUnit.HECTOGRAM);
  }

  public static Mass fromKilograms(double kilograms) {
    return from(kilograms, MassUnit.KILOGRAM);
  }

  public static Mass fromKilotonnes(double kilotonnes) {
    return from(kilotonnes, MassUnit.KILOTONNE);
  }

  public static Mass fromLongTons(double longTons) {
    return from(longTons, MassUnit.LONG_TON);
  }

  public static Mass fromMegatonnes(double megatonnes) {
    return from(megatonnes, MassUnit.MEGATONNE);
  }

  public static Mass fromMicrograms(double micrograms) {
    return from(micrograms, MassUnit.MICROGRAM);
  }

  public static Mass fromMilligrams(double milligrams) {
    return from(milligrams, MassUnit.MILLIGRAM);
  }

  public static Mass fromNanograms(double nanograms) {
    return from(nanograms, MassUnit.NANOGRAM);
  }

  public static Mass fromOunces(double ounces) {
    return from(ounces, MassUnit.OUNCE);
  }

  public static Mass fromPounds(double pounds) {
    return from(pounds, MassUnit.POUND);
  }

  public static Mass fromShortTons(double shortTons) {
    return from(shortTons, MassUnit.SHORT_TON);
  }

  public static Mass fromStone(double stone) {
    return from(stone, MassUnit.STONE);
  }

  public static Mass fromTonnes(double tonnes) {
    return from(tonnes, MassUnit.TONNE);
  }

  public double getCentigrams() {
    return as(MassUnit.CENTIGRAM);
  }

  public double getDecagrams() {
    return as(MassUnit.DECAGRAM);
  }

  public double getDecigrams() {
    return as(MassUnit.DECIGRAM);
  }

  public double getGrams() {
    return as(MassUnit.GRAM);
  }

  public double getHectograms() {
    return as(MassUnit.HECTOGRAM);
  }

  public double getKilograms() {
    return getBaseValue();
  }

  public double getKilotonnes() {
    return as(MassUnit.KILOTONNE);
  }

  public double getLongTons() {
    return as(MassUnit.LONG_TON);
  }

  public double getMegatonnes() {
    return as(MassUnit.MEGATONNE);
  }

  public double getMicrograms() {
    return as(MassUnit.MICROGRAM);
  }

  public double getMilligrams() {
    return as(MassUnit.MILLIGRAM);
  }

  public double getNanograms() {
    return as(MassUnit.NANOGRAM);
  }

  public double getOunces() {
    return as(MassUnit.OUNCE);
  }

  public double getPounds() {
    return as(MassUnit.POUND);
  }

  public double getShortTons() {
    return as(MassUnit.SHORT_TON);
  }

  public double getStone() {
    return as(MassUnit.STONE);
  }

  public double getTonnes() {
    return as(MassUnit.TONNE);
  }

  public static Mass parse(String text) {
    return parse(text, null);
  }

  public static Mass parse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parse(text, locale);
  }

  public static ParseResult<Mass> tryParse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).tryParse(text, locale);
  }

  public static MassUnit parseUnit(String text) {
    return parseUnit(text, null);
  }

  public static MassUnit parseUnit(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parseUnit(text, locale);
  }

  public static String getAbbreviation(MassUnit unit, @Nullable Locale locale) {
    return AbbreviationRegistry.getDefault().getDefaultAbbreviation(unit, locale);
  }
}
