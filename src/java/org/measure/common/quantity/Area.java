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
 * A two-dimensional extent, stored in square meters.
 */
public final class Area extends Quantity<Area, AreaUnit> {

  public static final Dimension<Area, AreaUnit> DIMENSION =
      Dimension.<Area, AreaUnit>builder("Area", AreaUnit.class)
          .baseUnit(AreaUnit.SQUARE_METER)
          .scale(AreaUnit.ACRE, 4046.86)
          .scale(AreaUnit.HECTARE, 1e4)
          .scale(AreaUnit.SQUARE_CENTIMETER, 1e-4)
          .scale(AreaUnit.SQUARE_DECIMETER, 1e-2)
          .scale(AreaUnit.SQUARE_FOOT, 0.092903)
          .scale(AreaUnit.SQUARE_INCH, 0.00064516)
          .scale(AreaUnit.SQUARE_KILOMETER, 1e6)
          .scale(AreaUnit.SQUARE_MILE, 2.59e6)
          .scale(AreaUnit.SQUARE_MILLIMETER, 1e-6)
          .scale(AreaUnit.SQUARE_YARD, 0.836127)
          .factory(new Function<Double, Area>() {
            @Override public Area apply(Double squareMeters) {
              return new Area(squareMeters);
            }
          })
          .build();

  public static final Area ZERO = new Area(0);

  public Area(double squareMeters) {
    super(squareMeters);
  }

  @Override
  public Dimension<Area, AreaUnit> getDimension() {
    return DIMENSION;
  }

  public static Area from(double value, AreaUnit unit) {
    return DIMENSION.from(value, unit);
  }

  public static Area fromAcres(double acres) {
    return from(acres, AreaUnit.ACRE);
  }

  public static Area fromHectares(double hectares) {
    return from(hectares, AreaUnit.HECTARE);
  }

  public static Area fromSquareCentimeters(double squareCentimeters) {
    return from(squareCentimeters, AreaUnit.SQUARE_CENTIMETER);
  }

  public static Area fromSquareDecimeters(double squareDecimeters) {
    return from(squareDecimeters, AreaUnit.SQUARE_DECIMETER);
  }

  public static Area fromSquareFeet(double squareFeet) {
    return from(squareFeet, AreaUnit.SQUARE_FOOT);
  }

  public static Area fromSquareInches(double squareInches) {
    return from(squareInches, AreaUnit.SQUARE_INCH);
  }

  public static Area fromSquareKilometers(double squareKilometers) {
    return from(squareKilometers, AreaUnit.SQUARE_KILOMETER);
  }

  public static Area fromSquareMeters(double squareMeters) {
    return from(squareMeters, AreaUnit.SQUARE_METER);
  }

  public static Area fromSquareMiles(double squareMiles) {
    return from(squareMiles, AreaUnit.SQUARE_MILE);
  }

  public static Area fromSquareMillimeters(double squareMillimeters) {
    return from(squareMillimeters, AreaUnit.SQUARE_MILLIMETER);
  }

  public static Area fromSquareYards(double squareYards) {
    return from(squareYards, AreaUnit.SQUARE_YARD);
  }

  public double getAcres() {
    return as(AreaUnit.ACRE);
  }

  public double getHectares() {
    return as(AreaUnit.HECTARE);
  }

  public double getSquareCentimeters() {
    return as(AreaUnit.SQUARE_CENTIMETER);
  }

  public double getSquareDecimeters() {
    return as(AreaUnit.SQUARE_DECIMETER);
  }

  public double getSquareFeet() {
    return as(AreaUnit.SQUARE_FOOT);
  }

  public double getSquareInches() {
    return as(AreaUnit.SQUARE_INCH);
  }

  public double getSquareKilometers() {
    return as(AreaUnit.SQUARE_KILOMETER);
  }

  public double getSquareMeters() {
    return getBaseValue();
  }

  public double getSquareMiles() {
    return as(AreaUnit.SQUARE_MILE);
  }

  public double getSquareMillimeters() {
    return as(AreaUnit.SQUARE_MILLIMETER);
  }

  public double getSquareYards() {
    return as(AreaUnit.SQUARE_YARD);
  }

  public static Area parse(String text) {
    return parse(text, null);
  }

  public static Area parse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parse(text, locale);
  }

  public static ParseResult<Area> tryParse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).tryParse(text, locale);
  }

  public static AreaUnit parseUnit(String text) {
    return parseUnit(text, null);
  }

  public static AreaUnit parseUnit(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parseUnit(text, locale);
  }

  public static String getAbbreviation(AreaUnit unit, @Nullable Locale locale) {
    return AbbreviationRegistry.getDefault().getDefaultAbbreviation(unit, locale);
  }
}
