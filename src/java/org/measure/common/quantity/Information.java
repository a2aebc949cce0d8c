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
 * An amount of digital information, stored in bits.
 */
public final class Information extends Quantity<Information, InformationUnit> {

  private static final double BITS_PER_BYTE = 8;

  public static final Dimension<Information, InformationUnit> DIMENSION =
      Dimension.<Information, InformationUnit>builder("Information", InformationUnit.class)
          .baseUnit(InformationUnit.BIT)
          .scale(InformationUnit.BYTE, BITS_PER_BYTE)
          .scale(InformationUnit.KILOBIT, decimal(1))
          .scale(InformationUnit.KILOBYTE, BITS_PER_BYTE * decimal(1))
          .scale(InformationUnit.MEGABIT, decimal(2))
          .scale(InformationUnit.MEGABYTE, BITS_PER_BYTE * decimal(2))
          .scale(InformationUnit.GIGABIT, decimal(3))
          .scale(InformationUnit.GIGABYTE, BITS_PER_BYTE * decimal(3))
          .scale(InformationUnit.TERABIT, decimal(4))
          .scale(InformationUnit.TERABYTE, BITS_PER_BYTE * decimal(4))
          .scale(InformationUnit.PETABIT, decimal(5))
          .scale(InformationUnit.PETABYTE, BITS_PER_BYTE * decimal(5))
          .scale(InformationUnit.KIBIBIT, binary(1))
          .scale(InformationUnit.KIBIBYTE, BITS_PER_BYTE * binary(1))
          .scale(InformationUnit.MEBIBIT, binary(2))
          .scale(InformationUnit.MEBIBYTE, BITS_PER_BYTE * binary(2))
          .scale(InformationUnit.GIBIBIT, binary(3))
          .scale(InformationUnit.GIBIBYTE, BITS_PER_BYTE * binary(3))
          .scale(InformationUnit.TEBIBIT, binary(4))
          .scale(InformationUnit.TEBIBYTE, BITS_PER_BYTE * binary(4))
          .scale(InformationUnit.PEBIBIT, binary(5))
          .scale(InformationUnit.PEBIBYTE, BITS_PER_BYTE * binary(5))
          .factory(new Function<Double, Information>() {
            @Override public Information apply(Double bits) {
              return new Information(bits);
            }
          })
          .build();

  public static final Information ZERO = new Information(0);

  public Information(double bits) {
    super(bits);
  }

  private static double decimal(int power) {
    return Math.pow(1000, power);
  }

  private static double binary(int power) {
    return Math.pow(1024, power);
  }

  @Override
  public Dimension<Information, InformationUnit> getDimension() {
    return DIMENSION;
  }

  public static Information from(double value, InformationUnit unit) {
    return DIMENSION.from(value, unit);
  }

  public static Information fromBits(double bits) {
    return from(bits, InformationUnit.BIT);
  }

  public static Information fromBytes(double bytes) {
    return from(bytes, InformationUnit.BYTE);
  }

  public static Information fromKilobits(double kilobits) {
    return from(kilobits, InformationUnit.KILOBIT);
  }

  public static Information fromKilobytes(double kilobytes) {
    return from(kilobytes, InformationUnit.KILOBYTE);
  }

  public static Information fromMegabits(double megabits) {
    return from(megabits, InformationUnit.MEGABIT);
  }

  public static Information fromMegabytes(double megabytes) {
    return from(megabytes, InformationUnit.MEGABYTE);
  }

  public static Information fromGigabits(double gigabits) {
    return from(gigabits, InformationUnit.GIGABIT);
  }

  public static Information fromGigabytes(double gigabytes) {
    return from(gigabytes, InformationUnit.GIGABYTE);
  }

  public static Information fromTerabits(double terabits) {
    return from(terabits, InformationUnit.TERABIT);
  }

  public static Information fromTerabytes(double terabytes) {
    return from(terabytes, InformationUnit.TERABYTE);
  }

  public static Information fromPetabits(double petabits) {
    return from(petabits, InformationUnit.PETABIT);
  }

  public static Information fromPetabytes(double petabytes) {
    return from(petabytes, InformationUnit.PETABYTE);
  }

  public static Information fromKibibits(double kibibits) {
    return from(kibibits, InformationUnit.KIBIBIT);
  }

  public static Information fromKibibytes(double kibibytes) {
    return from(kibibytes, InformationUnit.KIBIBYTE);
  }

  public static Information fromMebibits(double mebibits) {
    return from(mebibits, InformationUnit.MEBIBIT);
  }

  public static Information fromMebibytes(double mebibytes) {
    return from(mebibytes, InformationUnit.MEBIBYTE);
  }

  public static Information fromGibibits(double gibibits) {
    return from(gibibits, InformationUnit.GIBIBIT);
  }

  public static Information fromGibibytes(double gibibytes) {
    return from(gibibytes, InformationUnit.GIBIBYTE);
  }

  public static Information fromTebibits(double tebibits) {
    return from(tebibits, InformationUnit.TEBIBIT);
  }

  public static Information fromTebibytes(double tebibytes) {
    return from(tebibytes, InformationUnit.TEBIBYTE);
  }

  public static Information fromPebibits(double pebibits) {
    return from(pebibits, InformationUnit.PEBIBIT);
  }

  public static Information fromPebibytes(double pebibytes) {
    return from(pebibytes, InformationUnit.PEBIBYTE);
  }

  public double getBits() {
    return getBaseValue();
  }

  public double getBytes() {
    return as(InformationUnit.BYTE);
  }

  public double getKilobits() {
    return as(InformationUnit.KILOBIT);
  }

  public double getKilobytes() {
    return as(InformationUnit.KILOBYTE);
  }

  public double getMegabits() {
    return as(InformationUnit.MEGABIT);
  }

  public double getMegabytes() {
    return as(InformationUnit.MEGABYTE);
  }

  public double getGigabits() {
    return as(InformationUnit.GIGABIT);
  }

  public double getGigabytes() {
    return as(InformationUnit.GIGABYTE);
  }

  public double getTerabits() {
    return as(InformationUnit.TERABIT);
  }

  public double getTerabytes() {
    return as(InformationUnit.TERABYTE);
  }

  public double getPetabits() {
    return as(InformationUnit.PETABIT);
  }

  public double getPetabytes() {
    return as(InformationUnit.PETABYTE);
  }

  public double getKibibits() {
    return as(InformationUnit.KIBIBIT);
  }

  public double getKibibytes() {
    return as(InformationUnit.KIBIBYTE);
  }

  public double getMebibits() {
    return as(InformationUnit.MEBIBIT);
  }

  public double getMebibytes() {
    return as(InformationUnit.MEBIBYTE);
  }

  public double getGibibits() {
    return as(InformationUnit.GIBIBIT);
  }

  public double getGibibytes() {
    return as(InformationUnit.GIBIBYTE);
  }

  public double getTebibits() {
    return as(InformationUnit.TEBIBIT);
  }

  public double getTebibytes() {
    return as(InformationUnit.TEBIBYTE);
  }

  public double getPebibits() {
    return as(InformationUnit.PEBIBIT);
  }

  public double getPebibytes() {
    return as(InformationUnit.PEBIBYTE);
  }

  public static Information parse(String text) {
    return parse(text, null);
  }

  public static Information parse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parse(text, locale);
  }

  public static ParseResult<Information> tryParse(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).tryParse(text, locale);
  }

  public static InformationUnit parseUnit(String text) {
    return parseUnit(text, null);
  }

  public static InformationUnit parseUnit(String text, @Nullable Locale locale) {
    return QuantityParser.of(DIMENSION).parseUnit(text, locale);
  }

  public static String getAbbreviation(InformationUnit unit, @Nullable Locale locale) {
    return AbbreviationRegistry.getDefault().getDefaultAbbreviation(unit, locale);
  }
}
