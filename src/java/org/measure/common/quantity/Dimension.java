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

import java.util.Set;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

import org.measure.common.base.MorePreconditions;

/**
 * Describes a physical dimension: its name, its closed set of units, the base unit magnitudes are
 * stored in and the table converting every other unit to that base.  A dimension is the data that
 * specializes the generic {@link Quantity} engine; eg: {@link Length#DIMENSION}.
 *
 * @param <Q> the quantity type of the dimension
 * @param <U> the unit type of the dimension
 */
@Immutable
public final class Dimension<Q extends Quantity<Q, U>, U extends Enum<U> & Unit<U>> {

  private final String name;
  private final Class<U> unitType;
  private final U baseUnit;
  private final U undefinedUnit;
  private final ConversionTable<U> conversions;
  private final Function<Double, Q> factory;

  private Dimension(Builder<Q, U> builder) {
    this.name = builder.name;
    this.unitType = builder.unitType;
    this.baseUnit = Preconditions.checkNotNull(builder.baseUnit, "%s: no base unit", name);
    this.factory = Preconditions.checkNotNull(builder.factory, "%s: no factory", name);
    this.undefinedUnit = findUndefined(name, unitType);
    this.conversions = builder.conversions.build();

    Conversion base = conversions.factorFor(baseUnit);
    Preconditions.checkState(base.getScale() == 1 && base.getOffset() == 0,
        "%s: base unit %s must convert with scale 1 and offset 0, got %s", name, baseUnit, base);
  }

  private static <U extends Enum<U> & Unit<U>> U findUndefined(String name, Class<U> unitType) {
    U undefined = null;
    for (U unit : unitType.getEnumConstants()) {
      if (unit.isUndefined()) {
        Preconditions.checkState(undefined == null,
            "%s: more than one undefined unit: %s, %s", name, undefined, unit);
        undefined = unit;
      }
    }
    Preconditions.checkState(undefined != null, "%s: %s has no undefined unit", name, unitType);
    return undefined;
  }

  public String getName() {
    return name;
  }

  public Class<U> getUnitType() {
    return unitType;
  }

  public U getBaseUnit() {
    return baseUnit;
  }

  public U getUndefinedUnit() {
    return undefinedUnit;
  }

  public ConversionTable<U> getConversions() {
    return conversions;
  }

  /**
   * Returns every unit of the dimension except the undefined sentinel.
   */
  public Set<U> units() {
    return conversions.units();
  }

  public Q fromBase(double baseValue) {
    return factory.apply(baseValue);
  }

  public Q zero() {
    return fromBase(0);
  }

  /**
   * Creates a quantity from a value expressed in {@code unit}.
   *
   * @param value the magnitude in {@code unit}
   * @param unit the unit the value is expressed in
   * @return the quantity
   * @throws UnsupportedUnitException if {@code unit} is the undefined sentinel
   */
  public Q from(double value, U unit) {
    return fromBase(conversions.toBase(value, unit));
  }

  @Override
  public String toString() {
    return name;
  }

  public static <Q extends Quantity<Q, U>, U extends Enum<U> & Unit<U>> Builder<Q, U> builder(
      String name, Class<U> unitType) {
    return new Builder<Q, U>(name, unitType);
  }

  public static class Builder<Q extends Quantity<Q, U>, U extends Enum<U> & Unit<U>> {
    private final String name;
    private final Class<U> unitType;
    private final ConversionTable.Builder<U> conversions;
    private U baseUnit;
    private Function<Double, Q> factory;

    Builder(String name, Class<U> unitType) {
      this.name = MorePreconditions.checkNotBlank(name);
      this.unitType = Preconditions.checkNotNull(unitType);
      this.conversions = ConversionTable.builder(name, unitType);
    }

    public Builder<Q, U> baseUnit(U baseUnit) {
      this.baseUnit = Preconditions.checkNotNull(baseUnit);
      return scale(baseUnit, 1);
    }

    public Builder<Q, U> scale(U unit, double scale) {
      conversions.scale(unit, scale);
      return this;
    }

    public Builder<Q, U> affine(U unit, double scale, double offset) {
      conversions.affine(unit, scale, offset);
      return this;
    }

    public Builder<Q, U> factory(Function<Double, Q> factory) {
      this.factory = Preconditions.checkNotNull(factory);
      return this;
    }

    public Dimension<Q, U> build() {
      return new Dimension<Q, U>(this);
    }
  }
}
