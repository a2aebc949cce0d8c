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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Maps every defined unit of a dimension to the {@link Conversion} that projects it onto the
 * dimension's base unit.  Tables are exhaustive: {@link Builder#build()} refuses to create a table
 * that misses a defined unit, and the undefined sentinel never has an entry.
 *
 * @param <U> the unit type of the dimension
 */
@Immutable
public final class ConversionTable<U extends Enum<U> & Unit<U>> {

  private final String dimension;
  private final ImmutableMap<U, Conversion> conversions;

  private ConversionTable(String dimension, Map<U, Conversion> conversions) {
    this.dimension = dimension;
    this.conversions = Maps.immutableEnumMap(conversions);
  }

  /**
   * Returns the conversion registered for {@code unit}.
   *
   * @param unit the unit to look up
   * @return the unit's conversion
   * @throws UnsupportedUnitException if the unit has no conversion, eg: the undefined sentinel
   */
  public Conversion factorFor(U unit) {
    Preconditions.checkNotNull(unit);
    Conversion conversion = conversions.get(unit);
    if (conversion == null) {
      throw new UnsupportedUnitException(dimension, unit);
    }
    return conversion;
  }

  public double toBase(double value, U unit) {
    return factorFor(unit).toBase(value);
  }

  public double fromBase(double baseValue, U unit) {
    return factorFor(unit).fromBase(baseValue);
  }

  /**
   * Returns the units this table converts, in declaration order.
   */
  public Set<U> units() {
    return conversions.keySet();
  }

  public static <U extends Enum<U> & Unit<U>> Builder<U> builder(String dimension,
      Class<U> unitType) {
    return new Builder<U>(dimension, unitType);
  }

  public static class Builder<U extends Enum<U> & Unit<U>> {
    private final String dimension;
    private final Class<U> unitType;
    private final Map<U, Conversion> conversions;

    Builder(String dimension, Class<U> unitType) {
      this.dimension = Preconditions.checkNotNull(dimension);
      this.unitType = Preconditions.checkNotNull(unitType);
      this.conversions = new EnumMap<U, Conversion>(unitType);
    }

    public Builder<U> scale(U unit, double scale) {
      return put(unit, Conversion.scale(scale));
    }

    public Builder<U> affine(U unit, double scale, double offset) {
      return put(unit, Conversion.affine(scale, offset));
    }

    public Builder<U> put(U unit, Conversion conversion) {
      Preconditions.checkNotNull(unit);
      Preconditions.checkNotNull(conversion);
      Preconditions.checkArgument(!unit.isUndefined(),
          "%s: the undefined unit cannot have a conversion", dimension);
      Preconditions.checkArgument(!conversions.containsKey(unit),
          "%s: duplicate conversion for %s", dimension, unit);
      conversions.put(unit, conversion);
      return this;
    }

    /**
     * Creates the table after checking that every defined unit has a conversion.
     *
     * @return the conversion table
     * @throws IllegalStateException if a defined unit is missing
     */
    public ConversionTable<U> build() {
      Set<U> defined = EnumSet.noneOf(unitType);
      for (U unit : unitType.getEnumConstants()) {
        if (!unit.isUndefined()) {
          defined.add(unit);
        }
      }
      Set<U> missing = Sets.difference(defined, conversions.keySet());
      Preconditions.checkState(missing.isEmpty(),
          "%s: no conversion registered for %s", dimension, missing);
      return new ConversionTable<U>(dimension, conversions);
    }
  }
}
