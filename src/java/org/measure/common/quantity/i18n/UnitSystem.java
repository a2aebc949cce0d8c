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

package org.measure.common.quantity.i18n;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SetMultimap;

import org.measure.common.quantity.Unit;

/**
 * An immutable, culture-scoped view of the abbreviations held by an {@link AbbreviationRegistry}.
 * The view merges the data of every culture in its fallback chain, most specific culture first,
 * so lookups need no further fallback logic.
 *
 * <p>When two units of the same type share an abbreviation, {@link #parse(Class, String)} returns
 * the unit from the most specific culture, and within one culture the unit registered first.
 */
@Immutable
public final class UnitSystem {

  private final Locale locale;
  private final ImmutableList<Locale> chain;
  private final ImmutableMap<Unit<?>, ImmutableList<String>> abbreviations;
  private final ImmutableMap<Class<?>, ImmutableMap<String, Unit<?>>> unitsByAbbreviation;

  UnitSystem(Locale locale, List<Locale> chain,
      Map<Locale, ? extends SetMultimap<Unit<?>, String>> data) {
    this.locale = Preconditions.checkNotNull(locale);
    this.chain = ImmutableList.copyOf(chain);

    Map<Unit<?>, Set<String>> forward = new LinkedHashMap<Unit<?>, Set<String>>();
    Map<Class<?>, Map<String, Unit<?>>> reverse =
        new LinkedHashMap<Class<?>, Map<String, Unit<?>>>();
    for (Locale culture : this.chain) {
      SetMultimap<Unit<?>, String> cultureData = data.get(culture);
      if (cultureData == null) {
        continue;
      }
      for (Map.Entry<Unit<?>, String> entry : cultureData.entries()) {
        Unit<?> unit = entry.getKey();
        String abbreviation = entry.getValue();

        Set<String> strings = forward.get(unit);
        if (strings == null) {
          strings = new LinkedHashSet<String>();
          forward.put(unit, strings);
        }
        strings.add(abbreviation);

        Class<?> unitType = typeOf(unit);
        Map<String, Unit<?>> units = reverse.get(unitType);
        if (units == null) {
          units = new LinkedHashMap<String, Unit<?>>();
          reverse.put(unitType, units);
        }
        if (!units.containsKey(abbreviation)) {
          units.put(abbreviation, unit);
        }
      }
    }

    ImmutableMap.Builder<Unit<?>, ImmutableList<String>> forwardBuilder = ImmutableMap.builder();
    for (Map.Entry<Unit<?>, Set<String>> entry : forward.entrySet()) {
      forwardBuilder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    this.abbreviations = forwardBuilder.build();

    ImmutableMap.Builder<Class<?>, ImmutableMap<String, Unit<?>>> reverseBuilder =
        ImmutableMap.builder();
    for (Map.Entry<Class<?>, Map<String, Unit<?>>> entry : reverse.entrySet()) {
      reverseBuilder.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    this.unitsByAbbreviation = reverseBuilder.build();
  }

  static Class<?> typeOf(Unit<?> unit) {
    return ((Enum<?>) unit).getDeclaringClass();
  }

  /**
   * Returns the culture this view was created for.
   */
  public Locale getLocale() {
    return locale;
  }

  /**
   * Returns the cultures this view draws on, most specific first.
   */
  public ImmutableList<Locale> getChain() {
    return chain;
  }

  /**
   * Returns the abbreviation used when formatting {@code unit}: the first abbreviation of the most
   * specific culture that has one, or the unit's enum name if no culture does.
   */
  public <U extends Enum<U> & Unit<U>> String getDefaultAbbreviation(U unit) {
    List<String> strings = getAbbreviations(unit);
    return strings.isEmpty() ? unit.name() : strings.get(0);
  }

  /**
   * Returns every abbreviation accepted for {@code unit}, most specific culture first.
   */
  public <U extends Enum<U> & Unit<U>> ImmutableList<String> getAbbreviations(U unit) {
    Preconditions.checkNotNull(unit);
    ImmutableList<String> strings = abbreviations.get(unit);
    return strings == null ? ImmutableList.<String>of() : strings;
  }

  /**
   * Resolves an abbreviation to a unit.  Matching is exact and case sensitive after trimming
   * surrounding whitespace.
   *
   * @param unitType the type of unit to resolve
   * @param abbreviation the abbreviation to look up
   * @return the matching unit, or the undefined unit of {@code unitType} if none matches
   */
  public <U extends Enum<U> & Unit<U>> U parse(Class<U> unitType, String abbreviation) {
    Preconditions.checkNotNull(unitType);
    Preconditions.checkNotNull(abbreviation);

    ImmutableMap<String, Unit<?>> units = unitsByAbbreviation.get(unitType);
    Unit<?> unit = units == null ? null : units.get(abbreviation.trim());
    return unit == null ? undefinedOf(unitType) : unitType.cast(unit);
  }

  /**
   * Returns every abbreviation that {@link #parse(Class, String)} resolves for {@code unitType}.
   */
  public ImmutableSet<String> getAllAbbreviations(Class<?> unitType) {
    ImmutableMap<String, Unit<?>> units = unitsByAbbreviation.get(unitType);
    return units == null ? ImmutableSet.<String>of() : units.keySet();
  }

  private static <U extends Enum<U> & Unit<U>> U undefinedOf(Class<U> unitType) {
    for (U unit : unitType.getEnumConstants()) {
      if (unit.isUndefined()) {
        return unit;
      }
    }
    throw new IllegalStateException(unitType.getName() + " declares no undefined unit");
  }

  @Override
  public String toString() {
    return String.format("UnitSystem[%s, chain=%s]", locale.toLanguageTag(), chain);
  }
}
