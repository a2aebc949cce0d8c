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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import org.measure.common.base.MorePreconditions;
import org.measure.common.quantity.Unit;

/**
 * The abbreviations accepted for one unit in one culture.  The first abbreviation is the preferred
 * one and is used when formatting.
 *
 * @param <U> the unit type
 */
@Immutable
public final class AbbreviationEntry<U extends Enum<U> & Unit<U>> {

  private final U unit;
  private final Locale locale;
  private final ImmutableList<String> abbreviations;

  private AbbreviationEntry(U unit, Locale locale, List<String> abbreviations) {
    this.unit = Preconditions.checkNotNull(unit);
    Preconditions.checkArgument(!unit.isUndefined(), "Cannot register abbreviations for %s", unit);
    this.locale = Preconditions.checkNotNull(locale);
    MorePreconditions.checkNotBlank(abbreviations, "No abbreviations given for %s", unit);
    for (String abbreviation : abbreviations) {
      MorePreconditions.checkNotBlank(abbreviation, "Blank abbreviation given for %s", unit);
    }
    this.abbreviations = ImmutableList.copyOf(abbreviations);
  }

  public static <U extends Enum<U> & Unit<U>> AbbreviationEntry<U> of(U unit, Locale locale,
      String... abbreviations) {
    return of(unit, locale, Arrays.asList(abbreviations));
  }

  public static <U extends Enum<U> & Unit<U>> AbbreviationEntry<U> of(U unit, Locale locale,
      List<String> abbreviations) {
    return new AbbreviationEntry<U>(unit, locale, abbreviations);
  }

  public U getUnit() {
    return unit;
  }

  public Locale getLocale() {
    return locale;
  }

  public ImmutableList<String> getAbbreviations() {
    return abbreviations;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof AbbreviationEntry)) { return false; }

    AbbreviationEntry<?> that = (AbbreviationEntry<?>) o;
    return new EqualsBuilder()
        .append(this.unit, that.unit)
        .append(this.locale, that.locale)
        .append(this.abbreviations, that.abbreviations)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(unit)
        .append(locale)
        .append(abbreviations)
        .toHashCode();
  }

  @Override
  public String toString() {
    return String.format("%s.%s[%s]=%s", unit.getDeclaringClass().getSimpleName(), unit,
        locale.toLanguageTag(), abbreviations);
  }
}
