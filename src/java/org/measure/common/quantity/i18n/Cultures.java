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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Utilities for resolving the cultures consulted when looking up unit abbreviations.
 */
public final class Cultures {

  /**
   * The default culture abbreviations fall back to.
   */
  public static final Locale DEFAULT_FALLBACK = Locale.US;

  private Cultures() {
    // utility
  }

  /**
   * Computes the fallback chain for a requested culture.  The chain holds, in order and without
   * repeats:
   * <ol>
   *   <li>the requested locale
   *   <li>its language-only form, eg: {@code ru} for {@code ru-RU}
   *   <li>every known locale sharing its language, in the iteration order of {@code known}
   *   <li>the same three steps for {@code fallback}
   *   <li>{@link Locale#ROOT}
   * </ol>
   *
   * @param requested the requested culture, or {@code null} to start the chain at the fallback
   * @param fallback the culture consulted when the requested one has no data
   * @param known the cultures that have registered data
   * @return the cultures to consult, most specific first
   */
  public static ImmutableList<Locale> chain(@Nullable Locale requested, Locale fallback,
      Collection<Locale> known) {
    Preconditions.checkNotNull(fallback);
    Preconditions.checkNotNull(known);

    Set<Locale> chain = new LinkedHashSet<Locale>();
    if (requested != null) {
      addFamily(chain, requested, known);
    }
    addFamily(chain, fallback, known);
    chain.add(Locale.ROOT);
    return ImmutableList.copyOf(chain);
  }

  private static void addFamily(Set<Locale> chain, Locale locale, Collection<Locale> known) {
    chain.add(locale);
    String language = locale.getLanguage();
    if (language.isEmpty()) {
      return;
    }
    chain.add(new Locale(language));
    for (Locale candidate : known) {
      if (language.equals(candidate.getLanguage())) {
        chain.add(candidate);
      }
    }
  }

  /**
   * Parses a BCP 47 language tag, rejecting tags that do not name a language.
   *
   * @param languageTag a tag such as {@code en-US}
   * @return the locale for the tag
   * @throws IllegalArgumentException if the tag is blank or has no language
   */
  public static Locale forLanguageTag(String languageTag) {
    Preconditions.checkNotNull(languageTag);
    Locale locale = Locale.forLanguageTag(languageTag.trim());
    Preconditions.checkArgument(!locale.getLanguage().isEmpty(),
        "Not a language tag: '%s'", languageTag);
    return locale;
  }
}
