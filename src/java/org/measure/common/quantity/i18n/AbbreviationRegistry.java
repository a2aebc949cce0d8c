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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import com.google.common.base.Preconditions;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import org.measure.common.quantity.Unit;

/**
 * Maps units to the abbreviations used for them in each culture, and back.
 *
 * <p>The registry is read-mostly.  Its data is held as one immutable generation that readers
 * access without locking; every mutation builds and publishes a new generation, which discards all
 * previously cached {@link UnitSystem culture views}.
 *
 * <p>A process-wide instance populated from the bundled abbreviation data is available from
 * {@link #getDefault()}; independent instances are created with {@link #builder()}.
 */
@ThreadSafe
public final class AbbreviationRegistry {

  private static final Logger LOG = Logger.getLogger(AbbreviationRegistry.class.getName());

  /**
   * System property naming the culture used when a lookup supplies none or the requested one has
   * no data, as a language tag.
   */
  public static final String FALLBACK_LOCALE_PROPERTY =
      "org.measure.common.quantity.fallbackLocale";

  /**
   * System property naming the classpath resource the default registry is loaded from.
   */
  public static final String ABBREVIATIONS_PROPERTY = "org.measure.common.quantity.abbreviations";

  private static final class DefaultHolder {
    private static final AbbreviationRegistry INSTANCE = createDefault();
  }

  private final Locale fallbackLocale;

  @GuardedBy("this")
  private final Map<Locale, SetMultimap<Unit<?>, String>> data =
      new LinkedHashMap<Locale, SetMultimap<Unit<?>, String>>();

  private volatile State state;

  private AbbreviationRegistry(Locale fallbackLocale, @Nullable AbbreviationSource source) {
    this.fallbackLocale = Preconditions.checkNotNull(fallbackLocale);
    synchronized (this) {
      if (source != null) {
        List<AbbreviationEntry<?>> entries = source.load();
        for (AbbreviationEntry<?> entry : entries) {
          add(entry.getUnit(), entry.getLocale(), entry.getAbbreviations());
        }
        LOG.info(String.format("Loaded %d abbreviation entries for cultures %s", entries.size(),
            data.keySet()));
      }
      publish();
    }
  }

  /**
   * Returns the process-wide registry, creating it on first use from the bundled abbreviation
   * resource.  The resource and the fallback culture may be overridden with the
   * {@value #ABBREVIATIONS_PROPERTY} and {@value #FALLBACK_LOCALE_PROPERTY} system properties,
   * which are read once.
   *
   * @return the default registry
   * @throws IllegalStateException if the abbreviation data cannot be loaded
   */
  public static AbbreviationRegistry getDefault() {
    return DefaultHolder.INSTANCE;
  }

  private static AbbreviationRegistry createDefault() {
    String fallback = System.getProperty(FALLBACK_LOCALE_PROPERTY);
    String resource = System.getProperty(ABBREVIATIONS_PROPERTY,
        ResourceAbbreviationSource.DEFAULT_RESOURCE);
    return builder()
        .fallbackLocale(fallback == null ? Cultures.DEFAULT_FALLBACK
            : Cultures.forLanguageTag(fallback))
        .source(new ResourceAbbreviationSource(resource))
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Locale getFallbackLocale() {
    return fallbackLocale;
  }

  /**
   * Returns the cultures that currently have data, in the order they were first registered.
   */
  public ImmutableSet<Locale> getLocales() {
    return state.data.keySet();
  }

  /**
   * Returns the view of this registry for a culture.  Views are built at most once per culture
   * and generation.
   *
   * @param locale the culture, or {@code null} for the fallback culture
   * @return the culture's view
   */
  public UnitSystem getCached(@Nullable Locale locale) {
    return state.views.getUnchecked(locale == null ? fallbackLocale : locale);
  }

  /**
   * Returns the abbreviation used when formatting {@code unit} in {@code locale}.  Never fails:
   * a unit with no abbreviation in any culture of the chain yields its enum name.
   */
  public <U extends Enum<U> & Unit<U>> String getDefaultAbbreviation(U unit,
      @Nullable Locale locale) {
    return getCached(locale).getDefaultAbbreviation(unit);
  }

  public <U extends Enum<U> & Unit<U>> ImmutableList<String> getAbbreviations(U unit,
      @Nullable Locale locale) {
    return getCached(locale).getAbbreviations(unit);
  }

  /**
   * Resolves an abbreviation to a unit.
   *
   * @param unitType the type of unit to resolve
   * @param abbreviation the abbreviation, matched exactly after trimming
   * @param locale the culture, or {@code null} for the fallback culture
   * @return the unit, or the undefined unit of {@code unitType} if nothing matches
   */
  public <U extends Enum<U> & Unit<U>> U parse(Class<U> unitType, String abbreviation,
      @Nullable Locale locale) {
    return getCached(locale).parse(unitType, abbreviation);
  }

  /**
   * Adds abbreviations for a unit in a culture.  Abbreviations already registered for the unit
   * keep their position; new ones are appended, so the preferred abbreviation only changes if the
   * unit had none.
   *
   * @throws IllegalArgumentException if {@code unit} is undefined or no abbreviation is given
   */
  public synchronized <U extends Enum<U> & Unit<U>> void register(U unit, Locale locale,
      String... abbreviations) {
    AbbreviationEntry<U> entry = AbbreviationEntry.of(unit, locale, abbreviations);
    add(entry.getUnit(), entry.getLocale(), entry.getAbbreviations());
    publish();
  }

  /**
   * Replaces the abbreviations of a unit in a culture.  The first of {@code abbreviations}
   * becomes the unit's preferred abbreviation.
   */
  public synchronized <U extends Enum<U> & Unit<U>> void replace(U unit, Locale locale,
      String... abbreviations) {
    AbbreviationEntry<U> entry = AbbreviationEntry.of(unit, locale, abbreviations);
    SetMultimap<Unit<?>, String> culture = data.get(locale);
    if (culture != null && culture.containsKey(unit)) {
      LOG.fine(String.format("Overriding abbreviations of %s in %s: %s -> %s", unit,
          locale.toLanguageTag(), culture.get(unit), entry.getAbbreviations()));
      culture.removeAll(unit);
    }
    add(entry.getUnit(), entry.getLocale(), entry.getAbbreviations());
    publish();
  }

  /**
   * Replaces all the data of a culture.
   *
   * @param locale the culture to replace
   * @param entries the culture's new data; every entry must be for {@code locale}
   */
  public synchronized void replaceCulture(Locale locale,
      Iterable<? extends AbbreviationEntry<?>> entries) {
    Preconditions.checkNotNull(locale);
    Preconditions.checkNotNull(entries);
    for (AbbreviationEntry<?> entry : entries) {
      Preconditions.checkArgument(locale.equals(entry.getLocale()),
          "Entry %s is not for culture %s", entry, locale.toLanguageTag());
    }

    // Cleared in place so the culture keeps its position in fallback chains.
    SetMultimap<Unit<?>, String> previous = data.get(locale);
    if (previous != null) {
      LOG.fine(String.format("Replacing %d abbreviations of culture %s",
          previous.size(), locale.toLanguageTag()));
      previous.clear();
    }
    for (AbbreviationEntry<?> entry : entries) {
      add(entry.getUnit(), entry.getLocale(), entry.getAbbreviations());
    }
    publish();
  }

  @GuardedBy("this")
  private void add(Unit<?> unit, Locale locale, List<String> abbreviations) {
    SetMultimap<Unit<?>, String> culture = data.get(locale);
    if (culture == null) {
      culture = LinkedHashMultimap.create();
      data.put(locale, culture);
    }
    for (String abbreviation : abbreviations) {
      if (LOG.isLoggable(Level.FINE)) {
        logDuplicate(culture, unit, locale, abbreviation);
      }
      culture.put(unit, abbreviation);
    }
  }

  private static void logDuplicate(SetMultimap<Unit<?>, String> culture, Unit<?> unit,
      Locale locale, String abbreviation) {
    Class<?> unitType = UnitSystem.typeOf(unit);
    for (Map.Entry<Unit<?>, String> existing : culture.entries()) {
      if (existing.getKey() != unit
          && UnitSystem.typeOf(existing.getKey()) == unitType
          && existing.getValue().equals(abbreviation)) {
        LOG.fine(String.format("Abbreviation '%s' of %s in %s is already used by %s; "
            + "parsing resolves it to %s", abbreviation, unit, locale.toLanguageTag(),
            existing.getKey(), existing.getKey()));
        return;
      }
    }
  }

  @GuardedBy("this")
  private void publish() {
    ImmutableMap.Builder<Locale, ImmutableSetMultimap<Unit<?>, String>> snapshot =
        ImmutableMap.builder();
    for (Map.Entry<Locale, SetMultimap<Unit<?>, String>> entry : data.entrySet()) {
      snapshot.put(entry.getKey(), ImmutableSetMultimap.copyOf(entry.getValue()));
    }
    state = new State(fallbackLocale, snapshot.build());
  }

  /**
   * One immutable generation of registry data together with the views computed from it.
   */
  private static final class State {
    private final ImmutableMap<Locale, ImmutableSetMultimap<Unit<?>, String>> data;
    private final LoadingCache<Locale, UnitSystem> views;

    State(final Locale fallbackLocale,
        final ImmutableMap<Locale, ImmutableSetMultimap<Unit<?>, String>> data) {
      this.data = data;
      this.views = CacheBuilder.newBuilder().build(new CacheLoader<Locale, UnitSystem>() {
        @Override public UnitSystem load(Locale locale) {
          return new UnitSystem(locale, Cultures.chain(locale, fallbackLocale, data.keySet()),
              data);
        }
      });
    }
  }

  public static class Builder {
    private Locale fallbackLocale = Cultures.DEFAULT_FALLBACK;
    private AbbreviationSource source;

    Builder() {
    }

    /**
     * Sets the culture consulted when a lookup supplies none or the requested one has no data.
     * Defaults to {@link Cultures#DEFAULT_FALLBACK}.
     */
    public Builder fallbackLocale(Locale fallbackLocale) {
      this.fallbackLocale = Preconditions.checkNotNull(fallbackLocale);
      return this;
    }

    /**
     * Sets the source the registry is initially populated from.  Without one the registry starts
     * empty.
     */
    public Builder source(AbbreviationSource source) {
      this.source = Preconditions.checkNotNull(source);
      return this;
    }

    /**
     * @throws IllegalStateException if the source fails to load
     */
    public AbbreviationRegistry build() {
      return new AbbreviationRegistry(fallbackLocale, source);
    }
  }
}
