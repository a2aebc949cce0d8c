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

import java.io.IOException;
import java.net.URL;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;

import org.measure.common.base.MorePreconditions;
import org.measure.common.quantity.Dimension;
import org.measure.common.quantity.Dimensions;
import org.measure.common.quantity.Unit;

/**
 * Loads abbreviations from a UTF-8 classpath resource.  Each non-blank line that does not start
 * with {@code #} has the form:
 * <pre>
 *   &lt;Dimension&gt;.&lt;UNIT&gt;.&lt;language-tag&gt; = abbreviation[|abbreviation...]
 * </pre>
 * eg: {@code Length.FOOT.en-US = ft|'}.  Entries are registered in file order.
 */
public class ResourceAbbreviationSource implements AbbreviationSource {

  private static final Logger LOG = Logger.getLogger(ResourceAbbreviationSource.class.getName());

  /**
   * The abbreviation data bundled with this library.
   */
  public static final String DEFAULT_RESOURCE =
      "org/measure/common/quantity/i18n/abbreviations.txt";

  private static final Splitter KEY_SPLITTER = Splitter.on('.').trimResults();
  private static final Splitter VALUE_SPLITTER = Splitter.on('|').trimResults().omitEmptyStrings();

  private final String resource;

  public ResourceAbbreviationSource() {
    this(DEFAULT_RESOURCE);
  }

  /**
   * @param resource the classpath resource to load, relative to the classpath root
   */
  public ResourceAbbreviationSource(String resource) {
    this.resource = MorePreconditions.checkNotBlank(resource);
  }

  @Override
  public List<AbbreviationEntry<?>> load() {
    URL url;
    try {
      url = Resources.getResource(resource);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Abbreviation resource not found: " + resource, e);
    }

    List<String> lines;
    try {
      lines = Resources.readLines(url, Charsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read abbreviation resource " + url, e);
    }
    LOG.fine(String.format("Read %d lines from %s", lines.size(), url));
    return parse(resource, lines);
  }

  /**
   * Parses abbreviation data.
   *
   * @param name the name of the data, used in error messages
   * @param lines the lines of the data
   * @return the entries, in line order
   * @throws IllegalStateException if a line is malformed
   */
  @VisibleForTesting
  static List<AbbreviationEntry<?>> parse(String name, List<String> lines) {
    ImmutableList.Builder<AbbreviationEntry<?>> entries = ImmutableList.builder();
    int lineNumber = 0;
    for (String line : lines) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      try {
        entries.add(parseLine(trimmed));
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException(
            String.format("%s:%d: %s (%s)", name, lineNumber, e.getMessage(), trimmed), e);
      }
    }
    return entries.build();
  }

  private static AbbreviationEntry<?> parseLine(String line) {
    int separator = line.indexOf('=');
    if (separator < 0) {
      throw new IllegalArgumentException("Missing '='");
    }

    List<String> key = ImmutableList.copyOf(KEY_SPLITTER.split(line.substring(0, separator)));
    if (key.size() != 3) {
      throw new IllegalArgumentException("Key must be <Dimension>.<UNIT>.<language-tag>");
    }
    Optional<Dimension<?, ?>> dimension = Dimensions.forName(key.get(0));
    if (!dimension.isPresent()) {
      throw new IllegalArgumentException("Unknown dimension " + key.get(0));
    }
    Locale locale = Cultures.forLanguageTag(key.get(2));
    List<String> abbreviations =
        ImmutableList.copyOf(VALUE_SPLITTER.split(line.substring(separator + 1)));
    return entry(dimension.get().getUnitType(), key.get(1), locale, abbreviations);
  }

  private static <U extends Enum<U> & Unit<U>> AbbreviationEntry<U> entry(Class<U> unitType,
      String unitName, Locale locale, List<String> abbreviations) {
    return AbbreviationEntry.of(Enum.valueOf(unitType, unitName), locale, abbreviations);
  }

  @Override
  public String toString() {
    return "classpath:" + resource;
  }
}
