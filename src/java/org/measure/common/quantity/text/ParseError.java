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

package org.measure.common.quantity.text;

import java.util.Locale;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

/**
 * Describes why text could not be parsed into a quantity or a unit.
 */
@Immutable
public final class ParseError {

  /**
   * The kinds of parse failure.
   */
  public enum Kind {
    /** The input was empty or only whitespace. */
    EMPTY_INPUT("Input is empty"),

    /** A unit token matched no abbreviation of the culture. */
    UNRECOGNIZED_UNIT("Unrecognized unit"),

    /** A number token could not be read with the culture's separators. */
    MALFORMED_NUMBER("Malformed number"),

    /** The input held text that is neither a quantity nor a separator. */
    INVALID_FRAGMENT("Invalid text"),

    /** The input held no quantity. */
    NO_MATCHES("No quantity found");

    private final String description;

    Kind(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

  private final Kind kind;
  private final String input;
  @Nullable private final String matchedValue;
  @Nullable private final String matchedUnit;
  @Nullable private final Locale locale;
  @Nullable private final Throwable cause;

  private ParseError(Builder builder) {
    this.kind = builder.kind;
    this.input = builder.input;
    this.matchedValue = builder.matchedValue;
    this.matchedUnit = builder.matchedUnit;
    this.locale = builder.locale;
    this.cause = builder.cause;
  }

  public static Builder builder(Kind kind, String input) {
    return new Builder(kind, input);
  }

  public Kind getKind() {
    return kind;
  }

  public String getInput() {
    return input;
  }

  /**
   * Returns the number text of the pair being processed when the failure occurred, if any.
   */
  public Optional<String> getMatchedValue() {
    return Optional.fromNullable(matchedValue);
  }

  /**
   * Returns the unit text of the pair being processed when the failure occurred, if any.
   */
  public Optional<String> getMatchedUnit() {
    return Optional.fromNullable(matchedUnit);
  }

  public Optional<Locale> getLocale() {
    return Optional.fromNullable(locale);
  }

  public Optional<Throwable> getCause() {
    return Optional.fromNullable(cause);
  }

  /**
   * Creates an exception reporting this error.
   */
  public QuantityParseException toException() {
    return new QuantityParseException(this);
  }

  /**
   * Returns a human readable description, eg:
   * {@code Unrecognized unit: "5 zz" (value "5", unit "zz", locale en-US)}.
   */
  public String getMessage() {
    StringBuilder message = new StringBuilder()
        .append(kind.getDescription())
        .append(": \"").append(input).append('"');
    if (matchedValue != null || matchedUnit != null || locale != null) {
      message.append(" (");
      String separator = "";
      if (matchedValue != null) {
        message.append("value \"").append(matchedValue).append('"');
        separator = ", ";
      }
      if (matchedUnit != null) {
        message.append(separator).append("unit \"").append(matchedUnit).append('"');
        separator = ", ";
      }
      if (locale != null) {
        message.append(separator).append("locale ").append(locale.toLanguageTag());
      }
      message.append(')');
    }
    return message.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof ParseError)) { return false; }

    ParseError that = (ParseError) o;
    return new EqualsBuilder()
        .append(this.kind, that.kind)
        .append(this.input, that.input)
        .append(this.matchedValue, that.matchedValue)
        .append(this.matchedUnit, that.matchedUnit)
        .append(this.locale, that.locale)
        .append(this.cause, that.cause)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(kind)
        .append(input)
        .append(matchedValue)
        .append(matchedUnit)
        .append(locale)
        .toHashCode();
  }

  @Override
  public String toString() {
    return getMessage();
  }

  public static class Builder {
    private final Kind kind;
    private final String input;
    private String matchedValue;
    private String matchedUnit;
    private Locale locale;
    private Throwable cause;

    Builder(Kind kind, String input) {
      this.kind = Preconditions.checkNotNull(kind);
      this.input = Preconditions.checkNotNull(input);
    }

    public Builder matchedValue(@Nullable String matchedValue) {
      this.matchedValue = matchedValue;
      return this;
    }

    public Builder matchedUnit(@Nullable String matchedUnit) {
      this.matchedUnit = matchedUnit;
      return this;
    }

    public Builder locale(@Nullable Locale locale) {
      this.locale = locale;
      return this;
    }

    public Builder cause(@Nullable Throwable cause) {
      this.cause = cause;
      return this;
    }

    public ParseError build() {
      return new ParseError(this);
    }
  }
}
