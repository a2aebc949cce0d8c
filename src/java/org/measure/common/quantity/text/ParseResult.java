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

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Objects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

/**
 * The outcome of a parse: either a value or the {@link ParseError} explaining why no value could
 * be produced.
 *
 * @param <T> the type of the parsed value
 */
public final class ParseResult<T> {
  private final Optional<T> value;
  private final Optional<ParseError> error;

  private ParseResult(Optional<T> value, Optional<ParseError> error) {
    this.value = value;
    this.error = error;
  }

  public static <T> ParseResult<T> success(T value) {
    return new ParseResult<T>(Optional.of(value), Optional.<ParseError>absent());
  }

  public static <T> ParseResult<T> failure(ParseError error) {
    return new ParseResult<T>(Optional.<T>absent(), Optional.of(error));
  }

  public boolean isSuccess() {
    return value.isPresent();
  }

  /**
   * Returns the parsed value, if the parse succeeded.
   */
  public Optional<T> getValue() {
    return value;
  }

  /**
   * Returns the reason the parse failed, if it did.
   */
  public Optional<ParseError> getError() {
    return error;
  }

  /**
   * Returns the parsed value if the parse succeeded; otherwise, throws.
   *
   * @return the parsed value
   * @throws QuantityParseException if the parse failed
   */
  public T getOrThrow() throws QuantityParseException {
    if (!isSuccess()) {
      throw error.get().toException();
    }
    return value.get();
  }

  /**
   * If this is a success, maps its value into a new success; otherwise just returns this failure.
   *
   * @param transformer the transformation to apply to the value
   * @param <M> the type the value will be mapped to
   * @return the mapped success or else the failure
   */
  public <M> ParseResult<M> map(Function<? super T, M> transformer) {
    Preconditions.checkNotNull(transformer);
    if (isSuccess()) {
      return success(transformer.apply(value.get()));
    } else {
      @SuppressWarnings("unchecked") // I am a failure so my value is never accessible
      ParseResult<M> self = (ParseResult<M>) this;
      return self;
    }
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof ParseResult)) {
      return false;
    }
    ParseResult<?> other = (ParseResult<?>) o;
    return Objects.equal(value, other.value) && Objects.equal(error, other.error);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value, error);
  }

  @Override
  public String toString() {
    return isSuccess()
        ? String.format("Success(%s)", value.get())
        : String.format("Failure(%s)", error.get());
  }
}
