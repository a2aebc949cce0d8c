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

import com.google.common.base.Preconditions;

/**
 * Thrown when text cannot be parsed into a quantity or a unit.
 */
public class QuantityParseException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final transient ParseError error;

  public QuantityParseException(ParseError error) {
    super(Preconditions.checkNotNull(error).getMessage(), error.getCause().orNull());
    this.error = error;
  }

  /**
   * Returns the details of the failure.
   */
  public ParseError getError() {
    return error;
  }

  public ParseError.Kind getKind() {
    return error.getKind();
  }
}
