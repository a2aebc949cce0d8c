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

import javax.annotation.Nullable;

/**
 * Thrown when a unit without a conversion reaches a conversion table, most commonly the
 * {@link Unit#isUndefined() undefined} sentinel.  This signals a programming error rather than a
 * recoverable condition.
 */
public class UnsupportedUnitException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final Unit<?> unit;

  public UnsupportedUnitException(String dimension, @Nullable Unit<?> unit) {
    super(String.format("%s has no conversion for unit %s", dimension, unit));
    this.unit = unit;
  }

  @Nullable
  public Unit<?> getUnit() {
    return unit;
  }
}
