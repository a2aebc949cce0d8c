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

import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import org.measure.common.base.MorePreconditions;

/**
 * An affine mapping between a unit and the base unit of its dimension:
 * {@code base = raw * scale + offset}.  Most units are purely multiplicative and have an offset
 * of zero.
 */
@Immutable
public final class Conversion {

  private final double scale;
  private final double offset;

  private Conversion(double scale, double offset) {
    MorePreconditions.checkFinite(scale, "Scale must be finite, got %s");
    Preconditions.checkArgument(scale != 0, "Scale must be non-zero");
    this.scale = scale;
    this.offset = MorePreconditions.checkFinite(offset, "Offset must be finite, got %s");
  }

  /**
   * Creates a purely multiplicative conversion.
   *
   * @param scale the number of base units in one unit
   * @return a conversion with a zero offset
   */
  public static Conversion scale(double scale) {
    return new Conversion(scale, 0);
  }

  /**
   * Creates a conversion with both a scale and an offset, as temperature scales need.
   *
   * @param scale the number of base units in one unit
   * @param offset the base value corresponding to zero of the unit
   * @return an affine conversion
   */
  public static Conversion affine(double scale, double offset) {
    return new Conversion(scale, offset);
  }

  public double getScale() {
    return scale;
  }

  public double getOffset() {
    return offset;
  }

  public double toBase(double value) {
    return value * scale + offset;
  }

  public double fromBase(double baseValue) {
    return (baseValue - offset) / scale;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof Conversion)) { return false; }

    Conversion that = (Conversion) o;
    return new EqualsBuilder()
        .append(this.scale, that.scale)
        .append(this.offset, that.offset)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(scale)
        .append(offset)
        .toHashCode();
  }

  @Override
  public String toString() {
    return offset == 0
        ? String.format("x%s", scale)
        : String.format("x%s%+f", scale, offset);
  }
}
