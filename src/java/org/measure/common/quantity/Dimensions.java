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

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

/**
 * The dimensions known to this library.
 */
public final class Dimensions {

  private static final ImmutableList<Dimension<?, ?>> ALL = ImmutableList.<Dimension<?, ?>>of(
      Length.DIMENSION,
      Area.DIMENSION,
      Mass.DIMENSION,
      Pressure.DIMENSION,
      Temperature.DIMENSION,
      Duration.DIMENSION,
      Information.DIMENSION);

  private Dimensions() {
    // utility
  }

  public static ImmutableList<Dimension<?, ?>> all() {
    return ALL;
  }

  /**
   * Looks up a dimension by its {@link Dimension#getName() name}, eg: {@code Length}.
   *
   * @param name the case sensitive dimension name
   * @return the dimension if one is named {@code name}
   */
  public static Optional<Dimension<?, ?>> forName(String name) {
    for (Dimension<?, ?> dimension : ALL) {
      if (dimension.getName().equals(name)) {
        return Optional.<Dimension<?, ?>>of(dimension);
      }
    }
    return Optional.absent();
  }

  /**
   * Looks up the dimension whose units are of {@code unitType}.
   */
  public static Optional<Dimension<?, ?>> forUnitType(Class<?> unitType) {
    for (Dimension<?, ?> dimension : ALL) {
      if (dimension.getUnitType() == unitType) {
        return Optional.<Dimension<?, ?>>of(dimension);
      }
    }
    return Optional.absent();
  }
}
