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

/**
 * Units of {@link Pressure}.
 */
public enum PressureUnit implements Unit<PressureUnit> {
  UNDEFINED,
  ATMOSPHERE,
  BAR,
  CENTIBAR,
  DECAPASCAL,
  DECIBAR,
  GIGAPASCAL,
  HECTOPASCAL,
  KILOBAR,
  KILOGRAM_FORCE_PER_SQUARE_CENTIMETER,
  KILOPASCAL,
  MEGABAR,
  MEGAPASCAL,
  MICROPASCAL,
  MILLIBAR,
  NEWTON_PER_SQUARE_METER,
  PASCAL,
  PSI,
  TECHNICAL_ATMOSPHERE,
  TORR;

  @Override
  public boolean isUndefined() {
    return this == UNDEFINED;
  }
}
