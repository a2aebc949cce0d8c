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
 * Units of {@link Information}.  Decimal prefixes (kilo, mega, ...) step by a factor of 1000 while
 * binary prefixes (kibi, mebi, ...) step by 1024, and both come in a bit and a byte flavor.  Thus
 * {@link #KIBIBIT} is 1024 bits and {@link #KIBIBYTE} is 1024 bytes or 8192 bits.
 */
public enum InformationUnit implements Unit<InformationUnit> {
  UNDEFINED,
  BIT,
  BYTE,
  KILOBIT,
  KILOBYTE,
  MEGABIT,
  MEGABYTE,
  GIGABIT,
  GIGABYTE,
  TERABIT,
  TERABYTE,
  PETABIT,
  PETABYTE,
  KIBIBIT,
  KIBIBYTE,
  MEBIBIT,
  MEBIBYTE,
  GIBIBIT,
  GIBIBYTE,
  TEBIBIT,
  TEBIBYTE,
  PEBIBIT,
  PEBIBYTE;

  @Override
  public boolean isUndefined() {
    return this == UNDEFINED;
  }
}
