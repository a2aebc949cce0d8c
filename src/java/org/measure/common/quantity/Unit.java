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
 * Represents a unit of a given physical dimension; eg: length.  Instances represent specific
 * units of the dimension; eg: meters.
 *
 * <p>Every dimension's unit enumeration carries exactly one sentinel value that stands for "no unit
 * resolved".  Parsing paths return it instead of failing, and it is never a valid conversion
 * target.
 *
 * @param <U> the type of the concrete unit implementation
 */
public interface Unit<U extends Enum<U> & Unit<U>> {

  /**
   * Returns {@code true} if this is the sentinel unit that signals an unresolved unit.
   */
  boolean isUndefined();
}
