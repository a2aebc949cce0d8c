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

import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

/**
 * Units of {@link Duration}.  Units that have a {@link TimeUnit} counterpart expose it so
 * durations can be handed to {@code java.util.concurrent} APIs.
 */
public enum DurationUnit implements Unit<DurationUnit> {
  UNDEFINED(null),
  NANOSECOND(TimeUnit.NANOSECONDS),
  MICROSECOND(TimeUnit.MICROSECONDS),
  MILLISECOND(TimeUnit.MILLISECONDS),
  SECOND(TimeUnit.SECONDS),
  MINUTE(TimeUnit.MINUTES),
  HOUR(TimeUnit.HOURS),
  DAY(TimeUnit.DAYS),
  WEEK(null),
  MONTH(null),
  YEAR(null);

  private final TimeUnit timeUnit;

  private DurationUnit(@Nullable TimeUnit timeUnit) {
    this.timeUnit = timeUnit;
  }

  /**
   * Returns the equivalent {@code TimeUnit}, or {@code null} if there is none.
   */
  @Nullable
  public TimeUnit getTimeUnit() {
    return timeUnit;
  }

  /**
   * Finds the unit equivalent to a {@code TimeUnit}.
   *
   * @param timeUnit the time unit to look up
   * @return the matching duration unit
   */
  public static DurationUnit of(TimeUnit timeUnit) {
    for (DurationUnit unit : values()) {
      if (unit.timeUnit == timeUnit) {
        return unit;
      }
    }
    throw new IllegalArgumentException("No duration unit for " + timeUnit);
  }

  @Override
  public boolean isUndefined() {
    return this == UNDEFINED;
  }
}
