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

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class DurationTest {

  @Test
  public void testCalendarUnits() {
    assertEquals(86400, Duration.fromDays(1).getSeconds(), 0);
    assertEquals(7, Duration.fromWeeks(1).getDays(), 1e-12);
    assertEquals(30, Duration.fromMonths(1).getDays(), 1e-12);
    assertEquals(365, Duration.fromYears(1).getDays(), 1e-12);
    assertEquals(90, Duration.fromHours(1.5).getMinutes(), 1e-12);
  }

  @Test
  public void testTimeUnitInterop() {
    assertEquals(Duration.fromMinutes(15), Duration.of(15, TimeUnit.MINUTES));
    assertEquals(15 * 60 * 1000L, Duration.of(15, TimeUnit.MINUTES).to(TimeUnit.MILLISECONDS));
    assertEquals("expected conversion losing precision to use truncation",
        0L, Duration.of(45, TimeUnit.MINUTES).to(TimeUnit.HOURS));

    for (TimeUnit timeUnit : TimeUnit.values()) {
      assertSame(timeUnit, DurationUnit.of(timeUnit).getTimeUnit());
    }
    assertNull(DurationUnit.WEEK.getTimeUnit());
  }

  @Test
  public void testTimeUnitSameUnitIsLossless() {
    assertEquals(31L, Duration.of(31, TimeUnit.NANOSECONDS).to(TimeUnit.NANOSECONDS));
    assertEquals(241L, Duration.of(241, TimeUnit.NANOSECONDS).to(TimeUnit.NANOSECONDS));

    for (TimeUnit timeUnit : TimeUnit.values()) {
      for (long amount = 0; amount < 1000; amount++) {
        assertEquals(timeUnit + " " + amount,
            amount, Duration.of(amount, timeUnit).to(timeUnit));
        assertEquals(timeUnit + " " + -amount,
            -amount, Duration.of(-amount, timeUnit).to(timeUnit));
      }
    }
  }

  @Test
  public void testTimeUnitExactDownConversion() {
    assertEquals(1500L, Duration.of(1500, TimeUnit.NANOSECONDS).to(TimeUnit.NANOSECONDS));
    assertEquals(1L, Duration.of(1500, TimeUnit.NANOSECONDS).to(TimeUnit.MICROSECONDS));
    assertEquals(123000000L, Duration.of(123, TimeUnit.MILLISECONDS).to(TimeUnit.NANOSECONDS));
    assertEquals(Long.MAX_VALUE, Duration.fromYears(1e12).to(TimeUnit.NANOSECONDS));
  }

  @Test
  public void testParse() {
    assertEquals(5400, Duration.parse("1 hour 30 minutes", Locale.US).getSeconds(), 1e-9);
    assertEquals(90, Duration.parse("1 min, 30 s", Locale.US).getSeconds(), 1e-9);
    assertEquals(2, Duration.parse("2 ч", Locale.forLanguageTag("ru-RU")).getHours(), 1e-12);
  }
}
