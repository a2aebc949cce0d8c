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

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class AreaTest {

  private static final double DELTA = 1e-5;

  @Test
  public void testOneSquareMeterInEveryUnit() {
    Area squareMeter = Area.fromSquareMeters(1);
    assertEquals(0.000247105, squareMeter.getAcres(), 1e-9);
    assertEquals(0.0001, squareMeter.getHectares(), 1e-9);
    assertEquals(1e4, squareMeter.getSquareCentimeters(), DELTA);
    assertEquals(1e2, squareMeter.getSquareDecimeters(), DELTA);
    assertEquals(10.76391, squareMeter.getSquareFeet(), DELTA);
    assertEquals(1550.003100, squareMeter.getSquareInches(), DELTA);
    assertEquals(1e-6, squareMeter.getSquareKilometers(), 1e-12);
    assertEquals(1, squareMeter.getSquareMeters(), 0);
    assertEquals(3.86102e-7, squareMeter.getSquareMiles(), 1e-11);
    assertEquals(1e6, squareMeter.getSquareMillimeters(), DELTA);
    assertEquals(1.19599, squareMeter.getSquareYards(), DELTA);
  }

  @Test
  public void testRoundTrip() {
    for (AreaUnit unit : Area.DIMENSION.units()) {
      assertEquals(unit.toString(), 1, Area.from(1, unit).as(unit), 1e-9);
    }
  }

  @Test
  public void testParseSuperscript() {
    assertEquals(3, Area.parse("3 m²", Locale.US).getSquareMeters(), 0);
    Area russian = Area.parse("2,5 км²", Locale.forLanguageTag("ru-RU"));
    assertEquals(2.5, russian.getSquareKilometers(), 1e-12);
  }
}
