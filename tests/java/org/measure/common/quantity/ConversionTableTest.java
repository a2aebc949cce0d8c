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

import com.google.common.collect.ImmutableSet;
import com.google.common.testing.EqualsTester;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class ConversionTableTest {

  private static ConversionTable.Builder<LengthUnit> metricBuilder() {
    return ConversionTable.builder("Length", LengthUnit.class)
        .scale(LengthUnit.METER, 1)
        .scale(LengthUnit.CENTIMETER, 1e-2)
        .scale(LengthUnit.DECIMETER, 1e-1)
        .scale(LengthUnit.KILOMETER, 1e3)
        .scale(LengthUnit.MICROMETER, 1e-6)
        .scale(LengthUnit.MILLIMETER, 1e-3)
        .scale(LengthUnit.NANOMETER, 1e-9);
  }

  @Test
  public void testBuildRequiresEveryDefinedUnit() {
    try {
      metricBuilder().build();
      fail("expected a table missing imperial units to be rejected");
    } catch (IllegalStateException e) {
      assertContains(e.getMessage(), "FOOT");
      assertContains(e.getMessage(), "YARD");
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUndefinedUnitRejected() {
    metricBuilder().scale(LengthUnit.UNDEFINED, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateUnitRejected() {
    metricBuilder().scale(LengthUnit.METER, 2);
  }

  @Test
  public void testFactorFor() {
    ConversionTable<LengthUnit> table = Length.DIMENSION.getConversions();
    assertEquals(Conversion.scale(0.3048), table.factorFor(LengthUnit.FOOT));
    assertEquals(0.3048, table.toBase(1, LengthUnit.FOOT), 0);
    assertEquals(1, table.fromBase(0.3048, LengthUnit.FOOT), 0);
  }

  @Test
  public void testFactorForUndefined() {
    try {
      Length.DIMENSION.getConversions().factorFor(LengthUnit.UNDEFINED);
      fail("expected the undefined unit to have no conversion");
    } catch (UnsupportedUnitException e) {
      assertSame(LengthUnit.UNDEFINED, e.getUnit());
    }
  }

  @Test
  public void testUnitsExcludeUndefined() {
    assertEquals(ImmutableSet.of(TemperatureUnit.DEGREE_CELSIUS, TemperatureUnit.DEGREE_DELISLE,
        TemperatureUnit.DEGREE_FAHRENHEIT, TemperatureUnit.DEGREE_NEWTON,
        TemperatureUnit.DEGREE_RANKINE, TemperatureUnit.DEGREE_REAUMUR,
        TemperatureUnit.DEGREE_ROEMER, TemperatureUnit.KELVIN),
        Temperature.DIMENSION.units());
  }

  @Test
  public void testConversion() {
    Conversion celsius = Conversion.affine(1, 273.15);
    assertEquals(273.15, celsius.toBase(0), 0);
    assertEquals(0, celsius.fromBase(273.15), 0);

    new EqualsTester()
        .addEqualityGroup(Conversion.scale(2), Conversion.affine(2, 0))
        .addEqualityGroup(Conversion.affine(2, 1))
        .addEqualityGroup(Conversion.scale(3))
        .testEquals();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroScaleRejected() {
    Conversion.scale(0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInfiniteScaleRejected() {
    Conversion.scale(Double.POSITIVE_INFINITY);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNaNOffsetRejected() {
    Conversion.affine(1, Double.NaN);
  }

  private static void assertContains(String text, String expected) {
    if (!text.contains(expected)) {
      fail(String.format("expected '%s' to contain '%s'", text, expected));
    }
  }
}
