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

package org.measure.common.base;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class MorePreconditionsTest {

  @Test(expected = NullPointerException.class)
  public void testCheckNotBlankStringNull() {
    MorePreconditions.checkNotBlank((String) null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNotBlankStringEmpty() {
    MorePreconditions.checkNotBlank("");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNotBlankWhitespace() {
    MorePreconditions.checkNotBlank("\t\r\n ");
  }

  @Test
  public void testCheckNotBlankStringValid() {
    String argument = new String("m");
    assertSame(argument, MorePreconditions.checkNotBlank(argument));
  }

  @Test
  public void testCheckNotBlankStringExceptionFormatting() {
    try {
      MorePreconditions.checkNotBlank("", "Blank abbreviation given for %s", "METER");
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("Blank abbreviation given for METER", e.getMessage());
    }
  }

  @Test
  public void testCheckNotBlankIterable() {
    ImmutableList<String> argument = ImmutableList.of("");
    assertSame(argument, MorePreconditions.checkNotBlank(argument, "unused"));

    try {
      MorePreconditions.checkNotBlank((Iterable<?>) null, "No abbreviations given for %s", "FOOT");
      fail();
    } catch (NullPointerException e) {
      assertEquals("No abbreviations given for FOOT", e.getMessage());
    }

    try {
      MorePreconditions.checkNotBlank(ImmutableList.of(), "No abbreviations given for %s", "YARD");
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("No abbreviations given for YARD", e.getMessage());
    }
  }

  @Test
  public void testCheckFinite() {
    assertEquals(0.3048, MorePreconditions.checkFinite(0.3048, "bad %s"), 0);
    assertEquals(-1, MorePreconditions.checkFinite(-1, "bad %s"), 0);

    try {
      MorePreconditions.checkFinite(Double.NaN, "Scale must be finite, got %s");
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("Scale must be finite, got NaN", e.getMessage());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckFiniteInfinity() {
    MorePreconditions.checkFinite(Double.NEGATIVE_INFINITY, "bad %s");
  }
}
