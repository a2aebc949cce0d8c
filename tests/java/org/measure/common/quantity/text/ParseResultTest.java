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

package org.measure.common.quantity.text;

import java.util.Locale;

import com.google.common.base.Function;
import com.google.common.testing.EqualsTester;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ParseResultTest {

  private static final ParseError ERROR =
      ParseError.builder(ParseError.Kind.UNRECOGNIZED_UNIT, "5 zz")
          .matchedValue("5")
          .matchedUnit("zz")
          .locale(Locale.US)
          .build();

  private static final Function<String, Integer> LENGTH = new Function<String, Integer>() {
    @Override public Integer apply(String s) {
      return s.length();
    }
  };

  @Test
  public void testSuccess() {
    ParseResult<String> result = ParseResult.success("m");
    assertTrue(result.isSuccess());
    assertEquals("m", result.getValue().get());
    assertFalse(result.getError().isPresent());
    assertEquals("m", result.getOrThrow());
    assertEquals(Integer.valueOf(1), result.map(LENGTH).getOrThrow());
  }

  @Test
  public void testFailure() {
    ParseResult<String> result = ParseResult.failure(ERROR);
    assertFalse(result.isSuccess());
    assertFalse(result.getValue().isPresent());
    assertSame(ERROR, result.getError().get());
    assertSame(ERROR, result.map(LENGTH).getError().get());

    try {
      result.getOrThrow();
      fail();
    } catch (QuantityParseException e) {
      assertSame(ERROR, e.getError());
      assertEquals(ParseError.Kind.UNRECOGNIZED_UNIT, e.getKind());
      assertEquals("Unrecognized unit: \"5 zz\" (value \"5\", unit \"zz\", locale en-US)",
          e.getMessage());
    }
  }

  @Test
  public void testCauseIsAttached() {
    NumberFormatException cause = new NumberFormatException("1.2.3");
    ParseError error = ParseError.builder(ParseError.Kind.MALFORMED_NUMBER, "1.2.3 m")
        .cause(cause)
        .build();
    assertSame(cause, error.toException().getCause());
    assertEquals("Malformed number: \"1.2.3 m\"", error.getMessage());
  }

  @Test
  public void testEquals() {
    new EqualsTester()
        .addEqualityGroup(ParseResult.success("m"), ParseResult.success("m"))
        .addEqualityGroup(ParseResult.success("ft"))
        .addEqualityGroup(ParseResult.failure(ERROR), ParseResult.failure(
            ParseError.builder(ParseError.Kind.UNRECOGNIZED_UNIT, "5 zz")
                .matchedValue("5")
                .matchedUnit("zz")
                .locale(Locale.US)
                .build()))
        .addEqualityGroup(ParseResult.failure(
            ParseError.builder(ParseError.Kind.EMPTY_INPUT, "").build()))
        .testEquals();
  }
}
