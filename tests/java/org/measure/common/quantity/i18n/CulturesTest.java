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

package org.measure.common.quantity.i18n;

import java.util.Locale;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class CulturesTest {

  private static final Locale RU_RU = Locale.forLanguageTag("ru-RU");
  private static final Locale RU = new Locale("ru");
  private static final Locale EN = new Locale("en");

  @Test
  public void testChain() {
    assertEquals(ImmutableList.of(RU_RU, RU, Locale.US, EN, Locale.UK, Locale.ROOT),
        Cultures.chain(RU_RU, Locale.US, ImmutableList.of(Locale.US, RU_RU, Locale.UK)));
  }

  @Test
  public void testChainIncludesKnownCulturesOfTheSameLanguage() {
    assertEquals(ImmutableList.of(RU, RU_RU, Locale.US, EN, Locale.ROOT),
        Cultures.chain(RU, Locale.US, ImmutableList.of(Locale.US, RU_RU)));
    assertEquals(ImmutableList.of(Locale.CANADA, EN, Locale.UK, Locale.US, Locale.ROOT),
        Cultures.chain(Locale.CANADA, Locale.US, ImmutableList.of(Locale.UK, Locale.US)));
  }

  @Test
  public void testChainWithoutRequestedLocale() {
    assertEquals(ImmutableList.of(Locale.US, EN, Locale.ROOT),
        Cultures.chain(null, Locale.US, ImmutableList.of(Locale.US, RU_RU)));
  }

  @Test
  public void testChainForUnknownLocale() {
    assertEquals(ImmutableList.of(Locale.GERMANY, Locale.GERMAN, Locale.US, EN, Locale.ROOT),
        Cultures.chain(Locale.GERMANY, Locale.US, ImmutableList.<Locale>of()));
  }

  @Test
  public void testForLanguageTag() {
    assertEquals(RU_RU, Cultures.forLanguageTag(" ru-RU "));
    assertEquals(EN, Cultures.forLanguageTag("en"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testForLanguageTagRejectsBlank() {
    Cultures.forLanguageTag("");
  }
}
