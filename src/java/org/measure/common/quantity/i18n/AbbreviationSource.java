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

import java.util.List;

/**
 * Supplies the abbreviation data an {@link AbbreviationRegistry} is populated from.
 */
public interface AbbreviationSource {

  /**
   * Loads the abbreviation entries, in the order they should be registered.  Order matters:
   * when two units of a dimension share an abbreviation in a culture, the first one registered
   * wins on lookup.
   *
   * @return the entries to register
   * @throws IllegalStateException if the underlying data cannot be read or is malformed
   */
  List<AbbreviationEntry<?>> load();
}
