/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.ecashj.core;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Read-only view of the keysets a mint publishes for one unit.
 */
public interface KeysetRegistry {
    /**
     * Returns the keyset with the given id, or the active keyset when {@code id} is null.
     *
     * @throws InvalidConfigurationException if no keyset with that id is known
     */
    Keyset getKeyset(@Nullable String id);

    /** Returns the cheapest active keyset with a hex id. */
    Keyset getActiveKeyset();

    List<Keyset> getKeysets();
}
