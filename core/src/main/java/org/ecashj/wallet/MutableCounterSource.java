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

package org.ecashj.wallet;

/** A counter source whose cursors can be overwritten, for migrations and tests. */
public interface MutableCounterSource extends CounterSource {
    /**
     * Sets the cursor of the keyset to exactly {@code next}, even backwards. Moving a cursor backwards allows
     * counters to be reused, so this is not for normal operation.
     */
    void setNext(String keysetId, long next);
}
