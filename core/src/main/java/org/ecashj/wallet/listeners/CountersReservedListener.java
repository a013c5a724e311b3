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

package org.ecashj.wallet.listeners;

import org.ecashj.wallet.OperationCounters;

/**
 * Called after a wallet operation reserved deterministic counters, before it contacts the mint. Persist the
 * counters here to be able to restore the outputs if the operation never completes.
 */
public interface CountersReservedListener {
    void onCountersReserved(OperationCounters counters);
}
