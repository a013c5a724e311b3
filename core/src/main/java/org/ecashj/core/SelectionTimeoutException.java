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

/**
 * Thrown when an exact-match proof selection exhausts its time budget. The call may be retried with a smaller
 * set of proofs or with a close match allowed.
 */
public class SelectionTimeoutException extends RuntimeException {
    private final long elapsedMillis;

    public SelectionTimeoutException(long elapsedMillis) {
        super("Proof selection took too long (" + elapsedMillis + " ms). Try again with a smaller proof set.");
        this.elapsedMillis = elapsedMillis;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }
}
