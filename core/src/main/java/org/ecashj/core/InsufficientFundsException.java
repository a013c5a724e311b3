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
 * Thrown when the proofs handed to an operation cannot cover the requested amount, including the fees the
 * issuer charges for spending them.
 */
public class InsufficientFundsException extends Exception {
    /** Contains the number of units that would have been required to complete the operation, or -1 if unknown. */
    public final long missing;

    public InsufficientFundsException(String message) {
        super(message);
        this.missing = -1;
    }

    public InsufficientFundsException(long missing) {
        this(missing, "Insufficient funds, missing " + missing);
    }

    public InsufficientFundsException(long missing, String message) {
        super(message);
        this.missing = missing;
    }
}
