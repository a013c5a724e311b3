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

/** Which kind of secrets a wallet creates when an operation does not say. */
public enum SecretsPolicy {
    /** Deterministic if the wallet has a seed, random otherwise. */
    AUTO,
    RANDOM,
    /** Always deterministic. The wallet must have a seed. */
    DETERMINISTIC
}
