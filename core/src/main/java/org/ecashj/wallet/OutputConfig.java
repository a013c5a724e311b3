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

import javax.annotation.Nullable;

/** Output types for the two halves of a send. A null type means the wallet's default. */
public class OutputConfig {
    @Nullable public OutputType send = null;
    @Nullable public OutputType keep = null;

    public static OutputConfig of(@Nullable OutputType send, @Nullable OutputType keep) {
        OutputConfig config = new OutputConfig();
        config.send = send;
        config.keep = keep;
        return config;
    }
}
