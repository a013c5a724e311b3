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

import org.ecashj.wallet.MeltBlanks;

/**
 * Called when a melt has created the blank outputs for its fee change, before the melt is sent. Keep the blanks
 * to finish a melt that stays pending with {@link org.ecashj.wallet.Wallet#completeMelt(MeltBlanks)}.
 */
public interface ChangeOutputsCreatedListener {
    void onChangeOutputsCreated(MeltBlanks blanks);
}
