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

package org.ecashj.mint;

import com.google.common.util.concurrent.ListenableFuture;

import java.util.List;

/**
 * The wallet's view of one mint. Every call is a network round trip and completes asynchronously; a failed
 * call fails its future with whatever the transport raised. Implementations do not retry.
 */
public interface MintConnection {
    /** Base URL of the mint, used to check that received tokens were issued here. */
    String getMintUrl();

    /** Spends the inputs and returns one signature per output, in the order the outputs were sent. */
    ListenableFuture<List<BlindedSignature>> swap(SwapPayload payload);

    /** Returns one signature per output for a paid quote. */
    ListenableFuture<List<BlindedSignature>> mint(MintPayload payload);

    ListenableFuture<MeltResponse> melt(MeltPayload payload);

    /** Looks up signatures the mint issued before for any of the given outputs. */
    ListenableFuture<RestoreResponse> restore(List<BlindedMessage> outputs);
}
