/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.pulsar.rpc.runtime.retry;

import java.time.Duration;

/**
 * Computes how long to wait before the next attempt of a call.
 *
 * <p>Like {@link RetryPolicy}, instances carry per-call state and every call uses its own {@link #copy()}.
 */
public interface BackoffPolicy {

    /**
     * Returns the delay to wait before the next attempt and advances the policy.
     *
     * @return the delay, never negative
     */
    Duration nextDelay();

    /**
     * Creates a new, independent policy with the same configuration, starting again from the first delay.
     *
     * @return the new policy
     */
    BackoffPolicy copy();
}
