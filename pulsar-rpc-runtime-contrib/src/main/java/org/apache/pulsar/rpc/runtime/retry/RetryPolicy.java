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

import org.apache.pulsar.rpc.runtime.Status;

/**
 * Decides, after each failed attempt of a call, whether the call may be attempted again.
 *
 * <p>Implementations keep per-call state (failures seen, time elapsed) and are therefore not shared between
 * calls. A stub holds one instance as a template and runs every call with a {@link #copy()} of it.
 */
public interface RetryPolicy {

    /**
     * Records a failed attempt.
     *
     * @param status the non-OK status returned by the attempt
     * @return true if another attempt may be made, false if the status is final
     */
    boolean onFailure(Status status);

    /**
     * Creates a new, independent policy with the same configuration and an untouched retry budget.
     *
     * @return the new policy
     */
    RetryPolicy copy();
}
