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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import lombok.NonNull;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.StatusCode;

/**
 * Base class for policies that only retry transient failures.
 *
 * <p>A failure whose code is not in the retryable set is permanent and ends the call at once, whatever budget
 * is left.
 */
public abstract class AbstractRetryPolicy implements RetryPolicy {

    /** Codes that are retried unless a policy is configured otherwise. */
    public static final Set<StatusCode> DEFAULT_RETRYABLE_CODES = Collections.unmodifiableSet(EnumSet.of(
            StatusCode.UNAVAILABLE,
            StatusCode.DEADLINE_EXCEEDED,
            StatusCode.ABORTED,
            StatusCode.INTERNAL,
            StatusCode.RESOURCE_EXHAUSTED));

    private final Set<StatusCode> retryableCodes;

    protected AbstractRetryPolicy(@NonNull Set<StatusCode> retryableCodes) {
        this.retryableCodes = retryableCodes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(retryableCodes));
    }

    public Set<StatusCode> getRetryableCodes() {
        return retryableCodes;
    }

    @Override
    public final boolean onFailure(@NonNull Status status) {
        if (status.isOk() || !retryableCodes.contains(status.getCode())) {
            return false;
        }
        return onRetryableFailure(status);
    }

    /**
     * Records a failure already known to be retryable.
     *
     * @param status the failure
     * @return true if the budget allows another attempt
     */
    protected abstract boolean onRetryableFailure(Status status);
}
