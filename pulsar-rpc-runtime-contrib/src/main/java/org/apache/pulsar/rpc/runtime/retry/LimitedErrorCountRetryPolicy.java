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

import java.util.Set;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.StatusCode;

/**
 * Retries until more than {@code maxFailures} retryable failures have been seen, so a call runs at most
 * {@code maxFailures + 1} times. A policy with {@code maxFailures == 0} never retries.
 */
public class LimitedErrorCountRetryPolicy extends AbstractRetryPolicy {

    private final int maxFailures;
    private int failureCount;

    public LimitedErrorCountRetryPolicy(int maxFailures) {
        this(maxFailures, DEFAULT_RETRYABLE_CODES);
    }

    public LimitedErrorCountRetryPolicy(int maxFailures, Set<StatusCode> retryableCodes) {
        super(retryableCodes);
        if (maxFailures < 0) {
            throw new IllegalArgumentException("maxFailures must be >= 0");
        }
        this.maxFailures = maxFailures;
    }

    public int getMaxFailures() {
        return maxFailures;
    }

    @Override
    protected boolean onRetryableFailure(Status status) {
        return ++failureCount <= maxFailures;
    }

    @Override
    public RetryPolicy copy() {
        return new LimitedErrorCountRetryPolicy(maxFailures, getRetryableCodes());
    }

    @Override
    public String toString() {
        return "LimitedErrorCountRetryPolicy{maxFailures=" + maxFailures + ", failureCount=" + failureCount + '}';
    }
}
