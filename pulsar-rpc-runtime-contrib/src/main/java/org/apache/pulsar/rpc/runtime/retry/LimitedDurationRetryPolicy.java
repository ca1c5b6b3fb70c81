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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import lombok.NonNull;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.StatusCode;

/**
 * Retries while less than {@code maxDuration} has elapsed since the policy was created.
 *
 * <p>The budget starts when the instance is constructed; since calls run with a {@link #copy()} of the stub
 * template, it effectively starts when the call does.
 */
public class LimitedDurationRetryPolicy extends AbstractRetryPolicy {

    private final Duration maxDuration;
    private final Clock clock;
    private final Instant deadline;

    public LimitedDurationRetryPolicy(Duration maxDuration) {
        this(maxDuration, Clock.systemUTC());
    }

    public LimitedDurationRetryPolicy(Duration maxDuration, Clock clock) {
        this(maxDuration, clock, DEFAULT_RETRYABLE_CODES);
    }

    public LimitedDurationRetryPolicy(@NonNull Duration maxDuration, @NonNull Clock clock,
                                      Set<StatusCode> retryableCodes) {
        super(retryableCodes);
        if (maxDuration.isNegative()) {
            throw new IllegalArgumentException("maxDuration must not be negative");
        }
        this.maxDuration = maxDuration;
        this.clock = clock;
        this.deadline = clock.instant().plus(maxDuration);
    }

    public Duration getMaxDuration() {
        return maxDuration;
    }

    @Override
    protected boolean onRetryableFailure(Status status) {
        return clock.instant().isBefore(deadline);
    }

    @Override
    public RetryPolicy copy() {
        return new LimitedDurationRetryPolicy(maxDuration, clock, getRetryableCodes());
    }

    @Override
    public String toString() {
        return "LimitedDurationRetryPolicy{maxDuration=" + maxDuration + ", deadline=" + deadline + '}';
    }
}
