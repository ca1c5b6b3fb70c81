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
package org.apache.pulsar.rpc.runtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.NonNull;
import org.apache.pulsar.rpc.runtime.retry.BackoffPolicy;
import org.apache.pulsar.rpc.runtime.retry.RetryPolicy;

/**
 * Per-call settings for one logical client call.
 *
 * <p>A context carries the call deadline, optional {@link RetryPolicy} and {@link BackoffPolicy} instances that
 * replace the stub defaults for this call only, and the metadata handed to the transport. A context belongs to
 * the caller for the duration of one call and must not be shared between calls: the policies it carries keep
 * per-call state.
 */
public class CallContext {

    /** Metadata key under which the credentials token is sent. */
    public static final String AUTHORIZATION = "authorization";

    private Instant deadline;
    private RetryPolicy retryPolicy;
    private BackoffPolicy backoffPolicy;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    public CallContext() {
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public CallContext setDeadline(Instant deadline) {
        this.deadline = deadline;
        return this;
    }

    /**
     * Sets the deadline relative to now.
     *
     * @param timeout how long the call may take from now on
     * @return this context
     */
    public CallContext setTimeout(@NonNull Duration timeout) {
        return setDeadline(Instant.now().plus(timeout));
    }

    /**
     * Computes what is left of the deadline.
     *
     * @param clock the clock to measure against
     * @return the remaining time, possibly zero or negative, or empty if the call has no deadline
     */
    public Optional<Duration> remainingTime(@NonNull Clock clock) {
        return getDeadline().map(d -> Duration.between(clock.instant(), d));
    }

    public Optional<RetryPolicy> getRetryPolicy() {
        return Optional.ofNullable(retryPolicy);
    }

    public CallContext setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    public Optional<BackoffPolicy> getBackoffPolicy() {
        return Optional.ofNullable(backoffPolicy);
    }

    public CallContext setBackoffPolicy(BackoffPolicy backoffPolicy) {
        this.backoffPolicy = backoffPolicy;
        return this;
    }

    public CallContext putMetadata(@NonNull String key, @NonNull String value) {
        metadata.put(key, value);
        return this;
    }

    public CallContext setCredentials(@NonNull String token) {
        return putMetadata(AUTHORIZATION, token);
    }

    public Optional<String> getCredentials() {
        return Optional.ofNullable(metadata.get(AUTHORIZATION));
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }
}
