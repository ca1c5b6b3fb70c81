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
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.runtime.CallContext;
import org.apache.pulsar.rpc.runtime.Status;

/**
 * Runs an operation until it succeeds or its {@link RetryPolicy} gives up.
 *
 * <p>Each round invokes the operation once. An OK status is returned immediately. Otherwise the retry policy is
 * asked whether to continue; if it refuses, the status of that last attempt is returned unchanged, else the
 * calling thread sleeps for {@link BackoffPolicy#nextDelay()} and the next round starts.
 *
 * <p>The policies passed in are used as-is and mutated, so callers hand over instances dedicated to this call.
 */
@Slf4j
public final class RetryLoop {

    private RetryLoop() {
    }

    /**
     * One attempt of a call.
     *
     * @param <T> the request type
     * @param <V> the response container type
     */
    @FunctionalInterface
    public interface Invocation<T, V> {
        Status invoke(CallContext context, T request, V response);
    }

    public static <T, V> Status retryCall(CallContext context, T request, V response,
                                          Invocation<T, V> invocation,
                                          RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
        return retryCall(context, request, response, invocation, retryPolicy, backoffPolicy, Sleeper.DEFAULT);
    }

    /**
     * Runs {@code invocation} under the given policies.
     *
     * <p>If the thread is interrupted while waiting, the interrupt flag is restored and the status of the last
     * attempt is returned.
     *
     * @return the first OK status, or the status of the last failed attempt
     */
    public static <T, V> Status retryCall(@NonNull CallContext context, T request, V response,
                                          @NonNull Invocation<T, V> invocation,
                                          @NonNull RetryPolicy retryPolicy,
                                          @NonNull BackoffPolicy backoffPolicy,
                                          @NonNull Sleeper sleeper) {
        int attempt = 0;
        while (true) {
            attempt++;
            Status status = invocation.invoke(context, request, response);
            if (status.isOk()) {
                return status;
            }
            if (!retryPolicy.onFailure(status)) {
                log.debug("Attempt {} failed with {}, not retrying: {}", attempt, status, retryPolicy);
                return status;
            }
            Duration delay = backoffPolicy.nextDelay();
            log.debug("Attempt {} failed with {}, retrying in {}", attempt, status, delay);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting to retry after attempt {}, giving up with {}", attempt, status);
                return status;
            }
        }
    }
}
