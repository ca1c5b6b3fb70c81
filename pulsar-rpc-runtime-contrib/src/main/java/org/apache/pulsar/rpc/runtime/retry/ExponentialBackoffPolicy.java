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

/**
 * Backoff whose delay starts at {@code initialDelay} and is multiplied by {@code multiplier} after every
 * attempt, never exceeding {@code maxDelay}.
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private Duration currentDelay;

    public ExponentialBackoffPolicy(Duration initialDelay, Duration maxDelay) {
        this(initialDelay, maxDelay, DEFAULT_MULTIPLIER);
    }

    public ExponentialBackoffPolicy(@NonNull Duration initialDelay, @NonNull Duration maxDelay, double multiplier) {
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (!(multiplier >= 1.0)) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.currentDelay = initialDelay;
    }

    @Override
    public Duration nextDelay() {
        Duration delay = currentDelay;
        long nextNanos = (long) Math.min(currentDelay.toNanos() * multiplier, (double) maxDelay.toNanos());
        currentDelay = Duration.ofNanos(nextNanos);
        return delay;
    }

    @Override
    public BackoffPolicy copy() {
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, multiplier);
    }

    @Override
    public String toString() {
        return "ExponentialBackoffPolicy{initialDelay=" + initialDelay + ", maxDelay=" + maxDelay
                + ", multiplier=" + multiplier + '}';
    }
}
