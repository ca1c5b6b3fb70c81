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
package org.apache.pulsar.rpc.operations.channel;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Channel configuration read from environment variables.
 *
 * <ul>
 *   <li>{@code PULSAR_SERVICE_URL}, default {@value #DEFAULT_SERVICE_URL}</li>
 *   <li>{@code PULSAR_AUTH_PLUGIN} and {@code PULSAR_AUTH_PARAMS}, the ambient authentication, unset by default</li>
 *   <li>{@code OPERATIONS_REQUEST_TOPIC}, default {@value #DEFAULT_REQUEST_TOPIC}</li>
 *   <li>{@code OPERATIONS_REPLY_TOPIC} and {@code OPERATIONS_REPLY_SUBSCRIPTION}, generated per channel by
 *       default</li>
 *   <li>{@code OPERATIONS_REPLY_TIMEOUT_MS}, default 3000</li>
 * </ul>
 */
@Value
public class ChannelSettings {
    public static final String DEFAULT_SERVICE_URL = "pulsar://localhost:6650";
    public static final String DEFAULT_REQUEST_TOPIC = "persistent://public/default/operations-request";
    public static final long DEFAULT_REPLY_TIMEOUT_MS = 3000L;

    String serviceUrl;
    String authPlugin;
    @ToString.Exclude
    String authParams;
    String requestTopic;
    String replyTopic;
    String replySubscription;
    Duration replyTimeout;

    public static ChannelSettings fromEnvironment(@NonNull Map<String, String> env) {
        String timeout = env.get("OPERATIONS_REPLY_TIMEOUT_MS");
        long timeoutMillis;
        try {
            timeoutMillis = isBlank(timeout) ? DEFAULT_REPLY_TIMEOUT_MS : Long.parseLong(timeout.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("OPERATIONS_REPLY_TIMEOUT_MS is not a number: " + timeout, e);
        }
        return new ChannelSettings(
                env.getOrDefault("PULSAR_SERVICE_URL", DEFAULT_SERVICE_URL),
                blankToNull(env.get("PULSAR_AUTH_PLUGIN")),
                blankToNull(env.get("PULSAR_AUTH_PARAMS")),
                env.getOrDefault("OPERATIONS_REQUEST_TOPIC", DEFAULT_REQUEST_TOPIC),
                blankToNull(env.get("OPERATIONS_REPLY_TOPIC")),
                blankToNull(env.get("OPERATIONS_REPLY_SUBSCRIPTION")),
                Duration.ofMillis(timeoutMillis));
    }

    public Optional<String> getAuthPlugin() {
        return Optional.ofNullable(authPlugin);
    }

    /**
     * @return a channel builder preset with these settings
     */
    public PulsarRpcChannelBuilder channelBuilder() {
        PulsarRpcChannelBuilder builder = new PulsarRpcChannelBuilder()
                .requestTopic(requestTopic)
                .replyTimeout(replyTimeout);
        if (replyTopic != null) {
            builder.replyTopic(replyTopic);
        }
        if (replySubscription != null) {
            builder.replySubscription(replySubscription);
        }
        return builder;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
