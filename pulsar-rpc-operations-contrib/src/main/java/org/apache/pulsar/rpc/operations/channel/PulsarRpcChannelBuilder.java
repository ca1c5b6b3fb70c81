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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import org.apache.pulsar.client.api.PulsarClient;

/**
 * Fluent configuration of a {@link PulsarRpcChannel}.
 *
 * <p>Only the request topic is required. Without an explicit reply topic each channel gets its own, derived from
 * the request topic, and a matching subscription.
 */
@Getter(AccessLevel.PACKAGE)
public class PulsarRpcChannelBuilder {
    private String requestTopic;
    private String replyTopic;
    private String replySubscription;
    private Duration replyTimeout = Duration.ofSeconds(3);
    private Map<String, Object> requestProducerConfig = Collections.emptyMap();
    private ObjectMapper objectMapper = defaultObjectMapper();
    private boolean closeClient;

    /**
     * @param requestTopic the topic the service consumes requests from
     * @return this builder
     */
    public PulsarRpcChannelBuilder requestTopic(@NonNull String requestTopic) {
        this.requestTopic = requestTopic;
        return this;
    }

    /**
     * @param replyTopic the topic this channel receives replies on; it must not be shared with other channels
     * @return this builder
     */
    public PulsarRpcChannelBuilder replyTopic(@NonNull String replyTopic) {
        this.replyTopic = replyTopic;
        return this;
    }

    /**
     * @param replySubscription the exclusive subscription on the reply topic
     * @return this builder
     */
    public PulsarRpcChannelBuilder replySubscription(@NonNull String replySubscription) {
        this.replySubscription = replySubscription;
        return this;
    }

    /**
     * Sets how long a call without a deadline waits for its reply. Defaults to 3 seconds.
     *
     * @param replyTimeout the wait per attempt, must be positive
     * @return this builder
     */
    public PulsarRpcChannelBuilder replyTimeout(@NonNull Duration replyTimeout) {
        this.replyTimeout = replyTimeout;
        return this;
    }

    /**
     * @param requestProducerConfig producer settings applied with {@code ProducerBuilder#loadConf}
     * @return this builder
     */
    public PulsarRpcChannelBuilder requestProducerConfig(@NonNull Map<String, Object> requestProducerConfig) {
        this.requestProducerConfig = requestProducerConfig;
        return this;
    }

    /**
     * @param objectMapper the mapper for request and reply payloads
     * @return this builder
     */
    public PulsarRpcChannelBuilder objectMapper(@NonNull ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    /**
     * Makes the channel close the {@link PulsarClient} it was built with when the channel itself is closed.
     *
     * @param closeClient whether the channel owns the client
     * @return this builder
     */
    public PulsarRpcChannelBuilder closeClientOnClose(boolean closeClient) {
        this.closeClient = closeClient;
        return this;
    }

    /**
     * Creates the request producer and the reply consumer and returns the channel using them.
     *
     * @param pulsarClient the client to create the producer and consumer with
     * @return the new channel
     * @throws RpcChannelException if the configuration is incomplete or Pulsar refuses the producer or consumer
     */
    public PulsarRpcChannel build(@NonNull PulsarClient pulsarClient) throws RpcChannelException {
        if (requestTopic == null) {
            throw new RpcChannelException("Request topic is required.");
        }
        if (replyTimeout.isZero() || replyTimeout.isNegative()) {
            throw new RpcChannelException("Reply timeout must be positive: " + replyTimeout);
        }
        if (replyTopic == null) {
            replyTopic = requestTopic + "-reply-" + UUID.randomUUID();
        }
        if (replySubscription == null) {
            replySubscription = "operations-stub-" + UUID.randomUUID();
        }
        return PulsarRpcChannel.create(pulsarClient, this);
    }

    static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }
}
