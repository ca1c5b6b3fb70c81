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

import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.MessageListener;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.ProducerAccessMode;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.Schema;
import org.apache.pulsar.client.api.SubscriptionInitialPosition;
import org.apache.pulsar.client.api.SubscriptionType;

/**
 * Creates the request producer and the reply consumer of a {@link PulsarRpcChannel}.
 */
@RequiredArgsConstructor
class MessageDispatcherFactory {
    private final PulsarClient client;

    /**
     * Creates the producer for requests. Several channels may publish to the same request topic.
     *
     * @param topic the request topic
     * @param requestProducerConfig extra producer configuration
     * @return the created request producer
     * @throws PulsarClientException if there is an error creating the producer
     */
    Producer<byte[]> requestProducer(String topic, Map<String, Object> requestProducerConfig)
            throws PulsarClientException {
        return client.newProducer(Schema.BYTES)
                .loadConf(requestProducerConfig)
                .topic(topic)
                .accessMode(ProducerAccessMode.Shared)
                .create();
    }

    /**
     * Creates the consumer for replies. The reply topic belongs to one channel only.
     *
     * @param topic the reply topic
     * @param subscription the reply subscription
     * @param listener the listener completing pending requests
     * @return the created reply consumer
     * @throws PulsarClientException if there is an error creating the consumer
     */
    Consumer<byte[]> replyConsumer(String topic, String subscription, MessageListener<byte[]> listener)
            throws PulsarClientException {
        return client.newConsumer(Schema.BYTES)
                .topic(topic)
                .subscriptionName(subscription)
                .subscriptionInitialPosition(SubscriptionInitialPosition.Latest)
                // allow only one channel
                .subscriptionType(SubscriptionType.Exclusive)
                .messageListener(listener)
                .subscribe();
    }
}
