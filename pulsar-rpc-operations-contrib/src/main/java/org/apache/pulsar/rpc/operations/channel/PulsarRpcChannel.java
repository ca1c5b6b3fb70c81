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

import static lombok.AccessLevel.PACKAGE;
import static org.apache.pulsar.rpc.operations.channel.Constants.ERROR_MESSAGE;
import static org.apache.pulsar.rpc.operations.channel.Constants.REPLY_TOPIC;
import static org.apache.pulsar.rpc.operations.channel.Constants.REQUEST_TIMEOUT_MILLIS;
import static org.apache.pulsar.rpc.operations.channel.Constants.RPC_METHOD;
import static org.apache.pulsar.rpc.operations.channel.Constants.STATUS_CODE;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.TypedMessageBuilder;
import org.apache.pulsar.rpc.runtime.CallContext;
import org.apache.pulsar.rpc.runtime.StatusCode;

/**
 * A {@link RpcChannel} doing request/reply over Apache Pulsar.
 *
 * <p>Every request is published with a fresh correlation id as its message key and the channel's reply topic in
 * its properties. The service publishes the reply under the same key; the {@link ReplyListener} hands it back to
 * the waiting caller. Payloads are JSON.
 */
@Slf4j
@RequiredArgsConstructor(access = PACKAGE)
public class PulsarRpcChannel implements RpcChannel {
    private final ConcurrentHashMap<String, CompletableFuture<Message<byte[]>>> pendingRequestsMap;
    private final Producer<byte[]> requestProducer;
    private final Consumer<byte[]> replyConsumer;
    private final String replyTopic;
    private final Duration replyTimeout;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    // closed together with the channel when set
    private final PulsarClient ownedClient;

    /**
     * Creates a new channel using the specified builder settings.
     *
     * @param client the Pulsar client to create the producer and consumer with
     * @param builder the channel configuration
     * @return a new channel
     * @throws RpcChannelException if the producer or the consumer cannot be created
     */
    static PulsarRpcChannel create(@NonNull PulsarClient client, @NonNull PulsarRpcChannelBuilder builder)
            throws RpcChannelException {
        ConcurrentHashMap<String, CompletableFuture<Message<byte[]>>> pendingRequestsMap = new ConcurrentHashMap<>();
        MessageDispatcherFactory dispatcherFactory = new MessageDispatcherFactory(client);
        ReplyListener replyListener = new ReplyListener(pendingRequestsMap);

        Producer<byte[]> producer;
        Consumer<byte[]> consumer;
        try {
            producer = dispatcherFactory.requestProducer(builder.getRequestTopic(),
                    builder.getRequestProducerConfig());
        } catch (PulsarClientException e) {
            throw new RpcChannelException(e);
        }
        try {
            consumer = dispatcherFactory.replyConsumer(builder.getReplyTopic(), builder.getReplySubscription(),
                    replyListener);
        } catch (PulsarClientException e) {
            producer.closeAsync();
            throw new RpcChannelException(e);
        }
        log.info("Created channel: request topic {}, reply topic {}", builder.getRequestTopic(),
                builder.getReplyTopic());
        return new PulsarRpcChannel(pendingRequestsMap, producer, consumer, builder.getReplyTopic(),
                builder.getReplyTimeout(), builder.getObjectMapper(), Clock.systemUTC(),
                builder.isCloseClient() ? client : null);
    }

    @Override
    public void invoke(@NonNull CallContext context, @NonNull String method, @NonNull Object request,
                       @NonNull Object response) throws RpcChannelException {
        Duration timeout = context.remainingTime(clock).orElse(replyTimeout);
        // the wait and the request_timeout_millis property have millisecond resolution
        if (timeout.toMillis() <= 0) {
            throw new RpcChannelException(new TimeoutException("Deadline expired before sending " + method));
        }
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new RpcChannelException(e);
        }

        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<Message<byte[]>> replyFuture = new CompletableFuture<>();
        pendingRequestsMap.put(correlationId, replyFuture);
        try {
            newRequestMessage(correlationId, method, payload, timeout, context.getMetadata())
                    .sendAsync()
                    .exceptionally(ex -> {
                        replyFuture.completeExceptionally(ex);
                        return null;
                    });
            Message<byte[]> reply = replyFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            readReply(method, reply, response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcChannelException(e);
        } catch (ExecutionException e) {
            throw new RpcChannelException(e.getCause());
        } catch (TimeoutException e) {
            log.debug("[{}] No reply for {} within {}", replyTopic, method, timeout);
            throw new RpcChannelException(e);
        } finally {
            pendingRequestsMap.remove(correlationId);
        }
    }

    private TypedMessageBuilder<byte[]> newRequestMessage(String correlationId, String method, byte[] payload,
                                                          Duration timeout, Map<String, String> metadata) {
        TypedMessageBuilder<byte[]> messageBuilder = requestProducer.newMessage()
                .key(correlationId)
                .value(payload)
                .property(RPC_METHOD, method)
                .property(REPLY_TOPIC, replyTopic)
                .property(REQUEST_TIMEOUT_MILLIS, String.valueOf(timeout.toMillis()));
        metadata.forEach(messageBuilder::property);
        return messageBuilder;
    }

    private void readReply(String method, Message<byte[]> reply, Object response) throws RpcChannelException {
        String code = reply.getProperty(STATUS_CODE);
        String errorMessage = reply.getProperty(ERROR_MESSAGE);
        if (code != null && !StatusCode.OK.name().equals(code)) {
            throw new RpcChannelException(code, errorMessage == null ? "" : errorMessage);
        }
        if (code == null && errorMessage != null) {
            throw new RpcChannelException(StatusCode.UNKNOWN.name(), errorMessage);
        }
        byte[] value = reply.getValue();
        if (value == null || value.length == 0) {
            return;
        }
        try {
            objectMapper.readerForUpdating(response).readValue(value);
        } catch (IOException e) {
            log.warn("[{}] Cannot read reply to {}", replyTopic, method, e);
            throw new RpcChannelException(e);
        }
    }

    int pendingRequestSize() {
        return pendingRequestsMap.size();
    }

    @Override
    public void close() throws RpcChannelException {
        try (requestProducer;
             replyConsumer) {
            pendingRequestsMap.forEach((correlationId, future) -> future.cancel(false));
            pendingRequestsMap.clear();
        } catch (PulsarClientException e) {
            throw new RpcChannelException(e);
        } finally {
            closeOwnedClient();
        }
    }

    private void closeOwnedClient() {
        if (ownedClient == null) {
            return;
        }
        try {
            ownedClient.close();
        } catch (PulsarClientException e) {
            log.warn("Failed to close Pulsar client", e);
        }
    }
}
