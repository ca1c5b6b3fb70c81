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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.MessageListener;

/**
 * Completes the pending request whose correlation id matches the key of a reply message.
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
class ReplyListener implements MessageListener<byte[]> {
    private final ConcurrentHashMap<String, CompletableFuture<Message<byte[]>>> pendingRequestsMap;

    @Override
    public void received(Consumer<byte[]> consumer, Message<byte[]> msg) {
        String correlationId = msg.getKey();
        try {
            CompletableFuture<Message<byte[]>> future = correlationId == null ? null
                    : pendingRequestsMap.remove(correlationId);
            if (future == null) {
                log.warn("[{}] [{}] No pending request found for correlationId {}."
                                + " The caller may already have timed out.",
                        consumer.getTopic(), consumer.getSubscription(), correlationId);
            } else {
                future.complete(msg);
            }
        } finally {
            consumer.acknowledgeAsync(msg).exceptionally(ex -> {
                log.warn("[{}] [{}] Acknowledging message {} failed", msg.getTopicName(), correlationId,
                        msg.getMessageId(), ex);
                return null;
            });
        }
    }
}
