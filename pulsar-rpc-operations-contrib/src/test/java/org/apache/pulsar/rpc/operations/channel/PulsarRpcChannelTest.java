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

import static org.apache.pulsar.rpc.operations.channel.Constants.ERROR_MESSAGE;
import static org.apache.pulsar.rpc.operations.channel.Constants.REPLY_TOPIC;
import static org.apache.pulsar.rpc.operations.channel.Constants.REQUEST_TIMEOUT_MILLIS;
import static org.apache.pulsar.rpc.operations.channel.Constants.RPC_METHOD;
import static org.apache.pulsar.rpc.operations.channel.Constants.STATUS_CODE;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.MessageId;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.TypedMessageBuilder;
import org.apache.pulsar.rpc.operations.client.OperationsClient;
import org.apache.pulsar.rpc.operations.model.GetOperationRequest;
import org.apache.pulsar.rpc.operations.model.Operation;
import org.apache.pulsar.rpc.operations.stub.DefaultOperationsStub;
import org.apache.pulsar.rpc.runtime.CallContext;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.StatusCode;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class PulsarRpcChannelTest {
    private static final String METHOD = "google.longrunning.Operations/GetOperation";

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private Producer<byte[]> producer;
    private Consumer<byte[]> consumer;
    private TypedMessageBuilder<byte[]> messageBuilder;
    private Message<byte[]> reply;
    private ReplyListener replyListener;
    private PulsarRpcChannel channel;
    private volatile String lastKey;

    @BeforeMethod
    @SuppressWarnings("unchecked")
    public void setup() {
        producer = mock(Producer.class);
        consumer = mock(Consumer.class);
        messageBuilder = mock(TypedMessageBuilder.class, RETURNS_SELF);
        reply = mock(Message.class);

        when(producer.newMessage()).thenReturn(messageBuilder);
        when(messageBuilder.key(anyString())).thenAnswer(invocation -> {
            lastKey = invocation.getArgument(0);
            return messageBuilder;
        });
        when(reply.getKey()).thenAnswer(invocation -> lastKey);
        when(consumer.acknowledgeAsync(any(Message.class))).thenReturn(CompletableFuture.completedFuture(null));

        ConcurrentHashMap<String, CompletableFuture<Message<byte[]>>> pendingRequestsMap = new ConcurrentHashMap<>();
        replyListener = new ReplyListener(pendingRequestsMap);
        channel = new PulsarRpcChannel(pendingRequestsMap, producer, consumer, "reply-topic", Duration.ofSeconds(3),
                PulsarRpcChannelBuilder.defaultObjectMapper(), clock, null);
    }

    private void replyOnSend() {
        when(messageBuilder.sendAsync()).thenAnswer(invocation -> {
            replyListener.received(consumer, reply);
            return CompletableFuture.completedFuture(mock(MessageId.class));
        });
    }

    @Test
    public void testReplyIsMergedIntoResponse() throws Exception {
        when(reply.getValue()).thenReturn(
                "{\"name\":\"operations/1\",\"done\":true,\"metadata\":{\"step\":\"3\"}}"
                        .getBytes(StandardCharsets.UTF_8));
        replyOnSend();

        Operation response = new Operation();
        channel.invoke(new CallContext(), METHOD, new GetOperationRequest("operations/1"), response);

        assertEquals(response.getName(), "operations/1");
        assertTrue(response.isDone());
        assertEquals(response.getMetadata().get("step"), "3");
        verify(messageBuilder).property(RPC_METHOD, METHOD);
        verify(messageBuilder).property(REPLY_TOPIC, "reply-topic");
        verify(messageBuilder).property(REQUEST_TIMEOUT_MILLIS, "3000");
        verify(messageBuilder).value("{\"name\":\"operations/1\"}".getBytes(StandardCharsets.UTF_8));
        assertEquals(channel.pendingRequestSize(), 0);
    }

    @Test
    public void testNullOperationListIsReadAsEmptyPage() {
        when(reply.getValue()).thenReturn(
                "{\"operations\":null,\"nextPageToken\":\"t1\"}".getBytes(StandardCharsets.UTF_8),
                "{\"operations\":[],\"nextPageToken\":\"\"}".getBytes(StandardCharsets.UTF_8));
        replyOnSend();
        OperationsClient client = new OperationsClient(new DefaultOperationsStub(channel));

        List<Operation> operations = new ArrayList<>();
        client.listOperations("operations", "", 10).forEach(operations::add);

        assertTrue(operations.isEmpty());
        verify(messageBuilder, times(2)).sendAsync();
    }

    @Test
    public void testDeadlineBoundsRequestTimeout() throws Exception {
        replyOnSend();
        CallContext context = new CallContext().setDeadline(clock.instant().plusMillis(1500));

        channel.invoke(context, METHOD, new GetOperationRequest("operations/1"), new Operation());

        verify(messageBuilder).property(REQUEST_TIMEOUT_MILLIS, "1500");
    }

    @Test
    public void testMetadataIsSentAsProperties() throws Exception {
        replyOnSend();
        CallContext context = new CallContext().setCredentials("token-1").putMetadata("tenant", "public");

        channel.invoke(context, METHOD, new GetOperationRequest("operations/1"), new Operation());

        verify(messageBuilder).property(CallContext.AUTHORIZATION, "token-1");
        verify(messageBuilder).property("tenant", "public");
    }

    @Test
    public void testRemoteError() {
        when(reply.getProperty(STATUS_CODE)).thenReturn("NOT_FOUND");
        when(reply.getProperty(ERROR_MESSAGE)).thenReturn("no such operation");
        replyOnSend();

        RpcChannelException e = expectThrows(RpcChannelException.class, () ->
                channel.invoke(new CallContext(), METHOD, new GetOperationRequest("operations/9"), new Operation()));

        assertEquals(e.getRemoteCode().orElse(null), "NOT_FOUND");
        assertEquals(StatusTranslator.toStatus(e), new Status(StatusCode.NOT_FOUND, "no such operation"));
    }

    @Test
    public void testErrorMessageWithoutCodeIsUnknown() {
        when(reply.getProperty(ERROR_MESSAGE)).thenReturn("boom");
        replyOnSend();

        RpcChannelException e = expectThrows(RpcChannelException.class, () ->
                channel.invoke(new CallContext(), METHOD, new GetOperationRequest("operations/1"), new Operation()));

        assertEquals(StatusTranslator.toStatus(e), new Status(StatusCode.UNKNOWN, "boom"));
    }

    @Test
    public void testExpiredDeadlineIsNotSent() {
        CallContext context = new CallContext().setDeadline(clock.instant().minusMillis(1));

        RpcChannelException e = expectThrows(RpcChannelException.class, () ->
                channel.invoke(context, METHOD, new GetOperationRequest("operations/1"), new Operation()));

        assertTrue(e.getCause() instanceof TimeoutException);
        assertEquals(StatusTranslator.toStatus(e).getCode(), StatusCode.DEADLINE_EXCEEDED);
        verify(producer, never()).newMessage();
    }

    @Test
    public void testSubMillisecondRemainderIsNotSent() {
        CallContext context = new CallContext().setDeadline(clock.instant().plusNanos(500_000));

        RpcChannelException e = expectThrows(RpcChannelException.class, () ->
                channel.invoke(context, METHOD, new GetOperationRequest("operations/1"), new Operation()));

        assertEquals(StatusTranslator.toStatus(e).getCode(), StatusCode.DEADLINE_EXCEEDED);
        verify(producer, never()).newMessage();
    }

    @Test
    public void testNoReplyTimesOut() {
        when(messageBuilder.sendAsync()).thenReturn(CompletableFuture.completedFuture(mock(MessageId.class)));
        CallContext context = new CallContext().setDeadline(clock.instant().plusMillis(50));

        RpcChannelException e = expectThrows(RpcChannelException.class, () ->
                channel.invoke(context, METHOD, new GetOperationRequest("operations/1"), new Operation()));

        assertTrue(e.getCause() instanceof TimeoutException);
        assertEquals(StatusTranslator.toStatus(e).getCode(), StatusCode.DEADLINE_EXCEEDED);
        assertEquals(channel.pendingRequestSize(), 0);
    }

    @Test
    public void testSendFailure() {
        CompletableFuture<MessageId> failed = new CompletableFuture<>();
        failed.completeExceptionally(new PulsarClientException.AlreadyClosedException("producer closed"));
        when(messageBuilder.sendAsync()).thenReturn(failed);

        RpcChannelException e = expectThrows(RpcChannelException.class, () ->
                channel.invoke(new CallContext(), METHOD, new GetOperationRequest("operations/1"), new Operation()));

        assertFalse(e.getRemoteCode().isPresent());
        assertEquals(StatusTranslator.toStatus(e).getCode(), StatusCode.UNAVAILABLE);
    }

    @Test
    public void testUnreadableReply() {
        when(reply.getValue()).thenReturn("not json".getBytes(StandardCharsets.UTF_8));
        replyOnSend();

        RpcChannelException e = expectThrows(RpcChannelException.class, () ->
                channel.invoke(new CallContext(), METHOD, new GetOperationRequest("operations/1"), new Operation()));

        assertEquals(StatusTranslator.toStatus(e).getCode(), StatusCode.INTERNAL);
    }

    @Test
    public void testLateReplyIsAcknowledged() {
        when(reply.getKey()).thenReturn("unknown-id");

        replyListener.received(consumer, reply);

        verify(consumer).acknowledgeAsync(reply);
    }

    @Test
    public void testCloseReleasesProducerAndConsumer() throws Exception {
        channel.close();

        verify(producer).close();
        verify(consumer).close();
    }
}
