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

import static org.testng.Assert.assertEquals;
import com.fasterxml.jackson.core.JsonParseException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.StatusCode;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class StatusTranslatorTest {

    @DataProvider
    public Object[][] causes() {
        return new Object[][] {
                {new TimeoutException("late"), StatusCode.DEADLINE_EXCEEDED},
                {new PulsarClientException.TimeoutException("send timeout"), StatusCode.DEADLINE_EXCEEDED},
                {new InterruptedException(), StatusCode.CANCELLED},
                {new CancellationException(), StatusCode.CANCELLED},
                {new PulsarClientException.AuthenticationException("bad token"), StatusCode.UNAUTHENTICATED},
                {new PulsarClientException.AuthorizationException("no role"), StatusCode.PERMISSION_DENIED},
                {new PulsarClientException.TopicDoesNotExistException("gone"), StatusCode.NOT_FOUND},
                {new PulsarClientException.ProducerQueueIsFullError("full"), StatusCode.RESOURCE_EXHAUSTED},
                {new PulsarClientException.ConnectException("refused"), StatusCode.UNAVAILABLE},
                {new JsonParseException(null, "bad json"), StatusCode.INTERNAL},
                {new IllegalStateException("?"), StatusCode.UNKNOWN},
        };
    }

    @Test(dataProvider = "causes")
    public void testLocalFailures(Throwable cause, StatusCode expected) {
        assertEquals(StatusTranslator.toStatus(new RpcChannelException(cause)).getCode(), expected);
    }

    @Test
    public void testCompletionExceptionIsUnwrapped() {
        RpcChannelException e = new RpcChannelException(
                new CompletionException(new PulsarClientException.AuthorizationException("no role")));

        assertEquals(StatusTranslator.toStatus(e), new Status(StatusCode.PERMISSION_DENIED, "no role"));
    }

    @Test
    public void testRemoteCode() {
        assertEquals(StatusTranslator.toStatus(new RpcChannelException("ABORTED", "conflict")),
                new Status(StatusCode.ABORTED, "conflict"));
        assertEquals(StatusTranslator.toStatus(new RpcChannelException("NO_SUCH_CODE", "odd")),
                new Status(StatusCode.UNKNOWN, "odd"));
    }

    @Test
    public void testMessageOnly() {
        assertEquals(StatusTranslator.toStatus(new RpcChannelException("broken")),
                new Status(StatusCode.UNKNOWN, "broken"));
    }
}
