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

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import lombok.NonNull;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.StatusCode;

/**
 * Maps transport failures to the {@link Status} reported by the stubs.
 */
public final class StatusTranslator {

    private StatusTranslator() {
    }

    public static Status toStatus(@NonNull RpcChannelException e) {
        if (e.getRemoteCode().isPresent()) {
            return new Status(StatusCode.forName(e.getRemoteCode().get()), messageOf(e));
        }
        Throwable cause = unwrap(e.getCause());
        if (cause == null) {
            return new Status(StatusCode.UNKNOWN, messageOf(e));
        }
        return new Status(codeOf(cause), messageOf(cause));
    }

    static StatusCode codeOf(Throwable cause) {
        // PulsarClientException.TimeoutException extends PulsarClientException, so test it first
        if (cause instanceof TimeoutException || cause instanceof PulsarClientException.TimeoutException) {
            return StatusCode.DEADLINE_EXCEEDED;
        }
        if (cause instanceof InterruptedException || cause instanceof CancellationException) {
            return StatusCode.CANCELLED;
        }
        if (cause instanceof PulsarClientException.AuthenticationException) {
            return StatusCode.UNAUTHENTICATED;
        }
        if (cause instanceof PulsarClientException.AuthorizationException) {
            return StatusCode.PERMISSION_DENIED;
        }
        if (cause instanceof PulsarClientException.TopicDoesNotExistException) {
            return StatusCode.NOT_FOUND;
        }
        if (cause instanceof PulsarClientException.ProducerQueueIsFullError) {
            return StatusCode.RESOURCE_EXHAUSTED;
        }
        if (cause instanceof PulsarClientException) {
            return StatusCode.UNAVAILABLE;
        }
        if (cause instanceof JsonProcessingException) {
            return StatusCode.INTERNAL;
        }
        return StatusCode.UNKNOWN;
    }

    private static Throwable unwrap(Throwable cause) {
        Throwable current = cause;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
