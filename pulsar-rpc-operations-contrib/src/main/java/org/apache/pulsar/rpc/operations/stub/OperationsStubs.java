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
package org.apache.pulsar.rpc.operations.stub;

import java.time.Duration;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.client.api.Authentication;
import org.apache.pulsar.client.api.AuthenticationFactory;
import org.apache.pulsar.client.api.ClientBuilder;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.rpc.operations.channel.ChannelSettings;
import org.apache.pulsar.rpc.operations.channel.RpcChannel;
import org.apache.pulsar.rpc.operations.channel.RpcChannelException;
import org.apache.pulsar.rpc.runtime.retry.BackoffPolicy;
import org.apache.pulsar.rpc.runtime.retry.ExponentialBackoffPolicy;
import org.apache.pulsar.rpc.runtime.retry.LimitedDurationRetryPolicy;
import org.apache.pulsar.rpc.runtime.retry.RetryPolicy;

/**
 * Factory methods for ready to use Operations stubs.
 *
 * <p>The returned stack is a {@link RetryOperationsStub} over a {@link DefaultOperationsStub}, retrying for up to
 * 500ms with exponential backoff from 20ms to 100ms.
 */
@Slf4j
public final class OperationsStubs {
    public static final Duration DEFAULT_MAX_RETRY_DURATION = Duration.ofMillis(500);
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(20);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMillis(100);

    private OperationsStubs() {
    }

    public static RetryPolicy defaultRetryPolicy() {
        return new LimitedDurationRetryPolicy(DEFAULT_MAX_RETRY_DURATION);
    }

    public static BackoffPolicy defaultBackoffPolicy() {
        return new ExponentialBackoffPolicy(DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    /**
     * Creates a stub configured from the environment, authenticating with {@code PULSAR_AUTH_PLUGIN} and
     * {@code PULSAR_AUTH_PARAMS} when set.
     */
    public static OperationsStub createStub() throws RpcChannelException {
        ChannelSettings settings = ChannelSettings.fromEnvironment(System.getenv());
        Authentication authentication = null;
        if (settings.getAuthPlugin().isPresent()) {
            try {
                String authParams = settings.getAuthParams() == null ? "" : settings.getAuthParams();
                authentication = AuthenticationFactory.create(settings.getAuthPlugin().get(), authParams);
            } catch (PulsarClientException e) {
                throw new RpcChannelException(e);
            }
        }
        return createStub(settings, authentication);
    }

    /**
     * Creates a stub configured from the environment, authenticating with the given credentials.
     */
    public static OperationsStub createStub(@NonNull Authentication credentials) throws RpcChannelException {
        return createStub(ChannelSettings.fromEnvironment(System.getenv()), credentials);
    }

    /**
     * Wraps an existing channel. The returned stub owns the channel.
     */
    public static OperationsStub createStub(@NonNull RpcChannel channel) {
        return new RetryOperationsStub(new DefaultOperationsStub(channel), defaultRetryPolicy(),
                defaultBackoffPolicy());
    }

    static OperationsStub createStub(ChannelSettings settings, Authentication authentication)
            throws RpcChannelException {
        PulsarClient client;
        try {
            ClientBuilder clientBuilder = PulsarClient.builder().serviceUrl(settings.getServiceUrl());
            if (authentication != null) {
                clientBuilder.authentication(authentication);
            }
            client = clientBuilder.build();
        } catch (PulsarClientException e) {
            throw new RpcChannelException(e);
        }
        try {
            RpcChannel channel = settings.channelBuilder()
                    .closeClientOnClose(true)
                    .build(client);
            log.info("Created Operations stub for {}", settings.getServiceUrl());
            return createStub(channel);
        } catch (RpcChannelException e) {
            client.closeAsync();
            throw e;
        }
    }
}
