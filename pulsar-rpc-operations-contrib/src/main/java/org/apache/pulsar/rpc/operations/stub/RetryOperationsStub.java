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
import org.apache.pulsar.rpc.operations.channel.RpcChannelException;
import org.apache.pulsar.rpc.operations.model.CancelOperationRequest;
import org.apache.pulsar.rpc.operations.model.DeleteOperationRequest;
import org.apache.pulsar.rpc.operations.model.Empty;
import org.apache.pulsar.rpc.operations.model.GetOperationRequest;
import org.apache.pulsar.rpc.operations.model.ListOperationsRequest;
import org.apache.pulsar.rpc.operations.model.ListOperationsResponse;
import org.apache.pulsar.rpc.operations.model.Operation;
import org.apache.pulsar.rpc.runtime.CallContext;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.retry.BackoffPolicy;
import org.apache.pulsar.rpc.runtime.retry.ExponentialBackoffPolicy;
import org.apache.pulsar.rpc.runtime.retry.LimitedErrorCountRetryPolicy;
import org.apache.pulsar.rpc.runtime.retry.RetryLoop;
import org.apache.pulsar.rpc.runtime.retry.RetryPolicy;
import org.apache.pulsar.rpc.runtime.retry.Sleeper;

/**
 * Retries the calls of the stub it wraps.
 *
 * <p>The policies given at construction are templates: each call runs with fresh copies of them, unless its
 * {@link CallContext} carries its own policies, which are then used as they are. Concurrent calls therefore never
 * share retry or backoff state. Without a template and without an override a call gets exactly one attempt.
 */
public class RetryOperationsStub implements OperationsStub {
    private final OperationsStub nextStub;
    private final RetryPolicy retryPolicyTemplate;
    private final BackoffPolicy backoffPolicyTemplate;
    private final Sleeper sleeper;

    /**
     * @param nextStub the stub doing one attempt, owned and closed by this stub
     * @param retryPolicy the default retry policy, may be null
     * @param backoffPolicy the default backoff policy, may be null
     */
    public RetryOperationsStub(OperationsStub nextStub, RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
        this(nextStub, retryPolicy, backoffPolicy, Sleeper.DEFAULT);
    }

    RetryOperationsStub(@NonNull OperationsStub nextStub, RetryPolicy retryPolicy, BackoffPolicy backoffPolicy,
                        @NonNull Sleeper sleeper) {
        this.nextStub = nextStub;
        this.retryPolicyTemplate = retryPolicy == null ? null : retryPolicy.copy();
        this.backoffPolicyTemplate = backoffPolicy == null ? null : backoffPolicy.copy();
        this.sleeper = sleeper;
    }

    @Override
    public Status getOperation(CallContext context, GetOperationRequest request, Operation response) {
        return RetryLoop.retryCall(context, request, response, nextStub::getOperation,
                retryPolicy(context), backoffPolicy(context), sleeper);
    }

    @Override
    public Status listOperations(CallContext context, ListOperationsRequest request,
                                 ListOperationsResponse response) {
        return RetryLoop.retryCall(context, request, response, nextStub::listOperations,
                retryPolicy(context), backoffPolicy(context), sleeper);
    }

    @Override
    public Status deleteOperation(CallContext context, DeleteOperationRequest request, Empty response) {
        return RetryLoop.retryCall(context, request, response, nextStub::deleteOperation,
                retryPolicy(context), backoffPolicy(context), sleeper);
    }

    @Override
    public Status cancelOperation(CallContext context, CancelOperationRequest request, Empty response) {
        return RetryLoop.retryCall(context, request, response, nextStub::cancelOperation,
                retryPolicy(context), backoffPolicy(context), sleeper);
    }

    private RetryPolicy retryPolicy(@NonNull CallContext context) {
        return context.getRetryPolicy().orElseGet(() -> retryPolicyTemplate == null
                ? new LimitedErrorCountRetryPolicy(0) : retryPolicyTemplate.copy());
    }

    private BackoffPolicy backoffPolicy(@NonNull CallContext context) {
        return context.getBackoffPolicy().orElseGet(() -> backoffPolicyTemplate == null
                ? new ExponentialBackoffPolicy(Duration.ZERO, Duration.ZERO) : backoffPolicyTemplate.copy());
    }

    @Override
    public void close() throws RpcChannelException {
        nextStub.close();
    }
}
