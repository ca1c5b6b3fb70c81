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

import static org.apache.pulsar.rpc.operations.stub.OperationsMethods.CANCEL_OPERATION;
import static org.apache.pulsar.rpc.operations.stub.OperationsMethods.DELETE_OPERATION;
import static org.apache.pulsar.rpc.operations.stub.OperationsMethods.GET_OPERATION;
import static org.apache.pulsar.rpc.operations.stub.OperationsMethods.LIST_OPERATIONS;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.operations.channel.RpcChannel;
import org.apache.pulsar.rpc.operations.channel.RpcChannelException;
import org.apache.pulsar.rpc.operations.channel.StatusTranslator;
import org.apache.pulsar.rpc.operations.model.CancelOperationRequest;
import org.apache.pulsar.rpc.operations.model.DeleteOperationRequest;
import org.apache.pulsar.rpc.operations.model.Empty;
import org.apache.pulsar.rpc.operations.model.GetOperationRequest;
import org.apache.pulsar.rpc.operations.model.ListOperationsRequest;
import org.apache.pulsar.rpc.operations.model.ListOperationsResponse;
import org.apache.pulsar.rpc.operations.model.Operation;
import org.apache.pulsar.rpc.runtime.CallContext;
import org.apache.pulsar.rpc.runtime.Status;

/**
 * The innermost stub: one channel invocation per call, failures translated to a {@link Status}.
 */
@Slf4j
public class DefaultOperationsStub implements OperationsStub {
    private final RpcChannel channel;

    public DefaultOperationsStub(@NonNull RpcChannel channel) {
        this.channel = channel;
    }

    @Override
    public Status getOperation(CallContext context, GetOperationRequest request, Operation response) {
        return invoke(context, GET_OPERATION, request, response);
    }

    @Override
    public Status listOperations(CallContext context, ListOperationsRequest request,
                                 ListOperationsResponse response) {
        return invoke(context, LIST_OPERATIONS, request, response);
    }

    @Override
    public Status deleteOperation(CallContext context, DeleteOperationRequest request, Empty response) {
        return invoke(context, DELETE_OPERATION, request, response);
    }

    @Override
    public Status cancelOperation(CallContext context, CancelOperationRequest request, Empty response) {
        return invoke(context, CANCEL_OPERATION, request, response);
    }

    private Status invoke(@NonNull CallContext context, String method, @NonNull Object request,
                          @NonNull Object response) {
        try {
            channel.invoke(context, OperationsMethods.fullName(method), request, response);
            return Status.OK;
        } catch (RpcChannelException e) {
            Status status = StatusTranslator.toStatus(e);
            log.debug("[{}] Call failed: {}", method, status);
            return status;
        }
    }

    @Override
    public void close() throws RpcChannelException {
        channel.close();
    }
}
