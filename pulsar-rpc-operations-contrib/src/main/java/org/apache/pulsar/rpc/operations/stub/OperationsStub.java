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

/**
 * Client side of the Operations service.
 *
 * <p>Every method takes the per-call context, the request and a response container that is filled when the call
 * succeeds, and returns the outcome as a {@link Status}. Stubs are stacked as decorators, each one owning the
 * stub below it. A method a stub does not override reports {@code UNIMPLEMENTED}.
 */
public interface OperationsStub extends AutoCloseable {

    default Status getOperation(CallContext context, GetOperationRequest request, Operation response) {
        return Status.unimplemented(OperationsMethods.GET_OPERATION);
    }

    default Status listOperations(CallContext context, ListOperationsRequest request,
                                  ListOperationsResponse response) {
        return Status.unimplemented(OperationsMethods.LIST_OPERATIONS);
    }

    default Status deleteOperation(CallContext context, DeleteOperationRequest request, Empty response) {
        return Status.unimplemented(OperationsMethods.DELETE_OPERATION);
    }

    default Status cancelOperation(CallContext context, CancelOperationRequest request, Empty response) {
        return Status.unimplemented(OperationsMethods.CANCEL_OPERATION);
    }

    @Override
    default void close() throws RpcChannelException {
    }
}
