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
package org.apache.pulsar.rpc.operations.client;

import java.util.function.Supplier;
import lombok.NonNull;
import org.apache.pulsar.rpc.operations.channel.RpcChannelException;
import org.apache.pulsar.rpc.operations.model.CancelOperationRequest;
import org.apache.pulsar.rpc.operations.model.DeleteOperationRequest;
import org.apache.pulsar.rpc.operations.model.Empty;
import org.apache.pulsar.rpc.operations.model.GetOperationRequest;
import org.apache.pulsar.rpc.operations.model.ListOperationsRequest;
import org.apache.pulsar.rpc.operations.model.ListOperationsResponse;
import org.apache.pulsar.rpc.operations.model.Operation;
import org.apache.pulsar.rpc.operations.stub.OperationsStub;
import org.apache.pulsar.rpc.runtime.CallContext;
import org.apache.pulsar.rpc.runtime.RpcStatusException;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.pagination.PaginatedResult;

/**
 * Convenience API over an {@link OperationsStub}.
 *
 * <p>Each call, and each page fetched by a listing, runs with a new {@link CallContext} from the context factory.
 * Failed calls throw {@link RpcStatusException}.
 */
public class OperationsClient implements AutoCloseable {
    private final OperationsStub stub;
    private final Supplier<CallContext> contextFactory;

    public OperationsClient(OperationsStub stub) {
        this(stub, CallContext::new);
    }

    public OperationsClient(@NonNull OperationsStub stub, @NonNull Supplier<CallContext> contextFactory) {
        this.stub = stub;
        this.contextFactory = contextFactory;
    }

    /**
     * @param name the operation name
     * @return the current state of the operation
     * @throws RpcStatusException if the call fails
     */
    public Operation getOperation(@NonNull String name) {
        Operation operation = new Operation();
        check(stub.getOperation(contextFactory.get(), new GetOperationRequest(name), operation));
        return operation;
    }

    /**
     * @param name the operation name
     * @throws RpcStatusException if the call fails
     */
    public void deleteOperation(@NonNull String name) {
        check(stub.deleteOperation(contextFactory.get(), new DeleteOperationRequest(name), new Empty()));
    }

    public void cancelOperation(@NonNull String name) {
        check(stub.cancelOperation(contextFactory.get(), new CancelOperationRequest(name), new Empty()));
    }

    public PaginatedResult<Operation, ListOperationsResponse> listOperations(String name, String filter,
                                                                            int pageSize) {
        return listOperations(name, filter, pageSize, 0);
    }

    /**
     * Lists operations lazily. Nothing is fetched until the result is iterated, and every iteration starts the
     * listing over.
     *
     * @param name the collection to list
     * @param filter the server side filter, empty for none
     * @param pageSize the maximum number of operations per page, 0 to let the server choose
     * @param maxPages the page cap, 0 for none
     * @return the lazily fetched operations
     */
    public PaginatedResult<Operation, ListOperationsResponse> listOperations(String name, String filter,
                                                                            int pageSize, int maxPages) {
        ListOperationsRequest request = new ListOperationsRequest(name, filter, pageSize, "");
        return new PaginatedResult<>(() -> new ListOperationsRetriever(stub, request, contextFactory),
                new ListOperationsAccessor(), maxPages);
    }

    private static void check(Status status) {
        if (!status.isOk()) {
            throw new RpcStatusException(status);
        }
    }

    @Override
    public void close() throws RpcChannelException {
        stub.close();
    }
}
