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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.pulsar.rpc.operations.model.CancelOperationRequest;
import org.apache.pulsar.rpc.operations.model.DeleteOperationRequest;
import org.apache.pulsar.rpc.operations.model.Empty;
import org.apache.pulsar.rpc.operations.model.GetOperationRequest;
import org.apache.pulsar.rpc.operations.model.ListOperationsRequest;
import org.apache.pulsar.rpc.operations.model.ListOperationsResponse;
import org.apache.pulsar.rpc.operations.model.Operation;
import org.apache.pulsar.rpc.operations.stub.OperationsStub;
import org.apache.pulsar.rpc.runtime.CallContext;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.StatusCode;

/**
 * In-memory Operations service. Listing pages are addressed by {@code offset-N} tokens; the listing ends with an
 * empty page carrying an empty token.
 */
class FakeOperationsService implements OperationsStub {
    final Map<String, Operation> operations = Collections.synchronizedMap(new LinkedHashMap<>());
    final List<String> receivedTokens = Collections.synchronizedList(new ArrayList<>());
    final List<CallContext> receivedContexts = Collections.synchronizedList(new ArrayList<>());
    volatile int failListingAfterCalls = -1;

    FakeOperationsService(int count) {
        for (int i = 0; i < count; i++) {
            String name = "operations/" + i;
            operations.put(name, new Operation(name, false, null, null, new HashMap<>()));
        }
    }

    @Override
    public Status getOperation(CallContext context, GetOperationRequest request, Operation response) {
        receivedContexts.add(context);
        Operation operation = operations.get(request.getName());
        if (operation == null) {
            return new Status(StatusCode.NOT_FOUND, request.getName() + " not found");
        }
        response.setName(operation.getName());
        response.setDone(operation.isDone());
        return Status.OK;
    }

    @Override
    public Status listOperations(CallContext context, ListOperationsRequest request,
                                 ListOperationsResponse response) {
        receivedContexts.add(context);
        receivedTokens.add(request.getPageToken());
        if (failListingAfterCalls >= 0 && receivedTokens.size() > failListingAfterCalls) {
            return new Status(StatusCode.UNAVAILABLE, "listing unavailable");
        }
        List<Operation> all = new ArrayList<>(operations.values());
        int start = request.getPageToken().isEmpty() ? 0
                : Integer.parseInt(request.getPageToken().substring("offset-".length()));
        int end = Math.min(all.size(), start + request.getPageSize());
        response.getOperations().addAll(all.subList(Math.min(start, end), end));
        response.setNextPageToken(start >= all.size() ? "" : "offset-" + end);
        return Status.OK;
    }

    @Override
    public Status deleteOperation(CallContext context, DeleteOperationRequest request, Empty response) {
        receivedContexts.add(context);
        return operations.remove(request.getName()) == null
                ? new Status(StatusCode.NOT_FOUND, request.getName() + " not found") : Status.OK;
    }

    @Override
    public Status cancelOperation(CallContext context, CancelOperationRequest request, Empty response) {
        receivedContexts.add(context);
        Operation operation = operations.get(request.getName());
        if (operation == null) {
            return new Status(StatusCode.NOT_FOUND, request.getName() + " not found");
        }
        operation.setDone(true);
        operation.setErrorCode(StatusCode.CANCELLED.name());
        return Status.OK;
    }
}
