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
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.operations.model.ListOperationsRequest;
import org.apache.pulsar.rpc.operations.model.ListOperationsResponse;
import org.apache.pulsar.rpc.operations.stub.OperationsStub;
import org.apache.pulsar.rpc.runtime.CallContext;
import org.apache.pulsar.rpc.runtime.Status;
import org.apache.pulsar.rpc.runtime.pagination.PageRetriever;

/**
 * Fetches the pages of one listing, one {@code ListOperations} call per page.
 *
 * <p>The first call sends the page token of the original request; every later call sends the token of the page
 * fetched before it. A retriever walks one listing once, so a new one is needed to start over.
 */
@Slf4j
public class ListOperationsRetriever implements PageRetriever<ListOperationsResponse> {
    private final OperationsStub stub;
    private final ListOperationsRequest request;
    private final Supplier<CallContext> contextFactory;
    private String pageToken;

    public ListOperationsRetriever(@NonNull OperationsStub stub, @NonNull ListOperationsRequest request,
                                   @NonNull Supplier<CallContext> contextFactory) {
        this.stub = stub;
        this.request = request;
        this.contextFactory = contextFactory;
        this.pageToken = request.getPageToken() == null ? "" : request.getPageToken();
    }

    @Override
    public Status fetch(ListOperationsResponse page) {
        Status status = stub.listOperations(contextFactory.get(), request.withPageToken(pageToken), page);
        if (status.isOk()) {
            pageToken = page.getNextPageToken() == null ? "" : page.getNextPageToken();
        } else {
            log.debug("[{}] ListOperations failed at token '{}': {}", request.getName(), pageToken, status);
        }
        return status;
    }
}
