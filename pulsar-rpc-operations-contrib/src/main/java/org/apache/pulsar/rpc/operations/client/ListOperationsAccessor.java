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
import java.util.List;
import org.apache.pulsar.rpc.operations.model.ListOperationsResponse;
import org.apache.pulsar.rpc.operations.model.Operation;
import org.apache.pulsar.rpc.runtime.pagination.Accessor;

/**
 * Exposes the operations and the continuation token of a {@link ListOperationsResponse} to the pagination classes.
 */
public class ListOperationsAccessor implements Accessor<Operation, ListOperationsResponse> {

    @Override
    public ListOperationsResponse newPage() {
        return new ListOperationsResponse();
    }

    /**
     * Returns the page's own operation list. A page whose list was cleared to null by the reply gets an empty
     * list first.
     *
     * @param page the fetched page
     * @return the mutable operation list held by {@code page}
     */
    @Override
    public List<Operation> extractElements(ListOperationsResponse page) {
        if (page.getOperations() == null) {
            page.setOperations(new ArrayList<>());
        }
        return page.getOperations();
    }

    /**
     * @param page the fetched page
     * @return the token of the next page, empty or null on the last page
     */
    @Override
    public String extractNextToken(ListOperationsResponse page) {
        return page.getNextPageToken();
    }
}
