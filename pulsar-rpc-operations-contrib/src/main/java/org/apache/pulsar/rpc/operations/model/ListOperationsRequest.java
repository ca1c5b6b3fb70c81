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
package org.apache.pulsar.rpc.operations.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Requests one page of the operations under {@code name} matching {@code filter}. An empty {@code pageToken}
 * asks for the first page; later pages are requested with the token returned by the previous page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListOperationsRequest {
    /** Name of the collection to list, e.g. {@code operations}. */
    private String name;
    /** Server side filter expression, empty to list everything. */
    private String filter;
    /** Maximum number of operations per page, 0 to let the server choose. */
    private int pageSize;
    private String pageToken = "";

    /**
     * @param token the continuation token of the wanted page, empty for the first page
     * @return a copy of this request asking for the page identified by {@code token}
     */
    public ListOperationsRequest withPageToken(String token) {
        return new ListOperationsRequest(name, filter, pageSize, token);
    }
}
