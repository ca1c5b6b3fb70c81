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
package org.apache.pulsar.rpc.runtime.pagination;

import lombok.Getter;
import org.apache.pulsar.rpc.runtime.RpcStatusException;
import org.apache.pulsar.rpc.runtime.Status;

/**
 * Thrown by page and element iterators when a {@link PageRetriever} fails to fetch a page.
 */
@Getter
public class PageFetchException extends RpcStatusException {

    /** The 1-based number of the page whose fetch failed. */
    private final int pageNumber;

    public PageFetchException(Status status, int pageNumber) {
        super("Failed to fetch page " + pageNumber + ": " + status.getCode() + " " + status.getMessage(), status);
        this.pageNumber = pageNumber;
    }
}
