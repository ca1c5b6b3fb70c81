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

import java.util.List;

/**
 * Knows the shape of a raw page, so the pagination classes do not have to.
 *
 * @param <E> the element type
 * @param <P> the raw page type
 */
public interface Accessor<E, P> {

    /**
     * @return a new, empty page container to fetch into
     */
    P newPage();

    /**
     * Returns the element collection held by the page. The returned list is the page's own mutable list, not a
     * copy: {@link PageResult#takeElements()} empties it.
     */
    List<E> extractElements(P page);

    /**
     * @return the continuation token of the page; null and the empty string both mean there is no next page
     */
    String extractNextToken(P page);
}
