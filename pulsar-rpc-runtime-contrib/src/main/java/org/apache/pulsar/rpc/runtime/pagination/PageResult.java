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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import lombok.NonNull;

/**
 * One fetched page of a list result.
 *
 * <p>A page result is a single-use snapshot: {@link #takeElements()} moves the elements out and leaves the wrapped
 * page with an empty element collection. Callers that need the elements afterwards keep the returned list.
 *
 * @param <E> the element type
 * @param <P> the raw page type
 */
public class PageResult<E, P> implements Iterable<E> {

    private final P rawPage;
    private final Accessor<E, P> accessor;

    public PageResult(@NonNull P rawPage, @NonNull Accessor<E, P> accessor) {
        this.rawPage = rawPage;
        this.accessor = accessor;
    }

    /**
     * @return the continuation token of this page, empty if this is the last page
     */
    public String nextPageToken() {
        String token = accessor.extractNextToken(rawPage);
        return token == null ? "" : token;
    }

    public P rawPage() {
        return rawPage;
    }

    /**
     * @return a read-only view of the elements of this page
     */
    public List<E> elements() {
        return Collections.unmodifiableList(accessor.extractElements(rawPage));
    }

    @Override
    public Iterator<E> iterator() {
        return elements().iterator();
    }

    /**
     * Moves the elements out of this page.
     *
     * @return the elements, in page order
     */
    public List<E> takeElements() {
        List<E> source = accessor.extractElements(rawPage);
        List<E> taken = new ArrayList<>(source);
        source.clear();
        return taken;
    }

    @Override
    public String toString() {
        return "PageResult{nextPageToken=" + nextPageToken() + ", elements="
                + accessor.extractElements(rawPage).size() + '}';
    }
}
