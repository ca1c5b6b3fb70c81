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

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The elements of a list result, flattened across its pages.
 *
 * <p>Iteration drives a {@link Pages} traversal and crosses page boundaries transparently. The elements of the
 * page an underlying traversal ends on are not returned: when the page cap stops the traversal, that page lies
 * beyond the cap. With five pages of five elements and a cap of 4, only the fifteen elements of pages 1 to 3 are
 * returned.
 *
 * @param <E> the element type
 * @param <P> the raw page type
 */
public class PaginatedResult<E, P> implements Iterable<E> {

    private final Pages<E, P> pages;

    public PaginatedResult(Supplier<? extends PageRetriever<P>> retrieverFactory, Accessor<E, P> accessor,
                           int pageCap) {
        this.pages = new Pages<>(retrieverFactory, accessor, pageCap);
    }

    /**
     * @return the page-level view of this result
     */
    public Pages<E, P> pages() {
        return pages;
    }

    /**
     * @throws PageFetchException from {@code hasNext()} or {@code next()} if a page cannot be fetched
     */
    @Override
    public Iterator<E> iterator() {
        return new ElementIterator(pages.iterator());
    }

    public Stream<E> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private class ElementIterator implements Iterator<E> {
        private final Pages<E, P>.PageIterator pageIterator;
        private Iterator<E> elements = Collections.emptyIterator();

        ElementIterator(Pages<E, P>.PageIterator pageIterator) {
            this.pageIterator = pageIterator;
        }

        @Override
        public boolean hasNext() {
            while (!elements.hasNext()) {
                if (!pageIterator.hasNext()) {
                    return false;
                }
                elements = pageIterator.next().iterator();
            }
            return true;
        }

        @Override
        public E next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more elements");
            }
            return elements.next();
        }
    }
}
