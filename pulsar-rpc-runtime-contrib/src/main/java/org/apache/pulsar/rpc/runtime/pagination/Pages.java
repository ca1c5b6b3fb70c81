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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.runtime.Status;

/**
 * A lazy sequence of the pages of a list result.
 *
 * <p>Nothing is fetched up front: each page is fetched synchronously the first time an iterator reaches it.
 * An iterator ends when a page comes back with an empty continuation token, or when {@code pageCap} pages have
 * been fetched ({@code 0} means no cap). The page on which the iterator ends is not returned by
 * {@link PageIterator#next()}, but remains reachable through {@link PageIterator#current()}: with a cap of 5,
 * a loop visits pages 1 to 4 and {@code current()} afterwards returns page 5.
 *
 * <p>Every call to {@link #iterator()} starts a new traversal from the first page with a retriever freshly
 * obtained from the supplier, so walking the same {@code Pages} twice yields the same pages. Iterators are not
 * thread-safe.
 *
 * @param <E> the element type
 * @param <P> the raw page type
 */
@Slf4j
public class Pages<E, P> implements Iterable<PageResult<E, P>> {

    private final Supplier<? extends PageRetriever<P>> retrieverFactory;
    private final Accessor<E, P> accessor;
    private final int pageCap;

    public Pages(@NonNull Supplier<? extends PageRetriever<P>> retrieverFactory,
                 @NonNull Accessor<E, P> accessor,
                 int pageCap) {
        if (pageCap < 0) {
            throw new IllegalArgumentException("pageCap must be >= 0");
        }
        this.retrieverFactory = retrieverFactory;
        this.accessor = accessor;
        this.pageCap = pageCap;
    }

    public int getPageCap() {
        return pageCap;
    }

    @Override
    public PageIterator iterator() {
        return new PageIterator(retrieverFactory.get());
    }

    private enum State {
        FETCHING,
        HAS_PAGE,
        EXHAUSTED,
        FAILED
    }

    /**
     * Iterator over the pages of one traversal. {@link #hasNext()} is false once the iterator stands on the end
     * position; {@link #current()} dereferences the current position, including the end position.
     */
    public class PageIterator implements Iterator<PageResult<E, P>> {
        private final PageRetriever<P> retriever;
        private State state = State.FETCHING;
        private PageResult<E, P> current;
        private Status status = Status.OK;
        private int pageCount;

        PageIterator(@NonNull PageRetriever<P> retriever) {
            this.retriever = retriever;
        }

        /**
         * @throws PageFetchException if fetching the page at the current position fails
         */
        @Override
        public boolean hasNext() {
            fetchIfNeeded();
            return state == State.HAS_PAGE;
        }

        /**
         * @throws PageFetchException if fetching the page at the current position fails
         */
        @Override
        public PageResult<E, P> next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more pages");
            }
            PageResult<E, P> page = current;
            current = null;
            state = State.FETCHING;
            return page;
        }

        /**
         * Returns the page at the current position without advancing, fetching it if needed. On the end position
         * this is the last page fetched: an empty terminal page, or the page that reached the cap.
         *
         * @throws PageFetchException if fetching the page at the current position fails
         */
        public PageResult<E, P> current() {
            fetchIfNeeded();
            return current;
        }

        /**
         * @return the number of pages fetched so far by this traversal
         */
        public int pageCount() {
            return pageCount;
        }

        /**
         * @return the status of the most recent fetch, {@link Status#OK} before the first one
         */
        public Status status() {
            return status;
        }

        private void fetchIfNeeded() {
            if (state == State.FAILED) {
                throw new PageFetchException(status, pageCount + 1);
            }
            if (state != State.FETCHING) {
                return;
            }
            P rawPage = accessor.newPage();
            status = retriever.fetch(rawPage);
            if (!status.isOk()) {
                state = State.FAILED;
                log.warn("Fetching page {} failed with {}", pageCount + 1, status);
                throw new PageFetchException(status, pageCount + 1);
            }
            pageCount++;
            current = new PageResult<>(rawPage, accessor);
            boolean capReached = pageCap > 0 && pageCount >= pageCap;
            state = current.nextPageToken().isEmpty() || capReached ? State.EXHAUSTED : State.HAS_PAGE;
        }
    }
}
