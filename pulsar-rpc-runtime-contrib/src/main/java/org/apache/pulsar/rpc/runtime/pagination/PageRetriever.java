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

import org.apache.pulsar.rpc.runtime.Status;

/**
 * Fetches one page of a list result into a caller supplied container.
 *
 * <p>On success the container holds either some elements together with a non-empty continuation token, or no
 * elements and an empty token, which marks the end of the list. A non-OK status is a failed fetch and is never
 * mistaken for the end of the list.
 *
 * <p>A retriever usually remembers where the previous fetch stopped, so one instance serves exactly one
 * traversal. {@link Pages} obtains a new one for every traversal.
 *
 * @param <P> the raw page type
 */
@FunctionalInterface
public interface PageRetriever<P> {

    Status fetch(P page);
}
