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
/**
 * Lazy iteration over paginated list results, independent of the request and response types.
 *
 * <p>A {@link org.apache.pulsar.rpc.runtime.pagination.PageRetriever} fetches one raw page per call, an
 * {@link org.apache.pulsar.rpc.runtime.pagination.Accessor} reads elements and continuation tokens out of it.
 * {@link org.apache.pulsar.rpc.runtime.pagination.Pages} iterates page by page,
 * {@link org.apache.pulsar.rpc.runtime.pagination.PaginatedResult} element by element.
 */
package org.apache.pulsar.rpc.runtime.pagination;
