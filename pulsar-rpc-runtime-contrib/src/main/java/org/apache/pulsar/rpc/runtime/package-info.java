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
 * Runtime support for generated RPC client stubs.
 *
 * <p>The classes in this package are the values shared by every stub: {@link org.apache.pulsar.rpc.runtime.Status}
 * reports the outcome of a call and {@link org.apache.pulsar.rpc.runtime.CallContext} carries the per-call
 * deadline, policy overrides and metadata. Automatic retries live in
 * {@link org.apache.pulsar.rpc.runtime.retry}, lazy iteration over paginated list results in
 * {@link org.apache.pulsar.rpc.runtime.pagination}.
 */
package org.apache.pulsar.rpc.runtime;
