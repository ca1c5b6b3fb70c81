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
 * Policy-driven automatic retries.
 *
 * <p>{@link org.apache.pulsar.rpc.runtime.retry.RetryLoop} drives repeated attempts of one call under a
 * {@link org.apache.pulsar.rpc.runtime.retry.RetryPolicy}, which bounds the aggregate retry budget, and a
 * {@link org.apache.pulsar.rpc.runtime.retry.BackoffPolicy}, which spaces the attempts out. Both policies are
 * stateful and copied per call.
 */
package org.apache.pulsar.rpc.runtime.retry;
