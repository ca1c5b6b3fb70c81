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
package org.apache.pulsar.rpc.operations.channel;

import org.apache.pulsar.rpc.runtime.CallContext;

/**
 * The transport capability used by the base stub: sends one request and waits for its reply.
 */
public interface RpcChannel extends AutoCloseable {

    /**
     * Performs one attempt of a remote call.
     *
     * @param context the per-call settings; its deadline bounds the wait and its metadata is sent along
     * @param method the fully qualified method name
     * @param request the request message
     * @param response the container the reply is merged into on success
     * @throws RpcChannelException if the request could not be sent, no reply arrived in time, or the service
     *                             replied with an error
     */
    void invoke(CallContext context, String method, Object request, Object response) throws RpcChannelException;

    @Override
    void close() throws RpcChannelException;
}
