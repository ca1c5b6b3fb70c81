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

import java.util.Optional;

/**
 * Thrown by a {@link RpcChannel} when a call attempt fails, either locally or because the service replied with
 * an error.
 */
public class RpcChannelException extends Exception {

    private final String remoteCode;

    /**
     * Constructs a {@code RpcChannelException} with the specified detail message.
     *
     * @param msg the detail message
     */
    public RpcChannelException(String msg) {
        super(msg);
        this.remoteCode = null;
    }

    /**
     * Constructs a {@code RpcChannelException} with the specified cause.
     *
     * @param cause the cause, may be null
     */
    public RpcChannelException(Throwable cause) {
        super(cause);
        this.remoteCode = null;
    }

    /**
     * Constructs a {@code RpcChannelException} for an error reported by the service.
     *
     * @param remoteCode the status code name sent by the service
     * @param msg the error message sent by the service
     */
    public RpcChannelException(String remoteCode, String msg) {
        super(msg);
        this.remoteCode = remoteCode;
    }

    /**
     * @return the status code name sent by the service, or empty for local failures
     */
    public Optional<String> getRemoteCode() {
        return Optional.ofNullable(remoteCode);
    }
}
