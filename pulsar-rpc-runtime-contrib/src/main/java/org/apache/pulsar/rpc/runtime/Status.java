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
package org.apache.pulsar.rpc.runtime;

import lombok.NonNull;
import lombok.Value;

/**
 * The outcome of a remote call: a {@link StatusCode} and a human readable message.
 *
 * <p>Two statuses are equal when both their code and message are equal.
 */
@Value
public class Status {

    /** The default, successful status. */
    public static final Status OK = new Status(StatusCode.OK, "");

    @NonNull StatusCode code;
    @NonNull String message;

    public boolean isOk() {
        return code == StatusCode.OK;
    }

    /**
     * Builds the status returned by stub methods that have no implementation.
     *
     * @param methodName the RPC method name, e.g. {@code GetOperation}
     * @return {@code UNIMPLEMENTED} with the message {@code "<methodName> not implemented"}
     */
    public static Status unimplemented(String methodName) {
        return new Status(StatusCode.UNIMPLEMENTED, methodName + " not implemented");
    }
}
