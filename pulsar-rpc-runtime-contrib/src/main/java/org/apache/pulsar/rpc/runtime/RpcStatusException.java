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

import lombok.Getter;

/**
 * Unchecked exception carrying the non-OK {@link Status} of a call, for APIs that cannot hand a status back
 * to the caller, such as iterators.
 */
@Getter
public class RpcStatusException extends RuntimeException {

    private final Status status;

    public RpcStatusException(Status status) {
        super(status.getCode() + ": " + status.getMessage());
        this.status = status;
    }

    public RpcStatusException(String message, Status status) {
        super(message);
        this.status = status;
    }
}
