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
package org.apache.pulsar.rpc.operations.model;

import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A long-running operation tracked by the server.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Operation {
    /** Server assigned name, unique within the service, e.g. {@code operations/1234}. */
    private String name;
    private boolean done;
    /** Code name of the failure when the operation finished unsuccessfully, null otherwise. */
    private String errorCode;
    private String errorMessage;
    private Map<String, String> metadata = new HashMap<>();
}
