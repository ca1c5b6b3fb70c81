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
package org.apache.pulsar.rpc.operations.stub;

/**
 * Names of the Operations service methods as sent on the wire.
 */
public final class OperationsMethods {
    public static final String SERVICE = "google.longrunning.Operations";

    public static final String GET_OPERATION = "GetOperation";
    public static final String LIST_OPERATIONS = "ListOperations";
    public static final String DELETE_OPERATION = "DeleteOperation";
    public static final String CANCEL_OPERATION = "CancelOperation";

    private OperationsMethods() {
    }

    public static String fullName(String method) {
        return SERVICE + "/" + method;
    }
}
