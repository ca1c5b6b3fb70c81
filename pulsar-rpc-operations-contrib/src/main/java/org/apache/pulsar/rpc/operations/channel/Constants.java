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

/**
 * Message property names exchanged between the channel and the service.
 */
public final class Constants {
    public static final String RPC_METHOD = "rpc_method";
    public static final String REPLY_TOPIC = "reply_topic";
    public static final String REQUEST_TIMEOUT_MILLIS = "request_timeout_millis";
    public static final String STATUS_CODE = "status_code";
    public static final String ERROR_MESSAGE = "error_message";

    private Constants() {
    }
}
