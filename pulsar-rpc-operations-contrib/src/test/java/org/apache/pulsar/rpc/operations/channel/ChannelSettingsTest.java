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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.expectThrows;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.testng.annotations.Test;

public class ChannelSettingsTest {

    @Test
    public void testDefaults() {
        ChannelSettings settings = ChannelSettings.fromEnvironment(Collections.emptyMap());

        assertEquals(settings.getServiceUrl(), "pulsar://localhost:6650");
        assertEquals(settings.getRequestTopic(), ChannelSettings.DEFAULT_REQUEST_TOPIC);
        assertEquals(settings.getReplyTimeout(), Duration.ofSeconds(3));
        assertFalse(settings.getAuthPlugin().isPresent());
        assertNull(settings.getReplyTopic());
        assertNull(settings.getReplySubscription());
    }

    @Test
    public void testFromEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("PULSAR_SERVICE_URL", "pulsar+ssl://broker:6651");
        env.put("PULSAR_AUTH_PLUGIN", "org.apache.pulsar.client.impl.auth.AuthenticationToken");
        env.put("PULSAR_AUTH_PARAMS", "token:abc");
        env.put("OPERATIONS_REQUEST_TOPIC", "ops-request");
        env.put("OPERATIONS_REPLY_TOPIC", "ops-reply");
        env.put("OPERATIONS_REPLY_SUBSCRIPTION", "ops-sub");
        env.put("OPERATIONS_REPLY_TIMEOUT_MS", "750");

        ChannelSettings settings = ChannelSettings.fromEnvironment(env);
        PulsarRpcChannelBuilder builder = settings.channelBuilder();

        assertEquals(settings.getServiceUrl(), "pulsar+ssl://broker:6651");
        assertEquals(settings.getAuthPlugin().orElse(null), "org.apache.pulsar.client.impl.auth.AuthenticationToken");
        assertEquals(settings.getAuthParams(), "token:abc");
        assertEquals(builder.getRequestTopic(), "ops-request");
        assertEquals(builder.getReplyTopic(), "ops-reply");
        assertEquals(builder.getReplySubscription(), "ops-sub");
        assertEquals(builder.getReplyTimeout(), Duration.ofMillis(750));
    }

    @Test
    public void testBlankValuesAreUnset() {
        Map<String, String> env = new HashMap<>();
        env.put("PULSAR_AUTH_PLUGIN", " ");
        env.put("OPERATIONS_REPLY_TIMEOUT_MS", "");

        ChannelSettings settings = ChannelSettings.fromEnvironment(env);

        assertFalse(settings.getAuthPlugin().isPresent());
        assertEquals(settings.getReplyTimeout(), Duration.ofSeconds(3));
    }

    @Test
    public void testInvalidTimeout() {
        expectThrows(IllegalArgumentException.class, () ->
                ChannelSettings.fromEnvironment(Collections.singletonMap("OPERATIONS_REPLY_TIMEOUT_MS", "soon")));
    }
}
