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
package org.apache.pulsar.rpc.runtime.pagination;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import java.util.ArrayList;
import java.util.List;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class PageResultTest {

    private PageResult<String, FakeListResponse> pageResult;

    @BeforeMethod
    public void setup() {
        FakeListResponse response = new FakeListResponse();
        response.setNextPageToken("NextPage");
        for (int i = 0; i < 10; i++) {
            response.getNames().add("TestOperation" + i);
        }
        pageResult = new PageResult<>(response, FakeListResponse.ACCESSOR);
    }

    @Test
    public void testRawPage() {
        assertEquals(pageResult.nextPageToken(), "NextPage");
        assertEquals(pageResult.nextPageToken(), pageResult.rawPage().getNextPageToken());
        assertEquals(pageResult.rawPage().getNames().size(), 10);
    }

    @Test
    public void testIterationFollowsRawPage() {
        List<String> iterated = new ArrayList<>();
        for (String name : pageResult) {
            iterated.add(name);
        }
        assertEquals(iterated, pageResult.rawPage().getNames());
        assertEquals(pageResult.iterator().next(), "TestOperation0");
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testElementsViewIsReadOnly() {
        pageResult.elements().add("intruder");
    }

    @Test
    public void testTakeElementsEmptiesThePage() {
        List<String> taken = pageResult.takeElements();

        assertEquals(taken.size(), 10);
        assertEquals(taken.get(0), "TestOperation0");
        assertTrue(pageResult.elements().isEmpty());
        assertTrue(pageResult.rawPage().getNames().isEmpty());
        assertEquals(pageResult.nextPageToken(), "NextPage");
    }

    @Test
    public void testNullTokenReadsAsEmpty() {
        FakeListResponse response = new FakeListResponse();
        response.setNextPageToken(null);
        PageResult<String, FakeListResponse> terminal = new PageResult<>(response, FakeListResponse.ACCESSOR);

        assertEquals(terminal.nextPageToken(), "");
        assertSame(terminal.rawPage(), response);
    }
}
