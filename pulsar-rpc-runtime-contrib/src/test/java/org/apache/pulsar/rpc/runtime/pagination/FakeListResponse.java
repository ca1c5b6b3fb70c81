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

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
class FakeListResponse {
    private final List<String> names = new ArrayList<>();
    private String nextPageToken = "";

    void clear() {
        names.clear();
        nextPageToken = "";
    }

    static final Accessor<String, FakeListResponse> ACCESSOR = new Accessor<>() {
        @Override
        public FakeListResponse newPage() {
            return new FakeListResponse();
        }

        @Override
        public List<String> extractElements(FakeListResponse page) {
            return page.getNames();
        }

        @Override
        public String extractNextToken(FakeListResponse page) {
            return page.getNextPageToken();
        }
    };
}
