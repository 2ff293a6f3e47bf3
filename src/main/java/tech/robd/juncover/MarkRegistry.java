/*
 [File Info]
 path: src/main/java/tech/robd/juncover/MarkRegistry.java
 description: Concurrent, idempotent table of known mark names for one CoverageState.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.juncover;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Table of mark names known to a {@link CoverageState}.
 * <p>
 * Registration is idempotent: the first call for a name creates its {@link Mark}, every later call,
 * from any thread, returns that same instance. Entries live as long as the owning state.
 * </p>
 *
 * <p><strong>Thread-safety:</strong> safe for concurrent registration; reads never block.</p>
 */
public final class MarkRegistry {

    private final ConcurrentMap<String, Mark> marks = new ConcurrentHashMap<>();
    private final CoverageState state;

    MarkRegistry(CoverageState state) {
        this.state = state;
    }

    /**
     * @param name mark name (non-null, non-blank)
     * @return the single handle for {@code name}
     */
    public Mark register(String name) {
        Mark existing = marks.get(Mark.requireValidName(name));
        if (existing != null) return existing;
        return marks.computeIfAbsent(name, n -> new Mark(n, state));
    }

    public boolean contains(String name) {
        return name != null && marks.containsKey(name);
    }

    public int size() {
        return marks.size();
    }

    /**
     * @return sorted snapshot of the registered names
     */
    public SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(marks.keySet()));
    }
}
