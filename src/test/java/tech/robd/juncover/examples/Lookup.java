/*
 [File Info]
 path: src/test/java/tech/robd/juncover/examples/Lookup.java
 description: Sample instrumented code with a cached fast path, a computed slow path and an off-thread variant.
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

package tech.robd.juncover.examples;

import tech.robd.juncover.Uncover;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Resolves a word to a number: known words come from a table ("fast-path"),
 * anything else falls back to its length ("slow-path").
 */
public final class Lookup {

    private static final Map<String, Integer> KNOWN = Map.of("one", 1, "two", 2);

    private Lookup() {
    }

    public static int valueOf(String word) {
        Integer known = KNOWN.get(word);
        if (known != null) {
            Uncover.mark("fast-path");
            return known;
        }
        Uncover.mark("slow-path");
        return word.length();
    }

    /**
     * Same lookup on {@code executor}; its marks fire on the executor's thread.
     */
    public static CompletableFuture<Integer> valueOfAsync(String word, Executor executor) {
        return CompletableFuture.supplyAsync(() -> valueOf(word), executor);
    }
}
