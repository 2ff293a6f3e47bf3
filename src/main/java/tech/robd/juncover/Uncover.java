/*
 [File Info]
 path: src/main/java/tech/robd/juncover/Uncover.java
 description: Static entry points over the global CoverageState: mark(), register(), check(), call()/run().
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * Entry points for instrumented code and tests, backed by {@link CoverageState#global()}.
 *
 * <p>In code under observation, name the interesting branch:</p>
 * <pre>{@code
 * if (s.length() != 10) {
 *     Uncover.mark("short date");
 *     return null;
 * }
 * }</pre>
 *
 * <p>In the test, declare that the branch must run:</p>
 * <pre>{@code
 * try (CheckScope ignored = Uncover.check("short date")) {
 *     assertNull(DateParser.parse("92"));
 * }
 * }</pre>
 *
 * <p>Searching the sources for {@code "short date"} then answers both "which test covers this
 * branch" and "which branch does this test cover". Names are plain string literals for exactly that
 * reason.</p>
 *
 * <p>When {@link CoverageSwitch#ENABLED} is {@code false} every method here is a no-op and
 * {@link #mark(String)} reduces to a constant-folded early return.</p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class Uncover {

    private Uncover() {
    }

    // 🧩 Section: instrumentation

    /**
     * Record a hit of {@code name} on the calling thread. Never throws.
     */
    public static void mark(@Nullable String name) {
        if (!CoverageSwitch.ENABLED) return;
        CoverageState.global().hit(name);
    }

    /**
     * @return the single handle for {@code name}, for call sites that prefer a constant
     */
    public static Mark register(@NonNull String name) {
        return CoverageState.global().register(name);
    }
    // [/🧩 Section: instrumentation]

    // 🧩 Section: checks

    /**
     * Open a scope expecting each of {@code marks} at least once.
     */
    public static CheckScope check(@NonNull String... marks) {
        return check(Expectations.of(marks));
    }

    /**
     * Open a scope expecting {@code mark} exactly {@code times} times.
     */
    public static CheckScope checkExactly(@NonNull String mark, int times) {
        return check(Expectations.exactly(mark, times));
    }

    public static CheckScope check(@NonNull Expectations expectations) {
        return CoverageState.global().open(expectations);
    }

    /**
     * @see CoverageState#call(Expectations, ThrowingSupplier)
     */
    public static <T extends @Nullable Object> T call(@NonNull Expectations expectations,
                                                      @NonNull ThrowingSupplier<T> block) throws Exception {
        return CoverageState.global().call(expectations, block);
    }

    /**
     * @see CoverageState#run(Expectations, ThrowingRunnable)
     */
    public static void run(@NonNull Expectations expectations, @NonNull ThrowingRunnable block) throws Exception {
        CoverageState.global().run(expectations, block);
    }
    // [/🧩 Section: checks]

    public static boolean isEnabled() {
        return CoverageSwitch.ENABLED;
    }
}
