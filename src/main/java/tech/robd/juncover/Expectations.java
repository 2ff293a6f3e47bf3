/*
 [File Info]
 path: src/main/java/tech/robd/juncover/Expectations.java
 description: Immutable, insertion-ordered mapping from mark name to HitExpectation, with a small builder.
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The set of marks a {@link CheckScope} expects, each with its {@link HitExpectation}.
 * <p>
 * Declaration order is preserved so failures are reported in the order the test wrote them.
 * A mark may only be declared once per set.
 * </p>
 *
 * <pre>{@code
 * Expectations e = Expectations.builder()
 *         .atLeastOnce("cache-miss")
 *         .exactly("retry", 2)
 *         .build();
 * }</pre>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class Expectations {

    private static final Expectations NONE = new Expectations(Collections.emptyMap());

    private final Map<String, HitExpectation> byMark;

    private Expectations(Map<String, HitExpectation> byMark) {
        this.byMark = byMark;
    }

    // 🧩 Section: factories

    /**
     * @return an empty expectation set (a scope opened with it always passes)
     */
    public static Expectations none() {
        return NONE;
    }

    /**
     * Expect each of {@code marks} to be hit at least once.
     *
     * @param marks mark names, each declared once
     * @return the expectation set
     */
    public static Expectations of(@NonNull String... marks) {
        Objects.requireNonNull(marks, "marks");
        Builder builder = builder();
        for (String mark : marks) {
            builder.atLeastOnce(mark);
        }
        return builder.build();
    }

    /**
     * Expect {@code mark} to be hit exactly {@code times} times.
     */
    public static Expectations exactly(String mark, int times) {
        return builder().exactly(mark, times).build();
    }

    public static Builder builder() {
        return new Builder();
    }
    // [/🧩 Section: factories]

    // 🧩 Section: query

    /**
     * @return unmodifiable view, in declaration order
     */
    public Map<String, HitExpectation> asMap() {
        return byMark;
    }

    public Set<String> marks() {
        return byMark.keySet();
    }

    public @Nullable HitExpectation get(String mark) {
        return byMark.get(mark);
    }

    public boolean isEmpty() {
        return byMark.isEmpty();
    }

    public int size() {
        return byMark.size();
    }
    // [/🧩 Section: query]

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expectations other)) return false;
        return byMark.equals(other.byMark);
    }

    @Override
    public int hashCode() {
        return byMark.hashCode();
    }

    @Override
    public String toString() {
        return "Expectations" + byMark;
    }

    /**
     * Accumulates expectations; rejects a mark declared twice.
     * Not thread-safe.
     */
    public static final class Builder {
        private final LinkedHashMap<String, HitExpectation> byMark = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder atLeastOnce(String mark) {
            return expect(mark, HitExpectation.atLeastOnce());
        }

        public Builder exactly(String mark, int times) {
            return expect(mark, HitExpectation.exactly(times));
        }

        public Builder expect(String mark, HitExpectation expectation) {
            String name = Mark.requireValidName(mark);
            Objects.requireNonNull(expectation, "expectation");
            if (byMark.putIfAbsent(name, expectation) != null) {
                throw new IllegalArgumentException("Mark '" + name + "' is declared more than once");
            }
            return this;
        }

        public Expectations build() {
            if (byMark.isEmpty()) return NONE;
            return new Expectations(Collections.unmodifiableMap(new LinkedHashMap<>(byMark)));
        }
    }
}
