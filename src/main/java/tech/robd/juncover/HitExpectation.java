/*
 [File Info]
 path: src/main/java/tech/robd/juncover/HitExpectation.java
 description: How often a mark must be hit while a check scope is open: at least once, or an exact count.
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

/**
 * Per-mark expectation declared when opening a {@link CheckScope}.
 *
 * <ul>
 *   <li>{@link AtLeastOnce} – passes iff the observed count is {@code >= 1}.</li>
 *   <li>{@link ExactCount} – passes iff the observed count equals {@code times} exactly
 *       ({@code times == 0} asserts the mark is <em>not</em> hit).</li>
 * </ul>
 */
public sealed interface HitExpectation permits HitExpectation.AtLeastOnce, HitExpectation.ExactCount {

    /**
     * @param observed hits recorded for the mark while the scope was open
     * @return {@code true} if {@code observed} satisfies this expectation
     */
    boolean isSatisfiedBy(long observed);

    /**
     * @return {@code true} if this expectation fails when the mark is never hit
     */
    boolean requiresHit();

    /**
     * @return short human-readable form, e.g. {@code "at least once"} or {@code "exactly 2"}
     */
    String describe();

    static HitExpectation atLeastOnce() {
        return AtLeastOnce.INSTANCE;
    }

    static HitExpectation exactly(int times) {
        return new ExactCount(times);
    }

    // 🧩 Section: modes
    record AtLeastOnce() implements HitExpectation {

        private static final AtLeastOnce INSTANCE = new AtLeastOnce();

        @Override
        public boolean isSatisfiedBy(long observed) {
            return observed >= 1;
        }

        @Override
        public boolean requiresHit() {
            return true;
        }

        @Override
        public String describe() {
            return "at least once";
        }
    }

    record ExactCount(int times) implements HitExpectation {

        public ExactCount {
            if (times < 0) throw new IllegalArgumentException("Expected hit count cannot be negative: " + times);
        }

        @Override
        public boolean isSatisfiedBy(long observed) {
            return observed == times;
        }

        @Override
        public boolean requiresHit() {
            return times > 0;
        }

        @Override
        public String describe() {
            return "exactly " + times;
        }
    }
    // [/🧩 Section: modes]
}
