/*
 [File Info]
 path: src/main/java/tech/robd/juncover/Violation.java
 description: One failing expectation found when a check scope is validated: mark never hit, or hit count mismatch.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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
 * A single failed expectation reported by {@link CheckReporter}.
 */
public sealed interface Violation permits Violation.MarkNeverHit, Violation.CountMismatch {

    /**
     * @return the mark name the violation is about
     */
    String mark();

    /**
     * @return one-line diagnostic naming the mark, the expectation and the observation
     */
    String describe();

    /**
     * The mark was expected (at least once, or an exact count of one or more) but observed zero times.
     */
    record MarkNeverHit(String mark, HitExpectation expected) implements Violation {
        @Override
        public String describe() {
            return "mark '" + mark + "' was never hit (expected " + expected.describe() + ")";
        }
    }

    /**
     * An exact-count expectation observed a different count than declared.
     */
    record CountMismatch(String mark, int expected, long observed) implements Violation {
        @Override
        public String describe() {
            return "mark '" + mark + "' was hit " + observed + (observed == 1 ? " time" : " times")
                    + " (expected exactly " + expected + ")";
        }
    }
}
