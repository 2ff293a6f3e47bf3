/*
 [File Info]
 path: src/test/java/tech/robd/juncover/CheckReporterTest.java
 description: Violation evaluation and the diagnostic text of CheckFailure.
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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CheckReporterTest {

    private final CoverageState state = CoverageState.hermetic("reporter-test");

    @Test
    void evaluatesAnOpenScopeWithoutClosingIt() {
        CheckScope scope = state.open("partial", Expectations.builder().atLeastOnce("a").atLeastOnce("b").build());
        state.hit("b");

        assertEquals(List.of(new Violation.MarkNeverHit("a", HitExpectation.atLeastOnce())), CheckReporter.evaluate(scope));
        assertTrue(scope.isOpen());

        state.hit("a");
        assertEquals(List.of(), CheckReporter.evaluate(scope));
        scope.close();
    }

    @Test
        // The message names the scope, every failing mark, and expected vs observed.
    void failureMessageNamesMarksWithExpectedAndObserved() {
        CheckScope scope = state.open("parse-dates", Expectations.builder()
                .atLeastOnce("short date")
                .exactly("wrong dashes", 2)
                .build());
        state.hit("wrong dashes");

        CheckFailure failure = assertThrows(CheckFailure.class, () -> CheckReporter.verify(scope));
        String message = failure.getMessage();

        assertTrue(message.startsWith("Check 'parse-dates' failed: 2 violations"), message);
        assertTrue(message.contains("mark 'short date' was never hit (expected at least once)"), message);
        assertTrue(message.contains("mark 'wrong dashes' was hit 1 time (expected exactly 2)"), message);
        scope.abandon();
    }

    @Test
    void violationDescriptionsUsePlural() {
        assertEquals("mark 'm' was hit 3 times (expected exactly 1)",
                new Violation.CountMismatch("m", 1, 3).describe());
        assertEquals("mark 'm' was never hit (expected exactly 2)",
                new Violation.MarkNeverHit("m", HitExpectation.exactly(2)).describe());
    }

    @Test
    void checkFailureRequiresAViolation() {
        assertThrows(IllegalArgumentException.class, () -> new CheckFailure("empty", List.of()));
    }
}
