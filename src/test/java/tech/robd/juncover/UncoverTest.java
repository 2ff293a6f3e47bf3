/*
 [File Info]
 path: src/test/java/tech/robd/juncover/UncoverTest.java
 description: Global facade end to end: fast-path / slow-path checks over instrumented example code.
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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.robd.juncover.examples.Lookup;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

final class UncoverTest {

    @BeforeEach
    void requiresActiveGlobalState() {
        assumeTrue(Uncover.isEnabled(), "run with -Djuncover.enabled=true or -ea");
    }

    @AfterEach
    void threadStackIsEmpty() {
        assertEquals(0, CoverageState.global().openScopeCount());
    }

    @Test
    void fastPathInputPassesFastPathCheck() {
        try (CheckScope ignored = Uncover.check("fast-path")) {
            assertEquals(1, Lookup.valueOf("one"));
        }
    }

    @Test
    void slowPathInputFailsFastPathCheck() {
        CheckScope scope = Uncover.check("fast-path");
        assertEquals(5, Lookup.valueOf("three"));

        CheckFailure failure = assertThrows(CheckFailure.class, scope::close);

        assertEquals(List.of(new Violation.MarkNeverHit("fast-path", HitExpectation.atLeastOnce())), failure.violations());
    }

    @Test
    void checkExactlyCountsEachCall() {
        try (CheckScope scope = Uncover.checkExactly("slow-path", 2)) {
            Lookup.valueOf("three");
            Lookup.valueOf("one");
            Lookup.valueOf("four");
            assertEquals(2, scope.observed("slow-path"));
        }
    }

    @Test
    void registeredHandlesFeedGlobalChecks() {
        Mark handle = Uncover.register("uncover-test.handle");
        assertSame(handle, Uncover.register("uncover-test.handle"));
        assertTrue(CoverageState.global().registry().names().contains("uncover-test.handle"));

        try (CheckScope ignored = Uncover.check(Expectations.exactly("uncover-test.handle", 1))) {
            handle.hit();
        }
    }

    @Test
    void callAndRunWrapABlock() throws Exception {
        int two = Uncover.call(Expectations.of("fast-path"), () -> Lookup.valueOf("two"));
        assertEquals(2, two);
        Uncover.run(Expectations.exactly("fast-path", 0), () -> Lookup.valueOf("seven"));
        assertThrows(CheckFailure.class, () -> Uncover.run(Expectations.of("fast-path"), () -> Lookup.valueOf("seven")));
    }

    @Test
        // Marks fired on an executor thread belong to that thread, not to the test's scope.
    void marksFromAnExecutorThreadAreNotObserved() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try (CheckScope scope = Uncover.checkExactly("fast-path", 0)) {
            int value = Lookup.valueOfAsync("one", pool).get(1, TimeUnit.SECONDS);
            assertEquals(1, value);
            assertEquals(0, scope.observed("fast-path"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void markWithoutAnOpenScopeIsANoOp() {
        assertDoesNotThrow(() -> Uncover.mark("nobody-watching"));
        assertDoesNotThrow(() -> Uncover.mark(null));
    }
}
