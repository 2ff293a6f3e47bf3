/*
 [File Info]
 path: src/test/java/tech/robd/juncover/InertStateTest.java
 description: Switched-off state: every operation is a no-op with the same observable shape.
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

import static org.junit.jupiter.api.Assertions.*;

final class InertStateTest {

    private final CoverageState state = CoverageState.inert("inert-test");

    @Test
    void checksNeverFailAndNeverStack() {
        CheckScope scope = state.open(Expectations.of("never"));

        assertFalse(state.isEnabled());
        assertFalse(scope.isOpen());
        assertEquals(0, state.openScopeCount());
        assertEquals(0, scope.observed("never"));
        assertDoesNotThrow(scope::close);
        assertDoesNotThrow(scope::abandon);
        assertDoesNotThrow(state::assertNoOpenScopes);
    }

    @Test
    void hitsAreIgnoredButHandlesStayIdempotent() {
        Mark mark = state.register("fast-path");
        assertSame(mark, state.register("fast-path"));

        try (CheckScope scope = state.open(Expectations.exactly("fast-path", 0))) {
            mark.hit();
            state.hit("fast-path");
            assertEquals(0, scope.observed("fast-path"));
        }
    }

    @Test
    void callStillRunsTheBlock() throws Exception {
        String result = state.call(Expectations.of("never"), () -> "ran");
        assertEquals("ran", result);
    }
}
