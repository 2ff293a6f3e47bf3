/*
 [File Info]
 path: src/test/java/tech/robd/juncover/ExpectationsTest.java
 description: Expectation sets: declaration order, duplicate and argument validation.
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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ExpectationsTest {

    @Test
    void keepsDeclarationOrder() {
        Expectations e = Expectations.builder()
                .exactly("z", 1)
                .atLeastOnce("a")
                .expect("m", HitExpectation.exactly(0))
                .build();

        assertEquals(List.of("z", "a", "m"), List.copyOf(e.marks()));
        assertEquals(HitExpectation.exactly(1), e.get("z"));
        assertEquals(HitExpectation.atLeastOnce(), e.get("a"));
        assertNull(e.get("missing"));
        assertEquals(3, e.size());
    }

    @Test
    void ofDeclaresAtLeastOnce() {
        Expectations e = Expectations.of("x", "y");
        assertEquals(Expectations.builder().atLeastOnce("x").atLeastOnce("y").build(), e);
        assertSame(Expectations.none(), Expectations.of());
        assertTrue(Expectations.none().isEmpty());
    }

    @Test
    void rejectsDuplicateMarks() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Expectations.of("x", "x"));
        assertTrue(e.getMessage().contains("'x'"));
        assertThrows(IllegalArgumentException.class,
                () -> Expectations.builder().atLeastOnce("x").exactly("x", 1));
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> Expectations.exactly("x", -1));
        assertThrows(IllegalArgumentException.class, () -> Expectations.of(" "));
        assertThrows(NullPointerException.class, () -> Expectations.of((String) null));
    }

    @Test
    void isImmutable() {
        Expectations e = Expectations.of("x");
        assertThrows(UnsupportedOperationException.class, () -> e.asMap().put("y", HitExpectation.atLeastOnce()));
    }

    @Test
    void modesAnswerAsDeclared() {
        assertTrue(HitExpectation.atLeastOnce().isSatisfiedBy(1));
        assertFalse(HitExpectation.atLeastOnce().isSatisfiedBy(0));
        assertTrue(HitExpectation.exactly(0).isSatisfiedBy(0));
        assertFalse(HitExpectation.exactly(0).requiresHit());
        assertFalse(HitExpectation.exactly(2).isSatisfiedBy(3));
    }
}
