/*
 [File Info]
 path: src/main/java/tech/robd/juncover/CheckReporter.java
 description: Compares observed against expected hit counts for a closing scope and raises CheckFailure on mismatch.
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

import tech.robd.juncover.diagnostics.Diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a closing scope's counts into {@link Violation}s and surfaces them as a {@link CheckFailure}.
 */
public final class CheckReporter {

    private static final Diagnostics DIAG = Diagnostics.of(CheckReporter.class);

    private CheckReporter() {
    }

    /**
     * @param scope the scope to inspect (open or just closed)
     * @return violations in declaration order, empty when every expectation holds
     */
    public static List<Violation> evaluate(CheckScope scope) {
        List<Violation> violations = new ArrayList<>();
        for (Map.Entry<String, HitExpectation> e : scope.expectations().asMap().entrySet()) {
            String mark = e.getKey();
            HitExpectation expected = e.getValue();
            long observed = scope.observed(mark);
            if (expected.isSatisfiedBy(observed)) continue;

            if (observed == 0 && expected.requiresHit()) {
                violations.add(new Violation.MarkNeverHit(mark, expected));
            } else if (expected instanceof HitExpectation.ExactCount exact) {
                violations.add(new Violation.CountMismatch(mark, exact.times(), observed));
            }
        }
        return violations;
    }

    /**
     * @throws CheckFailure naming every failing mark, if any
     */
    public static void verify(CheckScope scope) {
        List<Violation> violations = evaluate(scope);
        if (violations.isEmpty()) {
            DIAG.debug("check '{}' passed ({} mark(s))", scope.label(), scope.expectations().size());
            return;
        }
        CheckFailure failure = new CheckFailure(scope.label(), violations);
        DIAG.warn("{}", failure.getMessage());
        throw failure;
    }
}
