/*
 [File Info]
 path: src/main/java/tech/robd/juncover/CheckFailure.java
 description: Assertion failure raised when a check scope closes with unmet expectations; lists every violation.
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

import java.util.List;

/**
 * Thrown when a {@link CheckScope} closes and at least one expected mark was not hit as declared.
 * <p>
 * This is an ordinary {@link AssertionError}: it fails the enclosing test and nothing else.
 * Every failing mark of the scope is listed, in declaration order.
 * </p>
 */
public final class CheckFailure extends AssertionError {

    private static final long serialVersionUID = 1L;

    private final String scopeLabel;
    private final transient List<Violation> violations;

    public CheckFailure(String scopeLabel, List<Violation> violations) {
        super(format(scopeLabel, violations));
        if (violations.isEmpty()) throw new IllegalArgumentException("A check failure needs at least one violation");
        this.scopeLabel = scopeLabel;
        this.violations = List.copyOf(violations);
    }

    public String scopeLabel() {
        return scopeLabel;
    }

    /**
     * @return the failing marks, in declaration order
     */
    public List<Violation> violations() {
        return violations;
    }

    private static String format(String scopeLabel, List<Violation> violations) {
        StringBuilder sb = new StringBuilder()
                .append("Check '").append(scopeLabel).append("' failed: ")
                .append(violations.size()).append(violations.size() == 1 ? " violation" : " violations");
        for (Violation v : violations) {
            sb.append(System.lineSeparator()).append("  - ").append(v.describe());
        }
        return sb.toString();
    }
}
