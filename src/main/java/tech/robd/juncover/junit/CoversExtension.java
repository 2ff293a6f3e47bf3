/*
 [File Info]
 path: src/main/java/tech/robd/juncover/junit/CoversExtension.java
 description: JUnit 5 extension opening a check scope for @Covers marks around each test body and validating it afterwards.
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

package tech.robd.juncover.junit;

import org.junit.jupiter.api.extension.AfterTestExecutionCallback;
import org.junit.jupiter.api.extension.BeforeTestExecutionCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.platform.commons.support.AnnotationSupport;
import tech.robd.juncover.CheckScope;
import tech.robd.juncover.CoverageState;
import tech.robd.juncover.Expectations;

import java.util.List;
import java.util.Objects;

/**
 * Runs the checks declared with {@link Covers}.
 *
 * <p>Before the test body the thread is checked for scopes leaked by earlier tests (raising
 * {@link tech.robd.juncover.UnbalancedScopeError}), then one scope is opened for all of the method's
 * {@code @Covers}. After the body the scope is closed and validated, or abandoned if the test has
 * already failed.</p>
 *
 * <p>Registered automatically by {@code @Covers}. Register an instance with
 * {@code @RegisterExtension} to check against a state other than {@link CoverageState#global()}.</p>
 */
public final class CoversExtension implements BeforeTestExecutionCallback, AfterTestExecutionCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(CoversExtension.class);
    private static final String SCOPE_KEY = "scope";

    private final CoverageState state;

    public CoversExtension() {
        this(CoverageState.global());
    }

    public CoversExtension(CoverageState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    @Override
    public void beforeTestExecution(ExtensionContext context) {
        List<Covers> covers = AnnotationSupport.findRepeatableAnnotations(context.getRequiredTestMethod(), Covers.class);
        if (covers.isEmpty()) return;

        state.assertNoOpenScopes();

        Expectations.Builder expectations = Expectations.builder();
        for (Covers c : covers) {
            if (c.times() < 0) {
                expectations.atLeastOnce(c.value());
            } else {
                expectations.exactly(c.value(), c.times());
            }
        }
        CheckScope scope = state.open(context.getDisplayName(), expectations.build());
        context.getStore(NAMESPACE).put(SCOPE_KEY, scope);
    }

    @Override
    public void afterTestExecution(ExtensionContext context) {
        CheckScope scope = context.getStore(NAMESPACE).remove(SCOPE_KEY, CheckScope.class);
        if (scope == null) return;

        if (context.getExecutionException().isPresent()) {
            scope.abandon();
        } else {
            scope.close();
        }
    }
}
