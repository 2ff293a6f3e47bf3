/*
 [File Info]
 path: src/main/java/tech/robd/juncover/UnbalancedScopeError.java
 description: Fatal usage fault: a check scope closed out of LIFO order, from a foreign thread, or leaked across a test boundary.
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
 * Signals that the check API itself was misused, as opposed to the code under test missing a mark.
 * <p>
 * Deliberately an {@link Error} rather than an {@link AssertionError}: once scopes are unbalanced,
 * later results on the same thread are no longer trustworthy. Every instance is also logged at
 * ERROR level by the component that raises it.
 * </p>
 */
public final class UnbalancedScopeError extends Error {

    private static final long serialVersionUID = 1L;

    /**
     * What went wrong.
     */
    public enum Kind {
        /** A scope was closed while a scope opened after it was still open. */
        OUT_OF_ORDER,
        /** A scope was closed on a thread other than the one that opened it. */
        FOREIGN_THREAD,
        /** Scopes were still open at a boundary where the thread's stack must be empty. */
        LEAKED_SCOPES
    }

    private final Kind kind;

    private UnbalancedScopeError(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    // 🧩 Section: factories
    public static UnbalancedScopeError outOfOrder(String closing, String innermost) {
        return new UnbalancedScopeError(Kind.OUT_OF_ORDER,
                "Check scope '" + closing + "' closed while inner scope '" + innermost
                        + "' is still open; scopes must close in reverse order of opening");
    }

    public static UnbalancedScopeError foreignThread(String label, String ownerThread, String closingThread) {
        return new UnbalancedScopeError(Kind.FOREIGN_THREAD,
                "Check scope '" + label + "' was opened on thread '" + ownerThread
                        + "' but closed on thread '" + closingThread + "'");
    }

    public static UnbalancedScopeError leakedScopes(String threadName, List<String> labels) {
        return new UnbalancedScopeError(Kind.LEAKED_SCOPES,
                labels.size() + " check scope(s) left open on thread '" + threadName + "': " + labels);
    }
    // [/🧩 Section: factories]
}
