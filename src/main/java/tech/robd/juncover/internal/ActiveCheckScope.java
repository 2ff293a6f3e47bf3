/*
 [File Info]
 path: src/main/java/tech/robd/juncover/internal/ActiveCheckScope.java
 description: Live CheckScope: per-mark hit tallies, owner-thread affinity, LIFO close checks and validation.
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

package tech.robd.juncover.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.juncover.CheckReporter;
import tech.robd.juncover.CheckScope;
import tech.robd.juncover.Expectations;
import tech.robd.juncover.UnbalancedScopeError;
import tech.robd.juncover.diagnostics.Diagnostics;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link CheckScope} backed by real bookkeeping.
 *
 * <p>Tallies are plain longs: they are only written by hits on the owning thread and read by that
 * thread when the scope closes. If hits were ever accepted from other threads these would have to
 * become atomic counters.</p>
 */
public final class ActiveCheckScope implements CheckScope {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ActiveCheckScope.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final String label;
    private final Expectations expectations;
    private final ScopeStack stack;
    private final Map<String, Tally> tallies;
    private volatile boolean closed;

    private static final class Tally {
        long hits;
    }
    // [/🧩 Section: state]

    private ActiveCheckScope(String label, Expectations expectations, ScopeStack stack) {
        this.label = label;
        this.expectations = expectations;
        this.stack = stack;
        this.tallies = new HashMap<>(Math.max(4, expectations.size() * 2));
        for (String mark : expectations.marks()) {
            tallies.put(mark, new Tally());
        }
    }

    /**
     * Create a scope and push it onto {@code stack}. Must be called on the stack's owning thread.
     */
    public static ActiveCheckScope open(String label, Expectations expectations, ScopeStack stack) {
        ActiveCheckScope scope = new ActiveCheckScope(label, expectations, stack);
        stack.push(scope);
        DIAG.debug("opened '{}' depth={} marks={}", label, stack.depth(), expectations.marks());
        return scope;
    }

    // 🧩 Section: hit-path
    void record(@Nullable String mark) {
        Tally tally = tallies.get(mark);
        if (tally != null) tally.hits++;
    }
    // [/🧩 Section: hit-path]

    // 🧩 Section: query
    @Override
    public String label() {
        return label;
    }

    @Override
    public Expectations expectations() {
        return expectations;
    }

    @Override
    public long observed(String mark) {
        Tally tally = tallies.get(mark);
        if (tally == null) {
            throw new IllegalArgumentException("Mark '" + mark + "' is not declared by check '" + label + "'");
        }
        return tally.hits;
    }

    @Override
    public boolean isOpen() {
        return !closed;
    }
    // [/🧩 Section: query]

    // 🧩 Section: lifecycle
    @Override
    public void close() {
        finish(true);
    }

    @Override
    public void abandon() {
        finish(false);
    }

    /**
     * Mark closed without touching the stack; used when the whole stack is drained as leaked.
     */
    void discard() {
        closed = true;
    }

    private void finish(boolean validate) {
        if (closed) return;

        Thread current = Thread.currentThread();
        if (current != stack.owner()) {
            UnbalancedScopeError misuse =
                    UnbalancedScopeError.foreignThread(label, stack.owner().getName(), current.getName());
            DIAG.error("{}", misuse.getMessage());
            throw misuse;
        }

        // pop first, whatever validation says
        closed = true;
        ActiveCheckScope innermost = stack.top();
        boolean wasInnermost = stack.remove(this);
        if (!wasInnermost) {
            UnbalancedScopeError misuse =
                    UnbalancedScopeError.outOfOrder(label, innermost == null ? "<none>" : innermost.label);
            DIAG.error("{}", misuse.getMessage());
            throw misuse;
        }

        DIAG.debug("closed '{}' validate={} depth={}", label, validate, stack.depth());
        if (validate) {
            CheckReporter.verify(this);
        }
    }
    // [/🧩 Section: lifecycle]

    @Override
    public String toString() {
        return "CheckScope[" + label + (closed ? ", closed]" : ", open]");
    }
}
