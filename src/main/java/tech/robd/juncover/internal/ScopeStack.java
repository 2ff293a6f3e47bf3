/*
 [File Info]
 path: src/main/java/tech/robd/juncover/internal/ScopeStack.java
 description: Per-thread, innermost-last stack of open check scopes; releases its ThreadLocal slot when it empties.
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

import java.util.ArrayList;
import java.util.List;

/**
 * The open {@link ActiveCheckScope}s of one thread, innermost last.
 *
 * <p>Confined to its owning thread: every method is called from that thread only, so no locking is
 * used. When the last scope is removed the stack detaches itself from its {@link ThreadLocal}, which
 * keeps pooled threads free of stale entries and keeps the hit path allocation-free on threads with
 * nothing open.</p>
 */
public final class ScopeStack {

    // 🧩 Section: state
    private final ArrayList<ActiveCheckScope> scopes = new ArrayList<>(4);
    private final ThreadLocal<ScopeStack> slot;
    private final Thread owner;
    // [/🧩 Section: state]

    /**
     * Create a stack for the current thread and install it in {@code slot}.
     */
    public static ScopeStack attach(ThreadLocal<ScopeStack> slot) {
        ScopeStack stack = new ScopeStack(slot, Thread.currentThread());
        slot.set(stack);
        return stack;
    }

    private ScopeStack(ThreadLocal<ScopeStack> slot, Thread owner) {
        this.slot = slot;
        this.owner = owner;
    }

    public Thread owner() {
        return owner;
    }

    // 🧩 Section: operations
    void push(ActiveCheckScope scope) {
        scopes.add(scope);
    }

    /**
     * Credit {@code mark} to every open scope on this thread that declared it.
     */
    public void deliver(@Nullable String mark) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            scopes.get(i).record(mark);
        }
    }

    public @Nullable ActiveCheckScope top() {
        return scopes.isEmpty() ? null : scopes.get(scopes.size() - 1);
    }

    /**
     * Remove {@code scope} wherever it sits.
     *
     * @return {@code true} if it was the innermost scope
     */
    boolean remove(ActiveCheckScope scope) {
        int last = scopes.size() - 1;
        for (int i = last; i >= 0; i--) {
            if (scopes.get(i) == scope) {
                scopes.remove(i);
                releaseIfEmpty();
                return i == last;
            }
        }
        return false;
    }

    /**
     * Remove and return every open scope, outermost first. The drained scopes count as closed
     * and are not validated.
     */
    public List<ActiveCheckScope> drain() {
        List<ActiveCheckScope> drained = new ArrayList<>(scopes);
        scopes.clear();
        for (ActiveCheckScope scope : drained) {
            scope.discard();
        }
        releaseIfEmpty();
        return drained;
    }

    public int depth() {
        return scopes.size();
    }
    // [/🧩 Section: operations]

    private void releaseIfEmpty() {
        if (scopes.isEmpty() && slot.get() == this) {
            slot.remove();
        }
    }
}
