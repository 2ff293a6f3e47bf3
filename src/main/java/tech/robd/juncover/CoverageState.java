/*
 [File Info]
 path: src/main/java/tech/robd/juncover/CoverageState.java
 description: Process-wide (or hermetic) mark/check state: registry, per-thread scope stacks, hit routing and scope opening.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.juncover.diagnostics.Diagnostics;
import tech.robd.juncover.internal.ActiveCheckScope;
import tech.robd.juncover.internal.ScopeStack;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owner of all mark/check bookkeeping: the {@link MarkRegistry} and, per thread, the stack of open
 * {@link CheckScope}s.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #global()} – the default instance used by {@link Uncover}; created on first use,
 *       lives until JVM exit, active iff {@link CoverageSwitch#ENABLED}.</li>
 *   <li>{@link #hermetic(String)} – an isolated, always-active instance, for harnesses that must not
 *       share anything with the rest of the suite.</li>
 *   <li>{@link #inert(String)} – an isolated, always-off instance; every operation is a no-op.</li>
 * </ul>
 *
 * <h2>Thread isolation</h2>
 * <p>A hit on thread T only reaches scopes opened on T. Tests running in parallel therefore never see
 * each other's hits. The flip side: hits produced on worker threads started by the code under test
 * are not seen by the test thread's scopes.</p>
 *
 * <p><strong>Thread-safety:</strong> all methods may be called from any thread. The hit path reads
 * only the caller's own {@link ThreadLocal} and takes no locks.</p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class CoverageState {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(CoverageState.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: default-instance
    private static final class GlobalHolder {
        static final CoverageState INSTANCE = new CoverageState("global", CoverageSwitch.ENABLED);
    }
    // [/🧩 Section: default-instance]

    // 🧩 Section: state
    private final String name;
    private final boolean enabled;
    private final MarkRegistry registry;
    private final ThreadLocal<ScopeStack> stacks = new ThreadLocal<>();
    private final AtomicLong scopeIds = new AtomicLong();
    // [/🧩 Section: state]

    private CoverageState(String name, boolean enabled) {
        this.name = name;
        this.enabled = enabled;
        this.registry = new MarkRegistry(this);
    }

    // 🧩 Section: factories
    public static CoverageState global() {
        return GlobalHolder.INSTANCE;
    }

    public static CoverageState hermetic(@NonNull String name) {
        return new CoverageState(Objects.requireNonNull(name, "name"), true);
    }

    public static CoverageState inert(@NonNull String name) {
        return new CoverageState(Objects.requireNonNull(name, "name"), false);
    }
    // [/🧩 Section: factories]

    public String name() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public MarkRegistry registry() {
        return registry;
    }

    /**
     * Shorthand for {@code registry().register(mark)}.
     */
    public Mark register(String mark) {
        return registry.register(mark);
    }

    // 🧩 Section: hit-path

    /**
     * Credit one hit of {@code mark} to every scope open on the calling thread that declared it.
     * A no-op when nothing on this thread is watching. Never throws.
     */
    public void hit(@Nullable String mark) {
        if (!enabled) return;
        ScopeStack stack = stacks.get();
        if (stack == null) return;
        stack.deliver(mark);
    }
    // [/🧩 Section: hit-path]

    // 🧩 Section: scopes

    public CheckScope open(Expectations expectations) {
        return open(null, expectations);
    }

    /**
     * Open a scope on the calling thread. The expected marks are registered as a side effect.
     *
     * @param label       name used in failure messages; {@code null} for {@code scope#N}
     * @param expectations marks to watch
     * @return the scope; close it on the same thread, innermost first
     */
    public CheckScope open(@Nullable String label, Expectations expectations) {
        Objects.requireNonNull(expectations, "expectations");
        if (!enabled) return InertCheckScope.INSTANCE;

        for (String mark : expectations.marks()) {
            registry.register(mark);
        }
        ScopeStack stack = stacks.get();
        if (stack == null) {
            stack = ScopeStack.attach(stacks);
        }
        String effectiveLabel = label != null ? label : "scope#" + scopeIds.incrementAndGet();
        return ActiveCheckScope.open(effectiveLabel, expectations, stack);
    }

    /**
     * Run {@code block} inside a scope. If the block throws, the scope is abandoned without
     * validation and the original throwable propagates; otherwise the scope is closed and validated.
     *
     * @return the block's result
     * @throws CheckFailure if the block completed but an expectation was not met
     */
    public <T extends @Nullable Object> T call(Expectations expectations, ThrowingSupplier<T> block)
            throws Exception {
        Objects.requireNonNull(block, "block");
        CheckScope scope = open(expectations);
        T result;
        try {
            result = block.get();
        } catch (Throwable failure) {
            abandonAfter(scope, failure);
            throw failure;
        }
        scope.close();
        return result;
    }

    /**
     * {@link #call(Expectations, ThrowingSupplier)} for blocks without a result.
     */
    public void run(Expectations expectations, ThrowingRunnable block) throws Exception {
        Objects.requireNonNull(block, "block");
        call(expectations, () -> {
            block.run();
            return null;
        });
    }

    private static void abandonAfter(CheckScope scope, Throwable failure) {
        try {
            scope.abandon();
        } catch (UnbalancedScopeError misuse) {
            failure.addSuppressed(misuse);
        }
    }

    /**
     * @return number of scopes currently open on the calling thread
     */
    public int openScopeCount() {
        ScopeStack stack = stacks.get();
        return stack == null ? 0 : stack.depth();
    }

    /**
     * Check that the calling thread has no open scopes, as must be the case between tests.
     * Leaked scopes are discarded, so the thread is clean afterwards either way.
     *
     * @throws UnbalancedScopeError naming the leaked scopes, if there were any
     */
    public void assertNoOpenScopes() {
        ScopeStack stack = stacks.get();
        if (stack == null) return;
        List<ActiveCheckScope> leaked = stack.drain();
        if (leaked.isEmpty()) return;

        List<String> labels = new ArrayList<>(leaked.size());
        for (ActiveCheckScope scope : leaked) {
            labels.add(scope.label());
        }
        UnbalancedScopeError misuse = UnbalancedScopeError.leakedScopes(Thread.currentThread().getName(), labels);
        DIAG.error("[{}] {}", name, misuse.getMessage());
        throw misuse;
    }
    // [/🧩 Section: scopes]

    @Override
    public String toString() {
        return "CoverageState[" + name + (enabled ? ", active]" : ", inert]");
    }
}
