/*
 [File Info]
 path: src/main/java/tech/robd/juncover/CheckScope.java
 description: Scoped assertion session: collects hits for declared marks on its owning thread and validates on close.
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

/**
 * An open check: a set of expected marks whose hits on the owning thread are counted until the
 * scope ends.
 * <p>
 * Use with try-with-resources so the scope is always removed from the thread's stack:
 * </p>
 * <pre>{@code
 * try (CheckScope ignored = Uncover.check("short date")) {
 *     assertNull(DateParser.parse("92"));
 * }
 * }</pre>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Only hits on the thread that opened the scope are counted. Hits from threads started by
 *       the code under test are not observed.</li>
 *   <li>Every open scope on the thread that declares a mark is credited for it, not just the
 *       innermost one.</li>
 *   <li>Scopes close in reverse order of opening; anything else raises
 *       {@link UnbalancedScopeError}.</li>
 *   <li>If the guarded block throws, the {@link CheckFailure} raised by {@link #close()} is
 *       attached to the block's exception as suppressed. {@link #abandon()} and
 *       {@link Uncover#call(Expectations, ThrowingSupplier)} skip validation entirely in that case.</li>
 * </ul>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public interface CheckScope extends AutoCloseable {

    // 🧩 Section: api

    /**
     * @return label used in failure messages (a test name, or {@code scope#N})
     */
    String label();

    /**
     * @return the expectations this scope validates on close
     */
    Expectations expectations();

    /**
     * @param mark a mark declared by this scope
     * @return hits observed so far for {@code mark}
     * @throws IllegalArgumentException if {@code mark} was not declared
     */
    long observed(String mark);

    /**
     * @return {@code true} until the scope has been closed or abandoned
     */
    boolean isOpen();

    /**
     * Remove this scope from its thread's stack, then validate observed against expected hits.
     * Calling it again is a no-op.
     *
     * @throws CheckFailure          if any expectation is not met
     * @throws UnbalancedScopeError  if closed out of order or from another thread
     */
    @Override
    void close();

    /**
     * Remove this scope from its thread's stack without validating. Used when the guarded block
     * has already failed, so a second failure is not layered over the first.
     *
     * @throws UnbalancedScopeError if abandoned out of order or from another thread
     */
    void abandon();
    // [/🧩 Section: api]
}
