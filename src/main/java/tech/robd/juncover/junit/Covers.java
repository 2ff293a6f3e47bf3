/*
 [File Info]
 path: src/main/java/tech/robd/juncover/junit/Covers.java
 description: Repeatable test-method annotation declaring a mark the test must hit; registers CoversExtension.
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

import org.junit.jupiter.api.extension.ExtendWith;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares that the annotated test must hit the named mark.
 *
 * <pre>{@code
 * @Test
 * @Covers("short date")
 * void rejectsShortInput() {
 *     assertNull(DateParser.parse("92"));
 * }
 * }</pre>
 *
 * <p>The check runs on the test's own thread around the test method body. A test that already
 * failed is not checked again. Tests using {@code @Timeout} with
 * {@code ThreadMode.SEPARATE_THREAD} run their body elsewhere and cannot be checked this way.</p>
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(Covers.List.class)
@ExtendWith(CoversExtension.class)
public @interface Covers {

    /**
     * @return the mark name, exactly as passed to {@code Uncover.mark}
     */
    String value();

    /**
     * @return exact number of expected hits; negative (the default) means at least once
     */
    int times() default -1;

    /**
     * Container for repeated {@link Covers}.
     */
    @Documented
    @Target(ElementType.METHOD)
    @Retention(RetentionPolicy.RUNTIME)
    @ExtendWith(CoversExtension.class)
    @interface List {
        Covers[] value();
    }
}
