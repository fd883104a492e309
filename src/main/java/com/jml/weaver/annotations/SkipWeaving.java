package com.jml.weaver.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation to mark methods or classes that the weaver must leave untouched.
 *
 * When applied to a method, neither its contract nor its loop invariants are woven.
 * When applied to a class, all methods and constructors in that class are skipped.
 *
 * Example usage:
 * <pre>
 * {@code
 * @SkipWeaving(reason = "Hot path, contracts verified in tests only")
 * @Requires("index >= 0")
 * public int get(int index) { ... }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.TYPE})
public @interface SkipWeaving {

    /**
     * Optional reason explaining why weaving is skipped for this element.
     *
     * @return The reason for skipping, or empty string if not specified
     */
    String reason() default "";
}
