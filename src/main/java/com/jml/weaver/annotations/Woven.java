package com.jml.weaver.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Added by the weaver to every method or constructor it has instrumented.
 * Woven declarations are never woven again.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.CONSTRUCTOR})
public @interface Woven {

    /**
     * Whether requirement and ensure checks were emitted. False when the method was
     * woven while instrumentation was disabled; loop invariant checks are emitted either way.
     *
     * @return true if contract checks are present in the body
     */
    boolean contracts() default true;
}
