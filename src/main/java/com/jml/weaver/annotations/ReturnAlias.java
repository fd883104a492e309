package com.jml.weaver.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Renames the identifier under which {@link Ensures} expressions see the returned value.
 * Use it when the method already declares a variable called {@code result}.
 *
 * <pre>
 * {@code
 * @ReturnAlias("total")
 * @Ensures("total >= 0")
 * public int sum(int[] values) { int result = 0; ... return result; }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface ReturnAlias {

    /**
     * @return A legal Java identifier
     */
    String value();
}
