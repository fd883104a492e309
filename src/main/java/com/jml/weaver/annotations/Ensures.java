package com.jml.weaver.annotations;

import java.lang.annotation.*;

/**
 * Postcondition contract.
 * Checked at every exit of the method, after the returned value has been bound to the
 * return alias ({@code result} unless {@link ReturnAlias} says otherwise).
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(Ensures.List.class)
public @interface Ensures {
    /**
     * The postcondition expressions, as Java source.
     * @return At least one boolean expression
     */
    String[] value();

    /**
     * Container annotation for multiple @Ensures.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        Ensures[] value();
    }
}
