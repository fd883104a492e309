package com.jml.weaver.annotations;

import java.lang.annotation.*;

/**
 * Precondition contract.
 * Every expression must hold when the method is entered; they are checked in
 * declaration order before the body runs.
 *
 * <pre>
 * {@code
 * @Requires({"dict.size() < 2", "key.length() > 0"})
 * public static void insert(Map<String, String> dict, String key, String value) { ... }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(Requires.List.class)
public @interface Requires {
    /**
     * The precondition expressions, as Java source.
     * @return At least one boolean expression
     */
    String[] value();

    /**
     * Container annotation for multiple @Requires.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        Requires[] value();
    }
}
