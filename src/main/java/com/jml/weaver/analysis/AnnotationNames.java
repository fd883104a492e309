package com.jml.weaver.analysis;

import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;

/**
 * Matches annotation usages against the weaver's own annotation types in
 * {@code com.jml.weaver.annotations}, without a symbol solver.
 *
 * A fully qualified usage matches only when it names that package. A simple usage such as
 * {@code @Requires} or {@code @Requires.List} matches unless the compilation unit imports a
 * different type under the same simple name. Wildcard and same-package declarations are
 * not resolved, so an unimported simple name is assumed to be ours.
 */
public final class AnnotationNames {

    public static final String PACKAGE = "com.jml.weaver.annotations";
    private static final String PACKAGE_PREFIX = PACKAGE + ".";

    private AnnotationNames() {
    }

    /**
     * @param annotation The annotation usage
     * @param typeName Name of the annotation type relative to its package, e.g. {@code Requires}
     *                 or {@code Requires.List}
     * @return true if the usage refers to that weaver annotation type
     */
    public static boolean refersTo(AnnotationExpr annotation, String typeName) {
        String written = annotation.getNameAsString();
        if (written.startsWith(PACKAGE_PREFIX)) {
            return written.substring(PACKAGE_PREFIX.length()).equals(typeName);
        }
        if (!written.equals(typeName)) {
            return false;
        }

        int dot = typeName.indexOf('.');
        String outermost = dot < 0 ? typeName : typeName.substring(0, dot);
        return annotation.findCompilationUnit()
                .map(cu -> cu.getImports().stream().noneMatch(imported -> importsOtherType(imported, outermost)))
                .orElse(true);
    }

    private static boolean importsOtherType(ImportDeclaration imported, String simpleName) {
        return !imported.isAsterisk()
                && imported.getName().getIdentifier().equals(simpleName)
                && !imported.getNameAsString().equals(PACKAGE_PREFIX + simpleName);
    }
}
