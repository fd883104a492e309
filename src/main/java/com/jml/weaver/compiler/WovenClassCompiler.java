package com.jml.weaver.compiler;

import com.github.javaparser.ast.CompilationUnit;
import com.jml.weaver.WeavingCompileException;
import com.jml.weaver.processor.SourceWeaver;
import com.jml.weaver.runtime.ViolationReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.*;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Compiles woven compilation units in memory and loads the resulting classes, so the
 * instrumented methods can be called under their original names.
 *
 * The weaver's runtime (violation types, annotations) is put on the compiler class path and
 * resolved through the parent class loader at run time.
 */
public class WovenClassCompiler {

    private static final Logger logger = LoggerFactory.getLogger(WovenClassCompiler.class);

    private final SourceWeaver sourceWeaver;
    private final ClassLoader parentLoader;

    public WovenClassCompiler() {
        this(new SourceWeaver());
    }

    public WovenClassCompiler(SourceWeaver sourceWeaver) {
        this.sourceWeaver = sourceWeaver;
        this.parentLoader = WovenClassCompiler.class.getClassLoader();
    }

    /**
     * Weaves, compiles and loads one source file.
     *
     * @param source Java source of one compilation unit with a primary public type
     * @return The primary type, instrumented
     */
    public Class<?> compile(String source) {
        CompilationUnit woven = sourceWeaver.weave(source);
        WovenClassLoader loader = compile(List.of(woven));
        String primaryName = binaryName(woven);
        try {
            return loader.loadClass(primaryName);
        } catch (ClassNotFoundException e) {
            throw new WeavingCompileException("Compiled sources do not define " + primaryName, woven.toString(), "", e);
        }
    }

    /**
     * Compiles already woven compilation units.
     *
     * @param units The woven units
     * @return A loader defining every class the units produce
     * @throws WeavingCompileException If the compiler is unavailable or reports errors
     */
    public WovenClassLoader compile(List<CompilationUnit> units) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new WeavingCompileException("No system Java compiler available, a JDK is required", null, null);
        }

        List<JavaFileObject> sources = new ArrayList<>();
        for (CompilationUnit unit : units) {
            sources.add(new SourceFile(binaryName(unit), unit.toString()));
        }
        String generatedSource = units.stream().map(CompilationUnit::toString).collect(Collectors.joining("\n"));

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        Map<String, ByteArrayOutputStream> outputs = new LinkedHashMap<>();
        try (StandardJavaFileManager standardManager = compiler.getStandardFileManager(diagnostics, null, null);
             InMemoryFileManager fileManager = new InMemoryFileManager(standardManager, outputs)) {

            List<String> options = List.of("-classpath", classPath(), "-proc:none", "-g");
            Boolean success = compiler.getTask(null, fileManager, diagnostics, options, null, sources).call();
            if (!Boolean.TRUE.equals(success)) {
                String messages = diagnostics.getDiagnostics().stream()
                        .map(diagnostic -> diagnostic.getKind() + " line " + diagnostic.getLineNumber()
                                + ": " + diagnostic.getMessage(Locale.ROOT))
                        .collect(Collectors.joining("\n"));
                throw new WeavingCompileException("Woven sources failed to compile:\n" + messages,
                        generatedSource, messages);
            }
        } catch (IOException e) {
            throw new WeavingCompileException("Compiler file manager failed", generatedSource, e.getMessage(), e);
        }

        Map<String, byte[]> byteCode = new LinkedHashMap<>();
        outputs.forEach((name, bytes) -> byteCode.put(name, bytes.toByteArray()));
        logger.debug("Compiled {} classes from {} woven units", byteCode.size(), units.size());
        return new WovenClassLoader(parentLoader, byteCode);
    }

    private String binaryName(CompilationUnit unit) {
        if (unit.getTypes().isEmpty()) {
            throw new WeavingCompileException("Compilation unit declares no type", unit.toString(), null);
        }
        String typeName = unit.getPrimaryTypeName()
                .orElseGet(() -> unit.getType(0).getNameAsString());
        return unit.getPackageDeclaration()
                .map(pkg -> pkg.getNameAsString() + "." + typeName)
                .orElse(typeName);
    }

    /**
     * The caller's class path, plus wherever the weaver runtime was loaded from. Test runners
     * and fat jars do not always expose the latter through {@code java.class.path}.
     */
    private String classPath() {
        Set<String> entries = new LinkedHashSet<>();
        String systemClassPath = System.getProperty("java.class.path", "");
        for (String entry : systemClassPath.split(File.pathSeparator)) {
            if (!entry.isEmpty()) {
                entries.add(entry);
            }
        }
        CodeSource runtimeSource = ViolationReporter.class.getProtectionDomain().getCodeSource();
        if (runtimeSource == null || runtimeSource.getLocation() == null) {
            logger.warn("Cannot locate the weaver runtime, relying on java.class.path");
        } else {
            try {
                entries.add(Paths.get(runtimeSource.getLocation().toURI()).toString());
            } catch (URISyntaxException e) {
                logger.warn("Cannot locate the weaver runtime, relying on java.class.path", e);
            }
        }
        return String.join(File.pathSeparator, entries);
    }

    private static class SourceFile extends SimpleJavaFileObject {
        private final String source;

        SourceFile(String binaryName, String source) {
            super(URI.create("string:///" + binaryName.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
            this.source = source;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return source;
        }
    }

    private static class ClassFile extends SimpleJavaFileObject {
        private final ByteArrayOutputStream bytes;

        ClassFile(String binaryName, ByteArrayOutputStream bytes) {
            super(URI.create("bytes:///" + binaryName.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
            this.bytes = bytes;
        }

        @Override
        public OutputStream openOutputStream() {
            return bytes;
        }
    }

    private static class InMemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
        private final Map<String, ByteArrayOutputStream> outputs;

        InMemoryFileManager(StandardJavaFileManager delegate, Map<String, ByteArrayOutputStream> outputs) {
            super(delegate);
            this.outputs = outputs;
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className,
                                                   JavaFileObject.Kind kind, FileObject sibling) {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            outputs.put(className, bytes);
            return new ClassFile(className, bytes);
        }
    }
}
