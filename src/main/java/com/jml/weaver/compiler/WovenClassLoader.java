package com.jml.weaver.compiler;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Defines classes compiled from woven sources. Everything else, in particular the
 * violation types thrown by woven code, comes from the parent loader.
 */
public class WovenClassLoader extends ClassLoader {

    private final Map<String, byte[]> byteCode;

    public WovenClassLoader(ClassLoader parent, Map<String, byte[]> byteCode) {
        super(parent);
        this.byteCode = new ConcurrentHashMap<>(byteCode);
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
        byte[] bytes = byteCode.get(name);
        if (bytes == null) {
            throw new ClassNotFoundException(name);
        }
        return defineClass(name, bytes, 0, bytes.length);
    }

    /**
     * @return Binary names of all classes this loader can define
     */
    public Set<String> getClassNames() {
        return Collections.unmodifiableSet(byteCode.keySet());
    }
}
