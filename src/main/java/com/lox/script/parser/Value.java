package com.lox.script.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime value: a type tag plus its payload.
 *
 * NUMBER holds a Double, BOOL a Boolean, STRING a String, FUNC a LoxCallable,
 * CLASS a ClassDescriptor, INSTANCE a ClassInstance and NIL holds null.
 */
public final class Value {
    public enum Type { NUMBER, BOOL, STRING, FUNC, CLASS, INSTANCE, NIL }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) {
        if (s == null) throw new IllegalArgumentException("string value must not be null");
        return new Value(Type.STRING, s);
    }
    public static Value func(LoxCallable fn) { return new Value(Type.FUNC, fn); }
    public static Value clazz(ClassDescriptor c) { return new Value(Type.CLASS, c); }
    public static Value instance(ClassInstance i) { return new Value(Type.INSTANCE, i); }

    /** Immutable once declared: name, optional superclass and the method table. */
    public static final class ClassDescriptor {
        public final String name;
        public final ClassDescriptor superclass; // may be null
        final Map<String, UserFunction> methods;

        ClassDescriptor(String name, ClassDescriptor superclass, Map<String, UserFunction> methods) {
            this.name = name;
            this.superclass = superclass;
            this.methods = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(methods));
        }

        /** Walks the method-resolution order: this class first, then each ancestor. */
        UserFunction findMethod(String methodName) {
            for (ClassDescriptor c = this; c != null; c = c.superclass) {
                UserFunction fn = c.methods.get(methodName);
                if (fn != null) return fn;
            }
            return null;
        }

        @Override
        public String toString() { return name; }
    }

    public static final class ClassInstance {
        public final ClassDescriptor klass;

        // Fields are created by assignment only, never on read.
        final Map<String, Value> fields = new LinkedHashMap<>();

        ClassInstance(ClassDescriptor klass) {
            this.klass = klass;
        }

        /** Read-only view of the fields, for hosts inspecting run results. */
        public Map<String, Value> fieldsView() {
            return java.util.Collections.unmodifiableMap(fields);
        }

        @Override
        public String toString() { return "<" + klass.name + " instance>"; }
    }

    public Type getType() { return type; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (Double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    public LoxCallable asFunc() {
        if (type != Type.FUNC) throw new IllegalStateException("Expected function, got " + type);
        return (LoxCallable) value;
    }

    public ClassDescriptor asClass() {
        if (type != Type.CLASS) throw new IllegalStateException("Expected class, got " + type);
        return (ClassDescriptor) value;
    }

    public ClassInstance asInstance() {
        if (type != Type.INSTANCE) throw new IllegalStateException("Expected instance, got " + type);
        return (ClassInstance) value;
    }

    /** Same rendering as the print statement. */
    @Override
    public String toString() {
        return Operators.stringify(this);
    }
}
