package org.miniworker.worker;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

/**
 * Resolves fully qualified class names to {@link Worker} implementations.
 */
public final class WorkerTypes {

    private WorkerTypes() {}

    /**
     * Loads {@code className} and checks that it is a concrete {@link Worker} with a
     * public no-argument constructor.
     *
     * @throws WorkerTypeException when the class is missing or not a usable worker
     */
    public static Class<? extends Worker> resolve(String className) {
        if (className == null || className.isBlank()) {
            throw new WorkerTypeException(className, "Worker class name is empty");
        }
        Class<?> type;
        try {
            type = Class.forName(className.trim(), false, classLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new WorkerTypeException(className, "Cannot load worker class " + className, e);
        }

        if (!Worker.class.isAssignableFrom(type)) {
            throw new WorkerTypeException(className, className + " does not implement " + Worker.class.getName());
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new WorkerTypeException(className, className + " is not a concrete worker class");
        }
        if (!Modifier.isPublic(type.getModifiers())) {
            throw new WorkerTypeException(className, className + " is not public");
        }
        try {
            Constructor<?> ctor = type.getConstructor();
            if (!Modifier.isPublic(ctor.getModifiers())) {
                throw new WorkerTypeException(className, className + " has no public no-argument constructor");
            }
        } catch (NoSuchMethodException e) {
            throw new WorkerTypeException(className, className + " has no public no-argument constructor", e);
        }
        return type.asSubclass(Worker.class);
    }

    /**
     * Resolves and instantiates {@code className}.
     */
    public static Worker instantiate(String className) {
        Class<? extends Worker> type = resolve(className);
        try {
            return type.getConstructor().newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new WorkerTypeException(className, "Constructor of " + className + " failed: " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException e) {
            throw new WorkerTypeException(className, "Cannot instantiate " + className, e);
        }
    }

    private static ClassLoader classLoader() {
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : WorkerTypes.class.getClassLoader();
    }
}
