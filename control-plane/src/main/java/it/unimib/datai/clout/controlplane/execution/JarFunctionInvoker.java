package it.unimib.datai.clout.controlplane.execution;

import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Runs a public method from a JAR in its own class loader, isolated from the application
 * classpath (the parent is the platform loader).
 *
 * <p>Accepted entrypoint signatures, in order of preference: {@code (String)} receiving the
 * input as UTF-8 text, {@code (byte[])} receiving the raw input, and no arguments.</p>
 */
public class JarFunctionInvoker implements FunctionInvoker {
    private static final Logger log = LoggerFactory.getLogger(JarFunctionInvoker.class);

    @Override
    public RuntimeKind runtime() {
        return RuntimeKind.JVM;
    }

    @Override
    public String codeFileSuffix() {
        return ".jar";
    }

    @Override
    public Verification verify(Path code, String entrypoint, String declaringType) {
        try (URLClassLoader loader = newLoader(code)) {
            if (declaringType != null && !declaringType.isBlank()) {
                Class<?> type;
                try {
                    type = Class.forName(declaringType, false, loader);
                } catch (ClassNotFoundException | LinkageError e) {
                    return Verification.failed("Type '" + declaringType + "' not found in JAR");
                }
                return findEntrypoint(type, entrypoint) != null
                        ? Verification.ok(declaringType)
                        : Verification.failed("Type '" + declaringType + "' has no public method '" + entrypoint + "'");
            }
            return discover(code, loader, entrypoint);
        } catch (IOException e) {
            return Verification.failed("Not a readable JAR: " + e.getMessage());
        }
    }

    @Override
    public String invoke(FunctionRegistration function, Path code, byte[] input, FunctionWorkspace workspace)
            throws Exception {
        String typeName = function.declaringType();
        if (typeName == null || typeName.isBlank()) {
            Verification verification = verify(code, function.entrypoint(), null);
            if (!verification.resolved()) {
                throw new NoSuchMethodException(verification.reason());
            }
            typeName = verification.declaringType();
        }

        try (URLClassLoader loader = newLoader(code)) {
            Thread current = Thread.currentThread();
            ClassLoader previous = current.getContextClassLoader();
            current.setContextClassLoader(loader);
            try {
                Class<?> type = Class.forName(typeName, true, loader);
                Method method = findEntrypoint(type, function.entrypoint());
                if (method == null) {
                    throw new NoSuchMethodException(typeName + "." + function.entrypoint());
                }
                Object target = Modifier.isStatic(method.getModifiers())
                        ? null
                        : type.getDeclaredConstructor().newInstance();
                return render(call(method, target, arguments(method, input)));
            } finally {
                current.setContextClassLoader(previous);
            }
        }
    }

    static Method findEntrypoint(Class<?> type, String name) {
        Method noArgs = null;
        Method bytes = null;
        for (Method method : type.getMethods()) {
            if (!method.getName().equals(name)) {
                continue;
            }
            Class<?>[] parameters = method.getParameterTypes();
            if (parameters.length == 1 && parameters[0] == String.class) {
                return method;
            }
            if (parameters.length == 1 && parameters[0] == byte[].class) {
                bytes = method;
            } else if (parameters.length == 0) {
                noArgs = method;
            }
        }
        return bytes != null ? bytes : noArgs;
    }

    private Verification discover(Path code, ClassLoader loader, String entrypoint) throws IOException {
        try (JarFile jar = new JarFile(code.toFile())) {
            List<String> classNames = jar.stream()
                    .map(JarEntry::getName)
                    .filter(name -> name.endsWith(".class"))
                    .filter(name -> !name.endsWith("module-info.class") && !name.endsWith("package-info.class"))
                    .sorted(Comparator.naturalOrder())
                    .map(name -> name.substring(0, name.length() - ".class".length()).replace('/', '.'))
                    .toList();
            for (String className : classNames) {
                try {
                    Class<?> candidate = Class.forName(className, false, loader);
                    if (findEntrypoint(candidate, entrypoint) != null) {
                        return Verification.ok(className);
                    }
                } catch (ClassNotFoundException | LinkageError e) {
                    log.debug("Skipping class {} during entrypoint discovery: {}", className, e.toString());
                }
            }
        }
        return Verification.failed("No class in JAR declares a public method '" + entrypoint + "'");
    }

    private static Object[] arguments(Method method, byte[] input) {
        Class<?>[] parameters = method.getParameterTypes();
        if (parameters.length == 0) {
            return new Object[0];
        }
        if (parameters[0] == String.class) {
            return new Object[]{new String(input, StandardCharsets.UTF_8)};
        }
        return new Object[]{input};
    }

    private static Object call(Method method, Object target, Object[] args) throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private static String render(Object result) throws Exception {
        if (result == null) {
            return "";
        }
        if (result instanceof String text) {
            return text;
        }
        if (result instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        if (result instanceof CompletionStage<?> stage) {
            return render(stage.toCompletableFuture().get());
        }
        if (result instanceof Future<?> future) {
            return render(future.get());
        }
        return String.valueOf(result);
    }

    private static URLClassLoader newLoader(Path code) throws IOException {
        return new URLClassLoader("clout-function", new URL[]{code.toUri().toURL()},
                ClassLoader.getPlatformClassLoader());
    }
}
