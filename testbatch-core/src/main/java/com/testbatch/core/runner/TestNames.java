package com.testbatch.core.runner;

import com.testbatch.core.model.TestBody;
import com.testbatch.core.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.SerializedLambda;
import java.lang.reflect.Method;

/**
 * Derives display names from test bodies.
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>Method reference {@code ParserTests::parsesNumbers} - {@code "ParserTests::parsesNumbers"}</li>
 *   <li>Named class implementing {@link TestBody} - its simple class name</li>
 *   <li>Lambda or anonymous class - {@link TestCase#DEFAULT_NAME}</li>
 * </ul>
 *
 * <p>Method references are read through their serialized form, which needs reflective access
 * to the generated class. Bodies declared in a named module that does not open its package to
 * this module, or created without a serialized form, fall back to {@link TestCase#DEFAULT_NAME}.
 */
final class TestNames {

    private static final Logger log = LoggerFactory.getLogger(TestNames.class);

    private static final String LAMBDA_PREFIX = "lambda$";

    private TestNames() {
    }

    static String of(TestBody body) {
        Class<?> type = body.getClass();
        if (!type.isSynthetic()) {
            String simpleName = type.getSimpleName();
            return simpleName.isEmpty() ? TestCase.DEFAULT_NAME : simpleName;
        }

        SerializedLambda lambda = serializedForm(body);
        if (lambda == null || lambda.getImplMethodName().startsWith(LAMBDA_PREFIX)) {
            return TestCase.DEFAULT_NAME;
        }
        return ownerName(lambda.getImplClass()) + "::" + lambda.getImplMethodName();
    }

    private static SerializedLambda serializedForm(TestBody body) {
        try {
            Method writeReplace = body.getClass().getDeclaredMethod("writeReplace");
            writeReplace.setAccessible(true);
            Object replacement = writeReplace.invoke(body);
            if (replacement instanceof SerializedLambda) {
                return (SerializedLambda) replacement;
            }
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.debug("Cannot derive a name from {}: {}", body.getClass().getName(), e.getMessage());
        }
        return null;
    }

    /**
     * Converts an internal class name such as {@code com/acme/Outer$Inner} to {@code Inner}.
     */
    private static String ownerName(String internalName) {
        String name = internalName.substring(internalName.lastIndexOf('/') + 1);
        return name.substring(name.lastIndexOf('$') + 1);
    }
}
