package com.ringbench.helper;

import com.ringbench.dispatcher.Dispatcher;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

import java.util.concurrent.TimeUnit;

/**
 * JUnit 5 extension that hands each test a fresh work-stealing dispatcher and shuts it
 * down once the test completes.
 *
 * Usage:
 * <pre>
 * {@code
 * @ExtendWith(DispatcherExtension.class)
 * class MyTest {
 *     @Test
 *     void test(Dispatcher dispatcher) { ... }
 * }
 * }
 * </pre>
 */
public class DispatcherExtension implements ParameterResolver, AfterEachCallback {

    private static final String DISPATCHER_KEY = "ringbench.test.dispatcher";
    private static final int WORKERS = 4;

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
            throws ParameterResolutionException {
        return parameterContext.getParameter().getType() == Dispatcher.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
            throws ParameterResolutionException {
        return extensionContext.getStore(ExtensionContext.Namespace.GLOBAL).getOrComputeIfAbsent(
                DISPATCHER_KEY,
                key -> Dispatcher.workStealingDispatcher(WORKERS, "test-" + extensionContext.getDisplayName()),
                Dispatcher.class);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        Dispatcher dispatcher = context.getStore(ExtensionContext.Namespace.GLOBAL)
                .remove(DISPATCHER_KEY, Dispatcher.class);
        if (dispatcher != null) {
            dispatcher.shutdown();
            dispatcher.awaitTermination(2, TimeUnit.SECONDS);
        }
    }
}
