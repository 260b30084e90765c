package com.tyron.multicode.testFramework;

import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * {@code @ExtendWith(TestLoggingExtension.class)} configures {@link TestLogging} before the first test of a
 * class runs.
 */
public final class TestLoggingExtension implements BeforeAllCallback {

    @Override
    public void beforeAll(ExtensionContext context) {
        TestLogging.configureOnce();
    }
}
