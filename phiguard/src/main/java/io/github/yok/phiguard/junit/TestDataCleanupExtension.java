package io.github.yok.phiguard.junit;

import io.github.yok.phiguard.core.CleanupResult;
import io.github.yok.phiguard.core.CleanupScope;
import io.github.yok.phiguard.core.TestDataCleaner;
import io.github.yok.phiguard.db.ConnectionManager;
import io.github.yok.phiguard.db.QueryExecutor;
import io.github.yok.phiguard.exception.PhiGuardException;
import java.lang.reflect.Method;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ExtensionContext.Namespace;
import org.junit.jupiter.api.extension.ExtensionContext.Store;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;

/**
 * JUnit 5 Extension that interprets {@link CleanupTestData} and purges fixtures after each test.
 *
 * <ul>
 * <li><b>Before each test:</b> builds a {@link CleanupScope} from the effective annotation
 * (method-level wins over class-level) and keeps it in the test's store.</li>
 * <li><b>Parameter injection:</b> a {@link CleanupScope} test parameter receives that scope, so the
 * test can add ids of fixtures it creates.</li>
 * <li><b>After each test:</b> runs {@link TestDataCleaner} through the {@link ConnectionManager}
 * registered in {@link ConnectionRegistry}. Residual rows fail the test.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TestDataCleanupExtension
        implements BeforeEachCallback, AfterEachCallback, ParameterResolver {

    // Store namespace and keys
    private static final Namespace NS =
            Namespace.create(TestDataCleanupExtension.class.getName(), "CLEANUP");
    private static final String STORE_KEY_SCOPE = "SCOPE";
    private static final String STORE_KEY_CONNECTION = "CONNECTION";

    /**
     * Prepares the per-test cleanup scope.
     *
     * @param context execution context
     */
    @Override
    public void beforeEach(ExtensionContext context) {
        CleanupTestData ann = resolveAnnotation(context).orElse(null);
        if (ann == null) {
            return;
        }
        CleanupScope scope = CleanupScope.create();
        if (ann.prefixes().length > 0) {
            scope.patientPrefix(ann.prefixes());
        }
        if (ann.userPrefixes().length > 0) {
            scope.userPrefix(ann.userPrefixes());
        }
        Store store = context.getStore(NS);
        store.put(STORE_KEY_SCOPE, scope);
        store.put(STORE_KEY_CONNECTION, ann.connection());
        log.debug("Cleanup scope prepared. test={}, connection={}", context.getDisplayName(),
                ann.connection());
    }

    /**
     * Purges the fixtures collected in the test's scope.
     *
     * @param context execution context
     */
    @Override
    public void afterEach(ExtensionContext context) {
        Store store = context.getStore(NS);
        CleanupScope scope = store.get(STORE_KEY_SCOPE, CleanupScope.class);
        if (scope == null) {
            return;
        }
        String name = store.get(STORE_KEY_CONNECTION, String.class);
        ConnectionManager manager = ConnectionRegistry.find(name)
                .orElseThrow(() -> PhiGuardException.validation(
                        "No connection registered under '" + name + "' for test data cleanup"));
        CleanupResult result = new TestDataCleaner(new QueryExecutor(manager)).cleanup(scope);
        log.info("Test data cleanup finished. test={}, deleted={}", context.getDisplayName(),
                result.getTotalDeleted());
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext,
            ExtensionContext extensionContext) {
        return parameterContext.getParameter().getType() == CleanupScope.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext,
            ExtensionContext extensionContext) {
        CleanupScope scope = extensionContext.getStore(NS).get(STORE_KEY_SCOPE, CleanupScope.class);
        if (scope == null) {
            throw PhiGuardException.validation(
                    "CleanupScope can only be injected into tests annotated with @CleanupTestData");
        }
        return scope;
    }

    /**
     * Resolves the effective annotation: method-level first, then the test class and its
     * enclosing classes.
     *
     * @param context execution context
     * @return annotation, or empty when none applies
     */
    private Optional<CleanupTestData> resolveAnnotation(ExtensionContext context) {
        Optional<Method> method = context.getTestMethod();
        if (method.isPresent()) {
            CleanupTestData methodAnn = method.get().getAnnotation(CleanupTestData.class);
            if (methodAnn != null) {
                return Optional.of(methodAnn);
            }
        }
        Class<?> type = context.getTestClass().orElse(null);
        while (type != null) {
            CleanupTestData classAnn = type.getAnnotation(CleanupTestData.class);
            if (classAnn != null) {
                return Optional.of(classAnn);
            }
            type = type.getEnclosingClass();
        }
        return Optional.empty();
    }
}
