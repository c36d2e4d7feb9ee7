package io.github.yok.phiguard.junit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Annotation to purge synthetic fixtures after each test.
 *
 * This annotation can be placed on a test class or on individual test methods. A method-level
 * annotation replaces the class-level one for that method.<br>
 * The {@link TestDataCleanupExtension} interprets this annotation.
 *
 * <pre>
 * &#64;CleanupTestData(connection = "app", prefixes = "TEST_")
 * class PatientRegistrationTest {
 *
 *     &#64;Test
 *     void register(CleanupScope scope) {
 *         String id = ui.registerPatient();
 *         scope.patientId(id);
 *     }
 * }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@ExtendWith(TestDataCleanupExtension.class)
public @interface CleanupTestData {

    /**
     * Name under which the {@link io.github.yok.phiguard.db.ConnectionManager} was registered in
     * {@link ConnectionRegistry}.
     *
     * @return connection name
     */
    String connection() default "default";

    /**
     * Patient identifier prefixes purged after the test.
     *
     * @return prefixes (e.g., {@code {"TEST_", "PAT_"}})
     */
    String[] prefixes() default {};

    /**
     * Synthetic user marker prefixes purged after the test.
     *
     * @return prefixes (e.g., {@code {"TESTUSER_"}})
     */
    String[] userPrefixes() default {};
}
