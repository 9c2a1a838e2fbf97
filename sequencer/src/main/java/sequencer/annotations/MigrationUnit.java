package sequencer.annotations;

import java.lang.annotation.*;

/**
 * Marks a class as a discoverable migration.
 *
 * <p>The annotated class must implement {@link sequencer.Migration} and have a
 * no-arg constructor. The attributes feed the default identity methods of the
 * contract, so a typical unit only implements its operations.
 *
 * <h2>Example:</h2>
 * <pre>
 * {@literal @}MigrationUnit(id = "add-src-layout", version = "0.1.0")
 * public class AddSourceLayout implements Migration { ... }
 *
 * {@literal @}MigrationUnit(id = "split-settings", version = "0.2.0", dependsOn = "add-src-layout")
 * public class SplitSettings implements Migration { ... }
 * </pre>
 *
 * @see sequencer.Migration
 * @see sequencer.registry.AnnotationMigrationSource
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface MigrationUnit {

    /** Unique identity. Blank means the simple class name. */
    String id() default "";

    /** Ordering key, a dotted version such as {@code 0.2.5} or a timestamp. */
    String version() default "0";

    /** Identities that must be applied first. */
    String[] dependsOn() default {};

    /** Human-readable summary shown by status and dry-run output. */
    String description() default "";
}
