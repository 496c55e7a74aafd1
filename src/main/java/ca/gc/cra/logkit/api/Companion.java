package ca.gc.cra.logkit.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a static nested class whose loggers should be named after the enclosing class.
 *
 * <p>Typical use is a holder of static helpers that logs on behalf of its owner:
 * <pre>{@code
 * public class Invoice {
 *   @Companion
 *   static final class Helpers implements Logging { ... }   // logs as "Invoice"
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Companion {}
