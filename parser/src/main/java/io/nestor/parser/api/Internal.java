package io.nestor.parser.api;

import static java.lang.annotation.ElementType.*;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks APIs that exist only so the scanner and tree builder can assemble results, and that callers
 * of the parser should not use.
 *
 * <p>Anything carrying this annotation may change or disappear in any release. Parse results are
 * obtained through {@link NestedParser}; node factories and scanner events are not part of the
 * supported surface.
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({TYPE, METHOD, FIELD, PACKAGE})
public @interface Internal {
  /**
   * Optional explanation of why this is internal and which public API to use instead.
   *
   * @return description of the internal API and alternatives
   */
  String value() default "";
}
