// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type or method as internal to Ferrite.
 *
 * <p>Annotated elements are public only because another Ferrite module or package
 * needs them. They can change between releases without notice.
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
public @interface InternalApi {
}
