// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package chunkvec.util.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import javax.annotation.Nonnull;
import javax.annotation.meta.TypeQualifierDefault;

/**
 * Declares that fields, method return values and parameters in the annotated package or class are never
 * {@code null} unless annotated otherwise.
 * <p>
 * Elements that can be {@code null} must carry an explicit {@code @Nullable}, either the JetBrains one on public
 * API or the Checker Framework one elsewhere.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.PACKAGE, ElementType.TYPE})
@TypeQualifierDefault({
    ElementType.FIELD,
    ElementType.METHOD,
    ElementType.PARAMETER,
})
@Nonnull
public @interface NonNullByDefault {
}
