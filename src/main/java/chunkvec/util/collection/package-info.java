// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Mutable, single-owner sequence containers.
 * <p>
 * Nothing in this package is thread-safe. Callers either share an instance between any number of readers or hand
 * it to exactly one writer, never both at once.
 */
@NonNullByDefault
package chunkvec.util.collection;

import chunkvec.util.annotation.NonNullByDefault;
