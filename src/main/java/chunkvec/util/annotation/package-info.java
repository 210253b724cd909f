// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Nullness annotations shared by the rest of the library.
 */
package chunkvec.util.annotation;
