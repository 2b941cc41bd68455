/**
 * GitHub Chronicle core package: fetching, filtering, attributing and aggregating
 * activity of GitHub users and organizations.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.NullMarked;
