/**
 * Tree-walking helpers used by {@link works.typedmap.TypedMap}.
 */
package works.typedmap.util;
