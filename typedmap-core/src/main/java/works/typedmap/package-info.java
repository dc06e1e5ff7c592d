/**
 * {@link works.typedmap.TypedMap}: a {@link java.util.Map} that validates, coerces,
 * and checks its values according to a {@link works.typedmap.Schema},
 * with computed members whose cached values are invalidated when their dependencies change.
 */
package works.typedmap;
