/**
 * Annotations recognized by {@link works.typedmap.Schema.Builder#scan} and {@link works.typedmap.TypedMap#as}.
 */
package works.typedmap.annotations;
