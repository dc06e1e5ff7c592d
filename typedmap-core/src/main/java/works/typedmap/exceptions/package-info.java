/**
 * Failures raised by {@link works.typedmap.TypedMap} and {@link works.typedmap.Schema}.
 * Type check failures live in {@link works.typedmap.types.exceptions}.
 */
package works.typedmap.exceptions;
