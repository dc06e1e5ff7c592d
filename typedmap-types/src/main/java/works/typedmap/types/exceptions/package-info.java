/**
 * Failures raised while checking values against {@link works.typedmap.types.ValueType}s.
 * <p>
 * Both kinds extend {@link works.typedmap.types.exceptions.TypeCheckException},
 * so callers that don't care whether coercion was attempted can catch just that.
 */
package works.typedmap.types.exceptions;
