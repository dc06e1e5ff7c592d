/**
 * Structural type expressions for runtime values, rooted at {@link works.typedmap.types.ValueType}.
 * <p>
 * A {@link works.typedmap.types.ValueType} describes an allowed value shape:
 * a primitive kind, a parametrized container, a union, or an instance of some class.
 * The {@link works.typedmap.types.TypeMatcher} decides whether a value conforms,
 * the {@link works.typedmap.types.Coercer} attempts a best-effort conversion when it doesn't,
 * and {@link works.typedmap.types.Contracts} enforces expressions on method arguments and results.
 */
package works.typedmap.types;
