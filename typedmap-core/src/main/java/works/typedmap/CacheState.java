package works.typedmap;

/**
 * The state of one cached computed member in one {@link TypedMap}.
 */
public enum CacheState {
	/**
	 * Never produced.
	 * Non-caching members are always in this state.
	 */
	UNCOMPUTED,

	CACHED,

	/**
	 * Produced before, but something it depends on has changed since.
	 */
	INVALID,
}
