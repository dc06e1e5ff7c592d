package works.typedmap.util;

import java.util.List;

/**
 * Paths like {@code db.replicas.0.host}: keys separated by dots,
 * where a segment of digits can also index into a list.
 */
public final class DottedPath {
	private DottedPath() { }

	/**
	 * @throws IllegalArgumentException if {@code path} is empty or has an empty segment
	 */
	public static List<String> parse(String path) {
		if (path.isEmpty()) {
			throw new IllegalArgumentException("Path is empty");
		}
		List<String> segments = List.of(path.split("\\.", -1));
		if (segments.contains("")) {
			throw new IllegalArgumentException("Path has an empty segment: \"" + path + "\"");
		}
		return segments;
	}

	public static boolean isIndex(String segment) {
		return !segment.isEmpty() && segment.chars().allMatch(c -> c >= '0' && c <= '9');
	}

	/**
	 * @return the index denoted by {@code segment}, or -1 if it isn't a valid index
	 */
	public static int indexOf(String segment) {
		if (!isIndex(segment)) {
			return -1;
		}
		try {
			return Integer.parseInt(segment);
		} catch (NumberFormatException e) {
			// Too large to index anything
			return -1;
		}
	}
}
