package works.typedmap.exceptions;

import java.util.List;

/**
 * Required fields were absent when an instance was created or {@link works.typedmap.TypedMap#validate() validated}.
 */
public class MissingFieldException extends IllegalArgumentException {
	private final Class<?> containingClass;
	private final List<String> fieldNames;

	public MissingFieldException(Class<?> containingClass, List<String> fieldNames) {
		super(fullMessage(containingClass, fieldNames));
		this.containingClass = containingClass;
		this.fieldNames = List.copyOf(fieldNames);
	}

	public Class<?> containingClass() {
		return containingClass;
	}

	public List<String> fieldNames() {
		return fieldNames;
	}

	private static String fullMessage(Class<?> containingClass, List<String> fieldNames) {
		return containingClass.getSimpleName() + " is missing required field"
			+ (fieldNames.size() == 1 ? " " : "s ")
			+ fieldNames;
	}
}
