package works.typedmap.exceptions;

/**
 * Computed members can only be established by their producer, so they can't be written or removed.
 */
public class ReadOnlyMemberException extends UnsupportedOperationException {
	private final Class<?> containingClass;
	private final String memberName;

	public ReadOnlyMemberException(Class<?> containingClass, String memberName) {
		super("Computed member " + containingClass.getSimpleName() + "." + memberName + " is read-only");
		this.containingClass = containingClass;
		this.memberName = memberName;
	}

	public Class<?> containingClass() {
		return containingClass;
	}

	public String memberName() {
		return memberName;
	}
}
