package works.typedmap.exceptions;

import java.util.List;

public class DependencyCycleException extends InvalidDeclarationException {
	private final List<String> cycle;

	/**
	 * @param cycle the computed members involved, starting and ending with the same name
	 */
	public DependencyCycleException(List<String> cycle) {
		super("Dependency cycle among computed members: " + String.join(" -> ", cycle));
		this.cycle = List.copyOf(cycle);
	}

	public List<String> cycle() {
		return cycle;
	}
}
