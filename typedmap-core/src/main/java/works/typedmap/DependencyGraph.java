package works.typedmap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import works.typedmap.exceptions.DependencyCycleException;

import static java.util.Collections.unmodifiableSet;

/**
 * Edges from each computed member to the keys it depends on,
 * which may be fields, undeclared keys, or other computed members.
 * <p>
 * Built once per {@link Schema} and immutable thereafter.
 * The set of members affected by each key is worked out up front.
 */
public final class DependencyGraph {
	private final Map<String, List<String>> dependencies;
	private final Map<String, Set<String>> affectedBy;

	/**
	 * @throws DependencyCycleException if the computed members depend on each other in a cycle
	 */
	public DependencyGraph(Collection<ComputedSpec> computed) {
		Map<String, List<String>> edges = new LinkedHashMap<>();
		computed.forEach(c -> edges.put(c.name(), c.dependencies()));
		this.dependencies = Map.copyOf(edges);
		checkAcyclic(edges);

		Map<String, List<String>> dependents = new HashMap<>();
		edges.forEach((member, deps) -> deps.forEach(dep ->
			dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(member)));

		Map<String, Set<String>> affected = new HashMap<>();
		for (String key : dependents.keySet()) {
			affected.put(key, unmodifiableSet(reverseWalk(key, dependents)));
		}
		this.affectedBy = Map.copyOf(affected);
	}

	/**
	 * @return the computed members that depend on {@code key}, directly or transitively,
	 * nearest first. Empty if nothing depends on {@code key}.
	 */
	public Set<String> affectedBy(String key) {
		return affectedBy.getOrDefault(key, Set.of());
	}

	/**
	 * @return the declared dependencies of a computed member, or an empty list if {@code name} isn't one
	 */
	public List<String> dependenciesOf(String name) {
		return dependencies.getOrDefault(name, List.of());
	}

	private static Set<String> reverseWalk(String key, Map<String, List<String>> dependents) {
		Set<String> result = new LinkedHashSet<>();
		Deque<String> queue = new ArrayDeque<>(dependents.getOrDefault(key, List.of()));
		while (!queue.isEmpty()) {
			String member = queue.removeFirst();
			if (result.add(member)) {
				queue.addAll(dependents.getOrDefault(member, List.of()));
			}
		}
		return result;
	}

	private static void checkAcyclic(Map<String, List<String>> edges) {
		Set<String> finished = new LinkedHashSet<>();
		List<String> stack = new ArrayList<>();
		for (String member : edges.keySet()) {
			visit(member, edges, finished, stack);
		}
	}

	private static void visit(String member, Map<String, List<String>> edges, Set<String> finished, List<String> stack) {
		if (finished.contains(member)) {
			return;
		}
		int index = stack.indexOf(member);
		if (index >= 0) {
			List<String> cycle = new ArrayList<>(stack.subList(index, stack.size()));
			cycle.add(member);
			throw new DependencyCycleException(cycle);
		}
		stack.add(member);
		for (String dep : edges.getOrDefault(member, List.of())) {
			// Only computed members have outgoing edges; fields are leaves
			if (edges.containsKey(dep)) {
				visit(dep, edges, finished, stack);
			}
		}
		stack.remove(stack.size() - 1);
		finished.add(member);
	}

	@Override
	public String toString() {
		return "DependencyGraph" + dependencies;
	}
}
