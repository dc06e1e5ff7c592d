package works.typedmap.types;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * The arguments of one call through a {@link CheckedFunction},
 * already checked against the {@link Contract}'s parameter types.
 */
public final class Arguments {
	private final Contract contract;
	private final List<Object> values;

	Arguments(Contract contract, List<Object> values) {
		this.contract = contract;
		this.values = values;
	}

	public int size() {
		return values.size();
	}

	public @Nullable Object get(int index) {
		return values.get(index);
	}

	public @Nullable Object get(String name) {
		return values.get(contract.indexOf(name));
	}

	/**
	 * @throws ClassCastException if the argument is not null and not an instance of {@code type}
	 */
	public <V> V get(String name, Class<V> type) {
		return type.cast(get(name));
	}

	public Object[] toArray() {
		return values.toArray();
	}

	/**
	 * @return the parameter names mapped to their arguments, in declaration order
	 */
	public Map<String, Object> asMap() {
		Map<String, Object> result = new LinkedHashMap<>();
		for (int i = 0; i < values.size(); i++) {
			result.put(contract.parameters().get(i).name(), values.get(i));
		}
		return result;
	}

	@Override
	public String toString() {
		return asMap().toString();
	}
}
