package cpp2py.print;

import cpp2py.ast.cpp.TypeCategory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Names seen so far during one rendering pass.
 *
 * Each identifier maps to the type tag of its most recent declaration in generation order. There is no scoping:
 * a later declaration overwrites an earlier one, wherever it appears.
 */
public final class Environment {
	private final Map<String, String> types = new HashMap<>();
	private final Set<String> globals = new HashSet<>();
	private final Set<String> classes = new HashSet<>();

	public void declare(String name, String typeTag) {
		types.put(name, typeTag);
	}

	public Optional<String> typeOf(String name) {
		return Optional.ofNullable(types.get(name));
	}

	public TypeCategory categoryOf(String name) {
		return TypeCategory.of(types.get(name));
	}

	void declareGlobal(String name) {
		globals.add(name);
	}

	public boolean isGlobal(String name) {
		return globals.contains(name);
	}

	void declareClass(String name) {
		classes.add(name);
	}

	public boolean isClass(String name) {
		return classes.contains(name);
	}
}
