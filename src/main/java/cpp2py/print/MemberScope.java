package cpp2py.print;

import java.util.Set;

/**
 * Names visible inside a function or method body. Field and method names not shadowed by a local are reached
 * through {@code self}; free functions have neither.
 */
record MemberScope(Set<String> fields, Set<String> methods, Set<String> locals) {
	boolean isField(String name) {
		return fields.contains(name) && !locals.contains(name);
	}

	boolean isMethod(String name) {
		return methods.contains(name) && !locals.contains(name);
	}
}
