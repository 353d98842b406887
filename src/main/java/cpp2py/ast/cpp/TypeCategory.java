package cpp2py.ast.cpp;

/**
 * Coarse classification of a declared type tag. Everything the subset cannot name (void, class types, unknown
 * identifiers) is {@link #OTHER}.
 */
public enum TypeCategory {
	INTEGER, FLOATING, CHARACTER, STRING, BOOLEAN, OTHER;

	public static TypeCategory of(String typeTag) {
		if (typeTag == null) {
			return OTHER;
		}
		return switch (typeTag) {
			case "int", "long", "short" -> INTEGER;
			case "float", "double" -> FLOATING;
			case "char" -> CHARACTER;
			case "string" -> STRING;
			case "bool" -> BOOLEAN;
			default -> OTHER;
		};
	}
}
