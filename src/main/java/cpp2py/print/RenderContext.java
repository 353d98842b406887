package cpp2py.print;

/**
 * Environment, indentation level and enclosing definition for one rendering step.
 */
public final class RenderContext {
	private final Environment env;
	private final String indentUnit;
	private final int indent;
	private final boolean inFunction;
	private final MemberScope members;

	private RenderContext(Environment env, String indentUnit, int indent, boolean inFunction, MemberScope members) {
		this.env = env;
		this.indentUnit = indentUnit;
		this.indent = indent;
		this.inFunction = inFunction;
		this.members = members;
	}

	public static RenderContext root(Environment env, int indentWidth) {
		return new RenderContext(env, " ".repeat(indentWidth), 0, false, null);
	}

	public RenderContext at(int indent) {
		return new RenderContext(env, indentUnit, indent, inFunction, members);
	}

	public RenderContext indented() {
		return at(indent + 1);
	}

	RenderContext inFunction(MemberScope members) {
		return new RenderContext(env, indentUnit, indent + 1, true, members);
	}

	public Environment env() {
		return env;
	}

	public int indent() {
		return indent;
	}

	public boolean inFunction() {
		return inFunction;
	}

	MemberScope members() {
		return members;
	}

	String pad() {
		return indentUnit.repeat(indent);
	}
}
