package cpp2py.ast;

/**
 * Source position for diagnostics.
 *
 * Lines and columns are 1-based.
 */
public record SourcePos(int line, int column) {
	public static final SourcePos NONE = new SourcePos(-1, -1);
}
