package cpp2py.ast.cpp;

/**
 * One link of an output chain: either a value or the end-of-line marker.
 */
public sealed interface CppStreamItem extends CppNode permits CppStreamValue, CppEndl {
}
