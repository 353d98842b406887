package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppStreamValue(CppExpr value, SourcePos pos) implements CppStreamItem {
}
