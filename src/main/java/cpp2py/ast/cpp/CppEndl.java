package cpp2py.ast.cpp;

import cpp2py.ast.SourcePos;

public record CppEndl(SourcePos pos) implements CppStreamItem {
}
