package org.cellang.ast;

import org.cellang.codegen.CodeGenerator;
import org.cellang.error.LangException;
import org.cellang.syntax.Span;

/**
 * Statement node of a {@link UserFunction}.
 */
public sealed interface Statement permits SetVarStatement, IfStatement, ReturnStatement
{
	Span getSpan();

	void compile(CodeGenerator generator, UserFunction userFunction) throws LangException;
}
