package org.cellang.functions;

import org.cellang.ast.ExprRef;
import org.cellang.ast.UserFunction;
import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.Span;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;

import java.util.List;

/**
 * A built-in operation that expressions apply to their arguments.
 * <p>
 * Each implementation checks its own argument count and types, knows how to emit
 * code for itself and, where possible, how to fold itself into a constant.
 */
public interface BuiltinFunction
{
	/**
	 * Name used in diagnostics and debug output.
	 */
	String name();

	/**
	 * Validates the arguments and returns the type of the result.
	 */
	Type returnType(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException;

	/**
	 * Emits code computing the result at the generator's cursor.
	 */
	Value compile(CodeGenerator generator, UserFunction userFunction, List<ExprRef> args) throws LangException;

	/**
	 * Computes the result at compile time. The default refuses.
	 */
	default ConstValue constEval(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		throw LangException.of(LangErrorKind.CANNOT_EVAL_AS_CONST, span);
	}
}
