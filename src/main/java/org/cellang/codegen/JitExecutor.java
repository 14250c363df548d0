package org.cellang.codegen;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMExecutionEngineRef;
import org.bytedeco.llvm.LLVM.LLVMGenericValueRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.cellang.ast.UserFunction;
import org.cellang.error.LangError;
import org.cellang.error.LangException;
import org.cellang.util.Debug;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Compiles a generated module to machine code with MCJIT and runs its functions.
 * <p>
 * Creating an executor hands ownership of the module to the execution engine; the
 * generator that produced it can still be closed, but must not emit anything further.
 */
public class JitExecutor implements AutoCloseable
{
	private static final int OPT_LEVEL = 2;

	private final LLVMExecutionEngineRef engine;
	private final LLVMModuleRef module;

	private JitExecutor(LLVMExecutionEngineRef engine, LLVMModuleRef module)
	{
		this.engine = engine;
		this.module = module;
	}

	/**
	 * Verifies the generator's module and JIT-compiles it.
	 */
	public static JitExecutor create(CodeGenerator generator) throws LangException
	{
		generator.verifyModule();

		LLVMExecutionEngineRef engine = new LLVMExecutionEngineRef();
		BytePointer error = new BytePointer((Pointer) null);
		if (LLVMCreateJITCompilerForModule(engine, generator.getModule(), OPT_LEVEL, error) != 0)
		{
			String message = error.getString();
			LLVMDisposeMessage(error);
			throw LangError.internal(null, "Failed to create JIT compiler: " + message).toException();
		}
		generator.releaseModule();
		Debug.logDebug("JIT: Created execution engine.");
		return new JitExecutor(engine, generator.getModule());
	}

	/**
	 * Runs the zero-argument function {@code name} and returns its raw 64-bit result.
	 */
	public long run(String name)
	{
		LLVMValueRef fn = LLVMGetNamedFunction(module, name);
		if (fn == null)
		{
			throw new IllegalArgumentException("No function named '" + name + "' in module");
		}
		LLVMGenericValueRef result = LLVMRunFunction(engine, fn, 0, (PointerPointer) null);
		try
		{
			return LLVMGenericValueToInt(result, 0);
		}
		finally
		{
			LLVMDisposeGenericValue(result);
		}
	}

	/**
	 * Runs {@code name} and decodes its result against the error-point table of the user
	 * function it was generated from.
	 */
	public ExecutionResult call(String name, UserFunction userFunction)
	{
		long raw = run(name);
		Debug.logDebug("JIT: " + name + "() returned 0x" + Long.toHexString(raw));
		return ExecutionResult.decode(raw, userFunction);
	}

	@Override
	public void close()
	{
		// Disposing the engine also disposes the module it owns
		LLVMDisposeExecutionEngine(engine);
	}
}
