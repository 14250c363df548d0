package org.cellang.codegen;

import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.cellang.util.Debug;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Hands out the LLVM context of the calling thread.
 * <p>
 * An LLVM context must not be used from more than one thread, so every thread that
 * generates code gets its own, created on first use and kept for the lifetime of the
 * thread. Contexts are never handed to another thread.
 */
public final class CodegenContext
{
	private static final ThreadLocal<LLVMContextRef> CONTEXT = ThreadLocal.withInitial(() ->
	{
		LLVMContextRef context = LLVMContextCreate();
		Debug.logDebug("IR: Created LLVM context for thread " + Thread.currentThread().getName());
		return context;
	});

	private CodegenContext()
	{
	}

	/**
	 * Returns the calling thread's LLVM context, creating it if needed.
	 */
	public static LLVMContextRef get()
	{
		return CONTEXT.get();
	}
}
