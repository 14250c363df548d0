package org.cellang.codegen;

import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.cellang.type.Type;

/**
 * A value computed by generated code, together with its language type.
 */
public record Value(Type type, LLVMValueRef ref)
{
}
