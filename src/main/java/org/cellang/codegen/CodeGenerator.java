package org.cellang.codegen;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.cellang.ast.UserFunction;
import org.cellang.error.LangError;
import org.cellang.error.LangException;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;
import org.cellang.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Emits LLVM IR for {@link UserFunction}s into one module.
 * <p>
 * The generator keeps a single cursor (the instruction builder) and a single current
 * function, so it is strictly sequential and must only be used by the thread that
 * created it. Generating on several threads means one generator per thread.
 */
public class CodeGenerator implements AutoCloseable
{
	static
	{
		LLVMLinkInMCJIT();
		LLVMInitializeNativeTarget();
		LLVMInitializeNativeAsmPrinter();
		LLVMInitializeNativeAsmParser();
		Debug.logDebug("LLVM native target initialized.");
	}

	/**
	 * Builds the contents of one branch of a conditional. Implementations may leave the
	 * current block unterminated (falls through to the merge block) or terminate it.
	 */
	@FunctionalInterface
	public interface BlockBuilder
	{
		void build(CodeGenerator generator) throws LangException;
	}

	private final Thread ownerThread;
	private final LLVMContextRef context;
	private final LLVMModuleRef module;
	private final LLVMBuilderRef builder;
	private final TypeConverter types;

	private LLVMValueRef fnValue = null;
	private final Map<String, LLVMValueRef> varSlots = new HashMap<>();

	// Cleared once an execution engine takes over the module
	private boolean ownsModule = true;

	public CodeGenerator(String moduleName)
	{
		this.ownerThread = Thread.currentThread();
		this.context = CodegenContext.get();
		this.module = LLVMModuleCreateWithNameInContext(moduleName, context);
		this.builder = LLVMCreateBuilderInContext(context);
		this.types = new TypeConverter(context);
	}

	public LLVMModuleRef getModule()
	{
		return module;
	}

	public LLVMContextRef getContext()
	{
		return context;
	}

	public LLVMBuilderRef builder()
	{
		return builder;
	}

	public TypeConverter types()
	{
		return types;
	}

	public LLVMTypeRef intType()
	{
		return types.intType();
	}

	public LLVMTypeRef cellStateType()
	{
		return types.cellStateType();
	}

	public LLVMTypeRef returnType()
	{
		return types.returnType();
	}

	/**
	 * Emits {@code userFunction} as a function {@code i64 name()} and returns it.
	 */
	public LLVMValueRef compileFunction(String name, UserFunction userFunction) throws LangException
	{
		ensureOwnerThread();
		if (!userFunction.isBuilt())
		{
			throw new IllegalStateException("Cannot compile user function '" + name + "' before it is built");
		}
		if (LLVMGetNamedFunction(module, name) != null)
		{
			throw new IllegalArgumentException("Function '" + name + "' already exists in module");
		}

		LLVMTypeRef fnType = LLVMFunctionType(returnType(), (PointerPointer) null, 0, 0);
		fnValue = LLVMAddFunction(module, name, fnType);
		varSlots.clear();

		LLVMBasicBlockRef entry = appendBasicBlock("entry");
		LLVMPositionBuilderAtEnd(builder, entry);

		// One stack slot per variable, initialized to the type's default value
		for (Map.Entry<String, Type> var : userFunction.getVariables().entrySet())
		{
			LLVMValueRef slot = buildEntryBlockAlloca(types.toLLVMType(var.getValue()), var.getKey());
			LLVMBuildStore(builder, getDefaultVarValue(var.getValue()), slot);
			varSlots.put(var.getKey(), slot);
		}

		userFunction.compileBlock(this, userFunction.getBody());

		// Falling off the end returns the default value of the return type
		if (needsTerminator())
		{
			Type returnType = userFunction.getReturnType();
			buildReturnValue(new Value(returnType, getDefaultVarValue(returnType)));
		}

		Debug.logDebug("IR: Generated function " + name + " with " + varSlots.size() + " variable(s).");
		LLVMValueRef function = fnValue;
		fnValue = null;
		varSlots.clear();
		return function;
	}

	/**
	 * Returns the LLVM function currently being generated.
	 */
	public LLVMValueRef fnValue()
	{
		if (fnValue == null)
		{
			throw new IllegalStateException("No function is being generated");
		}
		return fnValue;
	}

	/**
	 * Appends a basic block to the end of the current function.
	 */
	public LLVMBasicBlockRef appendBasicBlock(String label)
	{
		return LLVMAppendBasicBlockInContext(context, fnValue(), label);
	}

	/**
	 * Allocates a stack slot in the entry block of the current function, after any
	 * allocas already there, without moving the cursor.
	 */
	public LLVMValueRef buildEntryBlockAlloca(LLVMTypeRef type, String name)
	{
		LLVMBasicBlockRef entryBlock = LLVMGetEntryBasicBlock(fnValue());
		LLVMBuilderRef tmpBuilder = LLVMCreateBuilderInContext(context);
		try
		{
			LLVMValueRef inst = LLVMGetFirstInstruction(entryBlock);
			while (inst != null && LLVMIsAAllocaInst(inst) != null)
			{
				inst = LLVMGetNextInstruction(inst);
			}
			if (inst != null)
			{
				LLVMPositionBuilderBefore(tmpBuilder, inst);
			}
			else
			{
				LLVMPositionBuilderAtEnd(tmpBuilder, entryBlock);
			}
			return LLVMBuildAlloca(tmpBuilder, type, name);
		}
		finally
		{
			LLVMDisposeBuilder(tmpBuilder);
		}
	}

	/**
	 * Returns whether the block at the cursor does not have a terminator instruction yet.
	 */
	public boolean needsTerminator()
	{
		return LLVMGetBasicBlockTerminator(LLVMGetInsertBlock(builder)) == null;
	}

	/**
	 * Branches on whether {@code conditionValue} is non-zero, builds both arms, and leaves
	 * the cursor at the block where they merge. An arm that does not terminate on its own
	 * gets a branch to the merge block.
	 */
	public void buildConditional(LLVMValueRef conditionValue, BlockBuilder buildIfTrue, BlockBuilder buildIfFalse) throws LangException
	{
		LLVMBasicBlockRef ifTrueBlock = appendBasicBlock("ifTrue");
		LLVMBasicBlockRef ifFalseBlock = appendBasicBlock("ifFalse");
		LLVMBasicBlockRef mergeBlock = appendBasicBlock("endIf");

		// A switch instead of a conditional branch, because the condition need not be 1-bit
		LLVMValueRef switchInst = LLVMBuildSwitch(builder, conditionValue, ifTrueBlock, 1);
		LLVMAddCase(switchInst, LLVMConstNull(LLVMTypeOf(conditionValue)), ifFalseBlock);

		LLVMPositionBuilderAtEnd(builder, ifTrueBlock);
		buildIfTrue.build(this);
		if (needsTerminator())
		{
			LLVMBuildBr(builder, mergeBlock);
		}

		LLVMPositionBuilderAtEnd(builder, ifFalseBlock);
		buildIfFalse.build(this);
		if (needsTerminator())
		{
			LLVMBuildBr(builder, mergeBlock);
		}

		LLVMPositionBuilderAtEnd(builder, mergeBlock);
	}

	/**
	 * Returns {@code error_index} with the error flag set.
	 */
	public void buildReturnError(int errorIndex)
	{
		LLVMValueRef returnValue = LLVMConstInt(returnType(), ReturnEncoding.encodeError(errorIndex), 0);
		LLVMBuildRet(builder, returnValue);
	}

	/**
	 * Returns {@code value}, zero-extended into the low bits of the return value.
	 */
	public void buildReturnValue(Value value) throws LangException
	{
		Type type = value.type();
		if (!type.fitsInReturnValue())
		{
			throw LangError.internal(null, "Cannot return a value of type " + type).toException();
		}
		LLVMValueRef packed = value.ref();
		if (type.isVector())
		{
			packed = LLVMBuildBitCast(builder, packed, types.packedType(type), "packedVector");
		}
		LLVMValueRef wide = LLVMBuildZExt(builder, packed, returnType(), "returnValue");
		LLVMBuildRet(builder, wide);
	}

	public LLVMValueRef getLlvmIntrinsic(String name, LLVMTypeRef fnType) throws LangException
	{
		LLVMValueRef fn = LLVMGetNamedFunction(module, name);
		if (fn == null)
		{
			fn = LLVMAddFunction(module, name, fnType);
			LLVMSetLinkage(fn, LLVMExternalLinkage);
			return fn;
		}
		if (!LLVMGlobalGetValueType(fn).equals(fnType))
		{
			throw LangError.internal(null, "Requested LLVM intrinsic " + name + " with a different type signature").toException();
		}
		return fn;
	}

	/**
	 * Performs {@code name} (e.g. {@code sadd}) through the overflow-reporting LLVM intrinsic.
	 * {@code onOverflow} runs in the overflow branch and is expected to terminate it; the
	 * returned result is only valid on the path without overflow.
	 */
	public LLVMValueRef buildCheckedIntArithmetic(LLVMValueRef lhs, LLVMValueRef rhs, String name, BlockBuilder onOverflow) throws LangException
	{
		String intrinsicName = "llvm." + name + ".with.overflow.i" + Type.INT_BITS;
		LLVMTypeRef[] resultFields = {intType(), types.boolType()};
		LLVMTypeRef intrinsicReturnType = LLVMStructTypeInContext(context, new PointerPointer<>(resultFields), 2, 0);
		LLVMTypeRef[] paramTypes = {intType(), intType()};
		LLVMTypeRef intrinsicFnType = LLVMFunctionType(intrinsicReturnType, new PointerPointer<>(paramTypes), 2, 0);
		LLVMValueRef intrinsicFn = getLlvmIntrinsic(intrinsicName, intrinsicFnType);

		LLVMValueRef[] args = {lhs, rhs};
		LLVMValueRef callResult = LLVMBuildCall2(builder, intrinsicFnType, intrinsicFn, new PointerPointer<>(args), 2, "tmp_" + name);

		// { result, overflow flag }
		LLVMValueRef resultValue = LLVMBuildExtractValue(builder, callResult, 0, "tmp_" + name + "Result");
		LLVMValueRef isOverflow = LLVMBuildExtractValue(builder, callResult, 1, "tmp_" + name + "Overflow");

		buildConditional(isOverflow, onOverflow, g ->
		{
		});

		return resultValue;
	}

	/**
	 * Guards a signed division: {@code onDivByZero} runs when {@code rhs} is zero, otherwise
	 * {@code onOverflow} runs when computing {@code MIN_INT / -1}. Both are expected to
	 * terminate. The caller emits the division itself after this returns.
	 */
	public void buildDivCheck(LLVMValueRef lhs, LLVMValueRef rhs, BlockBuilder onOverflow, BlockBuilder onDivByZero) throws LangException
	{
		LLVMValueRef zero = LLVMConstNull(intType());
		LLVMValueRef isDivByZero = LLVMBuildICmp(builder, LLVMIntEQ, rhs, zero, "isDivByZero");

		buildConditional(isDivByZero, onDivByZero, g ->
		{
			LLVMValueRef numIsMinValue = LLVMBuildICmp(builder, LLVMIntEQ, lhs, getMinIntValue(), "isMinValue");
			LLVMValueRef negativeOne = LLVMConstInt(intType(), -1L, 1);
			LLVMValueRef denomIsNegOne = LLVMBuildICmp(builder, LLVMIntEQ, rhs, negativeOne, "isNegOne");
			LLVMValueRef isOverflow = LLVMBuildAnd(builder, numIsMinValue, denomIsNegOne, "isOverflow");

			g.buildConditional(isOverflow, onOverflow, g2 ->
			{
			});
		});
	}

	/**
	 * Returns the zero value of {@code type}, used to initialize variables.
	 */
	public LLVMValueRef getDefaultVarValue(Type type)
	{
		return types.toLLVMConst(ConstValue.defaultFor(type));
	}

	public LLVMValueRef getMinIntValue()
	{
		return LLVMConstInt(intType(), Integer.MIN_VALUE, 1);
	}

	public Value buildLoadVar(String varName, Type type) throws LangException
	{
		LLVMValueRef slot = getVarSlot(varName);
		LLVMValueRef loaded = LLVMBuildLoad2(builder, types.toLLVMType(type), slot, varName);
		return new Value(type, loaded);
	}

	public void buildStoreVar(String varName, Value value) throws LangException
	{
		LLVMBuildStore(builder, value.ref(), getVarSlot(varName));
	}

	private LLVMValueRef getVarSlot(String varName) throws LangException
	{
		LLVMValueRef slot = varSlots.get(varName);
		if (slot == null)
		{
			throw LangError.internal(null, "No storage slot for variable '" + varName + "'").toException();
		}
		return slot;
	}

	/**
	 * Runs the LLVM verifier over the whole module.
	 */
	public void verifyModule() throws LangException
	{
		BytePointer error = new BytePointer((Pointer) null);
		try
		{
			if (LLVMVerifyModule(module, LLVMReturnStatusAction, error) != 0)
			{
				throw LangError.internal(null, "Invalid LLVM module: " + error.getString()).toException();
			}
		}
		finally
		{
			if (!error.isNull())
			{
				LLVMDisposeMessage(error);
			}
		}
	}

	public String printModule()
	{
		BytePointer ir = LLVMPrintModuleToString(module);
		try
		{
			return ir.getString();
		}
		finally
		{
			LLVMDisposeMessage(ir);
		}
	}

	public void writeModuleToFile(Path outputPath) throws IOException
	{
		if (outputPath.getParent() != null)
		{
			Files.createDirectories(outputPath.getParent());
		}
		BytePointer error = new BytePointer((Pointer) null);
		if (LLVMPrintModuleToFile(module, outputPath.toString(), error) != 0)
		{
			String message = error.getString();
			LLVMDisposeMessage(error);
			throw new IOException("Error writing LLVM IR to " + outputPath + ": " + message);
		}
		Debug.logDebug("LLVM IR written to " + outputPath);
	}

	/**
	 * Called when an execution engine takes ownership of the module.
	 */
	void releaseModule()
	{
		ownsModule = false;
	}

	private void ensureOwnerThread()
	{
		if (Thread.currentThread() != ownerThread)
		{
			throw new IllegalStateException("CodeGenerator used from thread " + Thread.currentThread().getName()
					+ " but it belongs to " + ownerThread.getName());
		}
	}

	@Override
	public void close()
	{
		LLVMDisposeBuilder(builder);
		if (ownsModule)
		{
			LLVMDisposeModule(module);
		}
	}
}
