package org.cellang.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Error-point tables of every function of a compiled rule, so that a host running the
 * generated code can turn a trapping return value into a diagnostic.
 */
public class ErrorTableDTO
{
	public String source;
	public int stateCount;
	public int ndim;
	public String neighborhood;
	public List<FunctionErrorsDTO> functions = new ArrayList<>();
}
