package org.cellang.dto;

import java.util.ArrayList;
import java.util.List;

public class FunctionErrorsDTO
{
	public String function;
	public String returnType;
	public List<ErrorPointDTO> errorPoints = new ArrayList<>();
}
