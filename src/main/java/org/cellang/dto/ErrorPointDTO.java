package org.cellang.dto;

/**
 * One runtime error point as written to the error table.
 */
public class ErrorPointDTO
{
	public int index;
	public String kind;
	public String message;
	public Integer start;
	public Integer end;
	public Integer line;
	public Integer column;
}
