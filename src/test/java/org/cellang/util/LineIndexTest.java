package org.cellang.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LineIndexTest
{
	private final LineIndex index = new LineIndex("ab\ncde\n\nf");

	@Test
	void lineAndColumn_shouldBeOneBased()
	{
		assertThat(index.lineCount()).isEqualTo(4);
		assertThat(index.lineOf(0)).isEqualTo(1);
		assertThat(index.columnOf(1)).isEqualTo(2);
		assertThat(index.lineOf(3)).isEqualTo(2);
		assertThat(index.columnOf(5)).isEqualTo(3);
		assertThat(index.lineOf(7)).isEqualTo(3);
		assertThat(index.lineOf(8)).isEqualTo(4);
	}

	@Test
	void offsetOf_shouldInvertAntlrPositions()
	{
		assertThat(index.offsetOf(2, 1)).isEqualTo(4);
		assertThat(index.offsetOf(4, 0)).isEqualTo(8);
		assertThat(index.offsetOf(99, 0)).isEqualTo(9);
	}

	@Test
	void lineOf_shouldRejectOffsetsOutsideSource()
	{
		assertThatThrownBy(() -> index.lineOf(10)).isInstanceOf(IndexOutOfBoundsException.class);
	}
}
