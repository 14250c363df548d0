package org.cellang.type;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TypeTest
{
	@Test
	@DisplayName("Bit widths follow the int and cell state sizes")
	void bits_shouldMatchDeclaredWidths()
	{
		assertThat(Type.INT.bits()).isEqualTo(32);
		assertThat(Type.CELL_STATE.bits()).isEqualTo(8);
		assertThat(Type.vector(3).bits()).isEqualTo(96);
	}

	@Test
	@DisplayName("Vector types are equal when their lengths are")
	void equals_shouldBeStructural()
	{
		assertThat(Type.vector(3)).isEqualTo(Type.vector(3));
		assertThat(Type.vector(3)).isNotEqualTo(Type.vector(4));
		assertThat(Type.INT).isNotEqualTo(Type.CELL_STATE);
	}

	@Test
	@DisplayName("Only types narrower than 64 bits fit in a return value")
	void fitsInReturnValue_shouldLeaveRoomForErrorFlag()
	{
		assertThat(Type.INT.fitsInReturnValue()).isTrue();
		assertThat(Type.CELL_STATE.fitsInReturnValue()).isTrue();
		assertThat(Type.vector(1).fitsInReturnValue()).isTrue();
		assertThat(Type.vector(2).fitsInReturnValue()).isFalse();
	}

	@Test
	void vector_shouldRejectInvalidLengths()
	{
		assertThatThrownBy(() -> Type.vector(0)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Type.vector(Type.MAX_VECTOR_LEN + 1)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void names_shouldBeSourceSyntax()
	{
		assertThat(Type.INT.getName()).isEqualTo("int");
		assertThat(Type.CELL_STATE.getName()).isEqualTo("cell");
		assertThat(Type.vector(5).toString()).isEqualTo("vec[5]");
	}

	@Test
	@DisplayName("Default values are zero of the matching type")
	void defaultFor_shouldReturnZeroValues()
	{
		assertThat(ConstValue.defaultFor(Type.INT)).isEqualTo(new ConstValue.Int(0));
		assertThat(ConstValue.defaultFor(Type.CELL_STATE)).isEqualTo(new ConstValue.CellState(0));
		assertThat(ConstValue.defaultFor(Type.vector(3))).isEqualTo(new ConstValue.Vector(List.of(0, 0, 0)));
		assertThat(ConstValue.defaultFor(Type.vector(3)).getType()).isEqualTo(Type.vector(3));
	}

	@Test
	void cellState_shouldRejectValuesOutsideEightBits()
	{
		assertThatThrownBy(() -> new ConstValue.CellState(256)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ConstValue.CellState(-1)).isInstanceOf(IllegalArgumentException.class);
		assertThat(new ConstValue.CellState(255).toString()).isEqualTo("#255");
	}
}
