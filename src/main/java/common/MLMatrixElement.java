package common;

import java.io.Serializable;

public class MLMatrixElement implements Serializable {

	private static final long serialVersionUID = 4459215037839121690L;
	private int rowIndex;
	private int colIndex;
	private float value;

	public MLMatrixElement(final int rowIndexP, final int colIndexP,
			final float valueP) {
		this.rowIndex = rowIndexP;
		this.colIndex = colIndexP;
		this.value = valueP;
	}

	public int getColIndex() {
		return this.colIndex;
	}

	public int getRowIndex() {
		return this.rowIndex;
	}

	public float getValue() {
		return this.value;
	}

	public void setValue(final float valueP) {
		this.value = valueP;
	}

}
