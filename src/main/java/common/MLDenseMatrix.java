package common;

import java.io.Serializable;
import java.util.Arrays;

public class MLDenseMatrix implements Serializable {

	private static final long serialVersionUID = 7205377913518024815L;
	private MLDenseVector[] rows;
	private int nCols;

	public MLDenseMatrix(final MLDenseVector[] rowsP, final int nColsP) {
		this.rows = rowsP;
		this.nCols = nColsP;
	}

	public int getNCols() {
		return this.nCols;
	}

	public int getNRows() {
		return this.rows.length;
	}

	public MLDenseVector getRow(final int rowIndex) {
		return this.rows[rowIndex];
	}

	public float getValue(final int rowIndex, final int colIndex) {
		return this.rows[rowIndex].getValue(colIndex);
	}

	public double[] sumRows(final int[] rowIndexes) {
		// repeated indexes are summed repeatedly
		double[] sum = new double[this.nCols];
		for (int rowIndex : rowIndexes) {
			float[] values = this.rows[rowIndex].getValues();
			for (int i = 0; i < this.nCols; i++) {
				sum[i] += values[i];
			}
		}
		return sum;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj instanceof MLDenseMatrix == false) {
			return false;
		}
		MLDenseMatrix other = (MLDenseMatrix) obj;
		return this.nCols == other.nCols
				&& Arrays.equals(this.rows, other.rows);
	}

	@Override
	public int hashCode() {
		return 31 * this.nCols + Arrays.hashCode(this.rows);
	}

}
