package common;

import java.io.Serializable;

public interface MLSparseMatrix extends Serializable {

	public abstract MLDenseVector getColSum();

	public abstract MLDenseVector getColNorm(final int p);

	public abstract int getNCols();

	public abstract long getNNZ();

	public abstract int getNRows();

	/**
	 * @return the stored row, or null if it is empty; not a copy
	 */
	public abstract MLSparseVector getRow(final int rowIndex);

	public abstract MLSparseVector getRow(final int rowIndex,
			final boolean returnEmpty);

	public abstract MLDenseVector getRowNorm(final int p);

	public abstract MLSparseMatrix mult(final MLSparseMatrix another);

	public abstract MLDenseVector multRow(final MLSparseVector vector);

	public abstract MLSparseMatrix transpose();

}
