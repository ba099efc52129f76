package common;

import java.util.Arrays;
import java.util.stream.IntStream;

import com.google.common.util.concurrent.AtomicDoubleArray;

/**
 * Sparse matrix stored as an array of sparse rows; empty rows are kept as
 * null.
 */
public class MLSparseMatrixAOO implements MLSparseMatrix {

	private static final long serialVersionUID = -1630725488310962411L;
	private MLSparseVector[] rows;
	private int nCols;

	public MLSparseMatrixAOO(final MLSparseVector[] rowsP, final int nColsP) {
		this.rows = rowsP;
		this.nCols = nColsP;
	}

	@Override
	public MLDenseVector getColNorm(final int p) {
		// compute L^p norm
		final int nCol = this.getNCols();
		AtomicDoubleArray colNorm = new AtomicDoubleArray(nCol);
		IntStream.range(0, this.getNRows()).parallel().forEach(rowIndex -> {
			MLSparseVector row = this.rows[rowIndex];
			if (row == null) {
				return;
			}

			float[] values = row.getValues();
			int[] indexes = row.getIndexes();
			for (int i = 0; i < values.length; i++) {
				if (p == 1) {
					colNorm.addAndGet(indexes[i], Math.abs(values[i]));
				} else {
					colNorm.addAndGet(indexes[i], Math.pow(values[i], p));
				}
			}
		});

		float[] result = new float[nCol];
		for (int i = 0; i < nCol; i++) {
			if (p == 1) {
				result[i] = (float) colNorm.get(i);
			} else {
				// take p'th root
				result[i] = (float) Math.pow(colNorm.get(i), 1.0 / p);
			}
		}
		return new MLDenseVector(result);
	}

	@Override
	public MLDenseVector getColSum() {
		AtomicDoubleArray colSum = new AtomicDoubleArray(this.getNCols());
		IntStream.range(0, this.getNRows()).parallel().forEach(rowIndex -> {
			MLSparseVector row = this.rows[rowIndex];
			if (row == null) {
				return;
			}
			int[] indexes = row.getIndexes();
			float[] values = row.getValues();
			for (int i = 0; i < indexes.length; i++) {
				colSum.addAndGet(indexes[i], values[i]);
			}
		});

		float[] result = new float[this.getNCols()];
		for (int i = 0; i < result.length; i++) {
			result[i] = (float) colSum.get(i);
		}
		return new MLDenseVector(result);
	}

	@Override
	public int getNCols() {
		return this.nCols;
	}

	@Override
	public long getNNZ() {
		long nnz = 0;
		for (MLSparseVector row : this.rows) {
			if (row == null) {
				continue;
			}
			nnz += row.getNNZ();
		}

		return nnz;
	}

	@Override
	public int getNRows() {
		return this.rows.length;
	}

	@Override
	public MLSparseVector getRow(final int rowIndex) {
		return this.rows[rowIndex];
	}

	@Override
	public MLSparseVector getRow(final int rowIndex, boolean returnEmpty) {
		MLSparseVector row = this.getRow(rowIndex);
		if (row == null && returnEmpty == true) {
			// return empty row instead of null
			row = new MLSparseVector(new int[] {}, new float[] {},
					this.getNCols());
		}
		return row;
	}

	@Override
	public MLDenseVector getRowNorm(final int p) {
		final float[] rowNorm = new float[this.getNRows()];
		IntStream.range(0, this.getNRows()).parallel().forEach(rowIndex -> {
			MLSparseVector row = this.rows[rowIndex];
			if (row == null) {
				return;
			}
			rowNorm[rowIndex] = row.getNorm(p);
		});
		return new MLDenseVector(rowNorm);
	}

	@Override
	public MLSparseMatrix mult(final MLSparseMatrix another) {
		if (this.getNCols() != another.getNRows()) {
			throw new IllegalArgumentException(
					"this.getNCols() != another.getNRows()");
		}
		MLSparseVector[] resultRows = new MLSparseVector[this.getNRows()];
		IntStream.range(0, this.getNRows()).parallel().forEach(i -> {
			MLSparseVector row = this.rows[i];
			if (row == null) {
				return;
			}

			float[] resultRow = new float[another.getNCols()];
			int[] indexes = row.getIndexes();
			float[] values = row.getValues();
			for (int j = 0; j < indexes.length; j++) {
				int index = indexes[j];
				float value = values[j];

				MLSparseVector rowAnother = another.getRow(index);
				if (rowAnother == null) {
					continue;
				}

				int[] indexesAnother = rowAnother.getIndexes();
				float[] valuesAnother = rowAnother.getValues();
				for (int k = 0; k < indexesAnother.length; k++) {
					resultRow[indexesAnother[k]] += value * valuesAnother[k];
				}
			}
			MLSparseVector resultRowSparse = MLSparseVector
					.fromDense(new MLDenseVector(resultRow));
			if (resultRowSparse.isEmpty() == false) {
				resultRows[i] = resultRowSparse;
			}
		});

		return new MLSparseMatrixAOO(resultRows, another.getNCols());
	}

	@Override
	public MLDenseVector multRow(final MLSparseVector vector) {

		// multiply this matrix with nCols x 1 sparse vector
		if (this.getNCols() != vector.getLength()) {
			throw new IllegalArgumentException(
					"this.getNCols() != vector.getLength()");
		}

		float[] result = new float[this.getNRows()];
		IntStream.range(0, this.getNRows()).parallel().forEach(i -> {
			MLSparseVector row = this.rows[i];
			if (row == null) {
				return;
			}
			result[i] = row.multiply(vector);
		});

		return new MLDenseVector(result);
	}

	@Override
	public MLSparseMatrix transpose() {
		final int nRowsT = this.nCols;
		final int nColsT = this.getNRows();

		// count nnz in each transposed row
		int[] rowNNZT = new int[nRowsT];
		for (MLSparseVector row : this.rows) {
			if (row == null) {
				continue;
			}
			for (int index : row.getIndexes()) {
				rowNNZT[index]++;
			}
		}

		int[][] indexesT = new int[nRowsT][];
		float[][] valuesT = new float[nRowsT][];
		for (int i = 0; i < nRowsT; i++) {
			indexesT[i] = new int[rowNNZT[i]];
			valuesT[i] = new float[rowNNZT[i]];
		}

		// rows are visited in order so transposed indexes come out sorted
		int[] cur = new int[nRowsT];
		for (int rowIndex = 0; rowIndex < this.rows.length; rowIndex++) {
			MLSparseVector row = this.rows[rowIndex];
			if (row == null) {
				continue;
			}
			int[] indexes = row.getIndexes();
			float[] values = row.getValues();
			for (int j = 0; j < indexes.length; j++) {
				int colIndex = indexes[j];
				indexesT[colIndex][cur[colIndex]] = rowIndex;
				valuesT[colIndex][cur[colIndex]] = values[j];
				cur[colIndex]++;
			}
		}

		MLSparseVector[] rowsT = new MLSparseVector[nRowsT];
		for (int i = 0; i < nRowsT; i++) {
			if (rowNNZT[i] > 0) {
				rowsT[i] = new MLSparseVector(indexesT[i], valuesT[i], nColsT);
			}
		}
		return new MLSparseMatrixAOO(rowsT, nColsT);
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj instanceof MLSparseMatrixAOO == false) {
			return false;
		}
		MLSparseMatrixAOO other = (MLSparseMatrixAOO) obj;
		return this.nCols == other.nCols
				&& Arrays.equals(this.rows, other.rows);
	}

	@Override
	public int hashCode() {
		return 31 * this.nCols + Arrays.hashCode(this.rows);
	}
}
