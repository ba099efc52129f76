package common;

import java.io.Serializable;
import java.util.Arrays;

public class MLSparseVector implements Serializable {

	private static final long serialVersionUID = 2413904585201738466L;
	private int[] indexes;
	private float[] values;
	private int length;

	public MLSparseVector(final int[] indexesP, final float[] valuesP,
			final int lengthP) {
		if (indexesP == null || valuesP == null) {
			this.indexes = new int[0];
			this.values = new float[0];
		} else {
			if (indexesP.length != valuesP.length) {
				throw new IllegalArgumentException(
						"indexes.length != values.length");
			}
			this.indexes = indexesP;
			this.values = valuesP;
		}
		this.length = lengthP;
	}

	public int[] getIndexes() {
		return this.indexes;
	}

	public int getLength() {
		return this.length;
	}

	public float getNorm(final int p) {
		float norm = 0f;
		for (int i = 0; i < this.values.length; i++) {
			if (p == 1) {
				norm += Math.abs(this.values[i]);
			} else {
				norm += Math.pow(this.values[i], p);
			}
		}
		if (p != 1) {
			norm = (float) Math.pow(norm, 1.0 / p);
		}

		return norm;
	}

	public int getNNZ() {
		return this.indexes.length;
	}

	public float getValue(final int index) {
		// indexes are sorted
		int pos = Arrays.binarySearch(this.indexes, index);
		if (pos < 0) {
			return 0f;
		}
		return this.values[pos];
	}

	public float[] getValues() {
		return this.values;
	}

	public boolean isEmpty() {
		return this.indexes.length == 0;
	}

	public float multiply(final MLSparseVector other) {
		if (this.length != other.length) {
			throw new IllegalArgumentException("length != length");
		}
		if (this.isEmpty() == true || other.isEmpty() == true) {
			return 0f;
		}

		int maxIndex = this.indexes[this.indexes.length - 1];
		int[] otherIndexes = other.getIndexes();
		if (otherIndexes[0] > maxIndex) {
			// no overlap in indexes
			return 0f;
		}

		float product = 0f;
		float[] otherValues = other.getValues();

		int cur = 0;
		int curOther = 0;
		while (cur < this.indexes.length && curOther < otherIndexes.length) {
			if (otherIndexes[curOther] > maxIndex) {
				// indexes are sorted so can exit here
				break;
			}

			if (this.indexes[cur] == otherIndexes[curOther]) {
				product += this.values[cur] * otherValues[curOther];
				cur++;
				curOther++;

			} else if (this.indexes[cur] > otherIndexes[curOther]) {
				curOther++;

			} else {
				cur++;
			}
		}

		return product;
	}

	public float sum() {
		float sum = 0f;
		for (float value : this.values) {
			sum += value;
		}
		return sum;
	}

	public MLDenseVector toDense() {
		float[] dense = new float[this.length];
		for (int i = 0; i < this.indexes.length; i++) {
			dense[this.indexes[i]] = this.values[i];
		}
		return new MLDenseVector(dense);
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj instanceof MLSparseVector == false) {
			return false;
		}
		MLSparseVector other = (MLSparseVector) obj;
		return this.length == other.length
				&& Arrays.equals(this.indexes, other.indexes)
				&& Arrays.equals(this.values, other.values);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * this.length + Arrays.hashCode(this.indexes))
				+ Arrays.hashCode(this.values);
	}

	public static MLSparseVector fromDense(final MLDenseVector dense) {
		float[] denseVals = dense.getValues();

		int nnz = 0;
		for (int i = 0; i < denseVals.length; i++) {
			if (denseVals[i] != 0) {
				nnz++;
			}
		}

		int[] indexes = new int[nnz];
		float[] values = new float[nnz];
		int cur = 0;
		for (int i = 0; i < denseVals.length; i++) {
			if (denseVals[i] != 0) {
				indexes[cur] = i;
				values[cur] = denseVals[i];
				cur++;
			}
		}
		return new MLSparseVector(indexes, values, denseVals.length);
	}

}
