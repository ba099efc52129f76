package common;

import java.io.Serializable;
import java.util.Arrays;

public class MLDenseVector implements Serializable {

	private static final long serialVersionUID = -3371502985663381049L;
	private float[] values;

	public MLDenseVector(final float[] valuesP) {
		this.values = valuesP;
	}

	public int getLength() {
		return this.values.length;
	}

	public float getValue(final int index) {
		return this.values[index];
	}

	public float[] getValues() {
		return this.values;
	}

	public MLSparseVector toSparse() {
		return MLSparseVector.fromDense(this);
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj instanceof MLDenseVector == false) {
			return false;
		}
		return Arrays.equals(this.values, ((MLDenseVector) obj).values);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(this.values);
	}

}
