package common;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.Set;

public class FloatElement implements Serializable {

	public static class ValueComparator implements Comparator<FloatElement> {

		private boolean decreasing;
		private boolean lowerIndexFirst;

		public ValueComparator(final boolean decreasingP,
				final boolean lowerIndexFirstP) {
			this.decreasing = decreasingP;
			this.lowerIndexFirst = lowerIndexFirstP;
		}

		@Override
		public int compare(final FloatElement e1, final FloatElement e2) {
			int result;
			if (this.decreasing == true) {
				result = Float.compare(e2.value, e1.value);
			} else {
				result = Float.compare(e1.value, e2.value);
			}
			if (result != 0) {
				return result;
			}

			// equal values are ordered by index
			if (this.lowerIndexFirst == true) {
				return Integer.compare(e1.index, e2.index);
			} else {
				return Integer.compare(e2.index, e1.index);
			}
		}
	}

	private static final long serialVersionUID = -2062148841870411378L;
	private int index;
	private float value;

	public FloatElement(final int indexP, final float valueP) {
		this.index = indexP;
		this.value = valueP;
	}

	public int getIndex() {
		return this.index;
	}

	public float getValue() {
		return this.value;
	}

	@Override
	public String toString() {
		return this.index + ":" + this.value;
	}

	public static int[] getIndexes(final FloatElement[] elements) {
		int[] indexes = new int[elements.length];
		for (int i = 0; i < elements.length; i++) {
			indexes[i] = elements[i].index;
		}
		return indexes;
	}

	public static FloatElement[] sort(final float[] vec,
			final boolean lowerIndexFirst) {
		FloatElement[] elements = new FloatElement[vec.length];
		for (int i = 0; i < vec.length; i++) {
			elements[i] = new FloatElement(i, vec[i]);
		}
		Arrays.sort(elements,
				new FloatElement.ValueComparator(true, lowerIndexFirst));
		return elements;
	}

	public static FloatElement[] topNSort(final float[] vec, final int topN,
			final Set<Integer> exclusions, final boolean lowerIndexFirst) {
		if (topN <= 0) {
			return new FloatElement[0];
		}

		// heap head is the element that ranks last
		final Comparator<FloatElement> rankOrder = new FloatElement.ValueComparator(
				true, lowerIndexFirst);
		PriorityQueue<FloatElement> heap = new PriorityQueue<FloatElement>(
				topN, rankOrder.reversed());

		for (int i = 0; i < vec.length; i++) {
			if (exclusions != null && exclusions.contains(i) == true) {
				continue;
			}
			FloatElement element = new FloatElement(i, vec[i]);
			if (heap.size() < topN) {
				heap.add(element);

			} else if (rankOrder.compare(element, heap.peek()) < 0) {
				heap.poll();
				heap.add(element);
			}
		}

		FloatElement[] heapArray = new FloatElement[heap.size()];
		heap.toArray(heapArray);
		Arrays.sort(heapArray, rankOrder);

		return heapArray;
	}

	/**
	 * Top N of double scores. Ranking compares the double values; the returned
	 * elements carry them rounded to float.
	 */
	public static FloatElement[] topNSort(final double[] vec, final int topN,
			final Set<Integer> exclusions, final boolean lowerIndexFirst) {
		if (topN <= 0) {
			return new FloatElement[0];
		}

		final Comparator<Integer> rankOrder = (i1, i2) -> {
			int result = Double.compare(vec[i2], vec[i1]);
			if (result != 0) {
				return result;
			}
			if (lowerIndexFirst == true) {
				return Integer.compare(i1, i2);
			} else {
				return Integer.compare(i2, i1);
			}
		};
		PriorityQueue<Integer> heap = new PriorityQueue<Integer>(topN,
				rankOrder.reversed());

		for (int i = 0; i < vec.length; i++) {
			if (exclusions != null && exclusions.contains(i) == true) {
				continue;
			}
			if (heap.size() < topN) {
				heap.add(i);

			} else if (rankOrder.compare(i, heap.peek()) < 0) {
				heap.poll();
				heap.add(i);
			}
		}

		Integer[] heapArray = heap.toArray(new Integer[0]);
		Arrays.sort(heapArray, rankOrder);

		FloatElement[] elements = new FloatElement[heapArray.length];
		for (int i = 0; i < heapArray.length; i++) {
			elements[i] = new FloatElement(heapArray[i],
					(float) vec[heapArray[i]]);
		}
		return elements;
	}

}
