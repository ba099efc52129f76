package recommender;

import java.io.Serializable;
import java.util.List;
import java.util.TreeSet;

import com.google.common.collect.ImmutableBiMap;

/**
 * Immutable two-way mapping between category names and dense indexes
 * 0..size-1. Indexes follow the ascending order of the names.
 */
public class CategoricalIndex implements Serializable {

	private static final long serialVersionUID = 8817066335946014210L;

	private final ImmutableBiMap<String, Integer> catToIndex;

	private CategoricalIndex(final ImmutableBiMap<String, Integer> catToIndexP) {
		this.catToIndex = catToIndexP;
	}

	public boolean contains(final String cat) {
		return this.catToIndex.containsKey(cat);
	}

	public List<String> getCategories() {
		return this.catToIndex.keySet().asList();
	}

	public String getCategory(final int index) {
		String cat = this.catToIndex.inverse().get(index);
		if (cat == null) {
			throw new IndexOutOfBoundsException(
					"index " + index + " size " + this.size());
		}
		return cat;
	}

	/**
	 * @return index of the category or null when it is not indexed
	 */
	public Integer getIndex(final String cat) {
		return this.catToIndex.get(cat);
	}

	public int size() {
		return this.catToIndex.size();
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj instanceof CategoricalIndex == false) {
			return false;
		}
		return this.getCategories()
				.equals(((CategoricalIndex) obj).getCategories());
	}

	@Override
	public int hashCode() {
		return this.getCategories().hashCode();
	}

	public static CategoricalIndex fromValues(final Iterable<String> values) {
		TreeSet<String> sorted = new TreeSet<String>();
		for (String value : values) {
			if (value == null) {
				throw new IllegalArgumentException("null category");
			}
			sorted.add(value);
		}

		ImmutableBiMap.Builder<String, Integer> builder = ImmutableBiMap
				.builder();
		int index = 0;
		for (String value : sorted) {
			builder.put(value, index);
			index++;
		}
		return new CategoricalIndex(builder.build());
	}

}
