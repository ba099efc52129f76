package recommender;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Interactions surviving deduplication, spelling canonicalization and the
 * artist/user filters, in their input order.
 */
public class FilteredDataset implements Serializable {

	private static final long serialVersionUID = 3081957464312609587L;

	private final String buildId;
	private final Interaction[] rows;

	public FilteredDataset(final String buildIdP, final List<Interaction> rowsP) {
		this.buildId = buildIdP;
		this.rows = rowsP.toArray(new Interaction[0]);
	}

	public String getBuildId() {
		return this.buildId;
	}

	public Interaction getRow(final int index) {
		return this.rows[index];
	}

	public List<Interaction> getRows() {
		return Collections.unmodifiableList(Arrays.asList(this.rows));
	}

	public int size() {
		return this.rows.length;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj instanceof FilteredDataset == false) {
			return false;
		}
		FilteredDataset other = (FilteredDataset) obj;
		return this.buildId.equals(other.buildId)
				&& Arrays.equals(this.rows, other.rows);
	}

	@Override
	public int hashCode() {
		return 31 * this.buildId.hashCode() + Arrays.hashCode(this.rows);
	}

}
