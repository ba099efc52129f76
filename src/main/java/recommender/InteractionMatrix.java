package recommender;

import java.io.Serializable;

import common.MLSparseMatrix;

/**
 * User x artist rating matrix. A rating is the number of distinct playlists
 * in which the user has the artist. Rows follow the user index and columns
 * the artist index; both indexes are part of the matrix so scores can only
 * be mapped back to names through the encoding that produced them.
 */
public class InteractionMatrix implements Serializable {

	private static final long serialVersionUID = -2645893063309567041L;

	private final String buildId;
	private final MLSparseMatrix ratings;
	private final CategoricalIndex userIndex;
	private final CategoricalIndex artistIndex;

	public InteractionMatrix(final String buildIdP,
			final MLSparseMatrix ratingsP, final CategoricalIndex userIndexP,
			final CategoricalIndex artistIndexP) {
		if (ratingsP.getNRows() != userIndexP.size()) {
			throw new IllegalArgumentException("ratings rows "
					+ ratingsP.getNRows() + " != users " + userIndexP.size());
		}
		if (ratingsP.getNCols() != artistIndexP.size()) {
			throw new IllegalArgumentException("ratings cols "
					+ ratingsP.getNCols() + " != artists "
					+ artistIndexP.size());
		}
		this.buildId = buildIdP;
		this.ratings = ratingsP;
		this.userIndex = userIndexP;
		this.artistIndex = artistIndexP;
	}

	public CategoricalIndex getArtistIndex() {
		return this.artistIndex;
	}

	public String getBuildId() {
		return this.buildId;
	}

	public int getNArtists() {
		return this.artistIndex.size();
	}

	public int getNUsers() {
		return this.userIndex.size();
	}

	/**
	 * The matrix itself, not a copy. Its rows are read concurrently by every
	 * engine built on it and must not be modified.
	 */
	public MLSparseMatrix getRatings() {
		return this.ratings;
	}

	public CategoricalIndex getUserIndex() {
		return this.userIndex;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj instanceof InteractionMatrix == false) {
			return false;
		}
		InteractionMatrix other = (InteractionMatrix) obj;
		return this.buildId.equals(other.buildId)
				&& this.userIndex.equals(other.userIndex)
				&& this.artistIndex.equals(other.artistIndex)
				&& this.ratings.equals(other.ratings);
	}

	@Override
	public int hashCode() {
		return 31 * this.buildId.hashCode() + this.artistIndex.hashCode();
	}

}
