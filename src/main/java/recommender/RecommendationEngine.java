package recommender;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import common.FloatElement;
import common.MLDenseVector;
import common.MLSparseMatrix;

/**
 * Popularity, item-based and user-based artist recommendations over one
 * build. State is fixed at construction so one engine can serve concurrent
 * requests.
 */
public class RecommendationEngine {

	private final InteractionMatrix matrix;
	private final SimilarityEngine similarity;
	private final int nRecommendations;
	private final int nNeighbors;
	private final int[] popularArtists;

	public RecommendationEngine(final InteractionMatrix matrixP) {
		this(matrixP, new RecommenderParams());
	}

	public RecommendationEngine(final InteractionMatrix matrixP,
			final RecommenderParams params) {
		this.matrix = matrixP;
		this.similarity = new SimilarityEngine(matrixP);
		this.nRecommendations = params.nRecommendations;
		this.nNeighbors = params.nNeighbors;

		// ties go to the higher index, as a reversed ascending sort does
		MLDenseVector popularity = matrixP.getRatings().getColSum();
		this.popularArtists = FloatElement.getIndexes(
				FloatElement.sort(popularity.getValues(), false));
	}

	/**
	 * @return all artist indexes, most played first
	 */
	public int[] getPopularArtists() {
		return this.popularArtists.clone();
	}

	/**
	 * Recommendations for a user without history, so nothing is excluded.
	 */
	public List<String> getPopularArtistRecommendations() {
		int n = Math.min(this.nRecommendations, this.popularArtists.length);
		List<String> recommended = new ArrayList<String>(n);
		for (int i = 0; i < n; i++) {
			recommended.add(this.matrix.getArtistIndex()
					.getCategory(this.popularArtists[i]));
		}
		return recommended;
	}

	/**
	 * Scores every artist by its summed similarity to the selected artists.
	 * An artist selected twice counts twice.
	 *
	 * @throws UnknownArtistException
	 *             if a selected artist is not in the index
	 */
	public List<String> getItemBasedRecommendations(
			final List<String> selectedArtists) {
		if (selectedArtists == null || selectedArtists.isEmpty() == true) {
			return Collections.emptyList();
		}
		int[] selected = this.lookupArtists(selectedArtists);

		double[] scores = this.similarity.getArtistSimilarity()
				.sumRows(selected);

		// ties keep ascending index order
		FloatElement[] top = FloatElement.topNSort(scores,
				this.nRecommendations, toSet(selected), true);
		return this.toNames(top);
	}

	/**
	 * Predicts a rating per artist from the nearest users of a synthetic user
	 * holding the selected artists. Each neighbor contributes its mean-centered
	 * ratings weighted by its similarity and divided by its own rating total.
	 *
	 * @throws UnknownArtistException
	 *             if a selected artist is not in the index
	 */
	public List<String> getUserBasedRecommendations(
			final List<String> selectedArtists) {
		if (selectedArtists == null || selectedArtists.isEmpty() == true) {
			return Collections.emptyList();
		}
		int[] selected = this.lookupArtists(selectedArtists);
		final int nArtists = this.matrix.getNArtists();

		float[] userRatings = new float[nArtists];
		for (int artistIdx : selected) {
			userRatings[artistIdx] += 1;
		}
		MLDenseVector query = new MLDenseVector(userRatings);
		double averageRating = (double) selected.length / nArtists;

		MLDenseVector userSimilarity = this.similarity
				.userSimilarity(query.toSparse());
		FloatElement[] neighbors = FloatElement.topNSort(
				userSimilarity.getValues(), this.nNeighbors, null, false);

		double[] predicted = this.predictRatings(neighbors, nArtists);
		for (int i = 0; i < nArtists; i++) {
			predicted[i] += averageRating;
		}

		FloatElement[] top = FloatElement.topNSort(predicted,
				this.nRecommendations, toSet(selected), false);
		return this.toNames(top);
	}

	private int[] lookupArtists(final List<String> artistNames) {
		// resolve everything before scoring so a bad name rejects the request
		int[] indexes = new int[artistNames.size()];
		for (int i = 0; i < indexes.length; i++) {
			String artistName = artistNames.get(i);
			Integer index = artistName == null ? null
					: this.matrix.getArtistIndex().getIndex(artistName);
			if (index == null) {
				throw new UnknownArtistException(artistName);
			}
			indexes[i] = index;
		}
		return indexes;
	}

	private double[] predictRatings(final FloatElement[] neighbors,
			final int nArtists) {
		MLSparseMatrix ratings = this.matrix.getRatings();

		float[][] neighborRatings = new float[neighbors.length][];
		double[] meanRating = new double[nArtists];
		for (int n = 0; n < neighbors.length; n++) {
			neighborRatings[n] = ratings
					.getRow(neighbors[n].getIndex(), true).toDense()
					.getValues();
			for (int i = 0; i < nArtists; i++) {
				meanRating[i] += neighborRatings[n][i];
			}
		}
		for (int i = 0; i < nArtists; i++) {
			meanRating[i] /= neighbors.length;
		}

		double[] predicted = new double[nArtists];
		for (int n = 0; n < neighbors.length; n++) {
			double neighborTotal = ratings
					.getRow(neighbors[n].getIndex(), true).sum();
			if (neighborTotal == 0) {
				// users without ratings are never built into the matrix
				continue;
			}

			double weight = neighbors[n].getValue();
			for (int i = 0; i < nArtists; i++) {
				predicted[i] += (neighborRatings[n][i] - meanRating[i]) * weight
						/ neighborTotal;
			}
		}
		return predicted;
	}

	private List<String> toNames(final FloatElement[] ranked) {
		List<String> names = new ArrayList<String>(ranked.length);
		for (FloatElement element : ranked) {
			names.add(this.matrix.getArtistIndex()
					.getCategory(element.getIndex()));
		}
		return names;
	}

	private static Set<Integer> toSet(final int[] indexes) {
		Set<Integer> set = new HashSet<Integer>(indexes.length);
		for (int index : indexes) {
			set.add(index);
		}
		return set;
	}

}
