package recommender;

import java.util.stream.IntStream;

import common.MLDenseMatrix;
import common.MLDenseVector;
import common.MLSparseMatrix;
import common.MLSparseVector;
import common.MLTimer;

/**
 * Cosine similarities over the rating matrix. Vectors with zero norm have
 * similarity 0 with everything, themselves included.
 */
public class SimilarityEngine {

	private final MLSparseMatrix ratings;
	private final MLDenseVector userNorms;
	private final MLDenseMatrix artistSimilarity;

	public SimilarityEngine(final InteractionMatrix matrix) {
		MLTimer timer = new MLTimer("similarity");
		timer.tic();

		this.ratings = matrix.getRatings();
		this.userNorms = this.ratings.getRowNorm(2);
		this.artistSimilarity = computeArtistSimilarity(this.ratings);

		timer.toc(String.format("artist similarity [%d x %d]",
				this.artistSimilarity.getNRows(),
				this.artistSimilarity.getNCols()));
	}

	/**
	 * Shared with every request, callers must not modify it.
	 */
	public MLDenseMatrix getArtistSimilarity() {
		return this.artistSimilarity;
	}

	/**
	 * @param query
	 *            ratings over all artists
	 * @return similarity of the query with every user row
	 */
	public MLDenseVector userSimilarity(final MLSparseVector query) {
		float queryNorm = query.getNorm(2);
		MLDenseVector dots = this.ratings.multRow(query);

		float[] similarity = new float[this.ratings.getNRows()];
		for (int i = 0; i < similarity.length; i++) {
			similarity[i] = cosine(dots.getValue(i), queryNorm,
					this.userNorms.getValue(i));
		}
		return new MLDenseVector(similarity);
	}

	public static float cosine(final MLSparseVector v1, final MLSparseVector v2) {
		return cosine(v1.multiply(v2), v1.getNorm(2), v2.getNorm(2));
	}

	private static float cosine(final float dot, final float norm1,
			final float norm2) {
		if (norm1 == 0 || norm2 == 0) {
			return 0f;
		}
		return dot / (norm1 * norm2);
	}

	private static MLDenseMatrix computeArtistSimilarity(
			final MLSparseMatrix ratings) {
		final int nArtists = ratings.getNCols();

		// artist x artist dot products
		MLSparseMatrix gram = ratings.transpose().mult(ratings);
		MLDenseVector artistNorms = ratings.getColNorm(2);

		MLDenseVector[] rows = new MLDenseVector[nArtists];
		IntStream.range(0, nArtists).parallel().forEach(i -> {
			float[] row = new float[nArtists];
			MLSparseVector dots = gram.getRow(i);
			if (dots != null) {
				int[] indexes = dots.getIndexes();
				float[] values = dots.getValues();
				for (int j = 0; j < indexes.length; j++) {
					row[indexes[j]] = cosine(values[j], artistNorms.getValue(i),
							artistNorms.getValue(indexes[j]));
				}
			}
			rows[i] = new MLDenseVector(row);
		});
		return new MLDenseMatrix(rows, nArtists);
	}

}
