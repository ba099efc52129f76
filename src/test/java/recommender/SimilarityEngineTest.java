package recommender;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;

import common.MLDenseMatrix;
import common.MLDenseVector;
import common.MLSparseVector;

class SimilarityEngineTest {

	private static final float DELTA = 1e-5f;

	@Test
	void selfSimilarityIsOne() {
		MLSparseVector vector = new MLSparseVector(new int[] { 0, 3 },
				new float[] { 2f, 7f }, 5);

		assertEquals(1f, SimilarityEngine.cosine(vector, vector), DELTA);
	}

	@Test
	void zeroVectorSimilarityIsZero() {
		MLSparseVector zero = new MLSparseVector(null, null, 5);
		MLSparseVector vector = new MLSparseVector(new int[] { 1 },
				new float[] { 1f }, 5);

		assertEquals(0f, SimilarityEngine.cosine(zero, vector));
		assertEquals(0f, SimilarityEngine.cosine(zero, zero));
	}

	@Test
	void artistSimilarity() {
		SimilarityEngine engine = new SimilarityEngine(
				TestMatrices.createTwins());
		MLDenseMatrix similarity = engine.getArtistSimilarity();

		assertEquals(4, similarity.getNRows());
		assertEquals(4, similarity.getNCols());
		for (int i = 0; i < 4; i++) {
			assertEquals(1f, similarity.getValue(i, i), DELTA);
			for (int j = 0; j < 4; j++) {
				assertEquals(similarity.getValue(i, j),
						similarity.getValue(j, i), DELTA);
			}
		}
		assertEquals(1f, similarity.getValue(0, 1), DELTA);
		assertEquals(1f / Math.sqrt(10), similarity.getValue(0, 2), DELTA);
		assertEquals(1f / Math.sqrt(2), similarity.getValue(2, 3), DELTA);
		assertEquals(0f, similarity.getValue(0, 3));
	}

	@Test
	void unratedArtistHasNoSimilarity() {
		InteractionMatrix matrix = TestMatrices.create(
				new String[] { "u1", "u2" }, new String[] { "a", "b", "c" },
				new float[][] { { 1f, 0f, 0f }, { 1f, 1f, 0f } });
		MLDenseMatrix similarity = new SimilarityEngine(matrix)
				.getArtistSimilarity();

		for (int i = 0; i < 3; i++) {
			assertEquals(0f, similarity.getValue(2, i));
			assertEquals(0f, similarity.getValue(i, 2));
			assertFalse(Float.isNaN(similarity.getValue(i, 2)));
		}
	}

	@Test
	void userSimilarity() {
		SimilarityEngine engine = new SimilarityEngine(
				TestMatrices.createTwins());
		MLSparseVector query = new MLSparseVector(new int[] { 2 },
				new float[] { 1f }, 4);
		MLDenseVector similarity = engine.userSimilarity(query);

		assertEquals(3, similarity.getLength());
		assertEquals(1f / Math.sqrt(3), similarity.getValue(0), DELTA);
		assertEquals(0f, similarity.getValue(1), DELTA);
		assertEquals(1f / Math.sqrt(2), similarity.getValue(2), DELTA);

		MLDenseVector zero = engine
				.userSimilarity(new MLSparseVector(null, null, 4));
		for (float value : zero.getValues()) {
			assertEquals(0f, value);
		}
	}

}
