package recommender;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

class RecommendationEngineTest {

	private static InteractionMatrix createPopularity() {
		return TestMatrices.create(new String[] { "u1", "u2", "u3" },
				new String[] { "a", "b", "c", "d" },
				new float[][] { { 2f, 1f, 0f, 0f }, { 1f, 0f, 1f, 0f },
						{ 1f, 0f, 0f, 3f } });
	}

	@Test
	void popularArtistFirst() {
		RecommendationEngine engine = new RecommendationEngine(
				createPopularity());

		// b and c tie, the higher index goes first
		assertEquals(Arrays.asList("a", "d", "c", "b"),
				engine.getPopularArtistRecommendations());
		assertArrayEquals(new int[] { 0, 3, 2, 1 }, engine.getPopularArtists());
	}

	@Test
	void popularityIsStableAndBounded() {
		RecommenderParams params = new RecommenderParams();
		params.nRecommendations = 2;
		RecommendationEngine engine = new RecommendationEngine(
				createPopularity(), params);

		List<String> first = engine.getPopularArtistRecommendations();
		engine.getPopularArtists()[0] = 3;
		assertEquals(Arrays.asList("a", "d"), first);
		assertEquals(first, engine.getPopularArtistRecommendations());
	}

	@Test
	void itemBasedRanksIdenticalArtistFirst() {
		RecommendationEngine engine = new RecommendationEngine(
				TestMatrices.createTwins());

		assertEquals(Arrays.asList("b", "c", "d"),
				engine.getItemBasedRecommendations(Arrays.asList("a")));
	}

	@Test
	void itemBasedCountsRepeatedSelections() {
		RecommendationEngine engine = new RecommendationEngine(
				TestMatrices.createTwins());

		// a and b tie, the lower index goes first
		assertEquals(Arrays.asList("d", "a", "b"),
				engine.getItemBasedRecommendations(Arrays.asList("c", "c")));
	}

	@Test
	void userBasedPrediction() {
		RecommenderParams params = new RecommenderParams();
		params.nNeighbors = 2;
		RecommendationEngine engine = new RecommendationEngine(
				TestMatrices.createTwins(), params);

		// neighbors u3 and u1, each weighted by similarity over its own total
		assertEquals(Arrays.asList("d", "b", "a"),
				engine.getUserBasedRecommendations(Arrays.asList("c")));
	}

	@Test
	void selectedArtistsAreNeverRecommended() {
		RecommendationEngine engine = new RecommendationEngine(
				TestMatrices.createTwins());
		List<String> selected = Arrays.asList("a", "c");

		List<String> itemBased = engine.getItemBasedRecommendations(selected);
		List<String> userBased = engine.getUserBasedRecommendations(selected);

		assertEquals(Arrays.asList("b", "d"), itemBased);
		assertEquals(2, userBased.size());
		for (String artist : selected) {
			assertFalse(itemBased.contains(artist));
			assertFalse(userBased.contains(artist));
		}
	}

	@Test
	void unknownArtistRejectsRequest() {
		RecommendationEngine engine = new RecommendationEngine(
				TestMatrices.createTwins());

		UnknownArtistException e = assertThrows(UnknownArtistException.class,
				() -> engine.getItemBasedRecommendations(
						Arrays.asList("a", "zzz")));
		assertEquals("zzz", e.getArtistName());

		assertThrows(UnknownArtistException.class,
				() -> engine.getUserBasedRecommendations(
						Arrays.asList("zzz")));
		assertThrows(UnknownArtistException.class,
				() -> engine.getItemBasedRecommendations(
						Arrays.asList("a", null)));
	}

	@Test
	void emptySelectionGivesEmptyList() {
		RecommendationEngine engine = new RecommendationEngine(
				TestMatrices.createTwins());

		assertTrue(engine.getItemBasedRecommendations(Collections.emptyList())
				.isEmpty());
		assertTrue(engine.getUserBasedRecommendations(Collections.emptyList())
				.isEmpty());
		assertTrue(engine.getItemBasedRecommendations(null).isEmpty());
		assertTrue(engine.getUserBasedRecommendations(null).isEmpty());
	}

	@Test
	void engineDoesNotHandOutItsMatrix() {
		for (Method method : RecommendationEngine.class
				.getMethods()) {
			assertFalse(
					InteractionMatrix.class
							.isAssignableFrom(method.getReturnType()),
					method.getName());
		}
	}

}
