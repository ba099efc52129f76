package recommender;

import java.util.Arrays;
import java.util.List;

import common.MLTimer;

public class Executor {

	private static void printRecommendations(final String title,
			final List<String> artists) {
		if (artists.isEmpty() == true) {
			System.out.printf("[WARNING] no %s recommendations available\n",
					title);
			return;
		}
		System.out.printf("%s:\n", title);
		for (int i = 0; i < artists.size(); i++) {
			System.out.printf("  %2d. %s\n", i + 1, artists.get(i));
		}
	}

	/**
	 * Usage: {@code Executor [params.json] [track display name ...]}. Without a
	 * params file the bundled defaults are used.
	 */
	public static void main(final String[] args) {
		try {
			MLTimer timer = new MLTimer("main");
			timer.tic();

			RecommenderParams params;
			if (args.length > 0) {
				params = RecommenderParams.fromFile(args[0]);
			} else {
				params = RecommenderParams
						.fromResource(RecommenderParams.DEFAULT_RESOURCE);
			}
			System.out.println(params);

			ArtifactStore store = new ArtifactStore(params);
			Artifacts artifacts = store.load();
			timer.toc("artifacts loaded");

			RecommendationEngine engine = new RecommendationEngine(
					artifacts.getMatrix(), params);
			timer.toc("engine ready");

			List<String> selectedTracks = Arrays.asList(args)
					.subList(Math.min(1, args.length), args.length);
			List<String> selectedArtists = artifacts.getTracklist()
					.getArtistNames(selectedTracks);
			System.out.printf("selected tracks[%d] artists%s\n",
					selectedTracks.size(), selectedArtists);

			printRecommendations("most popular artists (new users)",
					engine.getPopularArtistRecommendations());
			printRecommendations("based on your artists",
					engine.getItemBasedRecommendations(selectedArtists));
			printRecommendations("similar users also like",
					engine.getUserBasedRecommendations(selectedArtists));

		} catch (Exception e) {
			e.printStackTrace();
			System.exit(1);
		}
	}
}
