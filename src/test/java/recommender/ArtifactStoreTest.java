package recommender;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import common.MLIOUtils;

class ArtifactStoreTest {

	private static final String CSV = String.join("\n",
			"user_id,artistname,trackname,playlistname", "u1,a,t1,p1",
			"u1,b,t2,p1", "u1,c,t3,p2", "u2,a,t1,p1", "u2,b,t4,p1",
			"u3,c,t3,p1", "u3,a,t5,p2", "");

	@TempDir
	Path tempDir;

	private RecommenderParams params;

	@BeforeEach
	void setUp() throws IOException {
		Path dataFile = this.tempDir.resolve("data.csv");
		Files.write(dataFile, CSV.getBytes(StandardCharsets.UTF_8));

		this.params = new RecommenderParams();
		this.params.dataFile = dataFile.toString();
		this.params.cachePath = this.tempDir.resolve("cache").toString();
		this.params.minArtistRows = 0;
		this.params.minUserTracks = 0;
	}

	private Artifacts build() throws IOException {
		return Artifacts.build(DataLoader.load(this.params.dataFile, true),
				this.params);
	}

	private Path current() {
		return this.tempDir.resolve("cache").resolve(ArtifactStore.CURRENT_DIR);
	}

	@Test
	void persistedBuildReadsBackVerbatim() throws IOException {
		Artifacts built = this.build();
		new ArtifactStore(this.params).persist(built);

		Artifacts read1 = new ArtifactStore(this.params).read();
		Artifacts read2 = new ArtifactStore(this.params).read();

		assertEquals(built.getBuildId(), read1.getBuildId());
		assertEquals(built.getDataset(), read1.getDataset());
		assertEquals(built.getMatrix(), read1.getMatrix());
		assertEquals(built.getTracklist(), read1.getTracklist());
		assertEquals(read1.getMatrix(), read2.getMatrix());
		assertEquals(read1.getTracklist(), read2.getTracklist());
	}

	@Test
	void cachedEngineRecommendsTheSame() throws IOException {
		Artifacts built = this.build();
		new ArtifactStore(this.params).persist(built);
		Artifacts read = new ArtifactStore(this.params).read();

		RecommendationEngine fresh = new RecommendationEngine(
				built.getMatrix(), this.params);
		RecommendationEngine cached = new RecommendationEngine(
				read.getMatrix(), this.params);
		List<String> selected = Arrays.asList("a");

		assertEquals(fresh.getPopularArtistRecommendations(),
				cached.getPopularArtistRecommendations());
		assertEquals(fresh.getItemBasedRecommendations(selected),
				cached.getItemBasedRecommendations(selected));
		assertEquals(fresh.getUserBasedRecommendations(selected),
				cached.getUserBasedRecommendations(selected));
	}

	@Test
	void loadBuildsOnceThenHitsCache() throws IOException {
		ArtifactStore store = new ArtifactStore(this.params);
		assertFalse(store.isCached());

		Artifacts first = store.load();
		assertTrue(store.isCached());
		assertSame(first, store.load());
		assertEquals(3, first.getMatrix().getNUsers());
		assertEquals(3, first.getMatrix().getNArtists());

		Artifacts again = new ArtifactStore(this.params).load();
		assertEquals(first.getBuildId(), again.getBuildId());
		assertEquals(first.getMatrix(), again.getMatrix());
	}

	@Test
	void invalidateForcesRebuild() throws IOException {
		ArtifactStore store = new ArtifactStore(this.params);
		Artifacts first = store.load();

		store.invalidate();
		assertFalse(store.isCached());
		Artifacts second = store.load();

		assertNotEquals(first.getBuildId(), second.getBuildId());
		assertEquals(first.getMatrix().getRatings(),
				second.getMatrix().getRatings());
	}

	@Test
	void changedSourceIsRebuilt() throws IOException {
		Artifacts first = new ArtifactStore(this.params).load();

		Files.write(Paths.get(this.params.dataFile),
				"u4,a,t1,p1\n".getBytes(StandardCharsets.UTF_8),
				StandardOpenOption.APPEND);
		ArtifactStore store = new ArtifactStore(this.params);
		assertFalse(store.isCached());

		Artifacts second = store.load();
		assertNotEquals(first.getBuildId(), second.getBuildId());
		assertEquals(4, second.getMatrix().getNUsers());
	}

	@Test
	void persistReplacesPreviousBuild() throws IOException {
		ArtifactStore store = new ArtifactStore(this.params);
		store.persist(this.build());
		Artifacts second = this.build();
		store.persist(second);

		assertEquals(second.getBuildId(), store.read().getBuildId());
		try (Stream<Path> children = Files
				.list(this.tempDir.resolve("cache"))) {
			assertEquals(Arrays.asList(ArtifactStore.CURRENT_DIR),
					children.map(p -> p.getFileName().toString())
							.collect(Collectors.toList()));
		}
	}

	@Test
	void missingManifestIsFatal() throws IOException {
		new ArtifactStore(this.params).persist(this.build());
		Files.delete(this.current().resolve(ArtifactStore.MANIFEST_FILE));

		ArtifactStore store = new ArtifactStore(this.params);
		assertThrows(ArtifactConsistencyException.class, () -> store.isCached());
		assertThrows(ArtifactConsistencyException.class, () -> store.load());
	}

	@Test
	void mixedBuildsAreFatal() throws IOException {
		new ArtifactStore(this.params).persist(this.build());
		Artifacts other = this.build();
		MLIOUtils.writeObjectToFileGZ(other.getTracklist(), this.current()
				.resolve(ArtifactStore.TRACKLIST_FILE).toString());

		assertThrows(ArtifactConsistencyException.class,
				() -> new ArtifactStore(this.params).read());
	}

	@Test
	void corruptArtifactIsFatal() throws IOException {
		new ArtifactStore(this.params).persist(this.build());
		Files.write(this.current().resolve(ArtifactStore.MATRIX_FILE),
				"garbage".getBytes(StandardCharsets.UTF_8));

		assertThrows(ArtifactConsistencyException.class,
				() -> new ArtifactStore(this.params).load());
	}

	@Test
	void artifactsFromDifferentBuildsAreRejected() throws IOException {
		Artifacts first = this.build();
		Artifacts second = this.build();

		assertThrows(ArtifactConsistencyException.class,
				() -> new Artifacts(first.getDataset(), second.getMatrix(),
						first.getTracklist()));
	}

	@Test
	void concurrentLoadsShareOneBuild() throws Exception {
		ArtifactStore store = new ArtifactStore(this.params);
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			Future<Artifacts> f1 = pool.submit(store::load);
			Future<Artifacts> f2 = pool.submit(store::load);
			Future<Artifacts> f3 = pool.submit(store::load);

			assertSame(f1.get(), f2.get());
			assertSame(f1.get(), f3.get());
		} finally {
			pool.shutdown();
		}
	}

}
