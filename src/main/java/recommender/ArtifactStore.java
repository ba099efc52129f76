package recommender;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import common.MLIOUtils;
import common.MLTimer;
import net.minidev.json.JSONObject;
import net.minidev.json.parser.JSONParser;
import net.minidev.json.parser.ParseException;

/**
 * Durable cache of one build. The three artifacts and a manifest live in
 * {@code <cachePath>/current}; a build is written to a temporary directory and
 * renamed into place so readers see either a whole build or none.
 */
public class ArtifactStore {

	public static final String CURRENT_DIR = "current";
	public static final String MANIFEST_FILE = "manifest.json";
	public static final String DATASET_FILE = "dataset.ser.gz";
	public static final String MATRIX_FILE = "matrix.ser.gz";
	public static final String TRACKLIST_FILE = "tracklist.ser.gz";

	private final RecommenderParams params;
	private final Path cacheDir;
	private final MLTimer timer;
	private Artifacts loaded;

	public ArtifactStore(final RecommenderParams paramsP) {
		this.params = paramsP;
		this.cacheDir = Paths.get(paramsP.cachePath);
		this.timer = new MLTimer("artifacts");
	}

	/**
	 * Returns the build of this store, reading it from the cache or building
	 * and persisting it from the raw data. Concurrent callers wait for the
	 * first one and share its result.
	 *
	 * @throws ArtifactConsistencyException
	 *             if the cache exists but can't be trusted
	 */
	public synchronized Artifacts load() throws IOException {
		if (this.loaded != null) {
			return this.loaded;
		}

		this.timer.tic();
		Artifacts artifacts;
		if (this.isCached() == true) {
			artifacts = this.read();
			this.timer.toc("cache hit build[" + artifacts.getBuildId() + "]");
		} else {
			this.timer.toc("cache miss, building from " + this.params.dataFile);
			artifacts = Artifacts.build(
					DataLoader.load(this.params.dataFile, this.params.hasHeader),
					this.params);
			this.persist(artifacts);
			this.timer.toc("persisted build[" + artifacts.getBuildId() + "]");
		}
		this.loaded = artifacts;
		return artifacts;
	}

	/**
	 * @return true if a build is cached and its source data is unchanged
	 */
	public boolean isCached() throws IOException {
		Path current = this.cacheDir.resolve(CURRENT_DIR);
		if (Files.isDirectory(current) == false) {
			return false;
		}
		JSONObject manifest = readManifest(current);
		return this.isStale(manifest) == false;
	}

	public synchronized void invalidate() throws IOException {
		Path current = this.cacheDir.resolve(CURRENT_DIR);
		if (Files.exists(current) == true) {
			MoreFiles.deleteRecursively(current,
					RecursiveDeleteOption.ALLOW_INSECURE);
		}
		this.loaded = null;
	}

	public void persist(final Artifacts artifacts) throws IOException {
		Files.createDirectories(this.cacheDir);
		Path tmp = Files.createTempDirectory(this.cacheDir, ".build-");
		try {
			MLIOUtils.writeObjectToFileGZ(artifacts.getDataset(),
					tmp.resolve(DATASET_FILE).toString());
			MLIOUtils.writeObjectToFileGZ(artifacts.getMatrix(),
					tmp.resolve(MATRIX_FILE).toString());
			MLIOUtils.writeObjectToFileGZ(artifacts.getTracklist(),
					tmp.resolve(TRACKLIST_FILE).toString());

			// manifest goes last, a directory without one is incomplete
			Files.write(tmp.resolve(MANIFEST_FILE),
					this.createManifest(artifacts).toJSONString()
							.getBytes(StandardCharsets.UTF_8));

			Path current = this.cacheDir.resolve(CURRENT_DIR);
			if (Files.exists(current) == true) {
				Path old = this.cacheDir.resolve(".old-" + UUID.randomUUID());
				Files.move(current, old, StandardCopyOption.ATOMIC_MOVE);
				MoreFiles.deleteRecursively(old,
						RecursiveDeleteOption.ALLOW_INSECURE);
			}
			Files.move(tmp, current, StandardCopyOption.ATOMIC_MOVE);

		} finally {
			if (Files.exists(tmp) == true) {
				MoreFiles.deleteRecursively(tmp,
						RecursiveDeleteOption.ALLOW_INSECURE);
			}
		}
	}

	/**
	 * Reads the cached build verbatim.
	 *
	 * @throws ArtifactConsistencyException
	 *             if anything is missing, unreadable or from another build
	 */
	public Artifacts read() throws IOException {
		Path current = this.cacheDir.resolve(CURRENT_DIR);
		JSONObject manifest = readManifest(current);
		String buildId = getManifestString(manifest, "buildId");

		FilteredDataset dataset = readArtifact(current.resolve(DATASET_FILE),
				FilteredDataset.class);
		InteractionMatrix matrix = readArtifact(current.resolve(MATRIX_FILE),
				InteractionMatrix.class);
		Tracklist tracklist = readArtifact(current.resolve(TRACKLIST_FILE),
				Tracklist.class);

		if (buildId.equals(dataset.getBuildId()) == false) {
			throw new ArtifactConsistencyException("manifest build[" + buildId
					+ "] != dataset build[" + dataset.getBuildId() + "]");
		}
		Artifacts artifacts = new Artifacts(dataset, matrix, tracklist);

		if (getManifestLong(manifest, "nRows") != dataset.size()
				|| getManifestLong(manifest, "nUsers") != matrix.getNUsers()
				|| getManifestLong(manifest, "nArtists") != matrix.getNArtists()
				|| getManifestLong(manifest, "nTracks") != tracklist.size()) {
			throw new ArtifactConsistencyException(
					"cached artifact sizes don't match manifest " + current);
		}
		return artifacts;
	}

	private JSONObject createManifest(final Artifacts artifacts)
			throws IOException {
		JSONObject manifest = new JSONObject();
		manifest.put("buildId", artifacts.getBuildId());
		manifest.put("createdAt", System.currentTimeMillis());
		manifest.put("nRows", artifacts.getDataset().size());
		manifest.put("nUsers", artifacts.getMatrix().getNUsers());
		manifest.put("nArtists", artifacts.getMatrix().getNArtists());
		manifest.put("nTracks", artifacts.getTracklist().size());

		Path dataFile = Paths.get(this.params.dataFile);
		if (Files.exists(dataFile) == true) {
			JSONObject source = new JSONObject();
			source.put("file", dataFile.toAbsolutePath().toString());
			source.put("size", Files.size(dataFile));
			source.put("lastModified",
					Files.getLastModifiedTime(dataFile).toMillis());
			manifest.put("source", source);
		}
		return manifest;
	}

	private boolean isStale(final JSONObject manifest) throws IOException {
		Object sourceObj = manifest.get("source");
		Path dataFile = Paths.get(this.params.dataFile);
		if (sourceObj instanceof JSONObject == false
				|| Files.exists(dataFile) == false) {
			// nothing to compare against, trust the cache
			return false;
		}

		JSONObject source = (JSONObject) sourceObj;
		return getManifestLong(source, "size") != Files.size(dataFile)
				|| getManifestLong(source, "lastModified") != Files
						.getLastModifiedTime(dataFile).toMillis();
	}

	private static long getManifestLong(final JSONObject manifest,
			final String key) throws ArtifactConsistencyException {
		Object value = manifest.get(key);
		if (value instanceof Number == false) {
			throw new ArtifactConsistencyException(
					"manifest field " + key + " missing or not a number");
		}
		return ((Number) value).longValue();
	}

	private static String getManifestString(final JSONObject manifest,
			final String key) throws ArtifactConsistencyException {
		Object value = manifest.get(key);
		if (value instanceof String == false) {
			throw new ArtifactConsistencyException(
					"manifest field " + key + " missing or not a string");
		}
		return (String) value;
	}

	private static <T extends Serializable> T readArtifact(
			final Path file, final Class<T> classType)
			throws ArtifactConsistencyException {
		try {
			return MLIOUtils.readObjectFromFileGZ(file.toString(), classType);
		} catch (IOException e) {
			throw new ArtifactConsistencyException(
					"unreadable cached artifact " + file, e);
		}
	}

	private static JSONObject readManifest(final Path current)
			throws ArtifactConsistencyException {
		Path manifestFile = current.resolve(MANIFEST_FILE);
		Object parsed;
		try (Reader reader = Files.newBufferedReader(manifestFile,
				StandardCharsets.UTF_8)) {
			parsed = new JSONParser(JSONParser.MODE_RFC4627).parse(reader);

		} catch (NoSuchFileException e) {
			throw new ArtifactConsistencyException(
					"cache without manifest " + current, e);
		} catch (IOException | ParseException e) {
			throw new ArtifactConsistencyException(
					"unreadable manifest " + manifestFile, e);
		}

		if (parsed instanceof JSONObject == false) {
			throw new ArtifactConsistencyException(
					"manifest is not a json object " + manifestFile);
		}
		return (JSONObject) parsed;
	}

}
