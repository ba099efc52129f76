package recommender;

import java.util.List;
import java.util.UUID;

/**
 * One build: the filtered dataset with the matrix and tracklist derived from
 * it.
 */
public class Artifacts {

	private final FilteredDataset dataset;
	private final InteractionMatrix matrix;
	private final Tracklist tracklist;

	public Artifacts(final FilteredDataset datasetP,
			final InteractionMatrix matrixP, final Tracklist tracklistP)
			throws ArtifactConsistencyException {
		this.dataset = datasetP;
		this.matrix = matrixP;
		this.tracklist = tracklistP;
		this.validate();
	}

	public String getBuildId() {
		return this.dataset.getBuildId();
	}

	public FilteredDataset getDataset() {
		return this.dataset;
	}

	public InteractionMatrix getMatrix() {
		return this.matrix;
	}

	public Tracklist getTracklist() {
		return this.tracklist;
	}

	private void validate() throws ArtifactConsistencyException {
		String buildId = this.dataset.getBuildId();
		if (buildId.equals(this.matrix.getBuildId()) == false
				|| buildId.equals(this.tracklist.getBuildId()) == false) {
			throw new ArtifactConsistencyException(String.format(
					"artifacts from different builds: dataset[%s] matrix[%s] tracklist[%s]",
					buildId, this.matrix.getBuildId(),
					this.tracklist.getBuildId()));
		}
		if (this.matrix.getRatings().getNRows() != this.matrix.getNUsers()
				|| this.matrix.getRatings().getNCols() != this.matrix
						.getNArtists()) {
			throw new ArtifactConsistencyException(
					"matrix shape doesn't match its indexes");
		}
		for (int i = 0; i < this.tracklist.size(); i++) {
			String artistName = this.tracklist.getEntry(i).getArtistName();
			if (this.matrix.getArtistIndex().contains(artistName) == false) {
				throw new ArtifactConsistencyException(
						"tracklist artist not in matrix: " + artistName);
			}
		}
	}

	public static Artifacts build(final List<Interaction> raw,
			final RecommenderParams params) {
		String buildId = UUID.randomUUID().toString();
		FilteredDataset dataset = new DatasetPreparer(params).prepare(raw,
				buildId);
		InteractionMatrix matrix = InteractionMatrixBuilder.buildMatrix(dataset);
		Tracklist tracklist = InteractionMatrixBuilder.buildTracklist(dataset);
		try {
			return new Artifacts(dataset, matrix, tracklist);
		} catch (ArtifactConsistencyException e) {
			// all three share the build id above
			throw new IllegalStateException(e);
		}
	}

}
