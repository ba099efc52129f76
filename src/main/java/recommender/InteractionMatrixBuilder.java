package recommender;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.IntStream;

import common.MLMatrixElement;
import common.MLSparseMatrixAOO;
import common.MLSparseVector;
import common.MLTimer;

public class InteractionMatrixBuilder {

	public static InteractionMatrix buildMatrix(final FilteredDataset dataset) {
		MLTimer timer = new MLTimer("buildMatrix");
		timer.tic();

		List<String> userIds = new ArrayList<String>(dataset.size());
		List<String> artistNames = new ArrayList<String>(dataset.size());
		for (Interaction row : dataset.getRows()) {
			userIds.add(row.getUserId());
			artistNames.add(row.getArtistName());
		}
		CategoricalIndex userIndex = CategoricalIndex.fromValues(userIds);
		CategoricalIndex artistIndex = CategoricalIndex.fromValues(artistNames);
		final int nUsers = userIndex.size();
		final int nArtists = artistIndex.size();

		// rating is the number of distinct playlists per user and artist
		Map<Integer, MLMatrixElement>[] rowMaps = new Map[nUsers];
		Set<String>[] seenPlaylists = new Set[nUsers];
		for (Interaction row : dataset.getRows()) {
			int userIdx = userIndex.getIndex(row.getUserId());
			int artistIdx = artistIndex.getIndex(row.getArtistName());

			if (rowMaps[userIdx] == null) {
				rowMaps[userIdx] = new TreeMap<Integer, MLMatrixElement>();
				seenPlaylists[userIdx] = new HashSet<String>();
			}
			if (seenPlaylists[userIdx].add(
					artistIdx + "\u0000" + row.getPlaylistName()) == false) {
				// same artist in the same playlist again
				continue;
			}

			Map<Integer, MLMatrixElement> userArtistMap = rowMaps[userIdx];
			MLMatrixElement cur = userArtistMap.get(artistIdx);
			if (cur == null) {
				userArtistMap.put(artistIdx,
						new MLMatrixElement(userIdx, artistIdx, 1f));
			} else {
				cur.setValue(cur.getValue() + 1f);
			}
		}

		MLSparseVector[] rows = new MLSparseVector[nUsers];
		IntStream.range(0, nUsers).parallel().forEach(userIdx -> {
			Map<Integer, MLMatrixElement> userArtistMap = rowMaps[userIdx];
			if (userArtistMap == null) {
				return;
			}

			int[] indexes = new int[userArtistMap.size()];
			float[] values = new float[userArtistMap.size()];
			int index = 0;
			for (MLMatrixElement element : userArtistMap.values()) {
				indexes[index] = element.getColIndex();
				values[index] = element.getValue();
				index++;
			}
			rows[userIdx] = new MLSparseVector(indexes, values, nArtists);
		});

		MLSparseMatrixAOO ratings = new MLSparseMatrixAOO(rows, nArtists);
		timer.toc(String.format("users[%d] artists[%d] nnz[%d]", nUsers,
				nArtists, ratings.getNNZ()));

		return new InteractionMatrix(dataset.getBuildId(), ratings, userIndex,
				artistIndex);
	}

	public static Tracklist buildTracklist(final FilteredDataset dataset) {
		Set<Tracklist.Entry> unique = new LinkedHashSet<Tracklist.Entry>();
		for (Interaction row : dataset.getRows()) {
			unique.add(
					new Tracklist.Entry(row.getArtistName(), row.getTrackName()));
		}

		// stable sort keeps first occurrence order within an artist
		List<Tracklist.Entry> entries = new ArrayList<Tracklist.Entry>(unique);
		entries.sort(Comparator.comparing(Tracklist.Entry::getArtistName));
		return new Tracklist(dataset.getBuildId(), entries);
	}

}
