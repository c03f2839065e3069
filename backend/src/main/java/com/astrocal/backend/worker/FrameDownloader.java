package com.astrocal.backend.worker;

import com.astrocal.backend.exception.DownloadException;
import com.astrocal.backend.image.FitsImage;
import com.astrocal.backend.image.FitsImageIO;
import com.astrocal.backend.model.FrameRecord;
import com.astrocal.backend.model.RejectedFrame;
import com.astrocal.backend.storage.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fetches FITS files from object storage into a job workspace and decodes them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FrameDownloader {

	private final ObjectStorage objectStorage;
	private final FitsImageIO fitsImageIO;
	@Qualifier("downloadExecutor")
	private final Executor downloadExecutor;

	/**
	 * Downloads every path in parallel on the download pool; results keep the order of
	 * {@code paths}.
	 */
	public DownloadBatch downloadAll(String bucket, List<String> paths, JobWorkspace workspace, String localPrefix) {
		long start = System.currentTimeMillis();
		List<CompletableFuture<Outcome>> futures = new ArrayList<>();
		for (int i = 0; i < paths.size(); i++) {
			String path = paths.get(i);
			String localName = localPrefix + "_" + i + "." + FilenameUtils.getExtension(path);
			futures.add(CompletableFuture.supplyAsync(() -> fetch(bucket, path, workspace, localName), downloadExecutor));
		}

		List<FrameRecord> frames = new ArrayList<>();
		List<RejectedFrame> unreadable = new ArrayList<>();
		List<String> warnings = new ArrayList<>();
		for (CompletableFuture<Outcome> future : futures) {
			Outcome outcome = future.join();
			if (outcome.frame != null) {
				frames.add(outcome.frame);
			} else if (outcome.rejected != null) {
				unreadable.add(outcome.rejected);
			} else {
				warnings.add(outcome.warning);
			}
		}
		log.info("Downloaded {} of {} files in {} ms", frames.size() + unreadable.size(), paths.size(),
				System.currentTimeMillis() - start);
		return new DownloadBatch(frames, unreadable, warnings);
	}

	/**
	 * Downloads and decodes a single file on the calling thread.
	 */
	public FitsImage download(String bucket, String path, JobWorkspace workspace, String localName)
			throws DownloadException, IOException {
		File target = workspace.file(localName);
		FileUtils.writeByteArrayToFile(target, objectStorage.download(bucket, path));
		return fitsImageIO.read(target);
	}

	private Outcome fetch(String bucket, String path, JobWorkspace workspace, String localName) {
		File target = workspace.file(localName);
		try {
			FileUtils.writeByteArrayToFile(target, objectStorage.download(bucket, path));
		} catch (DownloadException | IOException e) {
			log.warn("Failed to download {}: {}", path, e.getMessage());
			return Outcome.warning("Failed to download " + path + ": " + e.getMessage());
		}
		try {
			FitsImage fits = fitsImageIO.read(target);
			return Outcome.frame(FrameRecord.of(path, fits.getHeader(), fits.getImage()));
		} catch (IOException | RuntimeException e) {
			log.warn("Could not read FITS {}: {}", path, e.getMessage());
			String file = path.substring(path.lastIndexOf('/') + 1);
			return Outcome.rejected(RejectedFrame.withReason(file, "Error reading FITS: " + e.getMessage()));
		}
	}

	private static final class Outcome {
		private FrameRecord frame;
		private RejectedFrame rejected;
		private String warning;

		static Outcome frame(FrameRecord frame) {
			Outcome outcome = new Outcome();
			outcome.frame = frame;
			return outcome;
		}

		static Outcome rejected(RejectedFrame rejected) {
			Outcome outcome = new Outcome();
			outcome.rejected = rejected;
			return outcome;
		}

		static Outcome warning(String warning) {
			Outcome outcome = new Outcome();
			outcome.warning = warning;
			return outcome;
		}
	}
}
