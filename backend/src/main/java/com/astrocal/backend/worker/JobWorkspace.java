package com.astrocal.backend.worker;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Private temporary directory of one job, removed with everything in it on close.
 */
@Slf4j
public final class JobWorkspace implements AutoCloseable {

	private final Path root;

	private JobWorkspace(Path root) {
		this.root = root;
	}

	public static JobWorkspace create(String baseDir, UUID jobId) throws IOException {
		Path base = Path.of(baseDir);
		Files.createDirectories(base);
		Path root = Files.createTempDirectory(base, "astrocal-" + jobId + "-");
		log.debug("Created workspace {} for job {}", root, jobId);
		return new JobWorkspace(root);
	}

	public File file(String name) {
		return root.resolve(name).toFile();
	}

	public Path getRoot() {
		return root;
	}

	@Override
	public void close() {
		if (!FileUtils.deleteQuietly(root.toFile())) {
			log.warn("Could not delete workspace {}", root);
		}
	}
}
