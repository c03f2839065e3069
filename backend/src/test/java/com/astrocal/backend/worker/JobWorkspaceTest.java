package com.astrocal.backend.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JobWorkspaceTest {

	@TempDir
	Path tempDir;

	@Test
	void closeRemovesEverything() throws Exception {
		JobWorkspace workspace = JobWorkspace.create(tempDir.resolve("work").toString(), UUID.randomUUID());
		Files.writeString(workspace.file("frame.fits").toPath(), "data");
		Path root = workspace.getRoot();

		workspace.close();

		assertThat(root).doesNotExist();
	}
}
