package com.astrocal.backend.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class CancellationRegistry {

	private final Map<UUID, CancellationToken> tokens = new ConcurrentHashMap<>();

	public CancellationToken register(UUID jobId) {
		return tokens.computeIfAbsent(jobId, CancellationToken::new);
	}

	/** @return whether a running or queued job was signalled */
	public boolean cancel(UUID jobId) {
		CancellationToken token = tokens.get(jobId);
		if (token == null) {
			return false;
		}
		token.cancel();
		return true;
	}

	public void release(UUID jobId) {
		tokens.remove(jobId);
	}
}
