package com.astrocal.backend.storage;

import com.astrocal.backend.exception.DownloadException;
import com.astrocal.backend.exception.StorageException;

import java.util.List;

/**
 * Bucket/path addressed blob store holding raw frames and calibration artefacts.
 */
public interface ObjectStorage {

	byte[] download(String bucket, String path) throws DownloadException;

	/**
	 * @return a URL for the object when {@code makePublic} is set, otherwise {@code null}
	 */
	String upload(String bucket, String path, byte[] content, boolean makePublic) throws StorageException;

	List<StoredObject> list(String bucket, String prefix) throws StorageException;

	boolean delete(String bucket, String path);
}
