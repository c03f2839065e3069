package com.astrocal.backend.storage;

import com.astrocal.backend.exception.DownloadException;
import com.astrocal.backend.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class S3StorageService implements ObjectStorage {

	private final S3Client s3Client;

	private final S3Presigner s3Presigner;

	@Value("${aws.s3.presigned-url-minutes:60}")
	private long presignedUrlMinutes;

	@Override
	public byte[] download(String bucket, String path) throws DownloadException {
		GetObjectRequest getObjectRequest = GetObjectRequest.builder()
				.bucket(bucket)
				.key(path)
				.build();
		try {
			ResponseBytes<GetObjectResponse> objectBytes = s3Client.getObjectAsBytes(getObjectRequest);
			log.debug("Downloaded {} from S3 bucket {}", path, bucket);
			return objectBytes.asByteArray();
		} catch (SdkException e) {
			throw new DownloadException(bucket, path, e);
		}
	}

	@Override
	public String upload(String bucket, String path, byte[] content, boolean makePublic) throws StorageException {
		PutObjectRequest putObjectRequest = PutObjectRequest.builder()
				.bucket(bucket)
				.key(path)
				.contentType(contentType(path))
				.build();
		try {
			s3Client.putObject(putObjectRequest, RequestBody.fromBytes(content));
			log.info("Successfully uploaded {} to S3 bucket {}", path, bucket);
		} catch (SdkException e) {
			log.error("Error uploading {} to S3: {}", path, e.getMessage());
			throw new StorageException("Failed to upload " + path + " to bucket " + bucket, e);
		}
		return makePublic ? generatePresignedUrl(bucket, path) : null;
	}

	@Override
	public List<StoredObject> list(String bucket, String prefix) throws StorageException {
		ListObjectsV2Request request = ListObjectsV2Request.builder()
				.bucket(bucket)
				.prefix(prefix)
				.build();
		try {
			List<StoredObject> objects = new ArrayList<>();
			for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
				String name = object.key().startsWith(prefix) ? object.key().substring(prefix.length()) : object.key();
				objects.add(new StoredObject(name, object.size()));
			}
			return objects;
		} catch (SdkException e) {
			throw new StorageException("Failed to list " + prefix + " in bucket " + bucket, e);
		}
	}

	@Override
	public boolean delete(String bucket, String path) {
		try {
			s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(path).build());
			return true;
		} catch (SdkException e) {
			log.warn("Could not delete {} from bucket {}: {}", path, bucket, e.getMessage());
			return false;
		}
	}

	private String generatePresignedUrl(String bucket, String path) {
		GetObjectRequest getObjectRequest = GetObjectRequest.builder()
				.bucket(bucket)
				.key(path)
				.build();

		GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
				.signatureDuration(Duration.ofMinutes(presignedUrlMinutes))
				.getObjectRequest(getObjectRequest)
				.build();

		PresignedGetObjectRequest presignedRequest = s3Presigner.presignGetObject(presignRequest);
		log.debug("Generated presigned URL for key: {}", path);
		return presignedRequest.url().toString();
	}

	private static String contentType(String path) {
		switch (FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT)) {
			case "png":
				return "image/png";
			case "json":
				return "application/json";
			case "fit":
			case "fits":
			case "fts":
				return "application/fits";
			default:
				return "application/octet-stream";
		}
	}
}
