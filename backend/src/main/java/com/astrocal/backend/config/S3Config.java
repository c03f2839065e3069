package com.astrocal.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * S3 clients for the default credential chain. A non-empty {@code aws.s3.endpoint} points both
 * clients at an S3 compatible store with path style access.
 */
@Configuration
public class S3Config {

	@Value("${aws.region}")
	private String region;

	@Value("${aws.s3.endpoint:}")
	private String endpoint;

	@Bean
	public S3Client s3Client() {
		S3ClientBuilder builder = S3Client.builder().region(Region.of(region));
		if (!endpoint.isBlank()) {
			builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
		}
		return builder.build();
	}

	@Bean
	public S3Presigner s3Presigner() {
		S3Presigner.Builder builder = S3Presigner.builder().region(Region.of(region));
		if (!endpoint.isBlank()) {
			builder.endpointOverride(URI.create(endpoint))
					.serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
		}
		return builder.build();
	}
}
