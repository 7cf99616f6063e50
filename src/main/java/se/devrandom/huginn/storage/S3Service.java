/*
 * Huginn - SEI Process Synchronization
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.huginn.storage;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.*;

import java.io.IOException;
import java.net.URI;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

@Service
public class S3Service {
    private static final Logger log = LoggerFactory.getLogger(S3Service.class);

    private final S3Client s3Client;
    private final String bucketName;

    @Autowired
    public S3Service(
            @Value("${aws.s3.bucket-name}") String bucketName,
            @Value("${aws.s3.region:us-east-1}") String region,
            @Value("${aws.s3.endpoint:}") String endpoint,
            @Value("${aws.s3.path-style-access:false}") boolean pathStyleAccess,
            @Value("${aws.s3.access-key:}") String accessKey,
            @Value("${aws.s3.secret-key:}") String secretKey) {
        this.bucketName = bucketName;

        AwsCredentialsProvider credentialsProvider = accessKey == null || accessKey.isBlank()
                ? DefaultCredentialsProvider.create()
                : StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));

        // Timeouts so a slow object store cannot hang a download worker forever
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(pathStyleAccess)   // MinIO needs path-style
                        .build())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofMinutes(5))
                        .apiCallAttemptTimeout(Duration.ofMinutes(3))
                        .retryPolicy(RetryPolicy.builder()
                                .numRetries(2)
                                .build())
                        .build());
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        this.s3Client = builder.build();

        log.info("S3Service initialized with bucket: {} in region: {}{}", bucketName, region,
                endpoint == null || endpoint.isBlank() ? "" : " at " + endpoint);
    }

    S3Service(S3Client s3Client, String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    /**
     * Creates the bucket if it does not exist yet.
     */
    public void ensureBucketExists() throws IOException {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
            log.debug("Bucket {} exists", bucketName);
        } catch (NoSuchBucketException e) {
            log.info("Bucket {} does not exist, creating it", bucketName);
            try {
                s3Client.createBucket(CreateBucketRequest.builder().bucket(bucketName).build());
            } catch (Exception createError) {
                throw new IOException("S3 bucket creation failed: " + createError.getMessage(), createError);
            }
        } catch (Exception e) {
            throw new IOException("S3 bucket check failed: " + e.getMessage(), e);
        }
    }

    /**
     * Object key for a document binary: {protocol with '/' and '.' replaced by '-'}/{documentId}.{extension}
     * Example: 00002-012345-2024-11/987654.pdf
     */
    public String buildDocumentKey(String protocol, long documentId, String extension) {
        String folder = protocol.replace('/', '-').replace('.', '-');
        return String.format("%s/%d.%s", folder, documentId, extension);
    }

    /**
     * Upload a document binary. The SHA-256 is stored as object metadata alongside the protocol
     * and document id.
     *
     * @return The S3 key where the file was uploaded
     */
    public String uploadDocument(byte[] content, String key, String contentType, String sha256,
                                 String protocol, long documentId) throws IOException {
        log.debug("Uploading document to S3: bucket={}, key={}, size={} bytes", bucketName, key, content.length);

        try {
            Map<String, String> metadata = new HashMap<>();
            metadata.put("sha256", sha256);
            metadata.put("protocol", protocol);
            metadata.put("document-id", String.valueOf(documentId));
            metadata.put("upload-date", LocalDateTime.now().toString());

            PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .contentType(contentType)
                    .contentLength((long) content.length)
                    .metadata(metadata)
                    .build();

            s3Client.putObject(putObjectRequest, RequestBody.fromBytes(content));
            log.debug("Successfully uploaded document to S3: {}", key);
            return key;

        } catch (Exception e) {
            log.error("Failed to upload document to S3: {}", key, e);
            throw new IOException("S3 upload failed: " + e.getMessage(), e);
        }
    }

    /**
     * Lowercase hex SHA-256 of the content.
     */
    public static String sha256Hex(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Determine MIME type based on file extension
     */
    public static String contentTypeFor(String fileExtension) {
        if (fileExtension == null) {
            return "application/octet-stream";
        }

        return switch (fileExtension.toLowerCase(Locale.ROOT)) {
            case "pdf" -> "application/pdf";
            case "html", "htm" -> "text/html";
            case "jpg", "jpeg" -> "image/jpeg";
            case "png" -> "image/png";
            case "doc" -> "application/msword";
            case "docx" -> "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
            case "xls" -> "application/vnd.ms-excel";
            case "xlsx" -> "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
            case "odt" -> "application/vnd.oasis.opendocument.text";
            case "txt" -> "text/plain";
            case "zip" -> "application/zip";
            default -> "application/octet-stream";
        };
    }

    public String getBucketName() {
        return bucketName;
    }

    @PreDestroy
    public void close() {
        if (s3Client != null) {
            s3Client.close();
            log.info("S3Client closed");
        }
    }
}
