package com.example.filingcontacts.service.storage;

import com.example.filingcontacts.dto.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class S3DocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(S3DocumentStore.class);

    private final S3Client s3;

    @Value("${storage.s3.bucket:}")
    private String bucket;

    public S3DocumentStore(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public byte[] fetchBytes(String key) throws IOException {
        try {
            ResponseBytes<GetObjectResponse> object =
                    s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
            logger.debug("Downloaded s3://{}/{} ({} bytes)", bucket, key, object.asByteArray().length);
            return object.asByteArray();
        } catch (SdkException e) {
            throw new IOException("Could not download s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<StoredObject> list(String prefix) throws IOException {
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();
            // paginator follows continuation tokens for prefixes with more than 1000 keys
            return s3.listObjectsV2Paginator(request).contents().stream()
                    .map(this::toStoredObject)
                    .collect(Collectors.toList());
        } catch (SdkException e) {
            throw new IOException("Could not list s3://" + bucket + "/" + prefix + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void upload(String key, byte[] bytes) throws IOException {
        try {
            s3.putObject(PutObjectRequest.builder().bucket(bucket).key(key).contentType("application/pdf").build(),
                    RequestBody.fromBytes(bytes));
            logger.debug("Uploaded s3://{}/{} ({} bytes)", bucket, key, bytes.length);
        } catch (SdkException e) {
            throw new IOException("Could not upload s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String key) throws IOException {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            logger.debug("Deleted s3://{}/{}", bucket, key);
        } catch (SdkException e) {
            throw new IOException("Could not delete s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getLocation() {
        return bucket;
    }

    private StoredObject toStoredObject(S3Object object) {
        return new StoredObject(object.key(), object.size() == null ? 0 : object.size());
    }
}
