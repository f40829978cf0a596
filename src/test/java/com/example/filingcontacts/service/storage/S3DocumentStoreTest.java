package com.example.filingcontacts.service.storage;

import com.example.filingcontacts.dto.StoredObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3DocumentStoreTest {

    @Mock
    private S3Client s3;

    private S3DocumentStore store;

    @BeforeEach
    void setUp() {
        store = new S3DocumentStore(s3);
        ReflectionTestUtils.setField(store, "bucket", "filings-bucket");
    }

    @Test
    void fetchesObjectBytes() throws Exception {
        byte[] content = {1, 2, 3};
        when(s3.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), content));

        assertThat(store.fetchBytes("ocd/a.pdf")).containsExactly(1, 2, 3);

        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3).getObjectAsBytes(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo("filings-bucket");
        assertThat(captor.getValue().key()).isEqualTo("ocd/a.pdf");
    }

    @Test
    void sdkErrorsBecomeIoExceptions() {
        when(s3.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        assertThatThrownBy(() -> store.fetchBytes("ocd/missing.pdf"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("s3://filings-bucket/ocd/missing.pdf")
                .hasMessageContaining("does not exist");
    }

    @Test
    void listsObjectsUnderPrefix() throws Exception {
        ListObjectsV2Request request = ListObjectsV2Request.builder().bucket("filings-bucket").prefix("ocd/").build();
        when(s3.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
                .thenReturn(new ListObjectsV2Iterable(s3, request));
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("ocd/a.pdf").size(2048L).build(),
                        S3Object.builder().key("ocd/b.pdf").build())
                .build());

        List<StoredObject> objects = store.list("ocd/");

        assertThat(objects).extracting(StoredObject::getKey).containsExactly("ocd/a.pdf", "ocd/b.pdf");
        assertThat(objects).extracting(StoredObject::getSize).containsExactly(2048L, 0L);
    }

    @Test
    void uploadsAsPdf() throws Exception {
        store.upload("staging/x.pdf", new byte[]{1});

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3).putObject(captor.capture(), any(RequestBody.class));
        assertThat(captor.getValue().contentType()).isEqualTo("application/pdf");
        assertThat(captor.getValue().key()).isEqualTo("staging/x.pdf");
        assertThat(store.getLocation()).isEqualTo("filings-bucket");
    }

    @Test
    void deletesObjectFromBucket() throws Exception {
        store.delete("textract-staging/x.pdf");

        ArgumentCaptor<DeleteObjectRequest> captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3).deleteObject(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo("filings-bucket");
        assertThat(captor.getValue().key()).isEqualTo("textract-staging/x.pdf");
    }
}
