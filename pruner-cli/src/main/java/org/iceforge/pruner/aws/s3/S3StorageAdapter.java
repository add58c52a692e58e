package org.iceforge.pruner.aws.s3;

import org.iceforge.pruner.storage.DeleteStatus;
import org.iceforge.pruner.storage.ListPage;
import org.iceforge.pruner.storage.PermanentStorageException;
import org.iceforge.pruner.storage.StorageAdapter;
import org.iceforge.pruner.storage.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link StorageAdapter} over one S3 bucket (AWS SDK v2, ListObjectsV2 + DeleteObject).
 */
public class S3StorageAdapter implements StorageAdapter {
    private static final Logger logger = LoggerFactory.getLogger(S3StorageAdapter.class);

    private final S3Client s3;
    private final String bucket;
    private final int pageSize;

    public S3StorageAdapter(S3Client s3, String bucket, int pageSize) {
        this.s3 = Objects.requireNonNull(s3, "s3");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        if (pageSize < 1 || pageSize > 1000) {
            throw new IllegalArgumentException("pageSize must be within 1..1000, was " + pageSize);
        }
        this.pageSize = pageSize;
    }

    @Override
    public ListPage list(String prefix, String continuationToken) {
        String p = prefix == null ? "" : prefix;
        try {
            ListObjectsV2Response r = s3.listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(p)
                    .maxKeys(pageSize)
                    .continuationToken(continuationToken)
                    .build());

            List<StoredObject> out = new ArrayList<>();
            if (r.contents() != null) {
                for (S3Object o : r.contents()) {
                    out.add(new StoredObject(o.key(), o.lastModified(), o.size() == null ? 0L : o.size(), o.eTag()));
                }
            }

            if (!Boolean.TRUE.equals(r.isTruncated())) {
                return ListPage.last(out);
            }
            String next = r.nextContinuationToken();
            if (next == null || next.isEmpty()) {
                throw new PermanentStorageException("S3 list returned a truncated page without continuation token: s3://"
                        + bucket + "/" + p);
            }
            return new ListPage(out, next);
        } catch (SdkException e) {
            logger.warn("S3 list failed for s3://{}/{} (token={})", bucket, p, continuationToken, e);
            throw S3ErrorClassifier.classify("S3 list failed: s3://" + bucket + "/" + p, e);
        }
    }

    @Override
    public DeleteStatus delete(String key) {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            return DeleteStatus.DELETED;
        } catch (NoSuchKeyException e) {
            logger.debug("S3 object already gone: s3://{}/{}", bucket, key);
            return DeleteStatus.NOT_FOUND;
        } catch (SdkException e) {
            // Some S3-compatible APIs throw generic 404 as S3Exception; treat 404 as not-found.
            if (S3ErrorClassifier.isNotFound(e)) {
                logger.debug("S3 delete got 404, treating as gone: s3://{}/{}", bucket, key);
                return DeleteStatus.NOT_FOUND;
            }
            logger.warn("S3 delete failed for s3://{}/{}", bucket, key, e);
            throw S3ErrorClassifier.classify("S3 delete failed: s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public String describe() {
        return "s3://" + bucket;
    }
}
