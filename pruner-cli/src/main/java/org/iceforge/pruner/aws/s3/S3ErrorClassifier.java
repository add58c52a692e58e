package org.iceforge.pruner.aws.s3;

import org.iceforge.pruner.storage.PermanentStorageException;
import org.iceforge.pruner.storage.StorageException;
import org.iceforge.pruner.storage.TransientStorageException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.Set;

/**
 * Maps AWS SDK failures onto the retry split the runner understands.
 */
final class S3ErrorClassifier {

    private static final Set<String> TRANSIENT_ERROR_CODES = Set.of(
            "SlowDown", "Throttling", "ThrottlingException", "RequestTimeout", "RequestTimeTooSkewed",
            "InternalError", "ServiceUnavailable"
    );

    private S3ErrorClassifier() {}

    static StorageException classify(String message, SdkException e) {
        if (isTransient(e)) {
            return new TransientStorageException(message + ": " + e.getMessage(), e);
        }
        return new PermanentStorageException(message + ": " + e.getMessage(), e);
    }

    static boolean isTransient(SdkException e) {
        if (e instanceof AwsServiceException ase) {
            int status = ase.statusCode();
            if (status == 429 || status >= 500) {
                return true;
            }
            String code = ase.awsErrorDetails() == null ? null : ase.awsErrorDetails().errorCode();
            return code != null && TRANSIENT_ERROR_CODES.contains(code);
        }
        // connection resets, DNS failures, api-call timeouts
        if (e instanceof SdkClientException) {
            return true;
        }
        return e.retryable();
    }

    static boolean isNotFound(SdkException e) {
        return e instanceof AwsServiceException ase && ase.statusCode() == 404;
    }
}
