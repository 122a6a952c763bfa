package work.lcod.envbase.aws;

import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import work.lcod.envbase.cloud.ObjectStorage;

public final class AwsObjectStorage implements ObjectStorage {
    private final S3Client s3;

    public AwsObjectStorage(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public String putObject(String bucket, String key, String body, String acl) {
        var request = PutObjectRequest.builder().bucket(bucket).key(key);
        if (acl != null && !acl.isBlank()) {
            request.acl(acl);
        }
        s3.putObject(request.build(), RequestBody.fromString(body));
        return objectUrl(bucket, key);
    }

    static String objectUrl(String bucket, String key) {
        return "https://" + bucket + ".s3.amazonaws.com/" + key;
    }
}
