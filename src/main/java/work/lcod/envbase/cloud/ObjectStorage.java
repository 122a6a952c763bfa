package work.lcod.envbase.cloud;

public interface ObjectStorage {
    /** Stores {@code body} and returns the URL the object can be read back from. */
    String putObject(String bucket, String key, String body, String acl);
}
