package work.lcod.envbase.template;

/**
 * Where a child template is uploaded. Null fields fall back to the {@code template} config section.
 */
public record UploadTarget(String bucket, String prefix, String acl) {
    public static UploadTarget defaults() {
        return new UploadTarget(null, null, null);
    }

    UploadTarget orElse(ComposerSettings settings) {
        return new UploadTarget(
            bucket != null ? bucket : settings.templateBucket(),
            prefix != null ? prefix : settings.templatePrefix(),
            acl != null ? acl : settings.templateUploadAcl()
        );
    }
}
