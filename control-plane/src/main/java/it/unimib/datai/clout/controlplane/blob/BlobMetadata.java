package it.unimib.datai.clout.controlplane.blob;

public record BlobMetadata(
        String name,
        String contentType,
        String value
) {
    public static BlobMetadata text(String name, String value) {
        return new BlobMetadata(name, "text/plain", value);
    }
}
