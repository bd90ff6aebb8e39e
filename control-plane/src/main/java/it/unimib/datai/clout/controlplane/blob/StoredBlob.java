package it.unimib.datai.clout.controlplane.blob;

public record StoredBlob(
        BlobInfo info,
        byte[] content
) {
    public StoredBlob {
        content = content == null ? new byte[0] : content;
    }
}
