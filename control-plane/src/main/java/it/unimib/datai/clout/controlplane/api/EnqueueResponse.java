package it.unimib.datai.clout.controlplane.api;

public record EnqueueResponse(String queue, String messageId) {
}
