package io.chunkvault;

/**
 * Thrown when no committed manifest exists for an object version.
 */
public class ObjectNotFoundException extends ChunkVaultException {

    private final String objectId;
    private final long version;

    public ObjectNotFoundException(String objectId, long version) {
        super("Object not found: " + objectId + "@" + version);
        this.objectId = objectId;
        this.version = version;
    }

    public ObjectNotFoundException(String objectId, long version, String uploadId) {
        super("Manifest " + objectId + "@" + version + " is not owned by upload " + uploadId);
        this.objectId = objectId;
        this.version = version;
    }

    public ObjectNotFoundException(String objectId) {
        super("Object not found: " + objectId);
        this.objectId = objectId;
        this.version = -1;
    }

    public String getObjectId() {
        return objectId;
    }

    public long getVersion() {
        return version;
    }
}
