package io.chunkvault.read;

import io.chunkvault.ObjectNotFoundException;
import io.chunkvault.index.MetadataIndex;
import io.chunkvault.index.ObjectManifest;
import io.chunkvault.storage.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Clock;

/**
 * Streams committed objects back out of the chunk store.
 */
public class ReconstructionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReconstructionEngine.class);

    private final MetadataIndex index;
    private final ChunkStore chunkStore;
    private final Clock clock;

    public ReconstructionEngine(MetadataIndex index, ChunkStore chunkStore, Clock clock) {
        this.index = index;
        this.chunkStore = chunkStore;
        this.clock = clock;
    }

    public ObjectStream read(String objectId, long version) {
        return read(objectId, version, 0);
    }

    /**
     * Open a lazy stream over a committed object version.
     *
     * @param fromChunkIndex first chunk to return, for resuming an interrupted read
     * @throws ObjectNotFoundException if the version does not exist or is not committed
     */
    public ObjectStream read(String objectId, long version, int fromChunkIndex) {
        ObjectManifest manifest = committedManifest(objectId, version);
        if (fromChunkIndex < 0 || fromChunkIndex > manifest.getChunkCount()) {
            throw new IllegalArgumentException("Chunk index " + fromChunkIndex + " outside [0, "
                + manifest.getChunkCount() + "] for " + objectId + "@" + version);
        }
        logger.debug("Reading {}@{} from chunk {} of {}", objectId, version, fromChunkIndex, manifest.getChunkCount());
        return new ObjectStream(manifest, fromChunkIndex, index, chunkStore, clock);
    }

    /**
     * Read the latest committed version of an object.
     */
    public ObjectStream read(String objectId) {
        long version = index.latestCommittedVersion(objectId)
            .orElseThrow(() -> new ObjectNotFoundException(objectId));
        return read(objectId, version, 0);
    }

    public InputStream openInputStream(String objectId, long version) {
        return new ObjectInputStream(read(objectId, version, 0));
    }

    public ObjectManifest committedManifest(String objectId, long version) {
        ObjectManifest manifest = index.getManifest(objectId, version);
        if (!manifest.isCommitted()) {
            throw new ObjectNotFoundException(objectId, version);
        }
        return manifest;
    }
}
