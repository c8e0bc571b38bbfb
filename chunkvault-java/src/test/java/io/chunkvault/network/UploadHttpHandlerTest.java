package io.chunkvault.network;

import com.fasterxml.jackson.databind.JsonNode;
import io.chunkvault.ChunkVault;
import io.chunkvault.CorruptedChunkException;
import io.chunkvault.DuplicateChunkIndexException;
import io.chunkvault.IndexUnavailableException;
import io.chunkvault.InsufficientShardsException;
import io.chunkvault.MutableClock;
import io.chunkvault.ObjectNotFoundException;
import io.chunkvault.SessionExpiredException;
import io.chunkvault.SessionNotFoundException;
import io.chunkvault.TestData;
import io.chunkvault.VaultOptions;
import io.chunkvault.index.InMemoryMetadataIndex;
import io.chunkvault.storage.ChunkHasher;
import io.chunkvault.storage.InMemoryShardBackend;
import io.chunkvault.storage.ShardBackend;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UploadHttpHandler")
class UploadHttpHandlerTest {

    private static final byte[] FIRST = TestData.random(3000, 21);
    private static final byte[] SECOND = TestData.random(1500, 22);
    private static final String CHECKSUM = TestData.checksumOf(FIRST, SECOND);

    private MutableClock clock;
    private List<InMemoryShardBackend> backends;
    private ChunkVault vault;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        backends = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            backends.add(new InMemoryShardBackend("mem-" + i));
        }
        vault = new ChunkVault(VaultOptions.builder().concurrency(2).build(), new InMemoryMetadataIndex(),
            new ArrayList<ShardBackend>(backends), clock);
        channel = new EmbeddedChannel(new UploadHttpHandler(vault));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
        vault.close();
    }

    // ==================== Helpers ====================

    private FullHttpRequest request(HttpMethod method, String uri, byte[] body) {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri,
            Unpooled.wrappedBuffer(body));
        request.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.length);
        return request;
    }

    private FullHttpRequest json(HttpMethod method, String uri, String body) {
        return request(method, uri, body.getBytes(StandardCharsets.UTF_8));
    }

    private Reply send(FullHttpRequest request) {
        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "no response for " + request.uri());
        try {
            JsonNode body = UploadHttpHandler.MAPPER.readTree(response.content().toString(StandardCharsets.UTF_8));
            return new Reply(response.status(), body);
        } catch (Exception e) {
            throw new AssertionError("response body is not JSON", e);
        } finally {
            response.release();
        }
    }

    private String createUpload(String objectId) {
        Reply reply = send(json(HttpMethod.POST, "/uploads",
            "{\"objectId\":\"" + objectId + "\",\"totalChunks\":2,\"totalBytes\":4500,\"originalChecksum\":\"" + CHECKSUM + "\"}"));
        assertEquals(HttpResponseStatus.CREATED, reply.status());
        return reply.body().get("uploadId").asText();
    }

    private Reply putChunk(String uploadId, int index, byte[] data) {
        return send(request(HttpMethod.PUT, "/uploads/" + uploadId + "/chunks/" + index, data));
    }

    private String committedUpload(String objectId) {
        String uploadId = createUpload(objectId);
        putChunk(uploadId, 0, FIRST);
        putChunk(uploadId, 1, SECOND);
        assertEquals("complete", send(json(HttpMethod.POST, "/uploads/" + uploadId + "/finalize", "")).body().get("status").asText());
        return uploadId;
    }

    private record Reply(HttpResponseStatus status, JsonNode body) {}

    // ==================== Tests ====================

    @Nested
    @DisplayName("Upload routes")
    class UploadRoutes {

        @Test
        @DisplayName("POST /uploads should open a session")
        void create() {
            Reply reply = send(json(HttpMethod.POST, "/uploads",
                "{\"objectId\":\"clip.mp4\",\"totalChunks\":2,\"originalChecksum\":\"" + CHECKSUM + "\",\"extra\":1}"));

            assertEquals(HttpResponseStatus.CREATED, reply.status());
            assertEquals("clip.mp4", reply.body().get("objectId").asText());
            assertEquals(1, reply.body().get("version").asLong());
            assertEquals(2, reply.body().get("totalChunks").asInt());
            assertEquals("2024-01-01T01:00:00Z", reply.body().get("expiresAt").asText());
        }

        @Test
        @DisplayName("PUT chunk should report ok, duplicate and dedup")
        void putChunks() {
            String uploadId = createUpload("a");

            Reply first = putChunk(uploadId, 0, FIRST);
            assertEquals(HttpResponseStatus.OK, first.status());
            assertEquals("ok", first.body().get("status").asText());
            assertFalse(first.body().get("dedup").asBoolean());
            assertEquals(ChunkHasher.digest(FIRST), first.body().get("digest").asText());

            assertEquals("duplicate", putChunk(uploadId, 0, FIRST).body().get("status").asText());

            String other = createUpload("b");
            assertTrue(putChunk(other, 0, FIRST).body().get("dedup").asBoolean());
        }

        @Test
        @DisplayName("a digest header that does not match the body should be rejected")
        void digestHeader() {
            String uploadId = createUpload("a");
            FullHttpRequest request = request(HttpMethod.PUT, "/uploads/" + uploadId + "/chunks/0", FIRST);
            request.headers().set(UploadHttpHandler.DIGEST_HEADER, ChunkHasher.digest(SECOND));

            Reply reply = send(request);

            assertEquals(HttpResponseStatus.BAD_REQUEST, reply.status());
            assertEquals("InvalidChunk", reply.body().get("error").asText());
        }

        @Test
        @DisplayName("GET /uploads/{id} should report progress")
        void status() {
            String uploadId = createUpload("a");
            putChunk(uploadId, 1, SECOND);

            Reply reply = send(json(HttpMethod.GET, "/uploads/" + uploadId, ""));

            assertEquals(HttpResponseStatus.OK, reply.status());
            assertEquals(1, reply.body().get("receivedChunks").asInt());
            assertEquals(0, reply.body().get("missingChunks").get(0).asInt());
            assertEquals(0.5, reply.body().get("progress").asDouble(), 1e-9);
        }

        @Test
        @DisplayName("finalize should report missing chunks, then commit")
        void finalizeUpload() {
            String uploadId = createUpload("a");
            putChunk(uploadId, 0, FIRST);

            Reply incomplete = send(json(HttpMethod.POST, "/uploads/" + uploadId + "/finalize", ""));
            assertEquals("incomplete", incomplete.body().get("status").asText());
            assertEquals(1, incomplete.body().get("missingChunks").get(0).asInt());

            putChunk(uploadId, 1, SECOND);
            Reply complete = send(json(HttpMethod.POST, "/uploads/" + uploadId + "/finalize",
                "{\"objectId\":\"a\",\"version\":1}"));
            assertEquals("complete", complete.body().get("status").asText());
            assertEquals(CHECKSUM, complete.body().get("checksum").asText());
            assertEquals(4500, complete.body().get("totalBytes").asLong());
        }

        @Test
        @DisplayName("finalize with a wrong checksum should report a mismatch")
        void mismatch() {
            String uploadId = createUpload("a");
            putChunk(uploadId, 0, FIRST);
            putChunk(uploadId, 1, TestData.random(1500, 23));

            Reply reply = send(json(HttpMethod.POST, "/uploads/" + uploadId + "/finalize", ""));

            assertEquals(HttpResponseStatus.OK, reply.status());
            assertEquals("mismatch", reply.body().get("status").asText());

            assertEquals("replaced", putChunk(uploadId, 1, SECOND).body().get("status").asText());
            assertEquals("complete",
                send(json(HttpMethod.POST, "/uploads/" + uploadId + "/finalize", "")).body().get("status").asText());
        }

        @Test
        @DisplayName("DELETE should cancel and later requests should get 410")
        void cancel() {
            String uploadId = createUpload("a");

            Reply reply = send(json(HttpMethod.DELETE, "/uploads/" + uploadId, ""));
            assertEquals(HttpResponseStatus.OK, reply.status());
            assertEquals("cancelled", reply.body().get("status").asText());

            Reply late = putChunk(uploadId, 0, FIRST);
            assertEquals(HttpResponseStatus.GONE, late.status());
            assertEquals("SessionExpired", late.body().get("error").asText());
        }

        @Test
        @DisplayName("expired sessions should answer 410")
        void expired() {
            String uploadId = createUpload("a");
            clock.advance(Duration.ofHours(2));

            assertEquals(HttpResponseStatus.GONE, putChunk(uploadId, 0, FIRST).status());
        }
    }

    @Nested
    @DisplayName("Object routes")
    class ObjectRoutes {

        @Test
        @DisplayName("GET manifest should return the committed manifest")
        void manifest() {
            committedUpload("movie");

            Reply reply = send(json(HttpMethod.GET, "/objects/movie/versions/1/manifest", ""));

            assertEquals(HttpResponseStatus.OK, reply.status());
            assertEquals("movie", reply.body().get("objectId").asText());
            assertEquals(2, reply.body().get("entries").size());
        }

        @Test
        @DisplayName("GET object should stream chunks with chunked transfer encoding")
        void download() {
            committedUpload("movie");

            channel.writeInbound(json(HttpMethod.GET, "/objects/movie/versions/1", ""));

            HttpResponse head = channel.readOutbound();
            assertEquals(HttpResponseStatus.OK, head.status());
            assertEquals(HttpHeaderValues.CHUNKED.toString(), head.headers().get(HttpHeaderNames.TRANSFER_ENCODING));
            assertEquals("1", head.headers().get("X-Object-Version"));

            ByteArrayOutputStream body = new ByteArrayOutputStream();
            Object message;
            while ((message = channel.readOutbound()) != null) {
                HttpContent content = (HttpContent) message;
                body.writeBytes(ByteBufUtil.getBytes(content.content()));
                content.release();
                if (message instanceof LastHttpContent) {
                    break;
                }
            }
            assertArrayEquals(TestData.concat(List.of(FIRST, SECOND)), body.toByteArray());
        }

        @Test
        @DisplayName("a chunk that cannot be rebuilt should abort the transfer")
        void abortedDownload() {
            committedUpload("movie");
            String digest = vault.getManifest("movie", 1).digestAt(1).orElseThrow();
            vault.getIndex().lookup(digest).orElseThrow().shardLocations().stream().limit(4)
                .forEach(l -> backends.stream().filter(b -> b.id().equals(l.backendId()))
                    .forEach(b -> b.delete(l.storagePath())));

            channel.writeInbound(json(HttpMethod.GET, "/objects/movie/versions/1", ""));

            HttpResponse head = channel.readOutbound();
            assertEquals(HttpResponseStatus.OK, head.status());
            HttpContent first = channel.readOutbound();
            assertArrayEquals(FIRST, ByteBufUtil.getBytes(first.content()));
            first.release();
            assertNull(channel.readOutbound());
            assertFalse(channel.isOpen());
        }

        @Test
        @DisplayName("unknown objects should answer 404")
        void notFound() {
            Reply reply = send(json(HttpMethod.GET, "/objects/nothing/versions/1", ""));

            assertEquals(HttpResponseStatus.NOT_FOUND, reply.status());
            assertEquals("ObjectNotFound", reply.body().get("error").asText());
        }
    }

    @Nested
    @DisplayName("Errors and health")
    class ErrorsAndHealth {

        @Test
        @DisplayName("unknown routes and sessions should answer 404")
        void unknown() {
            assertEquals(HttpResponseStatus.NOT_FOUND, send(json(HttpMethod.GET, "/nowhere", "")).status());
            Reply reply = send(json(HttpMethod.GET, "/uploads/missing", ""));
            assertEquals(HttpResponseStatus.NOT_FOUND, reply.status());
            assertEquals("SessionNotFound", reply.body().get("error").asText());
        }

        @Test
        @DisplayName("malformed and incomplete bodies should answer 400")
        void badRequests() {
            Reply malformed = send(json(HttpMethod.POST, "/uploads", "{not json"));
            assertEquals(HttpResponseStatus.BAD_REQUEST, malformed.status());
            assertEquals("MalformedBody", malformed.body().get("error").asText());

            assertEquals(HttpResponseStatus.BAD_REQUEST,
                send(json(HttpMethod.POST, "/uploads", "{\"objectId\":\"a\"}")).status());
            assertEquals(HttpResponseStatus.BAD_REQUEST,
                send(json(HttpMethod.POST, "/uploads", "")).status());

            String uploadId = createUpload("a");
            assertEquals(HttpResponseStatus.BAD_REQUEST, putChunk(uploadId, 5, FIRST).status());
            assertEquals(HttpResponseStatus.BAD_REQUEST,
                send(request(HttpMethod.PUT, "/uploads/" + uploadId + "/chunks/x", FIRST)).status());
        }

        @Test
        @DisplayName("a chunk index beyond the int range should answer 400 and store nothing")
        void overflowingIndex() {
            String uploadId = createUpload("a");

            Reply reply = send(request(HttpMethod.PUT, "/uploads/" + uploadId + "/chunks/4294967296", FIRST));

            assertEquals(HttpResponseStatus.BAD_REQUEST, reply.status());
            Reply status = send(json(HttpMethod.GET, "/uploads/" + uploadId, ""));
            assertEquals(0, status.body().get("receivedChunks").asInt());
            assertEquals(2, status.body().get("missingChunks").size());
        }

        @Test
        @DisplayName("finalize status names should not depend on the default locale")
        void localeIndependentStatus() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(new Locale("tr", "TR"));
            try {
                String uploadId = createUpload("a");
                putChunk(uploadId, 0, FIRST);

                Reply reply = send(json(HttpMethod.POST, "/uploads/" + uploadId + "/finalize", ""));

                assertEquals("incomplete", reply.body().get("status").asText());
            } finally {
                Locale.setDefault(previous);
            }
        }

        @Test
        @DisplayName("a different chunk at a filled index should answer 409")
        void conflict() {
            String uploadId = createUpload("a");
            putChunk(uploadId, 0, FIRST);

            Reply reply = putChunk(uploadId, 0, SECOND);

            assertEquals(HttpResponseStatus.CONFLICT, reply.status());
            assertEquals("DuplicateChunkIndex", reply.body().get("error").asText());
        }

        @Test
        @DisplayName("GET /health should report backends and stats")
        void health() {
            committedUpload("movie");

            Reply ok = send(json(HttpMethod.GET, "/health", ""));
            assertEquals("ok", ok.body().get("status").asText());
            assertEquals(9, ok.body().get("backends").size());
            assertEquals(2, ok.body().get("stats").get("chunkCount").asInt());

            backends.get(0).setReady(false);
            assertEquals("degraded", send(json(HttpMethod.GET, "/health", "")).body().get("status").asText());
        }

        @Test
        @DisplayName("exceptions should map onto HTTP statuses")
        void statusMapping() {
            assertEquals(HttpResponseStatus.NOT_FOUND, UploadHttpHandler.statusFor(new SessionNotFoundException("u")));
            assertEquals(HttpResponseStatus.NOT_FOUND, UploadHttpHandler.statusFor(new ObjectNotFoundException("o", 1)));
            assertEquals(HttpResponseStatus.GONE, UploadHttpHandler.statusFor(new SessionExpiredException("u", Instant.EPOCH)));
            assertEquals(HttpResponseStatus.CONFLICT, UploadHttpHandler.statusFor(new DuplicateChunkIndexException("o", 1, 0, "a", "b")));
            assertEquals(HttpResponseStatus.SERVICE_UNAVAILABLE,
                UploadHttpHandler.statusFor(new IndexUnavailableException("down", new RuntimeException())));
            assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR,
                UploadHttpHandler.statusFor(new InsufficientShardsException(2, 6)));
            assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR,
                UploadHttpHandler.statusFor(new CorruptedChunkException("d", "bad")));
            assertEquals("InsufficientShards", UploadHttpHandler.errorKind(new InsufficientShardsException(2, 6)));
        }
    }
}
