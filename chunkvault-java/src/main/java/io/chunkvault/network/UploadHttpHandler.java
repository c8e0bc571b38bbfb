package io.chunkvault.network;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chunkvault.ChunkVault;
import io.chunkvault.ChunkVaultException;
import io.chunkvault.DigestCollisionException;
import io.chunkvault.DuplicateChunkIndexException;
import io.chunkvault.InvalidChunkException;
import io.chunkvault.ObjectNotFoundException;
import io.chunkvault.SessionExpiredException;
import io.chunkvault.SessionNotFoundException;
import io.chunkvault.ingest.AdmitResult;
import io.chunkvault.ingest.FinalizeRequest;
import io.chunkvault.ingest.FinalizeResult;
import io.chunkvault.read.ObjectStream;
import io.chunkvault.session.SessionRequest;
import io.chunkvault.session.UploadSession;
import io.chunkvault.storage.ShardBackend;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON/HTTP routes over a {@link ChunkVault}.
 *
 * <p>Handlers block on storage I/O, so the pipeline runs this handler on a
 * separate executor group rather than the channel's event loop.</p>
 */
public class UploadHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger logger = LoggerFactory.getLogger(UploadHttpHandler.class);

    static final String DIGEST_HEADER = "X-Content-Digest";

    static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final ChunkVault vault;

    public UploadHttpHandler(ChunkVault vault) {
        this.vault = vault;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        try {
            route(ctx, request, keepAlive);
        } catch (Exception e) {
            sendError(ctx, e, keepAlive);
        }
    }

    private void route(ChannelHandlerContext ctx, FullHttpRequest request, boolean keepAlive) throws Exception {
        HttpMethod method = request.method();
        List<String> path = segments(request.uri());

        if (path.size() == 1 && path.get(0).equals("health") && method.equals(HttpMethod.GET)) {
            sendJson(ctx, HttpResponseStatus.OK, health(), keepAlive);
            return;
        }

        if (!path.isEmpty() && path.get(0).equals("uploads")) {
            if (path.size() == 1 && method.equals(HttpMethod.POST)) {
                sendJson(ctx, HttpResponseStatus.CREATED, createUpload(request), keepAlive);
                return;
            }
            if (path.size() == 2 && method.equals(HttpMethod.GET)) {
                sendJson(ctx, HttpResponseStatus.OK, vault.status(path.get(1)), keepAlive);
                return;
            }
            if (path.size() == 2 && method.equals(HttpMethod.DELETE)) {
                vault.cancel(path.get(1));
                sendJson(ctx, HttpResponseStatus.OK, new CancelResponse("cancelled", path.get(1)), keepAlive);
                return;
            }
            if (path.size() == 3 && path.get(2).equals("finalize") && method.equals(HttpMethod.POST)) {
                sendJson(ctx, HttpResponseStatus.OK, finalizeUpload(path.get(1), request), keepAlive);
                return;
            }
            if (path.size() == 4 && path.get(2).equals("chunks") && method.equals(HttpMethod.PUT)) {
                sendJson(ctx, HttpResponseStatus.OK, uploadChunk(path.get(1), path.get(3), request), keepAlive);
                return;
            }
        }

        if (path.size() >= 4 && path.get(0).equals("objects") && path.get(2).equals("versions")
                && method.equals(HttpMethod.GET)) {
            String objectId = path.get(1);
            long version = parseNumber(path.get(3), "version");
            if (path.size() == 5 && path.get(4).equals("manifest")) {
                sendJson(ctx, HttpResponseStatus.OK, vault.getManifest(objectId, version), keepAlive);
                return;
            }
            if (path.size() == 4) {
                streamObject(ctx, objectId, version, keepAlive);
                return;
            }
        }

        sendJson(ctx, HttpResponseStatus.NOT_FOUND,
            new ErrorResponse("error", "NotFound", "No route for " + method + " " + request.uri()), keepAlive);
    }

    private CreateUploadResponse createUpload(FullHttpRequest request) throws JsonProcessingException {
        CreateUploadBody body = readBody(request, CreateUploadBody.class);
        if (body.totalChunks() == null) {
            throw new IllegalArgumentException("totalChunks is required");
        }
        UploadSession session = vault.createSession(new SessionRequest(
            body.objectId(),
            body.version() != null ? body.version() : 0,
            body.totalChunks(),
            body.totalBytes() != null ? body.totalBytes() : -1,
            body.originalChecksum()
        ));
        return new CreateUploadResponse(session.getUploadId(), session.getObjectId(), session.getVersion(),
            session.getTotalChunks(), session.getExpiresAt());
    }

    private ChunkResponse uploadChunk(String uploadId, String rawIndex, FullHttpRequest request) {
        int chunkIndex = parseIndex(rawIndex);
        byte[] bytes = ByteBufUtil.getBytes(request.content());
        String clientDigest = request.headers().get(DIGEST_HEADER);
        AdmitResult result = vault.admitChunk(uploadId, chunkIndex, bytes, clientDigest);
        String status = switch (result.status()) {
            case ACCEPTED -> "ok";
            case DUPLICATE -> "duplicate";
            case REPLACED -> "replaced";
        };
        return new ChunkResponse(status, result.dedupHit(), result.chunkIndex(), result.digest());
    }

    private FinalizeResponse finalizeUpload(String uploadId, FullHttpRequest request) throws JsonProcessingException {
        FinalizeBody body = request.content().isReadable()
            ? readBody(request, FinalizeBody.class)
            : new FinalizeBody(null, null, null);
        FinalizeResult result = vault.finalize(new FinalizeRequest(
            uploadId,
            body.objectId(),
            body.version() != null ? body.version() : 0,
            body.originalChecksum()
        ));
        return new FinalizeResponse(result.status().name().toLowerCase(Locale.ROOT), result.objectId(), result.version(),
            result.missingChunks(), result.checksum(), result.totalBytes());
    }

    private HealthResponse health() {
        List<ShardBackend.BackendStats> backends = vault.backendStats();
        boolean allReady = backends.stream().allMatch(ShardBackend.BackendStats::ready);
        return new HealthResponse(allReady ? "ok" : "degraded", backends, vault.stats());
    }

    private void streamObject(ChannelHandlerContext ctx, String objectId, long version, boolean keepAlive) {
        ObjectStream stream = vault.read(objectId, version);
        HttpResponse head = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        head.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_OCTET_STREAM);
        head.headers().set(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED);
        head.headers().set("X-Object-Version", version);
        if (keepAlive) {
            head.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        }
        ctx.write(head);

        try (stream) {
            while (stream.hasNext()) {
                ChannelFuture written = ctx.writeAndFlush(new DefaultHttpContent(Unpooled.wrappedBuffer(stream.next())));
                if (!ctx.channel().eventLoop().inEventLoop()) {
                    written.awaitUninterruptibly();
                }
                if (written.isDone() && !written.isSuccess()) {
                    logger.debug("Client went away while streaming {}@{}", objectId, version);
                    return;
                }
            }
        } catch (ChunkVaultException e) {
            // Headers are already sent; the only signal left is an aborted transfer.
            logger.warn("Aborting download of {}@{} at chunk {}: {}", objectId, version,
                stream.nextChunkIndex(), e.getMessage());
            ctx.close();
            return;
        }

        ChannelFuture done = ctx.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT);
        if (!keepAlive) {
            done.addListener(ChannelFutureListener.CLOSE);
        }
    }

    private void sendError(ChannelHandlerContext ctx, Exception e, boolean keepAlive) {
        HttpResponseStatus status = statusFor(e);
        if (status.code() >= 500) {
            logger.error("Request failed with {}", status, e);
        } else {
            logger.debug("Request rejected with {}: {}", status, e.getMessage());
        }
        sendJson(ctx, status, new ErrorResponse("error", errorKind(e), e.getMessage()), keepAlive);
    }

    static HttpResponseStatus statusFor(Throwable e) {
        if (e instanceof SessionNotFoundException || e instanceof ObjectNotFoundException) {
            return HttpResponseStatus.NOT_FOUND;
        }
        if (e instanceof SessionExpiredException) {
            return HttpResponseStatus.GONE;
        }
        if (e instanceof DuplicateChunkIndexException || e instanceof DigestCollisionException
                || e instanceof IllegalStateException) {
            return HttpResponseStatus.CONFLICT;
        }
        if (e instanceof InvalidChunkException || e instanceof IllegalArgumentException
                || e instanceof JsonProcessingException) {
            return HttpResponseStatus.BAD_REQUEST;
        }
        if (e instanceof ChunkVaultException vaultException && vaultException.isRetryable()) {
            return HttpResponseStatus.SERVICE_UNAVAILABLE;
        }
        // CorruptedChunkException and InsufficientShardsException included
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
    }

    static String errorKind(Throwable e) {
        if (e instanceof JsonProcessingException) {
            return "MalformedBody";
        }
        String name = e.getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }

    private void sendJson(ChannelHandlerContext ctx, HttpResponseStatus status, Object body, boolean keepAlive) {
        byte[] json;
        try {
            json = MAPPER.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {} response", body.getClass().getSimpleName(), e);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            json = "{\"status\":\"error\",\"error\":\"Serialization\"}".getBytes(StandardCharsets.UTF_8);
        }
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(json));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        HttpUtil.setContentLength(response, json.length);
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("HTTP channel error", cause);
        ctx.close();
    }

    private static <T> T readBody(FullHttpRequest request, Class<T> type) throws JsonProcessingException {
        String body = request.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("Request body is required");
        }
        return MAPPER.readValue(body, type);
    }

    private static List<String> segments(String uri) {
        String path = new QueryStringDecoder(uri).path();
        List<String> segments = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                segments.add(QueryStringDecoder.decodeComponent(part));
            }
        }
        return segments;
    }

    private static long parseNumber(String value, String what) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value);
        }
    }

    private static int parseIndex(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid chunk index: " + value);
        }
    }

    // ==================== Wire Types ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CreateUploadBody(String objectId, Long version, Integer totalChunks, Long totalBytes, String originalChecksum) {}

    record CreateUploadResponse(String uploadId, String objectId, long version, int totalChunks, Instant expiresAt) {}

    record ChunkResponse(String status, boolean dedup, int chunkIndex, String digest) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FinalizeBody(String objectId, Long version, String originalChecksum) {}

    record FinalizeResponse(String status, String objectId, long version, List<Integer> missingChunks,
                            String checksum, long totalBytes) {}

    record CancelResponse(String status, String uploadId) {}

    record HealthResponse(String status, List<ShardBackend.BackendStats> backends, ChunkVault.VaultStats stats) {}

    record ErrorResponse(String status, String error, String message) {}
}
