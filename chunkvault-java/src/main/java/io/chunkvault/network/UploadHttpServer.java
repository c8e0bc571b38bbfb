package io.chunkvault.network;

import io.chunkvault.ChunkVault;
import io.chunkvault.VaultOptions;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP front end for resumable uploads and object downloads.
 */
public class UploadHttpServer {

    private static final Logger logger = LoggerFactory.getLogger(UploadHttpServer.class);

    private final ChunkVault vault;
    private final VaultOptions options;

    private final EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup workerGroup = new NioEventLoopGroup();
    private final EventExecutorGroup handlerGroup;

    private Channel serverChannel;
    private volatile int port;

    public UploadHttpServer(ChunkVault vault) {
        this.vault = vault;
        this.options = vault.getOptions();
        this.handlerGroup = new DefaultEventExecutorGroup(options.concurrency());
    }

    /**
     * Bind the configured host and port.
     * @return future completing with the bound port
     */
    public CompletableFuture<Integer> start() {
        return start(options.httpPort());
    }

    public CompletableFuture<Integer> start(int requestedPort) {
        CompletableFuture<Integer> future = new CompletableFuture<>();
        int maxContentLength = (int) options.maxChunkBytes();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(maxContentLength));
                        pipeline.addLast(handlerGroup, new UploadHttpHandler(vault));
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

            ChannelFuture bindFuture = bootstrap.bind(options.httpHost(), requestedPort);
            bindFuture.addListener((ChannelFutureListener) f -> {
                if (f.isSuccess()) {
                    serverChannel = f.channel();
                    InetSocketAddress addr = (InetSocketAddress) serverChannel.localAddress();
                    this.port = addr.getPort();
                    logger.info("Upload server listening on {}:{}", options.httpHost(), this.port);
                    future.complete(this.port);
                } else {
                    logger.error("Failed to bind upload server to port {}", requestedPort, f.cause());
                    future.completeExceptionally(f.cause());
                }
            });
        } catch (Exception e) {
            future.completeExceptionally(e);
        }

        return future;
    }

    public int getPort() {
        return port;
    }

    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        handlerGroup.shutdownGracefully();
        logger.info("Upload server stopped");
    }

    public static void main(String[] args) {
        VaultOptions options = VaultOptions.load();
        ChunkVault vault = new ChunkVault(options);
        vault.startMaintenance();
        UploadHttpServer server = new UploadHttpServer(vault);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            vault.close();
        }, "chunkvault-shutdown"));
        server.start().join();
    }
}
